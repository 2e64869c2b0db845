package com.tradejournal.service.store;

import com.tradejournal.core.discipline.DisciplineScorer;
import com.tradejournal.core.model.ChecklistAnswers;
import com.tradejournal.core.model.DisciplineChecklist;
import com.tradejournal.core.model.Emotion;
import com.tradejournal.core.model.OptionType;
import com.tradejournal.core.model.Trade;
import com.tradejournal.core.model.TradeDirection;
import com.tradejournal.core.model.TradeStatus;
import com.tradejournal.core.model.UserProfile;
import com.tradejournal.core.model.UserSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Seeds a demo profile on startup so an empty store still has something to show.
 * Disabled with {@code journal.seed-demo-profile=false}.
 */
@Component
public class DemoProfileSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoProfileSeeder.class);

    public static final String DEMO_PROFILE_ID = "demo-user";

    private final ProfileStore store;
    private final UserSettings defaultSettings;
    private final boolean enabled;
    private final double initialCapital;

    public DemoProfileSeeder(ProfileStore store,
                             UserSettings defaultSettings,
                             @Value("${journal.seed-demo-profile:true}") boolean enabled,
                             @Value("${journal.defaults.initial-capital:10000}") double initialCapital) {
        this.store           = store;
        this.defaultSettings = defaultSettings;
        this.enabled         = enabled;
        this.initialCapital  = initialCapital;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("[DemoProfileSeeder] disabled");
            return;
        }
        if (store.find(DEMO_PROFILE_ID).isPresent()) {
            return;
        }
        store.save(demoProfile(defaultSettings, initialCapital));
        log.info("[DemoProfileSeeder] demo profile seeded. profile={}", DEMO_PROFILE_ID);
    }

    /** The three-trade sample ledger shown to a first-time user. */
    public static UserProfile demoProfile(UserSettings settings, double initialCapital) {
        List<Trade> trades = List.of(
            Trade.builder()
                .id("3").ticker("TSLA").direction(TradeDirection.SHORT).optionType(OptionType.PUT)
                .strikePrice(170.0).expirationDate(LocalDate.of(2024, 5, 24))
                .entryDate(LocalDateTime.of(2024, 5, 10, 9, 45)).status(TradeStatus.OPEN)
                .entryPrice(3.20).quantity(2).notes("Selling puts at support level.")
                .entryEmotion(Emotion.CONFIDENT)
                .checklist(checklist(ChecklistAnswers.allTrue())).disciplineScore(100)
                .build(),
            Trade.builder()
                .id("2").ticker("NVDA").direction(TradeDirection.LONG).optionType(OptionType.CALL)
                .strikePrice(900.0).expirationDate(LocalDate.of(2024, 6, 21))
                .entryDate(LocalDateTime.of(2024, 5, 3, 14, 0))
                .exitDate(LocalDateTime.of(2024, 5, 3, 15, 30)).status(TradeStatus.CLOSED)
                .entryPrice(15.00).exitPrice(10.00).quantity(1).pnl(-500.0)
                .notes("Chased the breakout. Should have waited for retest.")
                .entryEmotion(Emotion.FOMO).exitEmotion(Emotion.ANXIOUS)
                .checklist(checklist(new ChecklistAnswers(false, true, true, false, false)))
                .disciplineScore(DisciplineScorer.scoreOf(checklist(new ChecklistAnswers(false, true, true, false, false))))
                .violationReason("Chasing momentum without strategy alignment")
                .build(),
            Trade.builder()
                .id("1").ticker("SPY").direction(TradeDirection.SHORT).optionType(OptionType.PUT)
                .strikePrice(510.0).expirationDate(LocalDate.of(2024, 5, 15))
                .entryDate(LocalDateTime.of(2024, 5, 1, 10, 30))
                .exitDate(LocalDateTime.of(2024, 5, 8, 11, 0)).status(TradeStatus.CLOSED)
                .entryPrice(2.50).exitPrice(1.20).quantity(5).pnl(650.0)
                .notes("Selling puts at support level. High IV rank.")
                .entryEmotion(Emotion.CALM).exitEmotion(Emotion.CALM)
                .checklist(checklist(ChecklistAnswers.allTrue())).disciplineScore(100)
                .build());

        return new UserProfile(DEMO_PROFILE_ID, "Demo Trader", initialCapital,
            LocalDateTime.of(2024, 5, 1, 0, 0), trades, List.of(), settings);
    }

    private static DisciplineChecklist checklist(ChecklistAnswers answers) {
        return DisciplineChecklist.of(answers, true);
    }
}
