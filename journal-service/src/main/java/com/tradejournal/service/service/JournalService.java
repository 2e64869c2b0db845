package com.tradejournal.service.service;

import com.tradejournal.core.analytics.CalendarAggregator;
import com.tradejournal.core.analytics.ContractNames;
import com.tradejournal.core.analytics.MonthlySummary;
import com.tradejournal.core.analytics.StrategyBreakdown;
import com.tradejournal.core.analytics.StrategyPerformance;
import com.tradejournal.core.archive.SessionArchiver;
import com.tradejournal.core.discipline.DailyTradeCounter;
import com.tradejournal.core.discipline.DisciplineResult;
import com.tradejournal.core.discipline.DisciplineScorer;
import com.tradejournal.core.equity.EquityCurve;
import com.tradejournal.core.equity.EquityCurveBuilder;
import com.tradejournal.core.lifecycle.TradeLifecycle;
import com.tradejournal.core.metrics.MetricsAggregator;
import com.tradejournal.core.model.ChecklistAnswers;
import com.tradejournal.core.model.DailyTradeCount;
import com.tradejournal.core.model.DisciplineChecklist;
import com.tradejournal.core.model.Emotion;
import com.tradejournal.core.model.Metrics;
import com.tradejournal.core.model.OptionType;
import com.tradejournal.core.model.Trade;
import com.tradejournal.core.model.TradeDirection;
import com.tradejournal.core.model.TradeStatus;
import com.tradejournal.core.model.UserProfile;
import com.tradejournal.core.model.UserSettings;
import com.tradejournal.core.risk.RiskBudget;
import com.tradejournal.core.risk.RiskBudgetCalculator;
import com.tradejournal.core.validation.TradeValidator;
import com.tradejournal.service.dto.CreateProfileRequest;
import com.tradejournal.service.dto.TradeCloseRequest;
import com.tradejournal.service.dto.TradeEntryRequest;
import com.tradejournal.service.exception.ProfileNotFoundException;
import com.tradejournal.service.exception.TradeNotFoundException;
import com.tradejournal.service.logging.ProfileContextUtil;
import com.tradejournal.service.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * Journal use cases on top of the stateless engine.
 *
 * <p>Every write loads the profile snapshot, lets the engine compute the next one
 * and saves it in a single {@link ProfileStore#update} call. Analytics are
 * recomputed from the full ledger on every read. This class owns the clock; the
 * engine never reads wall time.
 */
@Service
public class JournalService {

    private static final Logger log = LoggerFactory.getLogger(JournalService.class);

    static final String DEFAULT_VIOLATION_REASON = "Pre-trade checklist violation";

    private final ProfileStore store;
    private final ProfileBackupCodec backupCodec;
    private final UserSettings defaultSettings;
    private final Clock clock;

    public JournalService(ProfileStore store,
                          ProfileBackupCodec backupCodec,
                          UserSettings defaultSettings,
                          Clock clock) {
        this.store           = store;
        this.backupCodec     = backupCodec;
        this.defaultSettings = defaultSettings;
        this.clock           = clock;
    }

    // ── Profiles ─────────────────────────────────────────────────────────────

    public Mono<UserProfile> createProfile(CreateProfileRequest request) {
        return Mono.fromCallable(() -> {
            if (request.name() == null || request.name().isBlank()) {
                throw new IllegalArgumentException("name is required");
            }
            UserSettings settings = request.settings() != null ? checkSettings(request.settings()) : defaultSettings;
            if (!Double.isFinite(request.initialCapital())) {
                throw new IllegalArgumentException("initialCapital must be finite");
            }
            UserProfile profile = new UserProfile(UUID.randomUUID().toString(), request.name().trim(),
                request.initialCapital(), now(), List.of(), List.of(), settings);
            store.save(profile);
            ProfileContextUtil.withMdc(profile.id(), () ->
                log.info("Profile created. profile={} capital={}", profile.id(), profile.initialCapital()));
            return profile;
        });
    }

    public Mono<UserProfile> getProfile(String profileId) {
        return Mono.fromCallable(() -> load(profileId));
    }

    public Mono<UserProfile> updateSettings(String profileId, UserSettings settings) {
        return Mono.fromCallable(() -> {
            UserSettings checked = checkSettings(settings);
            UserProfile updated = store.update(profileId, p -> p.withSettings(checked));
            ProfileContextUtil.withMdc(profileId, () ->
                log.info("Settings updated. profile={} settings={}", profileId, checked));
            return updated;
        });
    }

    // ── Trades ───────────────────────────────────────────────────────────────

    /**
     * Logs a new trade. The checklist is scored with the daily-limit item computed
     * from the trades already logged on the entry's calendar day. A low score is
     * recorded, never refused.
     */
    public Mono<Trade> addTrade(String profileId, TradeEntryRequest request) {
        return Mono.fromCallable(() -> {
            String tradeId = UUID.randomUUID().toString();
            UserProfile updated = store.update(profileId, p -> p.addTrade(newTrade(p, tradeId, request)));
            Trade trade = updated.findTrade(tradeId).orElseThrow();
            ProfileContextUtil.withMdc(profileId, () ->
                log.info("Trade logged. profile={} trade={} contract={} status={} score={}",
                    profileId, trade.id(), ContractNames.of(trade), trade.status(), trade.disciplineScore()));
            return trade;
        });
    }

    /**
     * Explicit edit. Null request fields keep their stored values; the discipline
     * score is re-derived from the (possibly new) answers and the daily-limit flag
     * computed at logging time. Pnl is recomputed from prices.
     */
    public Mono<Trade> editTrade(String profileId, String tradeId, TradeEntryRequest request) {
        return Mono.fromCallable(() -> {
            UserProfile updated = store.update(profileId, p -> {
                Trade existing = p.findTrade(tradeId).orElseThrow(() -> new TradeNotFoundException(profileId, tradeId));
                return p.replaceTrade(editedTrade(existing, request));
            });
            Trade trade = updated.findTrade(tradeId).orElseThrow();
            ProfileContextUtil.withMdc(profileId, () ->
                log.info("Trade edited. profile={} trade={} status={} pnl={} score={}",
                    profileId, tradeId, trade.status(), trade.pnl(), trade.disciplineScore()));
            return trade;
        });
    }

    public Mono<Trade> closeTrade(String profileId, String tradeId, TradeCloseRequest request) {
        return Mono.fromCallable(() -> {
            if (request.exitPrice() == null) {
                throw new IllegalArgumentException("exitPrice is required to close a trade");
            }
            UserProfile updated = store.update(profileId, p -> {
                Trade existing = p.findTrade(tradeId).orElseThrow(() -> new TradeNotFoundException(profileId, tradeId));
                LocalDateTime exitDate = request.exitDate() != null ? request.exitDate() : notBefore(existing.entryDate());
                Trade closed = TradeLifecycle.close(existing, request.exitPrice(), exitDate, request.exitEmotion());
                return p.replaceTrade(TradeValidator.validate(closed));
            });
            Trade trade = updated.findTrade(tradeId).orElseThrow();
            ProfileContextUtil.withMdc(profileId, () ->
                log.info("Trade closed. profile={} trade={} exitPrice={} pnl={}",
                    profileId, tradeId, trade.exitPrice(), trade.pnl()));
            return trade;
        });
    }

    public Mono<Trade> reopenTrade(String profileId, String tradeId) {
        return Mono.fromCallable(() -> {
            UserProfile updated = store.update(profileId, p -> {
                Trade existing = p.findTrade(tradeId).orElseThrow(() -> new TradeNotFoundException(profileId, tradeId));
                return p.replaceTrade(TradeLifecycle.reopen(existing));
            });
            ProfileContextUtil.withMdc(profileId, () ->
                log.info("Trade re-opened. profile={} trade={}", profileId, tradeId));
            return updated.findTrade(tradeId).orElseThrow();
        });
    }

    public Mono<Void> deleteTrade(String profileId, String tradeId) {
        return Mono.fromRunnable(() -> {
            store.update(profileId, p -> {
                p.findTrade(tradeId).orElseThrow(() -> new TradeNotFoundException(profileId, tradeId));
                return p.removeTrade(tradeId);
            });
            ProfileContextUtil.withMdc(profileId, () ->
                log.info("Trade deleted. profile={} trade={}", profileId, tradeId));
        });
    }

    // ── Analytics (recomputed on every read) ─────────────────────────────────

    public Mono<Metrics> metrics(String profileId) {
        return Mono.fromCallable(() -> MetricsAggregator.aggregate(load(profileId).trades()));
    }

    public Mono<EquityCurve> equityCurve(String profileId) {
        return Mono.fromCallable(() -> {
            UserProfile profile = load(profileId);
            return EquityCurveBuilder.build(profile.trades(), profile.initialCapital());
        });
    }

    public Mono<List<StrategyPerformance>> strategyPerformance(String profileId) {
        return Mono.fromCallable(() -> StrategyBreakdown.byDirectionAndType(load(profileId).trades()));
    }

    public Mono<MonthlySummary> calendar(String profileId, YearMonth month) {
        return Mono.fromCallable(() -> CalendarAggregator.month(load(profileId).trades(), month));
    }

    public Mono<RiskBudget> riskBudget(String profileId, Double entryPrice) {
        return Mono.fromCallable(() -> RiskBudgetCalculator.forProfile(load(profileId), entryPrice));
    }

    // ── Session archival ─────────────────────────────────────────────────────

    public Mono<UserProfile> resetSession(String profileId, double newInitialCapital) {
        return Mono.fromCallable(() -> {
            LocalDateTime now = now();
            UserProfile updated = store.update(profileId, p -> SessionArchiver.reset(p, newInitialCapital, now,
                () -> SessionArchiver.archiveId(now) + "-" + UUID.randomUUID()));
            ProfileContextUtil.withMdc(profileId, () ->
                log.info("Session reset. profile={} archives={} newCapital={}",
                    profileId, updated.archives().size(), newInitialCapital));
            return updated;
        });
    }

    // ── Backup ───────────────────────────────────────────────────────────────

    public Mono<String> exportBackup(String profileId) {
        return Mono.fromCallable(() -> backupCodec.encode(load(profileId)));
    }

    /**
     * Replaces the stored profile with the backup's content. The profile keeps the
     * id it is stored under, whatever id the backup carries.
     */
    public Mono<UserProfile> importBackup(String profileId, String json) {
        return Mono.fromCallable(() -> {
            UserProfile restored = backupCodec.decode(json);
            UserSettings settings = checkSettings(restored.settings());
            UserProfile updated = store.update(profileId, current -> new UserProfile(
                current.id(),
                restored.name() != null ? restored.name() : current.name(),
                restored.initialCapital(),
                restored.startDate(),
                restored.trades(),
                restored.archives(),
                settings));
            ProfileContextUtil.withMdc(profileId, () ->
                log.warn("Profile overwritten from backup. profile={} trades={} archives={}",
                    profileId, updated.trades().size(), updated.archives().size()));
            return updated;
        });
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private Trade newTrade(UserProfile profile, String tradeId, TradeEntryRequest request) {
        UserSettings settings = profile.settings();
        LocalDateTime entryDate = request.entryDate() != null ? request.entryDate() : now();

        DailyTradeCount usedToday = DailyTradeCounter.countFor(profile.trades(), entryDate.toLocalDate());
        ChecklistAnswers answers = request.checklist() != null ? request.checklist() : ChecklistAnswers.allFalse();
        DisciplineResult discipline = DisciplineScorer.score(answers, usedToday, settings.maxTradesPerDay());

        double entryPrice = request.entryPrice() != null ? request.entryPrice() : Double.NaN;
        boolean priced = Double.isFinite(entryPrice) && entryPrice >= 0;

        TradeStatus status = request.status() != null ? request.status() : TradeStatus.OPEN;
        Trade.Builder builder = Trade.builder()
            .id(tradeId)
            .ticker(request.ticker())
            .direction(orElse(request.direction(), TradeDirection.LONG))
            .optionType(orElse(request.optionType(), OptionType.CALL))
            .strikePrice(request.strikePrice())
            .expirationDate(request.expirationDate())
            .setup(request.setup())
            .entryDate(entryDate)
            .status(status)
            .entryPrice(entryPrice)
            .exitPrice(request.exitPrice())
            .quantity(request.quantity() != null ? request.quantity() : 1)
            .fees(request.fees() != null ? request.fees() : 0.0)
            .targetPrice(request.targetPrice() != null ? request.targetPrice()
                : priced ? RiskBudgetCalculator.defaultTarget(entryPrice, settings) : null)
            .stopLossPrice(request.stopLossPrice() != null ? request.stopLossPrice()
                : priced ? RiskBudgetCalculator.defaultStopLoss(entryPrice, settings) : null)
            .notes(request.notes())
            .entryEmotion(orElse(request.entryEmotion(), Emotion.CALM))
            .exitEmotion(request.exitEmotion())
            .checklist(discipline.checklist())
            .disciplineScore(discipline.score())
            .violationReason(discipline.isViolation() ? reasonOrDefault(request.violationReason()) : null);

        if (status == TradeStatus.CLOSED) {
            builder.exitDate(request.exitDate() != null ? request.exitDate() : notBefore(entryDate));
        }
        Trade draft = TradeLifecycle.settle(builder.build());
        return TradeValidator.validate(TradeValidator.normalize(draft));
    }

    private Trade editedTrade(Trade existing, TradeEntryRequest request) {
        ChecklistAnswers answers = request.checklist() != null ? request.checklist() : existing.checklist().answers();
        DisciplineChecklist checklist = DisciplineChecklist.of(answers, existing.checklist().dailyLimitRespected());
        int score = DisciplineScorer.scoreOf(checklist);

        String reason = request.violationReason() != null ? request.violationReason() : existing.violationReason();
        Trade.Builder builder = existing.toBuilder()
            .ticker(orElse(request.ticker(), existing.ticker()))
            .direction(orElse(request.direction(), existing.direction()))
            .optionType(orElse(request.optionType(), existing.optionType()))
            .strikePrice(orElse(request.strikePrice(), existing.strikePrice()))
            .expirationDate(orElse(request.expirationDate(), existing.expirationDate()))
            .setup(orElse(request.setup(), existing.setup()))
            .entryDate(orElse(request.entryDate(), existing.entryDate()))
            .exitDate(orElse(request.exitDate(), existing.exitDate()))
            .status(orElse(request.status(), existing.status()))
            .entryPrice(orElse(request.entryPrice(), existing.entryPrice()))
            .exitPrice(orElse(request.exitPrice(), existing.exitPrice()))
            .quantity(orElse(request.quantity(), existing.quantity()))
            .fees(orElse(request.fees(), existing.fees()))
            .targetPrice(orElse(request.targetPrice(), existing.targetPrice()))
            .stopLossPrice(orElse(request.stopLossPrice(), existing.stopLossPrice()))
            .notes(orElse(request.notes(), existing.notes()))
            .entryEmotion(orElse(request.entryEmotion(), existing.entryEmotion()))
            .exitEmotion(orElse(request.exitEmotion(), existing.exitEmotion()))
            .checklist(checklist)
            .disciplineScore(score)
            .violationReason(score < 100 ? reasonOrDefault(reason) : null);

        Trade draft = builder.build();
        if (draft.status() == TradeStatus.CLOSED && draft.exitDate() == null) {
            draft = draft.toBuilder().exitDate(notBefore(draft.entryDate())).build();
        }
        return TradeValidator.validate(TradeValidator.normalize(TradeLifecycle.settle(draft)));
    }

    private UserProfile load(String profileId) {
        return store.find(profileId).orElseThrow(() -> new ProfileNotFoundException(profileId));
    }

    private static UserSettings checkSettings(UserSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings are required");
        }
        if (!(settings.maxTradesPerDay() > 0)) {
            throw new IllegalArgumentException("maxTradesPerDay must be positive");
        }
        if (!(settings.maxRiskPerTradePercent() >= 0) || !(settings.defaultTargetPercent() >= 0)
                || !(settings.defaultStopLossPercent() >= 0)) {
            throw new IllegalArgumentException("percentages must be >= 0");
        }
        return settings;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /** Current time, or {@code floor} when the clock is behind it. */
    private LocalDateTime notBefore(LocalDateTime floor) {
        LocalDateTime now = now();
        return floor != null && now.isBefore(floor) ? floor : now;
    }

    private static String reasonOrDefault(String reason) {
        return reason != null && !reason.isBlank() ? reason : DEFAULT_VIOLATION_REASON;
    }

    private static <T> T orElse(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
