package com.tradejournal.service.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradejournal.core.model.UserSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class JournalConfig {

    @Value("${journal.defaults.target-percent:40}")
    private double defaultTargetPercent;

    @Value("${journal.defaults.stop-loss-percent:20}")
    private double defaultStopLossPercent;

    @Value("${journal.defaults.max-trades-per-day:3}")
    private double maxTradesPerDay;

    @Value("${journal.defaults.max-risk-per-trade-percent:4}")
    private double maxRiskPerTradePercent;

    /** Settings given to profiles created without explicit settings. */
    @Bean
    public UserSettings defaultUserSettings() {
        return new UserSettings(defaultTargetPercent, defaultStopLossPercent, maxTradesPerDay, maxRiskPerTradePercent);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return journalObjectMapper();
    }

    /** Mapper shared by the REST layer and the backup codec. */
    public static ObjectMapper journalObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
