package com.tradejournal.core.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StrategyPerformance(
    @JsonProperty("name")       String name,
    @JsonProperty("totalPnL")   double totalPnL,
    @JsonProperty("tradeCount") int tradeCount
) {}
