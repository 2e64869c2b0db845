package com.tradejournal.core.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One calendar cell: realized pnl of the day's closed trades, every trade entered that day, and wins.
 */
public record DailySummary(
    @JsonProperty("date")       LocalDate date,
    @JsonProperty("pnl")        double pnl,
    @JsonProperty("tradeCount") int tradeCount,
    @JsonProperty("wins")       int wins
) {}
