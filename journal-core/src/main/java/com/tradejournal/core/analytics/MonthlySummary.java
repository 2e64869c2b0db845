package com.tradejournal.core.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.YearMonth;
import java.util.List;

/**
 * Calendar view of one month. {@code days} holds only days with at least one trade,
 * in date order. {@code winRate} is wins over all trades entered in the month.
 */
public record MonthlySummary(
    @JsonProperty("month")      YearMonth month,
    @JsonProperty("days")       List<DailySummary> days,
    @JsonProperty("totalPnL")   double totalPnL,
    @JsonProperty("tradeCount") int tradeCount,
    @JsonProperty("wins")       int wins,
    @JsonProperty("winRate")    double winRate
) {
    public MonthlySummary {
        days = List.copyOf(days);
    }
}
