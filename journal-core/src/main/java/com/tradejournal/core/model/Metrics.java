package com.tradejournal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Dashboard summary derived from the ledger. Never persisted.
 *
 * @param winRate         percentage of closed trades with pnl &gt; 0, in [0, 100]
 * @param disciplineScore mean per-trade discipline score over all trades, open or closed
 * @param maxDrawdown     largest peak-to-trough decline in cumulative realized pnl, &gt;= 0
 */
public record Metrics(
    @JsonProperty("totalTrades")     int totalTrades,
    @JsonProperty("winRate")         double winRate,
    @JsonProperty("totalPnL")        double totalPnL,
    @JsonProperty("averagePnL")      double averagePnL,
    @JsonProperty("disciplineScore") double disciplineScore,
    @JsonProperty("maxDrawdown")     double maxDrawdown
) {
    public static final Metrics EMPTY = new Metrics(0, 0.0, 0.0, 0.0, 0.0, 0.0);
}
