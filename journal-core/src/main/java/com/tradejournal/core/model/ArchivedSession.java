package com.tradejournal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Immutable snapshot of a closed-out trading period.
 * {@code finalBalance == initialCapital + totalPnL}; {@code trades} is a frozen copy.
 */
public record ArchivedSession(
    @JsonProperty("id")             String id,
    @JsonProperty("startDate")      LocalDateTime startDate,
    @JsonProperty("endDate")        LocalDateTime endDate,
    @JsonProperty("initialCapital") double initialCapital,
    @JsonProperty("finalBalance")   double finalBalance,
    @JsonProperty("totalPnL")       double totalPnL,
    @JsonProperty("tradeCount")     int tradeCount,
    @JsonProperty("trades")         List<Trade> trades
) {
    public ArchivedSession {
        trades = trades == null ? List.of() : List.copyOf(trades);
    }
}
