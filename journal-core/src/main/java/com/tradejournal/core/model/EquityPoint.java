package com.tradejournal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * One point of the account balance curve. The synthetic start point has a null
 * {@code date} and zero {@code pnl}.
 */
public record EquityPoint(
    @JsonProperty("label")   String label,
    @JsonProperty("date")    LocalDateTime date,
    @JsonProperty("pnl")     double pnl,
    @JsonProperty("balance") double balance
) {
    public static final String START_LABEL = "Start";

    public static EquityPoint start(double initialCapital) {
        return new EquityPoint(START_LABEL, null, 0.0, initialCapital);
    }
}
