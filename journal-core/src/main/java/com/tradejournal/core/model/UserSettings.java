package com.tradejournal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-profile risk and discipline configuration.
 *
 * <p>{@code maxTradesPerDay} is fractional: an open and its matching close each
 * consume 0.5 of the allowance.
 */
public record UserSettings(
    @JsonProperty("defaultTargetPercent")   double defaultTargetPercent,
    @JsonProperty("defaultStopLossPercent") double defaultStopLossPercent,
    @JsonProperty("maxTradesPerDay")        double maxTradesPerDay,
    @JsonProperty("maxRiskPerTradePercent") double maxRiskPerTradePercent
) {
    public static UserSettings defaults() {
        return new UserSettings(40, 20, 3, 4);
    }
}
