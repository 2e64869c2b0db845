package com.tradejournal.core.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk guidance for a prospective entry. Target and stop are null when no entry
 * price was given.
 */
public record RiskBudget(
    @JsonProperty("currentBalance") double currentBalance,
    @JsonProperty("maxRiskAmount")  double maxRiskAmount,
    @JsonProperty("targetPrice")    Double targetPrice,
    @JsonProperty("stopLossPrice")  Double stopLossPrice
) {}
