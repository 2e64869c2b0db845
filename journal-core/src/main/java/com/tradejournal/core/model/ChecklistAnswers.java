package com.tradejournal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The manual, user-answered part of the pre-trade discipline checklist.
 * The daily-trade-limit item is deliberately absent: it is computed by the engine.
 */
public record ChecklistAnswers(
    @JsonProperty("strategyAligned")           boolean strategyAligned,
    @JsonProperty("riskDefined")               boolean riskDefined,
    @JsonProperty("sizeWithinLimits")          boolean sizeWithinLimits,
    @JsonProperty("marketConditionsFavorable") boolean marketConditionsFavorable,
    @JsonProperty("emotionallyStable")         boolean emotionallyStable
) {
    public static ChecklistAnswers allTrue() {
        return new ChecklistAnswers(true, true, true, true, true);
    }

    public static ChecklistAnswers allFalse() {
        return new ChecklistAnswers(false, false, false, false, false);
    }
}
