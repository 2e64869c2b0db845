package com.tradejournal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fixed-field pre-trade checklist as stored on a {@link Trade}.
 *
 * <p>Five items come from the trader's answers; {@code dailyLimitRespected} is
 * computed by {@link com.tradejournal.core.discipline.DisciplineScorer} from the
 * day's existing trade count and is never taken from user input. Build new
 * checklists through {@link #of(ChecklistAnswers, boolean)}.
 */
public record DisciplineChecklist(
    @JsonProperty("strategyAligned")           boolean strategyAligned,
    @JsonProperty("riskDefined")               boolean riskDefined,
    @JsonProperty("sizeWithinLimits")          boolean sizeWithinLimits,
    @JsonProperty("marketConditionsFavorable") boolean marketConditionsFavorable,
    @JsonProperty("emotionallyStable")         boolean emotionallyStable,
    @JsonProperty("dailyLimitRespected")       boolean dailyLimitRespected
) {

    /** Number of checklist items, manual plus computed. */
    public static final int ITEM_COUNT = 6;

    public static DisciplineChecklist of(ChecklistAnswers answers, boolean dailyLimitRespected) {
        return new DisciplineChecklist(
            answers.strategyAligned(),
            answers.riskDefined(),
            answers.sizeWithinLimits(),
            answers.marketConditionsFavorable(),
            answers.emotionallyStable(),
            dailyLimitRespected);
    }

    @JsonIgnore
    public int trueCount() {
        int count = 0;
        if (strategyAligned)           count++;
        if (riskDefined)               count++;
        if (sizeWithinLimits)          count++;
        if (marketConditionsFavorable) count++;
        if (emotionallyStable)         count++;
        if (dailyLimitRespected)       count++;
        return count;
    }

    /** The manual part of this checklist. */
    @JsonIgnore
    public ChecklistAnswers answers() {
        return new ChecklistAnswers(strategyAligned, riskDefined, sizeWithinLimits,
            marketConditionsFavorable, emotionallyStable);
    }
}
