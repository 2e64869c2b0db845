package com.tradejournal.core.discipline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradejournal.core.model.DisciplineChecklist;

/**
 * Scored checklist for one trade entry. A score below 100 is a rule violation,
 * but never blocks the trade.
 */
public record DisciplineResult(
    @JsonProperty("checklist") DisciplineChecklist checklist,
    @JsonProperty("score")     int score
) {
    @JsonIgnore
    public boolean isViolation() {
        return score < 100;
    }
}
