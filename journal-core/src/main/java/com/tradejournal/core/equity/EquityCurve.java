package com.tradejournal.core.equity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradejournal.core.model.EquityPoint;

import java.util.List;

/**
 * Chronological balance curve of a period plus its maximum drawdown.
 * {@code points} always starts with the synthetic start point.
 */
public record EquityCurve(
    @JsonProperty("points")      List<EquityPoint> points,
    @JsonProperty("maxDrawdown") double maxDrawdown
) {
    public EquityCurve {
        points = List.copyOf(points);
    }

    @JsonIgnore
    public double finalBalance() {
        return points.get(points.size() - 1).balance();
    }
}
