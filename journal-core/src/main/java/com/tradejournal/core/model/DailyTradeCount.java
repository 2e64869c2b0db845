package com.tradejournal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trade usage for one calendar day, kept as an integer number of half-units.
 *
 * <p>Every open and every close consumes one half-unit (0.5 of a trade), so a full
 * round trip counts as one trade. Halves are exact in binary floating point, which
 * keeps the limit comparison free of rounding drift.
 */
public record DailyTradeCount(@JsonProperty("halfUnits") int halfUnits) {

    public static final DailyTradeCount ZERO = new DailyTradeCount(0);

    public DailyTradeCount {
        if (halfUnits < 0) {
            throw new IllegalArgumentException("halfUnits must be >= 0, got " + halfUnits);
        }
    }

    /**
     * @param trades a non-negative multiple of 0.5
     * @throws IllegalArgumentException if {@code trades} is not a multiple of 0.5
     */
    public static DailyTradeCount ofTrades(double trades) {
        double doubled = trades * 2;
        if (!Double.isFinite(doubled) || doubled != Math.rint(doubled)) {
            throw new IllegalArgumentException("Daily trade count must be a multiple of 0.5, got " + trades);
        }
        return new DailyTradeCount((int) doubled);
    }

    public DailyTradeCount plusHalf() {
        return new DailyTradeCount(halfUnits + 1);
    }

    @JsonIgnore
    public double trades() {
        return halfUnits / 2.0;
    }
}
