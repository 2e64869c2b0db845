package com.tradejournal.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DailyTradeCountTest {

    @Test
    @DisplayName("ofTrades accepts multiples of 0.5")
    void acceptsHalves() {
        assertEquals(9, DailyTradeCount.ofTrades(4.5).halfUnits());
        assertEquals(0, DailyTradeCount.ofTrades(0).halfUnits());
    }

    @Test
    @DisplayName("ofTrades rejects values that are not multiples of 0.5")
    void rejectsOtherFractions() {
        assertThrows(IllegalArgumentException.class, () -> DailyTradeCount.ofTrades(1.3));
        assertThrows(IllegalArgumentException.class, () -> DailyTradeCount.ofTrades(Double.NaN));
    }

    @Test
    @DisplayName("negative counts are rejected")
    void rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> new DailyTradeCount(-1));
    }

    @Test
    @DisplayName("plusHalf adds exactly one half-unit")
    void plusHalf() {
        assertEquals(5.0, DailyTradeCount.ofTrades(4.5).plusHalf().trades());
    }
}
