package com.tradejournal.core.discipline;

import com.tradejournal.core.model.DailyTradeCount;
import com.tradejournal.core.model.Trade;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static com.tradejournal.core.support.TestTrades.closed;
import static com.tradejournal.core.support.TestTrades.open;
import static org.junit.jupiter.api.Assertions.*;

class DailyTradeCounterTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 6);

    @Test
    @DisplayName("empty ledger → zero")
    void emptyLedger() {
        assertEquals(DailyTradeCount.ZERO, DailyTradeCounter.countFor(List.of(), DAY));
    }

    @Test
    @DisplayName("open counts 0.5, same-day round trip counts 1.0")
    void halfUnitsPerEvent() {
        List<Trade> ledger = List.of(
            open("a", DAY.atTime(9, 35)),
            closed("b", DAY.atTime(10, 0), 120.0));   // exits one hour later, same day

        DailyTradeCount count = DailyTradeCounter.countFor(ledger, DAY);
        assertEquals(3, count.halfUnits());
        assertEquals(1.5, count.trades());
    }

    @Test
    @DisplayName("exit on the day of a trade entered earlier counts only the close")
    void exitOnlyCounts() {
        Trade heldOvernight = closed("c", DAY.minusDays(1).atTime(15, 0), 50.0)
            .toBuilder().exitDate(DAY.atTime(9, 45)).build();

        assertEquals(1, DailyTradeCounter.countFor(List.of(heldOvernight), DAY).halfUnits());
        assertEquals(1, DailyTradeCounter.countFor(List.of(heldOvernight), DAY.minusDays(1)).halfUnits());
    }

    @Test
    @DisplayName("trades on other days are ignored")
    void otherDaysIgnored() {
        List<Trade> ledger = List.of(open("d", LocalDateTime.of(2024, 5, 7, 10, 0)));
        assertEquals(0, DailyTradeCounter.countFor(ledger, DAY).halfUnits());
    }
}
