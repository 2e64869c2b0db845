package com.tradejournal.core.analytics;

import com.tradejournal.core.model.Trade;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;

import static com.tradejournal.core.support.TestTrades.closed;
import static com.tradejournal.core.support.TestTrades.open;
import static org.junit.jupiter.api.Assertions.*;

class CalendarAggregatorTest {

    private static final YearMonth MAY = YearMonth.of(2024, 5);

    private final List<Trade> trades = List.of(
        closed("1", LocalDateTime.of(2024, 5, 1, 10, 30), 650.0),
        closed("2", LocalDateTime.of(2024, 5, 1, 14, 0), -200.0),
        open("3", LocalDateTime.of(2024, 5, 10, 9, 45)),
        closed("4", LocalDateTime.of(2024, 4, 30, 15, 0), 999.0));

    @Test
    @DisplayName("days hold pnl of closed trades and the count of all trades")
    void dailyBuckets() {
        MonthlySummary summary = CalendarAggregator.month(trades, MAY);

        assertEquals(List.of(
            new DailySummary(LocalDate.of(2024, 5, 1), 450.0, 2, 1),
            new DailySummary(LocalDate.of(2024, 5, 10), 0.0, 1, 0)), summary.days());
    }

    @Test
    @DisplayName("month totals exclude other months; win rate is over all trades entered")
    void monthTotals() {
        MonthlySummary summary = CalendarAggregator.month(trades, MAY);
        assertEquals(MAY, summary.month());
        assertEquals(450.0, summary.totalPnL());
        assertEquals(3, summary.tradeCount());
        assertEquals(1, summary.wins());
        assertEquals(100.0 / 3.0, summary.winRate(), 1e-9);
    }

    @Test
    @DisplayName("empty month → no days, zero win rate")
    void emptyMonth() {
        MonthlySummary summary = CalendarAggregator.month(trades, YearMonth.of(2024, 7));
        assertTrue(summary.days().isEmpty());
        assertEquals(0.0, summary.winRate());
    }
}
