package com.tradejournal.core.discipline;

import com.tradejournal.core.model.DailyTradeCount;
import com.tradejournal.core.model.Trade;

import java.time.LocalDate;
import java.util.List;

/**
 * Counts how much of a day's trade allowance the ledger has already used:
 * one half-unit per trade entered that day and one per trade exited that day.
 */
public final class DailyTradeCounter {

    private DailyTradeCounter() {}

    public static DailyTradeCount countFor(List<Trade> ledger, LocalDate day) {
        int halfUnits = 0;
        for (Trade trade : ledger) {
            if (trade.entryDate() != null && trade.entryDate().toLocalDate().equals(day)) {
                halfUnits++;
            }
            if (trade.exitDate() != null && trade.exitDate().toLocalDate().equals(day)) {
                halfUnits++;
            }
        }
        return new DailyTradeCount(halfUnits);
    }
}
