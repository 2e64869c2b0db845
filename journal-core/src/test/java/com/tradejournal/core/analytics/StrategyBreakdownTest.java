package com.tradejournal.core.analytics;

import com.tradejournal.core.model.OptionType;
import com.tradejournal.core.model.Trade;
import com.tradejournal.core.model.TradeDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tradejournal.core.support.TestTrades.D1;
import static com.tradejournal.core.support.TestTrades.D2;
import static com.tradejournal.core.support.TestTrades.D3;
import static com.tradejournal.core.support.TestTrades.closed;
import static com.tradejournal.core.support.TestTrades.open;
import static org.junit.jupiter.api.Assertions.*;

class StrategyBreakdownTest {

    private static Trade shaped(Trade t, TradeDirection direction, OptionType type) {
        return t.toBuilder().direction(direction).optionType(type).build();
    }

    @Test
    @DisplayName("groups realized pnl by direction and option type, best first")
    void groupsAndSorts() {
        List<Trade> trades = List.of(
            shaped(closed("1", D1, 650.0), TradeDirection.SHORT, OptionType.PUT),
            shaped(closed("2", D2, -500.0), TradeDirection.LONG, OptionType.CALL),
            shaped(closed("3", D3, 100.0), TradeDirection.SHORT, OptionType.PUT),
            shaped(open("4", D3), TradeDirection.LONG, OptionType.PUT));

        List<StrategyPerformance> result = StrategyBreakdown.byDirectionAndType(trades);

        assertEquals(List.of(
            new StrategyPerformance("Short Put", 750.0, 2),
            new StrategyPerformance("Long Call", -500.0, 1)), result);
    }

    @Test
    @DisplayName("no closed trades → empty breakdown")
    void empty() {
        assertTrue(StrategyBreakdown.byDirectionAndType(List.of(open("1", D1))).isEmpty());
    }
}
