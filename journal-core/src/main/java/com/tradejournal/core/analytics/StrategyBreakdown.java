package com.tradejournal.core.analytics;

import com.tradejournal.core.equity.RealizedTrades;
import com.tradejournal.core.model.Trade;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Realized P&amp;L grouped by position shape, e.g. "Long Call" or "Short Put".
 * Results are ordered by total P&amp;L, best first.
 */
public final class StrategyBreakdown {

    private StrategyBreakdown() {}

    public static List<StrategyPerformance> byDirectionAndType(List<Trade> trades) {
        Map<String, double[]> totals = new LinkedHashMap<>();
        for (Trade trade : RealizedTrades.of(trades)) {
            String key = strategyName(trade);
            double[] acc = totals.computeIfAbsent(key, k -> new double[2]);
            acc[0] += trade.pnl();
            acc[1] += 1;
        }

        List<StrategyPerformance> out = new ArrayList<>(totals.size());
        totals.forEach((name, acc) -> out.add(new StrategyPerformance(name, acc[0], (int) acc[1])));
        out.sort(Comparator.comparingDouble(StrategyPerformance::totalPnL).reversed());
        return out;
    }

    static String strategyName(Trade trade) {
        return trade.direction().label() + " " + trade.optionType().label();
    }
}
