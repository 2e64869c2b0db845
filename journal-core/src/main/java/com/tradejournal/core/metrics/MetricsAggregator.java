package com.tradejournal.core.metrics;

import com.tradejournal.core.equity.EquityCurveBuilder;
import com.tradejournal.core.equity.RealizedTrades;
import com.tradejournal.core.model.Metrics;
import com.tradejournal.core.model.Trade;

import java.util.List;

/**
 * Folds a ledger into the dashboard {@link Metrics}.
 *
 * <ul>
 *   <li>totalPnL, averagePnL, winRate: closed trades only; open trades neither help nor hurt</li>
 *   <li>disciplineScore: mean over ALL trades, since it scores entry behavior, not outcome</li>
 *   <li>maxDrawdown: from {@link EquityCurveBuilder}</li>
 * </ul>
 * Every ratio resolves to 0 on an empty denominator.
 */
public final class MetricsAggregator {

    private MetricsAggregator() {}

    public static Metrics aggregate(List<Trade> trades) {
        if (trades == null || trades.isEmpty()) {
            return Metrics.EMPTY;
        }

        List<Trade> closed = RealizedTrades.of(trades);
        double totalPnl = RealizedTrades.totalPnl(closed);
        long wins = closed.stream().filter(t -> t.pnl() > 0).count();

        double winRate    = ratio(wins, closed.size()) * 100.0;
        double averagePnl = closed.isEmpty() ? 0.0 : totalPnl / closed.size();

        double disciplineSum = 0.0;
        int counted = 0;
        for (Trade trade : trades) {
            if (trade == null) continue;
            disciplineSum += trade.disciplineScore();
            counted++;
        }
        double disciplineScore = ratio(disciplineSum, counted);

        return new Metrics(
            counted,
            winRate,
            totalPnl,
            averagePnl,
            disciplineScore,
            EquityCurveBuilder.maxDrawdown(trades));
    }

    static double ratio(double numerator, int denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }
}
