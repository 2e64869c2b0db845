package com.tradejournal.core.equity;

import com.tradejournal.core.model.EquityPoint;
import com.tradejournal.core.model.Trade;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Rebuilds the running account balance from an unordered ledger.
 *
 * <h3>Algorithm</h3>
 * <pre>
 *   realized = trades with a valid realized pnl, stable-sorted by entryDate
 *   balance  = initialCapital + prefixSum(pnl)
 *   peak     = max(0, cumulative pnl so far)
 *   drawdown = peak − cumulative pnl
 * </pre>
 * The curve begins with a "Start" point at {@code initialCapital}; open trades add
 * no point. Drawdown is measured on cumulative realized pnl, not on balance, so it
 * is independent of the starting capital.
 */
public final class EquityCurveBuilder {

    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("MMM d", Locale.US);

    private static final Comparator<Trade> BY_ENTRY_DATE =
        Comparator.comparing(Trade::entryDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    private EquityCurveBuilder() {}

    public static EquityCurve build(List<Trade> trades, double initialCapital) {
        List<Trade> ordered = chronological(trades);

        List<EquityPoint> points = new ArrayList<>(ordered.size() + 1);
        points.add(EquityPoint.start(initialCapital));

        double cumulative = 0.0;
        for (Trade trade : ordered) {
            cumulative += trade.pnl();
            points.add(new EquityPoint(label(trade), trade.entryDate(), trade.pnl(), initialCapital + cumulative));
        }
        return new EquityCurve(points, drawdownOf(ordered));
    }

    /** Largest peak-to-trough decline of cumulative realized pnl; 0 when pnl never falls. */
    public static double maxDrawdown(List<Trade> trades) {
        return drawdownOf(chronological(trades));
    }

    private static double drawdownOf(List<Trade> ordered) {
        double peak = 0.0;
        double cumulative = 0.0;
        double maxDrawdown = 0.0;
        for (Trade trade : ordered) {
            cumulative += trade.pnl();
            peak = Math.max(peak, cumulative);
            maxDrawdown = Math.max(maxDrawdown, peak - cumulative);
        }
        return maxDrawdown;
    }

    // List.sort is stable, so equal entry dates keep their ledger order.
    private static List<Trade> chronological(List<Trade> trades) {
        List<Trade> realized = RealizedTrades.of(trades);
        realized.sort(BY_ENTRY_DATE);
        return realized;
    }

    private static String label(Trade trade) {
        return trade.entryDate() != null ? LABEL_FORMAT.format(trade.entryDate()) : trade.id();
    }
}
