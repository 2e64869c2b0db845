package com.tradejournal.core.equity;

import com.tradejournal.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-side filter shared by the equity curve and the metrics: selects the trades
 * whose realized pnl counts.
 *
 * <p>A trade counts when it is CLOSED with a finite pnl. Records that break the
 * open/closed invariant (an OPEN trade carrying pnl, a non-finite pnl) are skipped
 * with a warning instead of failing the whole computation.
 */
public final class RealizedTrades {

    private static final Logger log = LoggerFactory.getLogger(RealizedTrades.class);

    private RealizedTrades() {}

    /** Realized trades in their original relative order. */
    public static List<Trade> of(List<Trade> trades) {
        List<Trade> realized = new ArrayList<>();
        for (Trade trade : trades) {
            if (trade == null || !trade.hasPnl()) {
                continue;
            }
            if (!trade.isLifecycleConsistent()) {
                log.warn("Skipping inconsistent trade. id={} status={} pnl={}",
                    trade.id(), trade.status(), trade.pnl());
                continue;
            }
            realized.add(trade);
        }
        return realized;
    }

    public static double totalPnl(List<Trade> realized) {
        double total = 0.0;
        for (Trade trade : realized) {
            total += trade.pnl();
        }
        return total;
    }
}
