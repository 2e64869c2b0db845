package com.tradejournal.core.lifecycle;

import com.tradejournal.core.model.TradeDirection;

/**
 * Realized profit and loss of an options position.
 *
 * <pre>
 *   pnl = (exit − entry) × quantity × 100 × (LONG ? +1 : −1)
 * </pre>
 * Fees are recorded on the trade but are not part of the realized figure.
 */
public final class PnlCalculator {

    /** Shares controlled by one standard equity option contract. */
    public static final int CONTRACT_MULTIPLIER = 100;

    private PnlCalculator() {}

    public static double realizedPnl(TradeDirection direction, double entryPrice, double exitPrice,
                                     int quantity) {
        return (exitPrice - entryPrice) * quantity * CONTRACT_MULTIPLIER * direction.sign();
    }
}
