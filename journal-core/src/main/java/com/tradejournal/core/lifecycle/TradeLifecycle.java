package com.tradejournal.core.lifecycle;

import com.tradejournal.core.exception.InvalidTradeException;
import com.tradejournal.core.model.Emotion;
import com.tradejournal.core.model.Trade;
import com.tradejournal.core.model.TradeStatus;

import java.time.LocalDateTime;

/**
 * OPEN ⇄ CLOSED transitions of a single trade. Both return a new trade and keep
 * the discipline payload untouched.
 */
public final class TradeLifecycle {

    private TradeLifecycle() {}

    /**
     * Closes an open trade at {@code exitPrice}. The exit emotion defaults to CALM
     * when the trader did not record one.
     *
     * @throws InvalidTradeException if the trade is already closed or the exit precedes the entry
     */
    public static Trade close(Trade trade, double exitPrice, LocalDateTime exitDate, Emotion exitEmotion) {
        if (trade.isClosed()) {
            throw new InvalidTradeException(trade.id(), "trade is already closed");
        }
        if (!Double.isFinite(exitPrice) || exitPrice < 0) {
            throw new InvalidTradeException(trade.id(), "exitPrice must be a finite number >= 0");
        }
        if (exitDate != null && trade.entryDate() != null && exitDate.isBefore(trade.entryDate())) {
            throw new InvalidTradeException(trade.id(), "exitDate must not be before entryDate");
        }

        double pnl = PnlCalculator.realizedPnl(
            trade.direction(), trade.entryPrice(), exitPrice, trade.quantity());

        Emotion emotion = exitEmotion != null ? exitEmotion
            : trade.exitEmotion() != null ? trade.exitEmotion() : Emotion.CALM;

        return trade.toBuilder()
            .status(TradeStatus.CLOSED)
            .exitPrice(exitPrice)
            .exitDate(exitDate)
            .pnl(pnl)
            .exitEmotion(emotion)
            .build();
    }

    /**
     * Re-opens a closed trade, clearing all exit data.
     *
     * @throws InvalidTradeException if the trade is already open
     */
    public static Trade reopen(Trade trade) {
        if (!trade.isClosed()) {
            throw new InvalidTradeException(trade.id(), "trade is already open");
        }
        return trade.toBuilder()
            .status(TradeStatus.OPEN)
            .exitPrice(null)
            .exitDate(null)
            .pnl(null)
            .exitEmotion(null)
            .build();
    }

    /**
     * Re-derives pnl from the status after an explicit edit: recomputed from prices
     * for a closed trade with an exit price, cleared for an open one.
     */
    public static Trade settle(Trade trade) {
        if (trade.status() == TradeStatus.OPEN) {
            return trade.toBuilder().pnl(null).exitPrice(null).exitDate(null).build();
        }
        if (trade.exitPrice() == null) {
            return trade;
        }
        return trade.toBuilder()
            .pnl(PnlCalculator.realizedPnl(trade.direction(), trade.entryPrice(), trade.exitPrice(),
                trade.quantity()))
            .build();
    }
}
