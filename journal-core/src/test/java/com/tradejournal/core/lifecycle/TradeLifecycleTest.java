package com.tradejournal.core.lifecycle;

import com.tradejournal.core.exception.InvalidTradeException;
import com.tradejournal.core.model.Emotion;
import com.tradejournal.core.model.Trade;
import com.tradejournal.core.model.TradeDirection;
import com.tradejournal.core.model.TradeStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tradejournal.core.support.TestTrades.D1;
import static com.tradejournal.core.support.TestTrades.open;
import static org.junit.jupiter.api.Assertions.*;

class TradeLifecycleTest {

    @Nested
    @DisplayName("PnlCalculator")
    class PnlTests {

        @Test
        @DisplayName("short put 2.50 → 1.20 × 5 contracts → +650")
        void shortPutProfit() {
            assertEquals(650.0, PnlCalculator.realizedPnl(TradeDirection.SHORT, 2.50, 1.20, 5), 1e-9);
        }

        @Test
        @DisplayName("long call 15 → 10 × 1 contract → −500")
        void longCallLoss() {
            assertEquals(-500.0, PnlCalculator.realizedPnl(TradeDirection.LONG, 15.0, 10.0, 1), 1e-9);
        }

        @Test
        @DisplayName("fees do not change the realized pnl")
        void feesExcluded() {
            assertEquals(100.0, PnlCalculator.realizedPnl(TradeDirection.LONG, 1.0, 2.0, 1), 1e-9);
            Trade withFees = open("f1", D1).toBuilder()
                .direction(TradeDirection.LONG).entryPrice(1.0).quantity(1).fees(5.0).build();
            assertEquals(100.0, TradeLifecycle.close(withFees, 2.0, D1.plusHours(1), null).pnl(), 1e-9);
        }
    }

    @Nested
    @DisplayName("close() / reopen()")
    class TransitionTests {

        private final Trade openTrade = open("t1", D1).toBuilder()
            .direction(TradeDirection.LONG).entryPrice(3.0).quantity(2).fees(1.30).build();

        @Test
        @DisplayName("close sets exit fields and realized pnl")
        void close() {
            Trade closed = TradeLifecycle.close(openTrade, 4.0, D1.plusHours(2), null);
            assertEquals(TradeStatus.CLOSED, closed.status());
            assertEquals(4.0, closed.exitPrice());
            assertEquals(D1.plusHours(2), closed.exitDate());
            assertEquals(200.0, closed.pnl(), 1e-9);
            assertEquals(Emotion.CALM, closed.exitEmotion());
            assertEquals(openTrade.checklist(), closed.checklist());
            assertEquals(openTrade.disciplineScore(), closed.disciplineScore());
        }

        @Test
        @DisplayName("close keeps an explicit exit emotion")
        void closeWithEmotion() {
            assertEquals(Emotion.ANXIOUS, TradeLifecycle.close(openTrade, 1.0, D1, Emotion.ANXIOUS).exitEmotion());
        }

        @Test
        @DisplayName("reopen clears every exit field")
        void reopen() {
            Trade reopened = TradeLifecycle.reopen(TradeLifecycle.close(openTrade, 4.0, D1.plusHours(1), Emotion.BORED));
            assertEquals(TradeStatus.OPEN, reopened.status());
            assertNull(reopened.pnl());
            assertNull(reopened.exitPrice());
            assertNull(reopened.exitDate());
            assertNull(reopened.exitEmotion());
            assertTrue(reopened.isLifecycleConsistent());
        }

        @Test
        @DisplayName("closing a closed trade or reopening an open one is rejected")
        void invalidTransitions() {
            Trade closed = TradeLifecycle.close(openTrade, 4.0, D1, null);
            assertThrows(InvalidTradeException.class, () -> TradeLifecycle.close(closed, 5.0, D1, null));
            assertThrows(InvalidTradeException.class, () -> TradeLifecycle.reopen(openTrade));
        }

        @Test
        @DisplayName("exit before entry is rejected")
        void exitBeforeEntry() {
            assertThrows(InvalidTradeException.class,
                () -> TradeLifecycle.close(openTrade, 4.0, D1.minusMinutes(1), null));
        }
    }

    @Nested
    @DisplayName("settle(): after an explicit edit")
    class SettleTests {

        @Test
        @DisplayName("closed trade pnl is recomputed from prices")
        void recomputesClosed() {
            Trade edited = open("t2", D1).toBuilder()
                .status(TradeStatus.CLOSED).entryPrice(2.0).exitPrice(3.0).pnl(1.0).build();
            assertEquals(100.0, TradeLifecycle.settle(edited).pnl(), 1e-9);
        }

        @Test
        @DisplayName("open trade loses any pnl")
        void clearsOpen() {
            Trade edited = open("t3", D1).toBuilder().pnl(42.0).exitPrice(1.0).build();
            Trade settled = TradeLifecycle.settle(edited);
            assertNull(settled.pnl());
            assertNull(settled.exitPrice());
        }
    }
}
