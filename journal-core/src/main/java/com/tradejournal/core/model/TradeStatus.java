package com.tradejournal.core.model;

/**
 * Lifecycle state of a trade. Only CLOSED trades carry a realized pnl.
 */
public enum TradeStatus {
    OPEN,
    CLOSED
}
