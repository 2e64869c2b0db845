package com.tradejournal.core.model;

/**
 * Side of an options position. LONG buys the contract, SHORT sells (writes) it.
 */
public enum TradeDirection {

    LONG("Long"),
    SHORT("Short");

    private final String label;

    TradeDirection(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** +1 for LONG, -1 for SHORT. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
