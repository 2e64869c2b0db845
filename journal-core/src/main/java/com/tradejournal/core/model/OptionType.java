package com.tradejournal.core.model;

public enum OptionType {

    CALL("Call"),
    PUT("Put");

    private final String label;

    OptionType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Single-letter code used in compact contract names. */
    public char code() {
        return label.charAt(0);
    }
}
