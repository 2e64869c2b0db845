package com.tradejournal.core.exception;

import java.util.List;

/**
 * A trade entry was rejected before it could enter the ledger.
 * Carries every violation found, not only the first.
 */
public class InvalidTradeException extends JournalException {

    private final String tradeId;
    private final List<String> violations;

    public InvalidTradeException(String tradeId, List<String> violations) {
        super("[" + tradeId + "] invalid trade: " + String.join("; ", violations));
        this.tradeId = tradeId;
        this.violations = List.copyOf(violations);
    }

    public InvalidTradeException(String tradeId, String violation) {
        this(tradeId, List.of(violation));
    }

    public String getTradeId() {
        return tradeId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
