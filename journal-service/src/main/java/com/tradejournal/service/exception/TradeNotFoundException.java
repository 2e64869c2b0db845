package com.tradejournal.service.exception;

import com.tradejournal.core.exception.JournalException;

public class TradeNotFoundException extends JournalException {

    public TradeNotFoundException(String profileId, String tradeId) {
        super("Trade not found: " + tradeId + " (profile " + profileId + ")");
    }
}
