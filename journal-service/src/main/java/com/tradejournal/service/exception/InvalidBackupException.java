package com.tradejournal.service.exception;

import com.tradejournal.core.exception.JournalException;

import java.util.List;

/**
 * A backup document could not be parsed or holds trades the ledger would reject.
 */
public class InvalidBackupException extends JournalException {

    private final List<String> details;

    public InvalidBackupException(String message, List<String> details) {
        super(message);
        this.details = List.copyOf(details);
    }

    public InvalidBackupException(String message, Throwable cause) {
        super(message, cause);
        this.details = List.of(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
    }

    public List<String> getDetails() {
        return details;
    }
}
