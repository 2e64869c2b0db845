package com.tradejournal.core.exception;

/**
 * Base unchecked exception for journal errors the caller can recover from locally.
 */
public class JournalException extends RuntimeException {

    public JournalException(String message) {
        super(message);
    }

    public JournalException(String message, Throwable cause) {
        super(message, cause);
    }
}
