package com.tradejournal.service.controller;

import com.tradejournal.core.exception.InvalidTradeException;
import com.tradejournal.core.exception.JournalException;
import com.tradejournal.service.dto.ErrorResponse;
import com.tradejournal.service.exception.InvalidBackupException;
import com.tradejournal.service.exception.ProfileNotFoundException;
import com.tradejournal.service.exception.TradeNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Maps journal exceptions to HTTP responses. Everything here is recoverable by the
 * caller; only unexpected exceptions become 500.
 */
@RestControllerAdvice
public class JournalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(JournalExceptionHandler.class);

    @ExceptionHandler(InvalidTradeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTrade(InvalidTradeException ex) {
        log.warn("Invalid trade: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid trade", ex.getViolations()));
    }

    @ExceptionHandler(InvalidBackupException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBackup(InvalidBackupException ex) {
        log.warn("Invalid backup: {} details={}", ex.getMessage(), ex.getDetails());
        return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage(), ex.getDetails()));
    }

    @ExceptionHandler({ProfileNotFoundException.class, TradeNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(JournalException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeParseException.class})
    public ResponseEntity<ErrorResponse> handleBadArgument(RuntimeException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid argument", List.of(ex.getMessage())));
    }

    @ExceptionHandler(JournalException.class)
    public ResponseEntity<ErrorResponse> handleJournal(JournalException ex) {
        log.error("Journal error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(ex.getMessage()));
    }
}
