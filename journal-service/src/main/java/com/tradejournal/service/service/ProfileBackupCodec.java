package com.tradejournal.service.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradejournal.core.exception.JournalException;
import com.tradejournal.core.model.Trade;
import com.tradejournal.core.model.UserProfile;
import com.tradejournal.core.validation.TradeValidator;
import com.tradejournal.service.exception.InvalidBackupException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON backup of a whole {@link UserProfile}: active ledger, archives and settings.
 *
 * <p>Restores are all-or-nothing. Active trades go through {@link TradeValidator}
 * like any other ledger entry; archived sessions are taken as they are.
 */
@Component
public class ProfileBackupCodec {

    private final ObjectMapper objectMapper;

    public ProfileBackupCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(UserProfile profile) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile);
        } catch (JsonProcessingException e) {
            throw new JournalException("Failed to encode backup for profile " + profile.id(), e);
        }
    }

    /**
     * @throws InvalidBackupException if the document is not a profile or holds invalid trades
     */
    public UserProfile decode(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidBackupException("Backup document is empty", List.of());
        }

        UserProfile profile;
        try {
            profile = objectMapper.readValue(json, UserProfile.class);
        } catch (JsonProcessingException e) {
            throw new InvalidBackupException("Backup document is not valid JSON for a profile", e);
        }

        List<String> problems = new ArrayList<>();
        if (profile.startDate() == null) {
            problems.add("startDate is required");
        }
        if (!Double.isFinite(profile.initialCapital())) {
            problems.add("initialCapital must be finite");
        }

        List<Trade> normalized = new ArrayList<>(profile.trades().size());
        for (Trade trade : profile.trades()) {
            Trade t = TradeValidator.normalize(trade);
            TradeValidator.violations(t).forEach(v -> problems.add("trade " + t.id() + ": " + v));
            normalized.add(t);
        }

        if (!problems.isEmpty()) {
            throw new InvalidBackupException("Backup contains invalid data", problems);
        }
        return profile.withTrades(normalized);
    }
}
