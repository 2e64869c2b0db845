package com.tradejournal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate root of one journal: the active ledger, the current period's capital
 * and start date, archived sessions and settings.
 *
 * <p>{@code trades} is kept most-recent-first for display; nothing in the engine
 * assumes it is chronological. {@code archives} is newest first and append-only.
 * All mutators return a new profile.
 */
public record UserProfile(
    @JsonProperty("id")             String id,
    @JsonProperty("name")           String name,
    @JsonProperty("initialCapital") double initialCapital,
    @JsonProperty("startDate")      LocalDateTime startDate,
    @JsonProperty("trades")         List<Trade> trades,
    @JsonProperty("archives")       List<ArchivedSession> archives,
    @JsonProperty("settings")       UserSettings settings
) {
    public UserProfile {
        trades   = trades == null ? List.of() : List.copyOf(trades);
        archives = archives == null ? List.of() : List.copyOf(archives);
        settings = settings == null ? UserSettings.defaults() : settings;
    }

    public Optional<Trade> findTrade(String tradeId) {
        return trades.stream().filter(t -> t.id().equals(tradeId)).findFirst();
    }

    /** Prepends {@code trade}, keeping most-recent-first order. */
    public UserProfile addTrade(Trade trade) {
        List<Trade> next = new ArrayList<>(trades.size() + 1);
        next.add(trade);
        next.addAll(trades);
        return withTrades(next);
    }

    /** Replaces the trade with the same id in place; unknown ids leave the ledger unchanged. */
    public UserProfile replaceTrade(Trade trade) {
        List<Trade> next = trades.stream()
            .map(t -> t.id().equals(trade.id()) ? trade : t)
            .toList();
        return withTrades(next);
    }

    public UserProfile removeTrade(String tradeId) {
        return withTrades(trades.stream().filter(t -> !t.id().equals(tradeId)).toList());
    }

    public UserProfile withTrades(List<Trade> newTrades) {
        return new UserProfile(id, name, initialCapital, startDate, newTrades, archives, settings);
    }

    public UserProfile withSettings(UserSettings newSettings) {
        return new UserProfile(id, name, initialCapital, startDate, trades, archives, newSettings);
    }
}
