package com.tradejournal.core.archive;

import com.tradejournal.core.metrics.MetricsAggregator;
import com.tradejournal.core.model.ArchivedSession;
import com.tradejournal.core.model.Metrics;
import com.tradejournal.core.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Closes out a trading period.
 *
 * <p>{@code reset} snapshots the active ledger into an {@link ArchivedSession},
 * prepends it to the archive list and starts a fresh, empty period with the new
 * capital. The input profile is never modified; the caller persists the returned
 * one, so either both halves of the transition are observed or neither is.
 *
 * <p>Archives are terminal: nothing in the engine edits an existing snapshot.
 */
public final class SessionArchiver {

    private static final Logger log = LoggerFactory.getLogger(SessionArchiver.class);

    private SessionArchiver() {}

    /**
     * @param profile           current profile state
     * @param newInitialCapital starting capital of the next period; any finite number
     * @param now               end of the archived period and start of the new one
     * @return the reset profile
     * @throws IllegalArgumentException if {@code newInitialCapital} is NaN or infinite
     */
    public static UserProfile reset(UserProfile profile, double newInitialCapital, LocalDateTime now) {
        return reset(profile, newInitialCapital, now, () -> archiveId(now));
    }

    /**
     * Same as {@link #reset(UserProfile, double, LocalDateTime)} with the archive id
     * taken from {@code idSupplier}. Callers that can reset twice within the same
     * millisecond must supply unique ids.
     */
    public static UserProfile reset(UserProfile profile, double newInitialCapital, LocalDateTime now,
                                    Supplier<String> idSupplier) {
        if (!Double.isFinite(newInitialCapital)) {
            throw new IllegalArgumentException("newInitialCapital must be finite, got " + newInitialCapital);
        }

        ArchivedSession snapshot = snapshot(profile, now, idSupplier.get());

        List<ArchivedSession> archives = new ArrayList<>(profile.archives().size() + 1);
        archives.add(snapshot);
        archives.addAll(profile.archives());

        log.info("Session archived. profile={} archive={} trades={} totalPnL={} newCapital={}",
            profile.id(), snapshot.id(), snapshot.tradeCount(), snapshot.totalPnL(), newInitialCapital);

        return new UserProfile(
            profile.id(),
            profile.name(),
            newInitialCapital,
            now,
            List.of(),
            archives,
            profile.settings());
    }

    /** Builds the archive record for the profile's current period without resetting it. */
    public static ArchivedSession snapshot(UserProfile profile, LocalDateTime now) {
        return snapshot(profile, now, archiveId(now));
    }

    static ArchivedSession snapshot(UserProfile profile, LocalDateTime now, String archiveId) {
        if (archiveId == null || archiveId.isBlank()) {
            throw new IllegalArgumentException("archive id is required");
        }
        Metrics metrics = MetricsAggregator.aggregate(profile.trades());
        return new ArchivedSession(
            archiveId,
            profile.startDate(),
            now,
            profile.initialCapital(),
            profile.initialCapital() + metrics.totalPnL(),
            metrics.totalPnL(),
            profile.trades().size(),
            profile.trades());
    }

    /** {@code "session-"} plus the epoch millis of {@code now} taken as UTC. */
    public static String archiveId(LocalDateTime now) {
        return "session-" + now.toInstant(ZoneOffset.UTC).toEpochMilli();
    }
}
