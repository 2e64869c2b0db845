package com.tradejournal.service.store;

import com.tradejournal.core.model.UserProfile;
import com.tradejournal.service.exception.ProfileNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link ProfileStore}. Per-profile updates run inside
 * {@link ConcurrentHashMap#computeIfPresent}, so concurrent writers to the same
 * profile are serialized and a failing change leaves the entry untouched.
 */
@Repository
public class InMemoryProfileStore implements ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProfileStore.class);

    private final Map<String, UserProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<UserProfile> find(String profileId) {
        return Optional.ofNullable(profiles.get(profileId));
    }

    @Override
    public UserProfile save(UserProfile profile) {
        Objects.requireNonNull(profile.id(), "profile id");
        profiles.put(profile.id(), profile);
        log.debug("[ProfileStore] saved. profile={} trades={} archives={}",
            profile.id(), profile.trades().size(), profile.archives().size());
        return profile;
    }

    @Override
    public UserProfile update(String profileId, UnaryOperator<UserProfile> change) {
        UserProfile updated = profiles.computeIfPresent(profileId,
            (id, current) -> Objects.requireNonNull(change.apply(current), "updated profile"));
        if (updated == null) {
            throw new ProfileNotFoundException(profileId);
        }
        return updated;
    }
}
