package com.tradejournal.service.store;

import com.tradejournal.core.model.UserProfile;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Full-record storage of journal profiles.
 *
 * <p>{@link #update} is the only way to change an existing profile: the change
 * function receives the current snapshot and returns the next one. If it throws,
 * the stored profile stays as it was.
 */
public interface ProfileStore {

    Optional<UserProfile> find(String profileId);

    UserProfile save(UserProfile profile);

    /**
     * @throws com.tradejournal.service.exception.ProfileNotFoundException if no profile has this id
     */
    UserProfile update(String profileId, UnaryOperator<UserProfile> change);
}
