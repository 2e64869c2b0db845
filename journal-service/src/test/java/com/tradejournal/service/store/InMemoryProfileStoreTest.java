package com.tradejournal.service.store;

import com.tradejournal.core.model.UserProfile;
import com.tradejournal.core.model.UserSettings;
import com.tradejournal.service.exception.ProfileNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProfileStoreTest {

    private final InMemoryProfileStore store = new InMemoryProfileStore();

    private static UserProfile profile(String id) {
        return new UserProfile(id, "n", 100.0, LocalDateTime.of(2024, 1, 1, 0, 0), List.of(), List.of(), null);
    }

    @Test
    @DisplayName("saved profiles can be found by id")
    void saveAndFind() {
        store.save(profile("a"));
        store.save(profile("b"));
        assertTrue(store.find("a").isPresent());
        assertTrue(store.find("b").isPresent());
        assertTrue(store.find("c").isEmpty());
        assertEquals(UserSettings.defaults(), store.find("a").orElseThrow().settings());
    }

    @Test
    @DisplayName("update replaces the snapshot")
    void update() {
        store.save(profile("a"));
        UserProfile next = store.update("a", p -> p.withSettings(new UserSettings(1, 2, 3, 4)));
        assertEquals(next, store.find("a").orElseThrow());
    }

    @Test
    @DisplayName("failing update leaves the stored profile as it was")
    void failingUpdate() {
        UserProfile original = store.save(profile("a"));
        assertThrows(IllegalStateException.class, () -> store.update("a", p -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(original, store.find("a").orElseThrow());
    }

    @Test
    @DisplayName("update of an unknown profile raises ProfileNotFoundException")
    void updateUnknown() {
        assertThrows(ProfileNotFoundException.class, () -> store.update("x", p -> p));
    }
}
