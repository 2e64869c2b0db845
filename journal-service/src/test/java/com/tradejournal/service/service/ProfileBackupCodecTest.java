package com.tradejournal.service.service;

import com.tradejournal.core.model.UserProfile;
import com.tradejournal.core.model.UserSettings;
import com.tradejournal.service.config.JournalConfig;
import com.tradejournal.service.exception.InvalidBackupException;
import com.tradejournal.service.store.DemoProfileSeeder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProfileBackupCodecTest {

    private final ProfileBackupCodec codec = new ProfileBackupCodec(JournalConfig.journalObjectMapper());

    private static UserProfile demo() {
        return DemoProfileSeeder.demoProfile(UserSettings.defaults(), 10_000.0);
    }

    @Test
    @DisplayName("encoded profile decodes to an equal profile")
    void roundTrip() {
        assertEquals(demo(), codec.decode(codec.encode(demo())));
    }

    @Test
    @DisplayName("dates are written as ISO strings, helper accessors are not written")
    void wireFormat() {
        String json = codec.encode(demo());
        assertTrue(json.contains("\"startDate\" : \"2024-05-01T00:00"));
        assertFalse(json.contains("lifecycleConsistent"));
        assertFalse(json.contains("\"closed\""));
    }

    @Test
    @DisplayName("empty and malformed documents are rejected")
    void malformed() {
        assertThrows(InvalidBackupException.class, () -> codec.decode(""));
        assertThrows(InvalidBackupException.class, () -> codec.decode("[1,2]"));
    }

    @Test
    @DisplayName("missing start date is reported")
    void missingStartDate() {
        InvalidBackupException ex = assertThrows(InvalidBackupException.class,
            () -> codec.decode("{\"id\":\"p\",\"name\":\"n\",\"initialCapital\":1.0}"));
        assertTrue(ex.getDetails().contains("startDate is required"));
    }

    @Test
    @DisplayName("invalid active trades are reported with their id")
    void invalidTrade() {
        String json = codec.encode(demo()).replace("\"pnl\" : -500.0", "\"pnl\" : null");

        InvalidBackupException ex = assertThrows(InvalidBackupException.class, () -> codec.decode(json));
        assertTrue(ex.getDetails().contains("trade 2: closed trade requires a finite pnl"));
    }

    @Test
    @DisplayName("tickers are normalized on import")
    void normalizesTickers() {
        String json = codec.encode(demo()).replace("\"ticker\" : \"SPY\"", "\"ticker\" : \" spy \"");
        assertEquals("SPY", codec.decode(json).findTrade("1").orElseThrow().ticker());
    }
}
