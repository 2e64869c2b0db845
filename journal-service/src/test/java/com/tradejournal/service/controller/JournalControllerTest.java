package com.tradejournal.service.controller;

import com.tradejournal.core.model.UserSettings;
import com.tradejournal.service.config.JournalConfig;
import com.tradejournal.service.service.JournalService;
import com.tradejournal.service.service.ProfileBackupCodec;
import com.tradejournal.service.store.DemoProfileSeeder;
import com.tradejournal.service.store.InMemoryProfileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

class JournalControllerTest {

    private static final String DEMO = "/api/v1/journal/profiles/" + DemoProfileSeeder.DEMO_PROFILE_ID;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        InMemoryProfileStore store = new InMemoryProfileStore();
        new DemoProfileSeeder(store, UserSettings.defaults(), true, 10_000.0).run(null);
        JournalService service = new JournalService(store,
            new ProfileBackupCodec(JournalConfig.journalObjectMapper()), UserSettings.defaults(),
            Clock.fixed(Instant.parse("2024-05-10T12:00:00Z"), ZoneOffset.UTC));

        client = WebTestClient.bindToController(new JournalController(service))
            .controllerAdvice(new JournalExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("metrics of the demo profile")
    void metrics() {
        client.get().uri(DEMO + "/metrics").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.totalTrades").isEqualTo(3)
            .jsonPath("$.totalPnL").isEqualTo(150.0)
            .jsonPath("$.winRate").isEqualTo(50.0);
    }

    @Test
    @DisplayName("logging a trade returns 201 with the scored trade")
    void addTrade() {
        String body = """
            {"ticker":"aapl","entryPrice":1.5,"quantity":1,"entryDate":"2024-05-10T10:00:00",
             "checklist":{"strategyAligned":true,"riskDefined":true,"sizeWithinLimits":true,
                          "marketConditionsFavorable":true,"emotionallyStable":true}}
            """;
        client.post().uri(DEMO + "/trades").contentType(MediaType.APPLICATION_JSON).bodyValue(body).exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.ticker").isEqualTo("AAPL")
            .jsonPath("$.disciplineScore").isEqualTo(100);
    }

    @Test
    @DisplayName("invalid trade maps to 400 with violations")
    void invalidTrade() {
        client.post().uri(DEMO + "/trades").contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"entryPrice\":1.0}").exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Invalid trade")
            .jsonPath("$.details[0]").isEqualTo("ticker is required");
    }

    @Test
    @DisplayName("unknown profile and trade map to 404")
    void notFound() {
        client.get().uri("/api/v1/journal/profiles/nobody/metrics").exchange().expectStatus().isNotFound();
        client.delete().uri(DEMO + "/trades/missing").exchange().expectStatus().isNotFound();
    }

    @Test
    @DisplayName("malformed calendar month maps to 400")
    void badMonth() {
        client.get().uri(DEMO + "/calendar/May-2024").exchange().expectStatus().isBadRequest();
        client.get().uri(DEMO + "/calendar/2024-05").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.tradeCount").isEqualTo(3);
    }

    @Test
    @DisplayName("close without an exit price maps to 400 and leaves the trade open")
    void closeWithoutExitPrice() {
        client.post().uri(DEMO + "/trades/3/close").contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{}").exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.details[0]").isEqualTo("exitPrice is required to close a trade");

        client.get().uri(DEMO).exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.trades[0].id").isEqualTo("3")
            .jsonPath("$.trades[0].status").isEqualTo("OPEN")
            .jsonPath("$.trades[0].pnl").doesNotExist();
    }

    @Test
    @DisplayName("closing an open trade and deleting it")
    void closeAndDelete() {
        client.post().uri(DEMO + "/trades/3/close").contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"exitPrice\":1.2}").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("CLOSED")
            .jsonPath("$.pnl").isNumber();

        client.delete().uri(DEMO + "/trades/3").exchange().expectStatus().isNoContent();
    }
}
