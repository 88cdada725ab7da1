package warden.adapter.out.threat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.common.RiskLevel;
import warden.testing.MutableClock;

@DisplayName("HttpThreatFeedClient")
class HttpThreatFeedClientTest {

    private Vertx vertx;
    private MutableClock clock;
    private HttpThreatFeedClient client;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        client = new HttpThreatFeedClient(vertx, "http://localhost:1/feed", Duration.ofSeconds(1), clock);
    }

    @AfterEach
    void tearDown() {
        vertx.closeAndAwait();
    }

    @Test
    @DisplayName("should parse feed entries with defaults")
    void shouldParseEntries() {
        final var feed = new JsonArray()
                .add(new JsonObject()
                        .put("ipAddress", " 203.0.113.7 ")
                        .put("threatType", "Botnet")
                        .put("severity", "high")
                        .put("confidenceScore", 85)
                        .put("firstSeen", "2026-03-01T08:00:00Z")
                        .put("description", "C2 traffic"))
                .add(new JsonObject().put("ipAddress", "1.2.3.4").put("blacklisted", true).put("severity", "bogus"));

        final var records = client.parse(feed);

        assertEquals(2, records.size());
        final var botnet = records.get(0);
        assertEquals("203.0.113.7", botnet.ipAddress());
        assertEquals(RiskLevel.HIGH, botnet.severity());
        assertEquals(85, botnet.confidenceScore());
        assertEquals(Instant.parse("2026-03-01T08:00:00Z"), botnet.lastSeen());
        final var listed = records.get(1);
        assertTrue(listed.blacklisted());
        assertEquals(RiskLevel.MEDIUM, listed.severity());
        assertEquals(50, listed.confidenceScore());
        assertEquals(clock.instant(), listed.firstSeen());
    }

    @Test
    @DisplayName("should skip entries without an address")
    void shouldSkipInvalidEntries() {
        final var feed = new JsonArray()
                .add(new JsonObject().put("threatType", "Botnet"))
                .add("not an object")
                .add(new JsonObject().put("ipAddress", ""));

        assertTrue(client.parse(feed).isEmpty());
        assertTrue(client.parse(null).isEmpty());
    }
}
