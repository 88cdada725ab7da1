package warden.adapter.out.threat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.core.model.common.RiskLevel;
import warden.core.model.threat.ThreatRecord;
import warden.core.port.out.ThreatFeedClient;

/**
 * Threat feed fetched from an HTTP endpoint.
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * GET {url}
 *
 * [
 *   {
 *     "ipAddress": "203.0.113.7",
 *     "threatType": "Botnet",
 *     "severity": "high",
 *     "confidenceScore": 85,
 *     "blacklisted": false,
 *     "whitelisted": false,
 *     "firstSeen": "2024-05-01T10:00:00Z",
 *     "lastSeen": "2024-05-02T08:30:00Z",
 *     "description": "C2 traffic"
 *   }
 * ]
 * }</pre>
 *
 * <p>Entries without an {@code ipAddress} are skipped.
 */
public class HttpThreatFeedClient implements ThreatFeedClient {

    private static final Logger LOG = Logger.getLogger(HttpThreatFeedClient.class);

    private final WebClient webClient;
    private final String url;
    private final Duration timeout;
    private final Clock clock;

    public HttpThreatFeedClient(Vertx vertx, String url, Duration timeout, Clock clock) {
        this.webClient = WebClient.create(vertx);
        this.url = url;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public Uni<List<ThreatRecord>> fetch() {
        final var startTime = System.currentTimeMillis();
        return webClient
                .getAbs(url)
                .timeout(timeout.toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .map(response -> {
                    if (response.statusCode() != 200) {
                        throw new ThreatFeedUnavailableException(
                                "Threat feed returned status " + response.statusCode());
                    }
                    final var records = parse(response.bodyAsJsonArray());
                    LOG.debugf(
                            "Fetched %d threat records from %s in %dms",
                            (Object) records.size(), url, System.currentTimeMillis() - startTime);
                    return records;
                })
                .onFailure(error -> !(error instanceof ThreatFeedUnavailableException))
                .transform(error -> new ThreatFeedUnavailableException("Threat feed unreachable: " + url, error));
    }

    List<ThreatRecord> parse(JsonArray array) {
        if (array == null) {
            return List.of();
        }
        final var now = clock.instant();
        final var records = new ArrayList<ThreatRecord>(array.size());
        for (int i = 0; i < array.size(); i++) {
            final var value = array.getValue(i);
            if (!(value instanceof JsonObject)) {
                continue;
            }
            final var json = (JsonObject) value;
            final var ip = json.getString("ipAddress");
            if (ip == null || ip.isBlank()) {
                continue;
            }
            final var firstSeen = instant(json.getString("firstSeen"), now);
            records.add(new ThreatRecord(
                    ip.trim(),
                    json.getString("threatType"),
                    RiskLevel.parse(json.getString("severity")),
                    json.getInteger("confidenceScore", 50),
                    json.getBoolean("blacklisted", false),
                    json.getBoolean("whitelisted", false),
                    firstSeen,
                    instant(json.getString("lastSeen"), firstSeen),
                    json.getInteger("reportCount", 1),
                    json.getString("description")));
        }
        return records;
    }

    private static Instant instant(String value, Instant fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }
}
