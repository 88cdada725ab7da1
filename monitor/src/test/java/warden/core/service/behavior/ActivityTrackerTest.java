package warden.core.service.behavior;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.testing.MutableClock;
import warden.testing.TestConfigs;

@DisplayName("ActivityTracker")
class ActivityTrackerTest {

    @Test
    @DisplayName("should count actions of the last minute per user")
    void shouldCountRecentActions() {
        final var clock = MutableClock.at("2026-03-02T10:00:00Z");
        final var tracker = new ActivityTracker(TestConfigs.anomaly(), clock);

        tracker.recordAction("alice");
        clock.advance(Duration.ofSeconds(30));
        tracker.recordAction("alice");
        assertEquals(1.0, tracker.recordAction("bob"));
        assertEquals(3.0, tracker.recordAction("alice"));

        clock.advance(Duration.ofSeconds(45));
        assertEquals(3.0, tracker.recordAction("alice"));

        tracker.forget("alice");
        assertEquals(1.0, tracker.recordAction("alice"));
    }
}
