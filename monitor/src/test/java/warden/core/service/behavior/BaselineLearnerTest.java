package warden.core.service.behavior;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.behavior.ActiveHours;
import warden.core.model.behavior.BehaviorEvent;

@DisplayName("BaselineLearner")
class BaselineLearnerTest {

    private final BaselineLearner learner = new BaselineLearner(0.05, 0.1, 2);

    private static BehaviorEvent event(String location, double actionsPerMinute) {
        return new BehaviorEvent(
                "alice", "198.51.100.20", "login", Instant.parse("2026-03-02T10:00:00Z"),
                Duration.ofMinutes(20), actionsPerMinute, location, "Desktop_Firefox_Linux");
    }

    @Test
    @DisplayName("should average with alpha 1/(n+1) until the minimum is reached")
    void shouldApplyMovingAverage() {
        var baseline = learner.establish(event("Berlin, DE", 4.0), 10);

        baseline = learner.learn(baseline, event("Berlin, DE", 8.0), 10, false);
        assertEquals(6.0, baseline.typicalActionsPerMinute(), 1e-9);

        baseline = learner.learn(baseline, event("Berlin, DE", 9.0), 10, false);
        assertEquals(7.0, baseline.typicalActionsPerMinute(), 1e-9);
        assertEquals(Duration.ofMinutes(20), baseline.typicalSessionDuration());
        assertEquals(3, baseline.sampleCount());
    }

    @Test
    @DisplayName("should admit an anomalous value only after ten sightings")
    void shouldAccumulatePendingWeight() {
        var baseline = learner.establish(event("Berlin, DE", 4.0), 10);
        for (int i = 0; i < 9; i++) {
            baseline = learner.learn(baseline, event("Tokyo, JP", 4.0), 10, true);
        }
        assertFalse(baseline.typicalLocations().contains("Tokyo, JP"));

        baseline = learner.learn(baseline, event("Tokyo, JP", 4.0), 10, true);

        assertTrue(baseline.typicalLocations().contains("Tokyo, JP"));
        assertFalse(baseline.pendingLocations().containsKey("Tokyo, JP"));
    }

    @Test
    @DisplayName("should drop the oldest typical value beyond the limit")
    void shouldBoundTypicalValues() {
        var baseline = learner.establish(event("Berlin, DE", 4.0), 10);
        baseline = learner.learn(baseline, event("Hamburg, DE", 4.0), 10, false);
        baseline = learner.learn(baseline, event("Munich, DE", 4.0), 10, false);

        assertEquals(List.of("Hamburg, DE", "Munich, DE"), baseline.typicalLocations());
    }

    @Test
    @DisplayName("should widen active hours after a normal event at a new hour")
    void shouldWidenActiveHours() {
        var baseline = learner.establish(event("Berlin, DE", 4.0), 10);

        baseline = learner.learn(baseline, event("Berlin, DE", 4.0), 14, false);

        assertEquals(new ActiveHours(10, 14), baseline.typicalActiveHours());
    }
}
