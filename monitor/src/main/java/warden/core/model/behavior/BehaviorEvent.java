package warden.core.model.behavior;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One observed user action, scored against the user's baseline.
 *
 * <p>Ephemeral: only the baseline it updates and the audit log outlive it.
 *
 * @param userId           the user
 * @param ipAddress        client address
 * @param actionType       what the user did, e.g. {@code GET /api/tasks}
 * @param timestamp        when it happened
 * @param sessionDuration  age of the session at the time of the action
 * @param actionsPerMinute the user's current action rate
 * @param location         resolved location, or null when unknown
 * @param device           device identifier, or null when unknown
 */
public record BehaviorEvent(
        String userId,
        String ipAddress,
        String actionType,
        Instant timestamp,
        Duration sessionDuration,
        double actionsPerMinute,
        String location,
        String device) {

    public static final String UNKNOWN = "Unknown";

    public BehaviorEvent {
        Objects.requireNonNull(userId, "userId cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        sessionDuration = sessionDuration != null && !sessionDuration.isNegative() ? sessionDuration : Duration.ZERO;
        actionsPerMinute = Math.max(0, actionsPerMinute);
        location = location != null && !location.isBlank() ? location : UNKNOWN;
        device = device != null && !device.isBlank() ? device : UNKNOWN;
    }
}
