package warden.core.model.behavior;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolling statistical profile of a user's normal behavior.
 *
 * <p>Updated incrementally after each scored event, never replaced wholesale.
 * Values seen by anomalous events collect learning weight in the {@code pending*}
 * maps and only become typical once that weight reaches one full observation.
 *
 * @param userId                   the user
 * @param typicalLocations         locations considered normal, oldest first
 * @param typicalDevices           devices considered normal, oldest first
 * @param typicalActiveHours       usual hours of activity
 * @param typicalSessionDuration   moving average of session age at action time
 * @param typicalActionsPerMinute  moving average of action rate
 * @param lastUpdated              time of the latest event folded in
 * @param sampleCount              events folded in
 * @param pendingLocations         learning weight of not yet typical locations
 * @param pendingDevices           learning weight of not yet typical devices
 * @param pendingHours             learning weight of hours outside the active interval
 */
public record UserBaseline(
        String userId,
        List<String> typicalLocations,
        List<String> typicalDevices,
        ActiveHours typicalActiveHours,
        Duration typicalSessionDuration,
        double typicalActionsPerMinute,
        Instant lastUpdated,
        long sampleCount,
        Map<String, Double> pendingLocations,
        Map<String, Double> pendingDevices,
        Map<Integer, Double> pendingHours) {

    public UserBaseline {
        Objects.requireNonNull(userId, "userId cannot be null");
        typicalLocations = typicalLocations != null ? List.copyOf(typicalLocations) : List.of();
        typicalDevices = typicalDevices != null ? List.copyOf(typicalDevices) : List.of();
        typicalActiveHours = typicalActiveHours != null ? typicalActiveHours : ActiveHours.ALL_DAY;
        typicalSessionDuration = typicalSessionDuration != null ? typicalSessionDuration : Duration.ZERO;
        pendingLocations = pendingLocations != null ? Map.copyOf(pendingLocations) : Map.of();
        pendingDevices = pendingDevices != null ? Map.copyOf(pendingDevices) : Map.of();
        pendingHours = pendingHours != null ? Map.copyOf(pendingHours) : Map.of();
    }

    public boolean isEstablished() {
        return sampleCount > 0;
    }
}
