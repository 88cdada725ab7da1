package warden.core.service.behavior;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import warden.core.config.AnomalyConfig;
import warden.core.model.behavior.ActiveHours;
import warden.core.model.behavior.BehaviorEvent;
import warden.core.model.behavior.UserBaseline;

/**
 * Folds scored events into a user's baseline.
 *
 * <p>Numeric dimensions use an exponential moving average with factor
 * {@code max(minAlpha, 1 / (sampleCount + 1))}. Set-valued dimensions (locations,
 * devices, active hours) admit a new value once it has gathered one full
 * observation of learning weight. Anomalous events learn at
 * {@code anomalousRateFactor} of the normal rate in every dimension, so a single
 * burst is not normalized while repeated behavior still is.
 */
public final class BaselineLearner {

    private static final double EPSILON = 1e-9;

    private final double minAlpha;
    private final double anomalousRateFactor;
    private final int maxTypicalValues;

    public BaselineLearner(double minAlpha, double anomalousRateFactor, int maxTypicalValues) {
        this.minAlpha = minAlpha;
        this.anomalousRateFactor = anomalousRateFactor;
        this.maxTypicalValues = maxTypicalValues;
    }

    public static BaselineLearner from(AnomalyConfig config) {
        return new BaselineLearner(
                config.smoothing().minAlpha(), config.smoothing().anomalousRateFactor(), config.maxTypicalValues());
    }

    /**
     * Create the baseline from a user's first event.
     *
     * @param event the event
     * @param hour  hour of day of the event
     * @return a baseline with one sample
     */
    public UserBaseline establish(BehaviorEvent event, int hour) {
        return new UserBaseline(
                event.userId(),
                known(event.location()) ? List.of(event.location()) : List.of(),
                known(event.device()) ? List.of(event.device()) : List.of(),
                ActiveHours.of(hour),
                event.sessionDuration(),
                event.actionsPerMinute(),
                event.timestamp(),
                1,
                Map.of(),
                Map.of(),
                Map.of());
    }

    /**
     * Fold an event into an existing baseline.
     *
     * @param baseline  current baseline
     * @param event     the scored event
     * @param hour      hour of day of the event
     * @param anomalous whether the event scored as anomalous
     * @return the updated baseline
     */
    public UserBaseline learn(UserBaseline baseline, BehaviorEvent event, int hour, boolean anomalous) {
        final var alpha = Math.max(minAlpha, 1.0 / (baseline.sampleCount() + 1));
        final var rate = anomalous ? alpha * anomalousRateFactor : alpha;
        final var weight = anomalous ? anomalousRateFactor : 1.0;

        final var actionsPerMinute = ema(baseline.typicalActionsPerMinute(), event.actionsPerMinute(), rate);
        final var sessionMillis = ema(
                baseline.typicalSessionDuration().toMillis(), event.sessionDuration().toMillis(), rate);

        final var locations = new ArrayList<>(baseline.typicalLocations());
        final var pendingLocations = new HashMap<>(baseline.pendingLocations());
        if (known(event.location())) {
            observe(locations, pendingLocations, event.location(), weight);
        }

        final var devices = new ArrayList<>(baseline.typicalDevices());
        final var pendingDevices = new HashMap<>(baseline.pendingDevices());
        if (known(event.device())) {
            observe(devices, pendingDevices, event.device(), weight);
        }

        var activeHours = baseline.typicalActiveHours();
        final var pendingHours = new HashMap<>(baseline.pendingHours());
        if (!activeHours.contains(hour, 0)) {
            final var accumulated = pendingHours.getOrDefault(hour, 0.0) + weight;
            if (accumulated >= 1.0 - EPSILON) {
                activeHours = activeHours.extendTo(hour);
                final var widened = activeHours;
                pendingHours.keySet().removeIf(h -> widened.contains(h, 0));
            } else {
                pendingHours.put(hour, accumulated);
            }
        }

        final var lastUpdated = event.timestamp().isAfter(baseline.lastUpdated())
                ? event.timestamp()
                : baseline.lastUpdated();

        return new UserBaseline(
                baseline.userId(),
                locations,
                devices,
                activeHours,
                Duration.ofMillis(Math.round(sessionMillis)),
                actionsPerMinute,
                lastUpdated,
                baseline.sampleCount() + 1,
                pendingLocations,
                pendingDevices,
                pendingHours);
    }

    static boolean known(String value) {
        return value != null && !BehaviorEvent.UNKNOWN.equals(value);
    }

    private static double ema(double current, double observed, double rate) {
        return current + rate * (observed - current);
    }

    private <K> void observe(List<K> typical, Map<K, Double> pending, K value, double weight) {
        if (typical.contains(value)) {
            return;
        }
        final var accumulated = pending.getOrDefault(value, 0.0) + weight;
        if (accumulated >= 1.0 - EPSILON) {
            pending.remove(value);
            typical.add(value);
            while (typical.size() > maxTypicalValues) {
                typical.remove(0);
            }
            return;
        }
        pending.put(value, accumulated);
        while (pending.size() > maxTypicalValues) {
            pending.entrySet().stream()
                    .min(Map.Entry.comparingByValue())
                    .map(Map.Entry::getKey)
                    .ifPresent(pending::remove);
        }
    }
}
