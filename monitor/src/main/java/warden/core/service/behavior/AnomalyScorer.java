package warden.core.service.behavior;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.telemetry.SecurityEventDispatcher;
import warden.core.config.AnomalyConfig;
import warden.core.config.InvalidConfigurationException;
import warden.core.model.behavior.AnomalyFlag;
import warden.core.model.behavior.AnomalyResult;
import warden.core.model.behavior.BehaviorEvent;
import warden.core.model.behavior.UserBaseline;
import warden.core.model.common.RiskLevel;
import warden.core.service.threat.ThreatIntelligenceCache;
import warden.spi.SecurityEvent;

/**
 * Scores behavior events against the user's baseline.
 *
 * <p>Scoring and the baseline update for one event happen inside a single
 * {@link BaselineStore#update} call, so the score always reflects the baseline
 * as it was immediately before the event, and concurrent events of one user are
 * applied one after the other.
 *
 * <h2>Scoring</h2>
 * <ul>
 *   <li>Flags: new location, new device, off hours, high velocity, outside normal
 *       pattern, known threat source.
 *   <li>Score: sum of the weights of the triggered flags, clamped to [0, 1].
 *   <li>Risk level: from the configured thresholds.
 * </ul>
 *
 * <p>A user's first event only establishes the baseline and is never anomalous.
 */
@ApplicationScoped
public class AnomalyScorer {

    private static final Logger LOG = Logger.getLogger(AnomalyScorer.class);

    private final BaselineStore baselineStore;
    private final ThreatIntelligenceCache threatCache;
    private final AnomalyConfig config;
    private final SecurityEventDispatcher dispatcher;
    private final BaselineLearner learner;
    private final ZoneId zone;
    private final Map<AnomalyFlag, Double> weights;

    @Inject
    public AnomalyScorer(
            BaselineStore baselineStore,
            ThreatIntelligenceCache threatCache,
            AnomalyConfig config,
            SecurityEventDispatcher dispatcher) {
        this.baselineStore = baselineStore;
        this.threatCache = threatCache;
        this.config = config;
        this.dispatcher = dispatcher;
        this.learner = BaselineLearner.from(config);
        this.zone = parseZone(config.timeZone());
        this.weights = weights(config.weights());
        validate(config);
    }

    /**
     * Score an event and fold it into the user's baseline.
     *
     * @param event the event
     * @return the result; never fails
     */
    public Uni<AnomalyResult> score(BehaviorEvent event) {
        if (!config.enabled()) {
            return Uni.createFrom().item(AnomalyResult.coldStart());
        }
        return baselineStore
                .ensureLoaded(event.userId())
                .map(loaded -> {
                    final var result = scoreAndLearn(event);
                    return loaded ? result : result.asDegraded();
                })
                .invoke(result -> {
                    if (result.isAnomalous()) {
                        LOG.infof(
                                "Anomalous activity for user %s: score=%.2f risk=%s reasons=%s",
                                event.userId(), result.score(), result.riskLevel(), result.reasons());
                        dispatcher.dispatch(new SecurityEvent.AnomalyDetected(
                                event.timestamp(),
                                event.ipAddress(),
                                event.userId(),
                                result.score(),
                                result.riskLevel().name(),
                                result.reasons()));
                    }
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Anomaly scoring failed for user {0}", event.userId());
                    return AnomalyResult.coldStart().asDegraded();
                });
    }

    /**
     * Score an event against a baseline without updating anything.
     *
     * @param baseline the baseline, null or unestablished for a cold start
     * @param event    the event
     * @return the result
     */
    public AnomalyResult evaluate(UserBaseline baseline, BehaviorEvent event) {
        if (baseline == null || !baseline.isEstablished()) {
            return AnomalyResult.coldStart();
        }

        final var hour = hourOf(event);
        final var deviation = deviation(baseline, event);
        final var flags = new ArrayList<AnomalyFlag>();

        if (BaselineLearner.known(event.location()) && !baseline.typicalLocations().contains(event.location())) {
            flags.add(AnomalyFlag.NEW_LOCATION);
        }
        final var typicalRate = Math.max(baseline.typicalActionsPerMinute(), config.minTypicalActionsPerMinute());
        if (event.actionsPerMinute() > typicalRate * config.velocityMultiplier()) {
            flags.add(AnomalyFlag.HIGH_VELOCITY);
        }
        if (BaselineLearner.known(event.device()) && !baseline.typicalDevices().contains(event.device())) {
            flags.add(AnomalyFlag.NEW_DEVICE);
        }
        if (!baseline.typicalActiveHours().contains(hour, config.offHoursToleranceHours())) {
            flags.add(AnomalyFlag.OFF_HOURS);
        }
        if (weights.get(AnomalyFlag.OUTSIDE_NORMAL_PATTERN) > 0 && deviation > config.deviationThreshold()) {
            flags.add(AnomalyFlag.OUTSIDE_NORMAL_PATTERN);
        }
        if (weights.get(AnomalyFlag.KNOWN_THREAT_SOURCE) > 0 && isThreatSource(event.ipAddress())) {
            flags.add(AnomalyFlag.KNOWN_THREAT_SOURCE);
        }

        // Heaviest first; ties keep declaration order.
        flags.sort(Comparator.comparingDouble((AnomalyFlag flag) -> weights.get(flag))
                .reversed()
                .thenComparing(Comparator.naturalOrder()));

        var sum = 0.0;
        for (var flag : flags) {
            sum += weights.get(flag);
        }
        final var score = Math.round(Math.min(1.0, Math.max(0.0, sum)) * 10_000) / 10_000.0;
        final var riskLevel = riskLevel(score);

        return new AnomalyResult(
                score >= config.anomalousThreshold(),
                score,
                riskLevel,
                flags.stream().map(AnomalyFlag::reason).toList(),
                flags,
                deviation,
                riskLevel.recommendedAction(),
                false);
    }

    RiskLevel riskLevel(double score) {
        final var thresholds = config.thresholds();
        if (score >= thresholds.critical()) {
            return RiskLevel.CRITICAL;
        }
        if (score >= thresholds.high()) {
            return RiskLevel.HIGH;
        }
        if (score >= thresholds.medium()) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    int hourOf(BehaviorEvent event) {
        return event.timestamp().atZone(zone).getHour();
    }

    private AnomalyResult scoreAndLearn(BehaviorEvent event) {
        final var result = new AtomicReference<AnomalyResult>();
        final var hour = hourOf(event);
        baselineStore.update(event.userId(), existing -> {
            if (existing == null || !existing.isEstablished()) {
                result.set(AnomalyResult.coldStart());
                return learner.establish(event, hour);
            }
            final var scored = evaluate(existing, event);
            result.set(scored);
            return learner.learn(existing, event, hour, scored.isAnomalous());
        });
        return result.get();
    }

    /**
     * Weighted relative distance of session length and action rate from the baseline.
     */
    private double deviation(UserBaseline baseline, BehaviorEvent event) {
        final var smoothing = config.smoothing();
        final var sessionWeight = smoothing.sessionDurationWeight();
        final var rateWeight = smoothing.actionsPerMinuteWeight();
        final var total = sessionWeight + rateWeight;
        if (total <= 0) {
            return 0.0;
        }
        final var session = relativeDistance(
                baseline.typicalSessionDuration().toMillis(), event.sessionDuration().toMillis());
        final var rate = relativeDistance(baseline.typicalActionsPerMinute(), event.actionsPerMinute());
        return (sessionWeight * session + rateWeight * rate) / total;
    }

    private static double relativeDistance(double typical, double observed) {
        final var scale = Math.max(Math.abs(typical), Math.abs(observed));
        return scale == 0 ? 0.0 : Math.abs(observed - typical) / scale;
    }

    private boolean isThreatSource(String ipAddress) {
        final var verdict = threatCache.checkReputation(ipAddress);
        return verdict.isThreat() && !verdict.failClosed();
    }

    private static Map<AnomalyFlag, Double> weights(AnomalyConfig.Weights configured) {
        final var weights = new EnumMap<AnomalyFlag, Double>(AnomalyFlag.class);
        weights.put(AnomalyFlag.NEW_LOCATION, configured.newLocation());
        weights.put(AnomalyFlag.HIGH_VELOCITY, configured.highVelocity());
        weights.put(AnomalyFlag.NEW_DEVICE, configured.newDevice());
        weights.put(AnomalyFlag.OFF_HOURS, configured.offHours());
        weights.put(AnomalyFlag.OUTSIDE_NORMAL_PATTERN, configured.outsideNormalPattern());
        weights.put(AnomalyFlag.KNOWN_THREAT_SOURCE, configured.knownThreatSource());
        return weights;
    }

    private static ZoneId parseZone(String zoneId) {
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new InvalidConfigurationException("Invalid warden.anomaly.time-zone: " + zoneId);
        }
    }

    private void validate(AnomalyConfig config) {
        final var errors = new ArrayList<String>();
        weights.forEach((flag, weight) -> {
            if (weight < 0 || weight > 1) {
                errors.add("weight of " + flag + " must be within [0, 1]: " + weight);
            }
        });
        final var thresholds = config.thresholds();
        if (!(0 < thresholds.medium()
                && thresholds.medium() < thresholds.high()
                && thresholds.high() < thresholds.critical()
                && thresholds.critical() <= 1)) {
            errors.add(String.format(
                    "thresholds must satisfy 0 < medium < high < critical <= 1: %s, %s, %s",
                    thresholds.medium(), thresholds.high(), thresholds.critical()));
        }
        if (config.anomalousThreshold() <= 0 || config.anomalousThreshold() > 1) {
            errors.add("anomalous-threshold must be within (0, 1]: " + config.anomalousThreshold());
        }
        if (config.velocityMultiplier() <= 0) {
            errors.add("velocity-multiplier must be positive: " + config.velocityMultiplier());
        }
        if (config.offHoursToleranceHours() < 0 || config.offHoursToleranceHours() > 12) {
            errors.add("off-hours-tolerance-hours must be within [0, 12]: " + config.offHoursToleranceHours());
        }
        final var smoothing = config.smoothing();
        if (smoothing.minAlpha() <= 0 || smoothing.minAlpha() > 1) {
            errors.add("smoothing.min-alpha must be within (0, 1]: " + smoothing.minAlpha());
        }
        if (smoothing.anomalousRateFactor() < 0 || smoothing.anomalousRateFactor() > 1) {
            errors.add("smoothing.anomalous-rate-factor must be within [0, 1]: " + smoothing.anomalousRateFactor());
        }
        if (smoothing.sessionDurationWeight() < 0 || smoothing.actionsPerMinuteWeight() < 0) {
            errors.add("smoothing deviation weights must not be negative");
        }
        if (config.maxTypicalValues() < 1) {
            errors.add("max-typical-values must be positive: " + config.maxTypicalValues());
        }
        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException("Invalid anomaly configuration: " + String.join("; ", errors));
        }
    }
}
