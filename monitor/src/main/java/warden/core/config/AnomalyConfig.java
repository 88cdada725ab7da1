package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for behavioral baselines and anomaly scoring.
 *
 * <p>Configuration prefix: {@code warden.anomaly}
 *
 * <p>The score of an event is the clamped sum of the weights of its triggered
 * flags. Risk levels are derived from the score using the thresholds below, which
 * must be strictly increasing.
 *
 * @see warden.core.service.behavior.AnomalyScorer
 */
@ConfigMapping(prefix = "warden.anomaly")
public interface AnomalyConfig {

    /**
     * Enable anomaly scoring.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Weight contributed by each triggered flag.
     */
    Weights weights();

    /**
     * Score thresholds for risk levels.
     */
    Thresholds thresholds();

    /**
     * Minimum score at which an event is anomalous.
     *
     * @return threshold (default: 0.5)
     */
    @WithDefault("0.5")
    double anomalousThreshold();

    /**
     * Velocity is high when actions per minute exceed the typical rate times this value.
     *
     * @return multiplier (default: 3)
     */
    @WithDefault("3.0")
    double velocityMultiplier();

    /**
     * Floor for the typical actions per minute used in the velocity check, so that a
     * baseline learned from idle sessions does not flag every active one.
     *
     * @return floor (default: 1.0)
     */
    @WithDefault("1.0")
    double minTypicalActionsPerMinute();

    /**
     * Hours of tolerance around the typical active interval.
     *
     * @return tolerance in hours (default: 1)
     */
    @WithDefault("1")
    int offHoursToleranceHours();

    /**
     * Time zone in which event hours are compared with the typical active hours.
     *
     * @return zone id (default: UTC)
     */
    @WithDefault("UTC")
    String timeZone();

    /**
     * Deviation above which the outside-normal-pattern flag triggers.
     *
     * @return threshold (default: 0.7)
     */
    @WithDefault("0.7")
    double deviationThreshold();

    /**
     * Baseline learning rates.
     */
    Smoothing smoothing();

    /**
     * Maximum number of typical locations and devices kept per user.
     *
     * @return limit (default: 20)
     */
    @WithDefault("20")
    int maxTypicalValues();

    /**
     * Idle time after which a stored baseline is discarded.
     *
     * @return TTL (default: 30 days)
     */
    @WithDefault("P30D")
    Duration baselineTtl();

    /**
     * Maximum number of baselines held in memory.
     *
     * @return cache size (default: 100000)
     */
    @WithDefault("100000")
    long cacheSize();

    /**
     * Redis storage for baselines.
     */
    RedisConfig redis();

    interface Weights {

        @WithDefault("0.3")
        double newLocation();

        @WithDefault("0.25")
        double newDevice();

        @WithDefault("0.15")
        double offHours();

        @WithDefault("0.3")
        double highVelocity();

        @WithDefault("0.0")
        double outsideNormalPattern();

        @WithDefault("0.0")
        double knownThreatSource();
    }

    interface Thresholds {

        /** Lowest score classified MEDIUM. */
        @WithDefault("0.25")
        double medium();

        /** Lowest score classified HIGH. */
        @WithDefault("0.5")
        double high();

        /** Lowest score classified CRITICAL. */
        @WithDefault("0.75")
        double critical();
    }

    interface Smoothing {

        /**
         * Lower bound for the moving-average factor {@code 1 / (sampleCount + 1)}.
         */
        @WithDefault("0.05")
        double minAlpha();

        /**
         * Fraction of the normal learning rate applied to anomalous events.
         */
        @WithDefault("0.1")
        double anomalousRateFactor();

        /**
         * Relative weight of session duration in the deviation measure.
         */
        @WithDefault("0.5")
        double sessionDurationWeight();

        /**
         * Relative weight of actions per minute in the deviation measure.
         */
        @WithDefault("0.5")
        double actionsPerMinuteWeight();
    }

    interface RedisConfig {

        @WithDefault("false")
        boolean enabled();

        @WithDefault("warden:baseline:")
        String keyPrefix();
    }
}
