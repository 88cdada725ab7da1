package warden.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for request rate limiting.
 *
 * <p>Configuration prefix: {@code warden.rate-limiting}
 *
 * <p>Limits are configured per endpoint class. A request path is matched against
 * the {@code path-prefixes} of every class; the longest matching prefix wins and
 * unmatched requests use the default limit.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.rate-limiting.default-max-requests=30
 * warden.rate-limiting.default-window-seconds=60
 * warden.rate-limiting.endpoint-classes.auth.path-prefixes=/api/auth,/api/v1/auth
 * warden.rate-limiting.endpoint-classes.auth.max-requests=5
 * warden.rate-limiting.endpoint-classes.auth.window-seconds=60
 * warden.rate-limiting.endpoint-classes.auth.authentication=true
 * warden.rate-limiting.high-load.reduction-percent=50
 * }</pre>
 *
 * @see warden.core.service.ratelimit.RateLimitService
 */
@ConfigMapping(prefix = "warden.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable rate limiting.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Requests admitted per window for paths that match no endpoint class.
     *
     * @return max requests (default: 30)
     */
    @WithDefault("30")
    int defaultMaxRequests();

    /**
     * Window length for paths that match no endpoint class.
     *
     * @return window in seconds (default: 60)
     */
    @WithDefault("60")
    int defaultWindowSeconds();

    /**
     * Endpoint classes keyed by class name.
     *
     * @return endpoint classes
     */
    Map<String, EndpointClassConfig> endpointClasses();

    /**
     * Identity keys that are never rate limited (trusted system accounts).
     *
     * @return exempt identity keys
     */
    @WithDefault("system")
    Set<String> exemptUsers();

    /**
     * Multiplier applied to the limit of requests whose source IP the threat
     * intelligence cache reports as a (non-blacklisted) threat.
     *
     * @return factor in (0, 1] (default: 0.5)
     */
    @WithDefault("0.5")
    double threatLimitFactor();

    /**
     * Interval between sweeps of expired in-memory windows.
     *
     * @return sweep interval (default: 1 minute)
     */
    @WithDefault("PT1M")
    Duration sweepInterval();

    /**
     * Redis storage for rate windows.
     *
     * @return Redis configuration
     */
    RedisConfig redis();

    /**
     * Limit reduction while the host is under high CPU or memory load.
     *
     * @return high load configuration
     */
    HighLoadConfig highLoad();

    /**
     * A named group of endpoints sharing one limit.
     */
    interface EndpointClassConfig {

        /**
         * Path prefixes belonging to this class.
         */
        List<String> pathPrefixes();

        /**
         * Requests admitted per window.
         */
        int maxRequests();

        /**
         * Window length in seconds.
         */
        int windowSeconds();

        /**
         * Whether paths in this class are authentication endpoints.
         *
         * <p>An active account lockout blocks authentication endpoints and only
         * flags requests to other endpoints.
         */
        @WithDefault("false")
        boolean authentication();
    }

    /**
     * Limits shrink by {@code reduction-percent} while CPU or heap usage is above its
     * threshold. Usage is read from the Micrometer gauges {@code system.cpu.usage}
     * (falling back to {@code process.cpu.usage}) and {@code jvm.memory.used} /
     * {@code jvm.memory.max} for the heap, sampled at most once per {@code check-interval}.
     */
    interface HighLoadConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * CPU usage above which the system counts as loaded, as a fraction.
         */
        @WithDefault("0.8")
        double cpuThreshold();

        /**
         * Heap usage above which the system counts as loaded, as a fraction.
         */
        @WithDefault("0.8")
        double memoryThreshold();

        /**
         * Percentage taken off every limit under high load.
         */
        @WithDefault("50")
        int reductionPercent();

        /**
         * Smallest limit a reduction may produce.
         */
        @WithDefault("5")
        int minimumLimit();

        @WithDefault("PT30S")
        Duration checkInterval();
    }

    interface RedisConfig {

        /**
         * Use Redis for rate windows. Requires a configured Redis client.
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Prefix for window keys.
         */
        @WithDefault("warden:ratelimit:")
        String keyPrefix();
    }
}
