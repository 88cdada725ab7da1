package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session trust management.
 *
 * <p>Configuration prefix: {@code warden.sessions}
 */
@ConfigMapping(prefix = "warden.sessions")
public interface SessionTrustConfig {

    /**
     * Session lifetime. Activity extends it unless sessions are fixed-duration.
     *
     * @return TTL (default: 2 hours)
     */
    @WithDefault("PT2H")
    Duration ttl();

    /**
     * Create sessions whose expiry is not extended by activity.
     *
     * @return true for fixed-duration sessions (default: false)
     */
    @WithDefault("false")
    boolean fixedDuration();

    /**
     * Active sessions allowed per user. Creating one more terminates the oldest.
     *
     * @return limit (default: 5)
     */
    @WithDefault("5")
    int maxConcurrent();

    /**
     * Sessions created for one user within the rapid-creation window that mark the
     * newest one suspicious.
     *
     * @return threshold (default: 3)
     */
    @WithDefault("3")
    int rapidCreationThreshold();

    @WithDefault("PT1M")
    Duration rapidCreationWindow();

    /**
     * User agents shorter than this mark a new session suspicious.
     *
     * @return minimum length (default: 10)
     */
    @WithDefault("10")
    int minUserAgentLength();

    /**
     * How long terminated sessions are kept for listing before being purged.
     *
     * @return retention (default: 7 days)
     */
    @WithDefault("P7D")
    Duration retention();

    /**
     * Interval of the expired-session sweep.
     *
     * @return interval (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration cleanupInterval();

    /**
     * Attempts to generate a token that is not already in use.
     *
     * @return attempts (default: 3)
     */
    @WithDefault("3")
    int tokenGenerationAttempts();
}
