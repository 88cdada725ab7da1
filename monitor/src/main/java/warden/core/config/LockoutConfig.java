package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for failed-login tracking and account lockout.
 *
 * <p>Configuration prefix: {@code warden.lockout}
 *
 * <p>Failures are counted per credential inside a rolling observation window.
 * The client IP of every failure is kept for reporting only and never used as a
 * lockout key, since legitimate users share addresses behind NAT.
 *
 * @see warden.core.service.lockout.LockoutService
 * @see warden.spi.LoginFailureRepository
 */
@ConfigMapping(prefix = "warden.lockout")
public interface LockoutConfig {

    /**
     * Enable lockout enforcement.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Failures within the observation window that lock the credential.
     *
     * @return max attempts (default: 5)
     */
    @WithDefault("5")
    int maxAttempts();

    /**
     * Rolling window in which failures are counted.
     *
     * @return observation window (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration observationWindow();

    /**
     * How long a credential stays locked. Further failures during an active
     * lockout do not extend it.
     *
     * @return lockout duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration lockoutDuration();

    /**
     * Window used by the failure summary report.
     *
     * @return reporting window (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration reportingWindow();

    /**
     * Failures from one IP within the reporting window that mark the IP suspicious.
     *
     * @return threshold (default: 10)
     */
    @WithDefault("10")
    int suspiciousIpThreshold();

    /**
     * Distinct credentials targeted from one IP within the observation window
     * that add the multi-account risk factor.
     *
     * @return threshold (default: 5)
     */
    @WithDefault("5")
    int multiAccountThreshold();

    /**
     * Maximum number of failure records kept for reporting.
     *
     * @return history size (default: 10000)
     */
    @WithDefault("10000")
    int historySize();

    /**
     * Redis storage for failure counters.
     */
    RedisConfig redis();

    interface RedisConfig {

        @WithDefault("false")
        boolean enabled();

        @WithDefault("warden:lockout:")
        String keyPrefix();
    }
}
