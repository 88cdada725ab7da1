package warden.core.model.lockout;

import java.time.Duration;

import warden.core.config.InvalidConfigurationException;
import warden.core.config.LockoutConfig;

/**
 * Lockout thresholds handed to the failure repository.
 *
 * @param maxAttempts       failures within the window that lock the credential
 * @param observationWindow rolling window for counting failures
 * @param lockoutDuration   how long a lockout lasts
 */
public record LockoutPolicy(int maxAttempts, Duration observationWindow, Duration lockoutDuration) {

    public LockoutPolicy {
        if (maxAttempts < 1) {
            throw new InvalidConfigurationException("max-attempts must be positive: " + maxAttempts);
        }
        if (observationWindow == null || observationWindow.isNegative() || observationWindow.isZero()) {
            throw new InvalidConfigurationException("observation-window must be positive: " + observationWindow);
        }
        if (lockoutDuration == null || lockoutDuration.isNegative() || lockoutDuration.isZero()) {
            throw new InvalidConfigurationException("lockout-duration must be positive: " + lockoutDuration);
        }
    }

    public static LockoutPolicy from(LockoutConfig config) {
        return new LockoutPolicy(config.maxAttempts(), config.observationWindow(), config.lockoutDuration());
    }
}
