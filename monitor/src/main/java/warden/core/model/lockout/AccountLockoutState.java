package warden.core.model.lockout;

import java.time.Duration;
import java.time.Instant;

/**
 * Failure count and lockout status of one credential.
 *
 * <p>{@code lockoutUntil} is only set once {@code failedAttempts} reached the
 * policy maximum, and is cleared by a successful login or by expiry.
 *
 * @param credentialKey  the credential
 * @param failedAttempts failures in the observation window, plus failures during an active lockout
 * @param lockoutUntil   end of the active lockout, or null
 * @param lastAttempt    latest failure, or null
 * @param locked         whether a lockout was active when the state was read
 */
public record AccountLockoutState(
        String credentialKey, int failedAttempts, Instant lockoutUntil, Instant lastAttempt, boolean locked) {

    public static AccountLockoutState clear(String credentialKey) {
        return new AccountLockoutState(credentialKey, 0, null, null, false);
    }

    public boolean isLocked() {
        return locked;
    }

    /**
     * Failures left before the credential locks.
     *
     * @param maxAttempts policy maximum
     * @return remaining attempts, 0 while locked
     */
    public int remainingAttempts(int maxAttempts) {
        return locked ? 0 : Math.max(0, maxAttempts - failedAttempts);
    }

    /**
     * Time until the lockout ends.
     *
     * @param now current time
     * @return remaining lockout, zero when not locked
     */
    public Duration remaining(Instant now) {
        if (!locked || lockoutUntil == null || !now.isBefore(lockoutUntil)) {
            return Duration.ZERO;
        }
        return Duration.between(now, lockoutUntil);
    }
}
