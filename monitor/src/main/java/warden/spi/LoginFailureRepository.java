package warden.spi;

import java.time.Instant;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.lockout.AccountLockoutState;
import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.lockout.LoginFailureRecord;

/**
 * Storage for failed login attempts and credential lockouts.
 *
 * <p>Implementations must apply {@link #recordFailure} as one atomic step per
 * credential: counting, pruning the rolling window and starting a lockout must not
 * interleave with another update of the same credential.
 *
 * <p>Counting rules:
 * <ul>
 *   <li>Failures older than the observation window are not counted</li>
 *   <li>The failure that brings the count to {@code maxAttempts} starts a lockout of {@code lockoutDuration}</li>
 *   <li>Failures during an active lockout are counted but never extend it</li>
 *   <li>Once a lockout has expired the credential starts from a clean state</li>
 * </ul>
 */
public interface LoginFailureRepository {

    /**
     * Record a failure and apply the lockout policy.
     *
     * @param failure the failed attempt
     * @param policy  thresholds to apply
     * @return the state after this failure
     */
    Uni<AccountLockoutState> recordFailure(LoginFailureRecord failure, LockoutPolicy policy);

    /**
     * Read the current state of a credential.
     *
     * @param credentialKey the credential
     * @param policy        thresholds to apply
     * @return the state, cleared when nothing is tracked
     */
    Uni<AccountLockoutState> getState(String credentialKey, LockoutPolicy policy);

    /**
     * Forget all failures and any lockout of a credential.
     *
     * @param credentialKey the credential
     * @return completion
     */
    Uni<Void> clear(String credentialKey);

    /**
     * Stream every credential currently locked.
     *
     * @return active lockouts
     */
    Multi<AccountLockoutState> streamActiveLockouts();

    /**
     * Stream the failure history since an instant, newest first.
     *
     * <p>The history is bounded; the oldest records are dropped first.
     *
     * @param since lower bound (inclusive)
     * @return failure records
     */
    Multi<LoginFailureRecord> streamFailuresSince(Instant since);
}
