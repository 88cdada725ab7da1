package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.EffectiveRateLimit;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;

/**
 * Fixed-window request counter.
 *
 * <p>Implementations must make the increment-and-compare of one key atomic: of
 * N concurrent calls for a key with {@code limit} slots left, exactly
 * {@code min(N, limit)} are admitted.
 */
public interface RateLimiter {

    /**
     * Count a request and decide whether it is admitted.
     *
     * <p>A missing or expired window is replaced by a fresh one with counter 1.
     * Otherwise the counter is incremented and the request is rejected once
     * {@code counter > limit}, so exactly {@code limit} requests pass per window.
     *
     * @param key   window key
     * @param limit limit to apply
     * @return the decision
     */
    Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, EffectiveRateLimit limit);

    /**
     * Report the current window without counting a request.
     *
     * @param key   window key
     * @param limit limit to apply
     * @return the status
     */
    Uni<RateLimitDecision> getStatus(RateLimitKey key, EffectiveRateLimit limit);

    /**
     * Drop the window for a key.
     *
     * @param key window key
     * @return completion
     */
    Uni<Void> reset(RateLimitKey key);

    boolean isEnabled();
}
