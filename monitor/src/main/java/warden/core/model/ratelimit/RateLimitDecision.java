package warden.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a rate limit check.
 *
 * @param allowed           whether the request is admitted
 * @param remaining         requests left in the current window
 * @param limit             requests admitted per window
 * @param windowSeconds     window length
 * @param resetAt           when the current window closes
 * @param retryAfterSeconds seconds until a retry can succeed (only meaningful when rejected)
 * @param requestCount      requests counted in the current window
 * @param reduced           whether the limit was cut because the system is under high load
 */
public record RateLimitDecision(
        boolean allowed,
        long remaining,
        long limit,
        long windowSeconds,
        Instant resetAt,
        long retryAfterSeconds,
        int requestCount,
        boolean reduced) {

    /**
     * An unconditional admit, used when limiting is disabled, the identity is exempt
     * or the backing store failed.
     */
    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Long.MAX_VALUE, 0, Instant.MAX, 0, 0, false);
    }

    public static RateLimitDecision allow(long remaining, long limit, long windowSeconds, Instant resetAt, int requestCount) {
        return new RateLimitDecision(true, remaining, limit, windowSeconds, resetAt, 0, requestCount, false);
    }

    public static RateLimitDecision rejected(
            long limit, long windowSeconds, Instant resetAt, long retryAfterSeconds, int requestCount) {
        return new RateLimitDecision(false, 0, limit, windowSeconds, resetAt, retryAfterSeconds, requestCount, false);
    }

    /**
     * Build the decision for a window after the current request was counted.
     *
     * @param window the window including this request
     * @param limit  the applied limit
     * @param now    current time
     * @return admitted while {@code counter <= limit}, rejected afterwards
     */
    public static RateLimitDecision fromWindow(RateWindow window, EffectiveRateLimit limit, Instant now) {
        return fromCounter(window.counter(), window.windowEnd(), limit, now);
    }

    public static RateLimitDecision fromCounter(int counter, Instant resetAt, EffectiveRateLimit limit, Instant now) {
        if (counter > limit.maxRequests()) {
            final var retryAfter = Math.max(1, resetAt.getEpochSecond() - now.getEpochSecond());
            return rejected(limit.maxRequests(), limit.windowSeconds(), resetAt, retryAfter, counter);
        }
        return allow(limit.maxRequests() - counter, limit.maxRequests(), limit.windowSeconds(), resetAt, counter);
    }

    /**
     * The same decision, flagged as made against a load-reduced limit.
     */
    public RateLimitDecision asReduced() {
        return new RateLimitDecision(allowed, remaining, limit, windowSeconds, resetAt, retryAfterSeconds, requestCount, true);
    }

    /**
     * Whether this decision carries real window data (not an unconditional admit).
     */
    public boolean isTracked() {
        return limit != Long.MAX_VALUE;
    }
}
