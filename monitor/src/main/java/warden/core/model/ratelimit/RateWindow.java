package warden.core.model.ratelimit;

import java.time.Instant;

/**
 * A fixed counting window for one (identity, endpoint) pair.
 *
 * @param identityKey identity bucket
 * @param endpointKey endpoint
 * @param counter     requests seen in this window, including rejected ones
 * @param windowStart when the window opened
 * @param windowEnd   when the window closes; a request at or after this instant opens a new one
 */
public record RateWindow(String identityKey, String endpointKey, int counter, Instant windowStart, Instant windowEnd) {

    public static RateWindow open(RateLimitKey key, Instant now, int windowSeconds) {
        return new RateWindow(key.identityKey(), key.endpointKey(), 1, now, now.plusSeconds(windowSeconds));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(windowEnd);
    }

    public RateWindow increment() {
        // Saturate so a flood cannot overflow the counter back into the admitted range
        final var next = counter == Integer.MAX_VALUE ? counter : counter + 1;
        return new RateWindow(identityKey, endpointKey, next, windowStart, windowEnd);
    }
}
