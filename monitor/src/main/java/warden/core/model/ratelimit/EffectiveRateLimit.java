package warden.core.model.ratelimit;

/**
 * The limit applied to one request after endpoint classification, threat scaling and load reduction.
 *
 * @param maxRequests   requests admitted per window
 * @param windowSeconds window length
 */
public record EffectiveRateLimit(int maxRequests, int windowSeconds) {

    public EffectiveRateLimit {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
        }
        if (windowSeconds < 1) {
            throw new IllegalArgumentException("windowSeconds must be positive: " + windowSeconds);
        }
    }

    /**
     * Scale the request budget, never below one request per window.
     *
     * @param factor multiplier in (0, 1]
     * @return the reduced limit
     */
    public EffectiveRateLimit scaled(double factor) {
        final var scaled = (int) Math.floor(maxRequests * factor);
        return new EffectiveRateLimit(Math.max(1, scaled), windowSeconds);
    }

    /**
     * Cut the request budget by a percentage while the system is under load.
     *
     * <p>The result never drops below {@code floor} and never exceeds the current budget,
     * so limits already at or under the floor stay as they are.
     *
     * @param percent reduction in [0, 100)
     * @param floor   smallest budget the reduction may produce
     * @return the reduced limit
     */
    public EffectiveRateLimit reduced(int percent, int floor) {
        final var reduced = maxRequests * (100 - percent) / 100;
        return new EffectiveRateLimit(Math.min(maxRequests, Math.max(reduced, floor)), windowSeconds);
    }
}
