package warden.core.model.ratelimit;

/**
 * A named group of endpoints sharing one rate limit.
 *
 * @param name           class name, used as the endpoint key of rate windows
 * @param limit          the class limit
 * @param authentication whether the class holds authentication endpoints
 */
public record EndpointClass(String name, EffectiveRateLimit limit, boolean authentication) {

    public static final String DEFAULT_NAME = "default";
}
