package warden.core.model.ratelimit;

import java.util.Objects;

/**
 * Identifies one rate window: an identity bucket and an endpoint.
 *
 * @param identityKey namespaced identity key, see {@code ClientIdentity#bucketKey()}
 * @param endpointKey endpoint class name or path
 */
public record RateLimitKey(String identityKey, String endpointKey) {

    public RateLimitKey {
        Objects.requireNonNull(identityKey, "identityKey cannot be null");
        Objects.requireNonNull(endpointKey, "endpointKey cannot be null");
    }

    /**
     * Storage key shared by every limiter implementation.
     *
     * @return {@code {identityKey}|{endpointKey}}
     */
    public String toCacheKey() {
        return identityKey + "|" + endpointKey;
    }
}
