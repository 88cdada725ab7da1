package warden.core.port.out;

import java.util.Optional;

import warden.core.model.identity.RequestMetadata;

/**
 * Resolves a coarse location for a request, used as the location dimension of behavior events.
 */
public interface GeolocationResolver {

    /**
     * Resolve the location of a request.
     *
     * @param clientIp client address
     * @param request  request metadata
     * @return a location such as {@code "Berlin, DE"}, or empty when unknown
     */
    Optional<String> resolve(String clientIp, RequestMetadata request);
}
