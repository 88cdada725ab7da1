package warden.core.service.identity;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.model.identity.ClientIdentity;
import warden.core.model.identity.RequestMetadata;

/**
 * Derives the identity used for rate limiting and lockout from a request.
 *
 * <p>An authenticated user id wins; otherwise the client IP is used. Resolution
 * never fails a request: when no address can be derived the identity falls back
 * to the {@link ClientIdentity#UNKNOWN_IP} bucket.
 */
@ApplicationScoped
public class ClientIdentityResolver {

    private static final Logger LOG = Logger.getLogger(ClientIdentityResolver.class);

    public ClientIdentity resolve(RequestMetadata request) {
        final var userId = request.authenticatedUserId();
        if (userId != null && !userId.isBlank()) {
            return ClientIdentity.user(userId.trim());
        }
        return ClientIdentity.ip(resolveClientIp(request));
    }

    /**
     * Resolve the client address, falling back to {@link ClientIdentity#UNKNOWN_IP}.
     *
     * @param request the request
     * @return the client address
     */
    public String resolveClientIp(RequestMetadata request) {
        try {
            return requireClientIp(request);
        } catch (IdentityResolutionException e) {
            LOG.debugf("Falling back to anonymous IP bucket for %s: %s", request.path(), e.getMessage());
            return ClientIdentity.UNKNOWN_IP;
        }
    }

    private String requireClientIp(RequestMetadata request) {
        final var ip = ClientIpExtractor.extract(request);
        if (ip == null) {
            throw new IdentityResolutionException("No client address in headers or connection");
        }
        return ip;
    }

    /**
     * Raised when no identity can be derived from a request.
     */
    public static class IdentityResolutionException extends RuntimeException {

        public IdentityResolutionException(String message) {
            super(message);
        }
    }
}
