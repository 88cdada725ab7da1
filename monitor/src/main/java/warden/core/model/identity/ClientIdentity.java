package warden.core.model.identity;

import java.util.Objects;

/**
 * Stable identity used to bucket rate limiting and lockout.
 *
 * <p>Derived per request and never persisted on its own.
 *
 * @param key  the authenticated user id or the client IP address
 * @param kind where the key came from
 */
public record ClientIdentity(String key, IdentityKind kind) {

    public static final String UNKNOWN_IP = "unknown";

    public ClientIdentity {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public static ClientIdentity user(String userId) {
        return new ClientIdentity(userId, IdentityKind.USER);
    }

    public static ClientIdentity ip(String ipAddress) {
        return new ClientIdentity(ipAddress, IdentityKind.IP);
    }

    public boolean isUser() {
        return kind == IdentityKind.USER;
    }

    /**
     * Key namespaced by kind, so that a user id can never collide with an address.
     *
     * @return e.g. {@code user:alice} or {@code ip:10.0.0.1}
     */
    public String bucketKey() {
        return (kind == IdentityKind.USER ? "user:" : "ip:") + key;
    }
}
