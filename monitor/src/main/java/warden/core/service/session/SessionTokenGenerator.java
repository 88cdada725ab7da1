package warden.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Issues opaque session tokens: 256 bits from {@link SecureRandom}, URL-safe Base64
 * without padding (43 characters).
 *
 * <p>Uniqueness is not guaranteed here; {@link SessionTrustService} retries on a
 * collision reported by the repository.
 */
@ApplicationScoped
public class SessionTokenGenerator {

    private final SecureRandom random = new SecureRandom();
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();

    public String generate() {
        final var bytes = new byte[32];
        random.nextBytes(bytes);
        return encoder.encodeToString(bytes);
    }
}
