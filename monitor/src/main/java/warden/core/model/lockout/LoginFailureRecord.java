package warden.core.model.lockout;

import java.time.Instant;
import java.util.Objects;

/**
 * One failed login attempt. Append-only.
 *
 * @param credentialKey the targeted credential (username, email)
 * @param ipAddress     client address, kept for reporting only
 * @param attemptTime   when the attempt happened
 * @param reason        failure reason, e.g. {@code invalid_password}
 * @param geolocation   resolved location of the address, or null
 * @param userAgent     client user agent, or null
 */
public record LoginFailureRecord(
        String credentialKey, String ipAddress, Instant attemptTime, String reason, String geolocation, String userAgent) {

    public LoginFailureRecord {
        Objects.requireNonNull(credentialKey, "credentialKey cannot be null");
        Objects.requireNonNull(attemptTime, "attemptTime cannot be null");
        reason = reason != null ? reason : "unknown";
    }
}
