package warden.core.model.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A user's login session and its trust state.
 *
 * @param sessionToken      opaque bearer token, 43 characters
 * @param userId            session owner
 * @param ipAddress         address the session was created from
 * @param device            device identifier, see {@code DeviceDescriptor#id()}
 * @param location          resolved location, or null
 * @param isTrusted         created on or later bound to a trusted device
 * @param isSuspicious      flagged by creation checks or an anomaly finding
 * @param suspicionReasons  why the session was flagged, oldest first
 * @param status            ACTIVE until terminated
 * @param fixedDuration     activity does not extend the expiry
 * @param createdAt         creation time
 * @param lastActivityAt    latest touch
 * @param expiresAt         expiry time
 * @param terminatedAt      termination time, null while active
 * @param terminationReason termination reason, null while active
 */
public record UserSession(
        String sessionToken,
        String userId,
        String ipAddress,
        String device,
        String location,
        boolean isTrusted,
        boolean isSuspicious,
        List<String> suspicionReasons,
        SessionStatus status,
        boolean fixedDuration,
        Instant createdAt,
        Instant lastActivityAt,
        Instant expiresAt,
        Instant terminatedAt,
        TerminationReason terminationReason) {

    public UserSession {
        Objects.requireNonNull(sessionToken, "sessionToken cannot be null");
        Objects.requireNonNull(userId, "userId cannot be null");
        suspicionReasons = suspicionReasons != null ? List.copyOf(suspicionReasons) : List.of();
        status = status != null ? status : SessionStatus.ACTIVE;
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public UserSession withActivity(Instant now, Instant newExpiresAt) {
        return new UserSession(
                sessionToken, userId, ipAddress, device, location, isTrusted, isSuspicious, suspicionReasons,
                status, fixedDuration, createdAt, now, newExpiresAt, terminatedAt, terminationReason);
    }

    public UserSession withSuspicion(String reason) {
        final var reasons = new ArrayList<>(suspicionReasons);
        if (reason != null && !reasons.contains(reason)) {
            reasons.add(reason);
        }
        return new UserSession(
                sessionToken, userId, ipAddress, device, location, isTrusted, true, reasons,
                status, fixedDuration, createdAt, lastActivityAt, expiresAt, terminatedAt, terminationReason);
    }

    public UserSession withTrusted(boolean trusted) {
        return new UserSession(
                sessionToken, userId, ipAddress, device, location, trusted, isSuspicious, suspicionReasons,
                status, fixedDuration, createdAt, lastActivityAt, expiresAt, terminatedAt, terminationReason);
    }

    public UserSession terminated(Instant now, TerminationReason reason) {
        return new UserSession(
                sessionToken, userId, ipAddress, device, location, isTrusted, isSuspicious, suspicionReasons,
                SessionStatus.TERMINATED, fixedDuration, createdAt, lastActivityAt, expiresAt, now, reason);
    }

    /**
     * Token prefix safe for logs and events.
     */
    public String maskedToken() {
        return mask(sessionToken);
    }

    /**
     * Shorten any token to its first eight characters.
     *
     * @param token the token, may be null
     * @return the prefix followed by {@code ...}
     */
    public static String mask(String token) {
        return token == null || token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }
}
