package warden.spi;

import java.time.Instant;
import java.util.List;

/**
 * Sealed interface representing security events raised by the monitoring core.
 *
 * <p>Security events are dispatched to registered {@link SecurityEventHandler}
 * implementations for alerting, logging, and metrics recording.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link RateLimitExceeded} - Client exceeded a rate limit</li>
 *   <li>{@link AuthenticationFailure} - Failed login attempt</li>
 *   <li>{@link AuthenticationLockout} - Credential locked after repeated failures</li>
 *   <li>{@link AnomalyDetected} - Behavior deviating from the user's baseline</li>
 *   <li>{@link SessionFlagged} - Session marked suspicious</li>
 *   <li>{@link SessionInvalidated} - Session terminated</li>
 *   <li>{@link ThreatBlocked} - Request blocked by threat intelligence</li>
 *   <li>{@link StoreFailure} - Backing store unavailable, running degraded</li>
 * </ul>
 */
public sealed interface SecurityEvent {

    /**
     * Return the timestamp when this event occurred.
     *
     * @return event timestamp
     */
    Instant timestamp();

    /**
     * Return the client identifier (identity key or IP address).
     *
     * @return client identifier
     */
    String clientIdentifier();

    /**
     * Return the severity level of this event.
     *
     * @return severity level
     */
    Severity severity();

    /**
     * Severity levels for security events.
     */
    enum Severity {
        /** Informational events (e.g., normal session termination). */
        INFO,
        /** Warning events requiring attention (e.g., repeated login failures). */
        WARNING,
        /** Critical events requiring immediate action (e.g., blacklisted source). */
        CRITICAL
    }

    /**
     * Rate limit exceeded event.
     *
     * @param timestamp when the limit was exceeded
     * @param clientIdentifier identity bucket key
     * @param endpointKey endpoint class
     * @param requestCount requests in the window
     * @param threshold the limit
     * @param windowSeconds window length
     */
    record RateLimitExceeded(
            Instant timestamp,
            String clientIdentifier,
            String endpointKey,
            int requestCount,
            long threshold,
            long windowSeconds)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            double ratio = (double) requestCount / Math.max(1, threshold);
            if (ratio > 5.0) {
                return Severity.CRITICAL;
            } else if (ratio > 2.0) {
                return Severity.WARNING;
            }
            return Severity.INFO;
        }
    }

    /**
     * Failed login event.
     *
     * @param timestamp when the failure occurred
     * @param clientIdentifier client IP address
     * @param credentialKey the targeted credential
     * @param reason failure reason
     * @param failureCount failures in the observation window
     * @param riskFactors risk factors observed on this attempt
     */
    record AuthenticationFailure(
            Instant timestamp,
            String clientIdentifier,
            String credentialKey,
            String reason,
            int failureCount,
            List<String> riskFactors)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return failureCount >= 5 || !riskFactors.isEmpty() ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * Credential lockout event.
     *
     * @param timestamp when the lockout started
     * @param clientIdentifier IP address of the attempt that triggered it
     * @param credentialKey the locked credential
     * @param failedAttempts failures that caused the lockout
     * @param lockoutUntil when the lockout ends
     */
    record AuthenticationLockout(
            Instant timestamp, String clientIdentifier, String credentialKey, int failedAttempts, Instant lockoutUntil)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * Anomalous behavior event.
     *
     * @param timestamp when the event was scored
     * @param clientIdentifier client IP address
     * @param userId the user
     * @param score anomaly score
     * @param riskLevel derived risk level name
     * @param reasons triggered flags, most severe first
     */
    record AnomalyDetected(
            Instant timestamp,
            String clientIdentifier,
            String userId,
            double score,
            String riskLevel,
            List<String> reasons)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return "CRITICAL".equals(riskLevel) ? Severity.CRITICAL : Severity.WARNING;
        }
    }

    /**
     * Session marked suspicious.
     *
     * @param timestamp when the session was flagged
     * @param clientIdentifier session IP address
     * @param sessionId truncated session token
     * @param userId the session owner
     * @param reason why it was flagged
     */
    record SessionFlagged(Instant timestamp, String clientIdentifier, String sessionId, String userId, String reason)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * Session terminated.
     *
     * @param timestamp when the session was terminated
     * @param clientIdentifier session IP address
     * @param sessionId truncated session token
     * @param userId the session owner
     * @param reason termination reason
     */
    record SessionInvalidated(
            Instant timestamp, String clientIdentifier, String sessionId, String userId, String reason)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * Request blocked by threat intelligence.
     *
     * @param timestamp when the request was blocked
     * @param clientIdentifier the blocked address
     * @param threatType threat category, or "stale-feed" for fail-closed blocks
     * @param confidence confidence score 0-100
     * @param failClosed whether the block came from the fail-closed policy
     */
    record ThreatBlocked(
            Instant timestamp, String clientIdentifier, String threatType, int confidence, boolean failClosed)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return failClosed ? Severity.WARNING : Severity.CRITICAL;
        }
    }

    /**
     * Backing store failure; the affected component continues in degraded mode.
     *
     * @param timestamp when the failure was observed
     * @param clientIdentifier affected key (user id, credential)
     * @param store the store that failed
     * @param operation the failed operation
     * @param message error message
     */
    record StoreFailure(
            Instant timestamp, String clientIdentifier, String store, String operation, String message)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }
}
