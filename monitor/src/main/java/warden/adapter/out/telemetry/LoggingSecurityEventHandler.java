package warden.adapter.out.telemetry;

import org.jboss.logging.Logger;

import warden.spi.SecurityEvent;
import warden.spi.SecurityEventHandler;

/**
 * Security event handler that writes events to the {@code warden.security} log category.
 *
 * <p>Log levels follow event severity:
 * <ul>
 *   <li>INFO severity → DEBUG level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("warden.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs security events using JBoss Logging";
    }

    @Override
    public void handle(SecurityEvent event) {
        var message = format(event);
        switch (event.severity()) {
            case INFO -> LOG.debug(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    static String format(SecurityEvent event) {
        if (event instanceof SecurityEvent.RateLimitExceeded) {
            var e = (SecurityEvent.RateLimitExceeded) event;
            return String.format(
                    "RATE_LIMIT: client=%s endpoint=%s requests=%d threshold=%d window=%ds",
                    e.clientIdentifier(), e.endpointKey(), e.requestCount(), e.threshold(), e.windowSeconds());
        }
        if (event instanceof SecurityEvent.AuthenticationFailure) {
            var e = (SecurityEvent.AuthenticationFailure) event;
            return String.format(
                    "AUTH_FAILURE: client=%s credential=%s reason=%s failures=%d risk=%s",
                    e.clientIdentifier(), e.credentialKey(), e.reason(), e.failureCount(), e.riskFactors());
        }
        if (event instanceof SecurityEvent.AuthenticationLockout) {
            var e = (SecurityEvent.AuthenticationLockout) event;
            return String.format(
                    "AUTH_LOCKOUT: client=%s credential=%s failures=%d until=%s",
                    e.clientIdentifier(), e.credentialKey(), e.failedAttempts(), e.lockoutUntil());
        }
        if (event instanceof SecurityEvent.AnomalyDetected) {
            var e = (SecurityEvent.AnomalyDetected) event;
            return String.format(
                    "ANOMALY: client=%s user=%s score=%.2f risk=%s reasons=%s",
                    e.clientIdentifier(), e.userId(), e.score(), e.riskLevel(), e.reasons());
        }
        if (event instanceof SecurityEvent.SessionFlagged) {
            var e = (SecurityEvent.SessionFlagged) event;
            return String.format(
                    "SESSION_FLAGGED: client=%s session=%s user=%s reason=%s",
                    e.clientIdentifier(), e.sessionId(), e.userId(), e.reason());
        }
        if (event instanceof SecurityEvent.SessionInvalidated) {
            var e = (SecurityEvent.SessionInvalidated) event;
            return String.format(
                    "SESSION_INVALIDATED: client=%s session=%s user=%s reason=%s",
                    e.clientIdentifier(), e.sessionId(), e.userId(), e.reason());
        }
        if (event instanceof SecurityEvent.ThreatBlocked) {
            var e = (SecurityEvent.ThreatBlocked) event;
            return String.format(
                    "THREAT_BLOCKED: client=%s type=%s confidence=%d failClosed=%s",
                    e.clientIdentifier(), e.threatType(), e.confidence(), e.failClosed());
        }
        var e = (SecurityEvent.StoreFailure) event;
        return String.format(
                "STORE_FAILURE: key=%s store=%s operation=%s error=%s",
                e.clientIdentifier(), e.store(), e.operation(), e.message());
    }
}
