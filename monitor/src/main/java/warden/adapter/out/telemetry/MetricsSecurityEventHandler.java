package warden.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.spi.SecurityEvent;
import warden.spi.SecurityEventHandler;

/**
 * Security event handler that records events as Micrometer metrics.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.security.events.total} - all events by type and severity</li>
 *   <li>{@code warden.security.rate_limit.exceeded} - rate limit violations by endpoint</li>
 *   <li>{@code warden.security.auth.failures} - login failures by reason</li>
 *   <li>{@code warden.security.auth.lockouts} - credential lockouts</li>
 *   <li>{@code warden.security.anomalies} - anomalies by risk level</li>
 *   <li>{@code warden.security.session.flagged} / {@code .invalidated} - session trust changes</li>
 *   <li>{@code warden.security.threat.blocked} - threat intelligence blocks</li>
 *   <li>{@code warden.security.store.failures} - degraded store operations</li>
 * </ul>
 *
 * <p>Client identifiers are never used as tags to keep cardinality bounded.
 */
public class MetricsSecurityEventHandler implements SecurityEventHandler {

    private MeterRegistry registry;

    public MetricsSecurityEventHandler() {
        // Default constructor for ServiceLoader
    }

    public MetricsSecurityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Called by the dispatcher after ServiceLoader instantiation.
     *
     * @param registry the Micrometer registry
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public String description() {
        return "Records security events as Micrometer metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(SecurityEvent event) {
        if (registry == null) {
            return;
        }

        Counter.builder("warden.security.events.total")
                .description("Total security events")
                .tag("event_type", event.getClass().getSimpleName())
                .tag("severity", event.severity().name().toLowerCase())
                .register(registry)
                .increment();

        if (event instanceof SecurityEvent.RateLimitExceeded) {
            increment("warden.security.rate_limit.exceeded", "Rate limit violations",
                    "endpoint", ((SecurityEvent.RateLimitExceeded) event).endpointKey());
        } else if (event instanceof SecurityEvent.AuthenticationFailure) {
            increment("warden.security.auth.failures", "Login failures",
                    "reason", ((SecurityEvent.AuthenticationFailure) event).reason());
        } else if (event instanceof SecurityEvent.AuthenticationLockout) {
            increment("warden.security.auth.lockouts", "Credential lockouts", "source", "login");
        } else if (event instanceof SecurityEvent.AnomalyDetected) {
            increment("warden.security.anomalies", "Anomalous behavior detected",
                    "risk_level", ((SecurityEvent.AnomalyDetected) event).riskLevel());
        } else if (event instanceof SecurityEvent.SessionFlagged) {
            increment("warden.security.session.flagged", "Sessions marked suspicious", "source", "trust");
        } else if (event instanceof SecurityEvent.SessionInvalidated) {
            increment("warden.security.session.invalidated", "Session terminations",
                    "reason", ((SecurityEvent.SessionInvalidated) event).reason());
        } else if (event instanceof SecurityEvent.ThreatBlocked) {
            var blocked = (SecurityEvent.ThreatBlocked) event;
            increment("warden.security.threat.blocked", "Requests blocked by threat intelligence",
                    "fail_closed", String.valueOf(blocked.failClosed()));
        } else if (event instanceof SecurityEvent.StoreFailure) {
            increment("warden.security.store.failures", "Degraded store operations",
                    "store", ((SecurityEvent.StoreFailure) event).store());
        }
    }

    private void increment(String name, String description, String tagKey, String tagValue) {
        Counter.builder(name)
                .description(description)
                .tag(tagKey, tagValue != null ? tagValue : "unknown")
                .register(registry)
                .increment();
    }
}
