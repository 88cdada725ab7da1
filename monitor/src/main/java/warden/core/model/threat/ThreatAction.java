package warden.core.model.threat;

import warden.core.model.common.RiskLevel;

/**
 * Action recommended for traffic from an address with a given reputation.
 */
public enum ThreatAction {
    ALLOW,
    MONITOR,
    BLOCK;

    public static ThreatAction forSeverity(RiskLevel severity) {
        switch (severity) {
            case CRITICAL:
            case HIGH:
                return BLOCK;
            case MEDIUM:
                return MONITOR;
            default:
                return ALLOW;
        }
    }
}
