package warden.core.model.behavior;

/**
 * Deviation dimensions checked for every scored event, with their operator-facing reason.
 */
public enum AnomalyFlag {
    NEW_LOCATION("Access from new location"),
    HIGH_VELOCITY("Unusually high activity rate"),
    NEW_DEVICE("Access from new device"),
    OFF_HOURS("Access outside typical hours"),
    OUTSIDE_NORMAL_PATTERN("Session pattern deviates from baseline"),
    KNOWN_THREAT_SOURCE("Request from address with poor reputation");

    private final String reason;

    AnomalyFlag(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
