package warden.core.model.common;

/**
 * Ordinal risk classification shared by anomaly results and threat records.
 */
public enum RiskLevel {
    LOW("Continue monitoring"),
    MEDIUM("Monitor and log"),
    HIGH("Review and monitor closely"),
    CRITICAL("Immediate investigation required");

    private final String recommendedAction;

    RiskLevel(String recommendedAction) {
        this.recommendedAction = recommendedAction;
    }

    /**
     * Operator guidance for this level.
     */
    public String recommendedAction() {
        return recommendedAction;
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parse a level name case-insensitively, defaulting to MEDIUM for unknown values.
     *
     * @param value level name
     * @return the level
     */
    public static RiskLevel parse(String value) {
        if (value == null) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
