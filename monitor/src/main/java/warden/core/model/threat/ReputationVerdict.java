package warden.core.model.threat;

import warden.core.model.common.RiskLevel;

/**
 * Result of an IP reputation lookup.
 *
 * @param ipAddress         the address checked
 * @param isThreat          whether the address is a known threat
 * @param riskLevel         severity of the threat, LOW when none
 * @param confidence        confidence 0-100
 * @param recommendedAction what to do with the traffic
 * @param threatType        threat category, or null
 * @param blacklisted       address is on the blacklist
 * @param whitelisted       address is on the whitelist
 * @param stale             the cache has not been refreshed within its staleness window
 * @param failClosed        blocked only because the cache is stale and policy is fail-closed
 */
public record ReputationVerdict(
        String ipAddress,
        boolean isThreat,
        RiskLevel riskLevel,
        int confidence,
        ThreatAction recommendedAction,
        String threatType,
        boolean blacklisted,
        boolean whitelisted,
        boolean stale,
        boolean failClosed) {

    public static ReputationVerdict clean(String ipAddress, boolean stale) {
        return new ReputationVerdict(ipAddress, false, RiskLevel.LOW, 0, ThreatAction.ALLOW, null, false, false, stale, false);
    }

    public static ReputationVerdict trusted(ThreatRecord record, boolean stale) {
        return new ReputationVerdict(
                record.ipAddress(), false, RiskLevel.LOW, record.confidenceScore(), ThreatAction.ALLOW,
                null, false, true, stale, false);
    }

    public static ReputationVerdict fromRecord(ThreatRecord record, boolean stale) {
        if (record.blacklisted()) {
            return new ReputationVerdict(
                    record.ipAddress(), true, RiskLevel.CRITICAL, record.confidenceScore(), ThreatAction.BLOCK,
                    record.threatType(), true, false, stale, false);
        }
        return new ReputationVerdict(
                record.ipAddress(), true, record.severity(), record.confidenceScore(),
                ThreatAction.forSeverity(record.severity()), record.threatType(), false, false, stale, false);
    }

    public static ReputationVerdict failClosed(String ipAddress) {
        return new ReputationVerdict(
                ipAddress, true, RiskLevel.CRITICAL, 0, ThreatAction.BLOCK, "stale-feed", false, false, true, true);
    }

    /**
     * Whether the request must be blocked outright: a blacklist hit or a fail-closed stale feed.
     */
    public boolean mustBlock() {
        return blacklisted || failClosed;
    }
}
