package warden.core.model.threat;

import java.time.Instant;
import java.util.Objects;

import warden.core.model.common.RiskLevel;

/**
 * Reputation data for one IP address.
 *
 * @param ipAddress       the address
 * @param threatType      category such as {@code Botnet} or {@code Scanning}
 * @param severity        threat severity
 * @param confidenceScore confidence 0-100
 * @param blacklisted     always treated as a critical threat
 * @param whitelisted     never treated as a threat
 * @param firstSeen       first report
 * @param lastSeen        latest report
 * @param reportCount     number of reports merged into this record
 * @param description     free-form detail
 */
public record ThreatRecord(
        String ipAddress,
        String threatType,
        RiskLevel severity,
        int confidenceScore,
        boolean blacklisted,
        boolean whitelisted,
        Instant firstSeen,
        Instant lastSeen,
        int reportCount,
        String description) {

    public static final String TYPE_BLACKLISTED = "Blacklisted";
    public static final String TYPE_WHITELISTED = "Whitelisted";

    public ThreatRecord {
        Objects.requireNonNull(ipAddress, "ipAddress cannot be null");
        severity = severity != null ? severity : RiskLevel.MEDIUM;
        confidenceScore = Math.max(0, Math.min(100, confidenceScore));
        threatType = threatType != null ? threatType : "Suspicious";
        reportCount = Math.max(1, reportCount);
        if (blacklisted && whitelisted) {
            throw new IllegalArgumentException("Address cannot be both blacklisted and whitelisted: " + ipAddress);
        }
    }

    public static ThreatRecord blacklisted(String ipAddress, String reason, Instant now) {
        return new ThreatRecord(ipAddress, TYPE_BLACKLISTED, RiskLevel.CRITICAL, 100, true, false, now, now, 1, reason);
    }

    public static ThreatRecord whitelisted(String ipAddress, String reason, Instant now) {
        return new ThreatRecord(ipAddress, TYPE_WHITELISTED, RiskLevel.LOW, 100, false, true, now, now, 1, reason);
    }

    public static ThreatRecord reported(
            String ipAddress, String threatType, RiskLevel severity, int confidence, String description, Instant now) {
        return new ThreatRecord(ipAddress, threatType, severity, confidence, false, false, now, now, 1, description);
    }

    /**
     * Fold a newer report for the same address into this record.
     *
     * <p>Keeps the first sighting, the highest confidence and severity, and counts the report.
     *
     * @param report the newer report
     * @return the merged record
     */
    public ThreatRecord merge(ThreatRecord report) {
        final var mergedSeverity = report.severity().isAtLeast(severity) ? report.severity() : severity;
        return new ThreatRecord(
                ipAddress,
                report.threatType(),
                mergedSeverity,
                Math.max(confidenceScore, report.confidenceScore()),
                blacklisted || report.blacklisted(),
                whitelisted && !report.blacklisted(),
                firstSeen,
                report.lastSeen(),
                reportCount + report.reportCount(),
                report.description() != null ? report.description() : description);
    }
}
