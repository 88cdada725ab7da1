package warden.core.model.lockout;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate view of recent failed logins for operators.
 *
 * @param since                  start of the reporting window
 * @param totalFailures          failures in the window
 * @param uniqueCredentials      distinct credentials targeted
 * @param uniqueIps              distinct source addresses
 * @param topTargetedCredentials most targeted credentials, descending
 * @param topSourceIps           most active source addresses, descending
 * @param suspiciousIps          addresses at or above the suspicious threshold
 * @param activeLockouts         credentials currently locked
 */
public record FailedLoginSummary(
        Instant since,
        int totalFailures,
        int uniqueCredentials,
        int uniqueIps,
        List<Count> topTargetedCredentials,
        List<Count> topSourceIps,
        List<String> suspiciousIps,
        int activeLockouts) {

    /**
     * A key with its number of failures.
     */
    public record Count(String key, long failures) {}
}
