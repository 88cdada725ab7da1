package warden.core.model.decision;

import java.util.List;

import warden.core.model.behavior.AnomalyResult;
import warden.core.model.lockout.AccountLockoutState;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.threat.ReputationVerdict;

/**
 * Combined verdict for one request.
 *
 * @param action            what to do with the request
 * @param blockReason       why it was blocked or challenged, null when allowed
 * @param reasons           human readable findings, including non-blocking ones
 * @param retryAfterSeconds seconds until a retry may succeed, 0 if not applicable
 * @param rateLimit         rate limit decision, null if not evaluated
 * @param lockout           lockout state, null if not evaluated
 * @param reputation        reputation verdict, null if not evaluated
 * @param anomaly           anomaly result, null if not evaluated
 */
public record SecurityDecision(
        DecisionAction action,
        BlockReason blockReason,
        List<String> reasons,
        long retryAfterSeconds,
        RateLimitDecision rateLimit,
        AccountLockoutState lockout,
        ReputationVerdict reputation,
        AnomalyResult anomaly) {

    public static final String STEP_UP_HEADER = "X-Step-Up-Required";

    public SecurityDecision {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    /**
     * Unconditional allow, used when a check failed.
     */
    public static SecurityDecision allowDegraded(String reason) {
        return new SecurityDecision(DecisionAction.ALLOW, null, List.of(reason), 0, null, null, null, null);
    }

    public boolean isAllowed() {
        return action == DecisionAction.ALLOW;
    }

    /**
     * HTTP status for a non-allowed decision, 200 when allowed.
     */
    public int httpStatus() {
        return blockReason != null && !isAllowed() ? blockReason.httpStatus() : 200;
    }
}
