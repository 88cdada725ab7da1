package warden.core.model.behavior;

import java.util.List;

import warden.core.model.common.RiskLevel;

/**
 * Verdict of scoring one behavior event.
 *
 * @param isAnomalous       score reached the anomalous threshold
 * @param score             clamped sum of triggered flag weights, 0-1
 * @param riskLevel         classification of the score
 * @param reasons           reasons of triggered flags, most severe first
 * @param flags             triggered flags, in the same order as the reasons
 * @param deviation         weighted distance of session length and action rate from the baseline, 0-1
 * @param recommendedAction operator guidance for the risk level
 * @param degraded          the baseline store was unavailable and the result is best effort
 */
public record AnomalyResult(
        boolean isAnomalous,
        double score,
        RiskLevel riskLevel,
        List<String> reasons,
        List<AnomalyFlag> flags,
        double deviation,
        String recommendedAction,
        boolean degraded) {

    public AnomalyResult {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        flags = flags != null ? List.copyOf(flags) : List.of();
    }

    /**
     * Result for a user's first observed event, which only establishes the baseline.
     */
    public static AnomalyResult coldStart() {
        return new AnomalyResult(false, 0.0, RiskLevel.LOW, List.of(), List.of(), 0.0,
                RiskLevel.LOW.recommendedAction(), false);
    }

    public AnomalyResult asDegraded() {
        return new AnomalyResult(isAnomalous, score, riskLevel, reasons, flags, deviation, recommendedAction, true);
    }
}
