package warden.core.model.decision;

/**
 * Outcome of the security decision for one request.
 */
public enum DecisionAction {
    ALLOW,
    CHALLENGE,
    BLOCK
}
