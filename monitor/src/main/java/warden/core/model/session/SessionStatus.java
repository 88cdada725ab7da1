package warden.core.model.session;

/**
 * Lifecycle state of a session. Suspicion is tracked separately.
 */
public enum SessionStatus {
    ACTIVE,
    TERMINATED
}
