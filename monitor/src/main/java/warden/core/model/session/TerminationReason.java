package warden.core.model.session;

/**
 * Why a session ended.
 */
public enum TerminationReason {
    LOGOUT("User logout"),
    EXPIRED("Session expired"),
    SESSION_LIMIT("Session limit exceeded - oldest session terminated"),
    TERMINATE_ALL("All sessions terminated"),
    ADMIN("Terminated by administrator"),
    SECURITY("Terminated after security finding");

    private final String description;

    TerminationReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
