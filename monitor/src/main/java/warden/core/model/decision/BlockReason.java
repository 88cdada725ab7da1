package warden.core.model.decision;

/**
 * Why a request was not simply allowed, with the HTTP status it maps to.
 */
public enum BlockReason {
    BLACKLISTED(401, "Request source is blacklisted"),
    THREAT_FEED_UNAVAILABLE(401, "Threat intelligence unavailable"),
    ACCOUNT_LOCKED(423, "Account temporarily locked"),
    RATE_LIMITED(429, "Rate limit exceeded"),
    STEP_UP_REQUIRED(401, "Additional verification required");

    private final int httpStatus;
    private final String message;

    BlockReason(int httpStatus, String message) {
        this.httpStatus = httpStatus;
        this.message = message;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String message() {
        return message;
    }
}
