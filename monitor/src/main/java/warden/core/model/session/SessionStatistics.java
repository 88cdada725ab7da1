package warden.core.model.session;

/**
 * Snapshot of session activity across all users.
 *
 * @param activeSessions     sessions currently active
 * @param suspiciousSessions active sessions flagged suspicious
 * @param trustedSessions    active sessions on trusted devices
 * @param uniqueUsers        users with at least one active session
 */
public record SessionStatistics(int activeSessions, int suspiciousSessions, int trustedSessions, int uniqueUsers) {}
