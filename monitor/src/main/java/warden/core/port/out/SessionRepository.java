package warden.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.TerminationReason;
import warden.core.model.session.UserSession;

/**
 * Outbound port for session storage.
 */
public interface SessionRepository {

    /**
     * Store a new session only if its token is not already in use.
     *
     * @param session session to store
     * @return true if saved, false on a token collision
     */
    Uni<Boolean> saveIfAbsent(UserSession session);

    Uni<Optional<UserSession>> findByToken(String sessionToken);

    /**
     * Atomically replace a session with the result of {@code update}.
     *
     * @param sessionToken session token
     * @param update       receives the current session and returns the new one
     * @return the updated session, or empty if not found
     */
    Uni<Optional<UserSession>> update(String sessionToken, UnaryOperator<UserSession> update);

    /**
     * All sessions of a user, active and terminated, oldest first.
     */
    Uni<List<UserSession>> findByUser(String userId);

    /**
     * All active sessions.
     */
    Uni<List<UserSession>> findActive();

    /**
     * Terminate a user's oldest active sessions until at most {@code maxActive} remain.
     *
     * <p>Runs atomically per user. The session identified by {@code keepToken} is never
     * chosen.
     *
     * @param userId    the user
     * @param maxActive active sessions allowed
     * @param keepToken session to keep, may be null
     * @param now       termination time
     * @return the sessions terminated
     */
    Uni<List<UserSession>> enforceLimit(String userId, int maxActive, String keepToken, Instant now);

    /**
     * Terminate all active sessions of a user except one.
     *
     * @param userId      the user
     * @param exceptToken session to keep, may be null
     * @param reason      termination reason
     * @param now         termination time
     * @return the sessions terminated
     */
    Uni<List<UserSession>> terminateAll(String userId, String exceptToken, TerminationReason reason, Instant now);

    /**
     * Remove sessions terminated before a cutoff.
     *
     * @param cutoff termination time cutoff
     * @return number of sessions removed
     */
    Uni<Integer> purgeTerminatedBefore(Instant cutoff);
}
