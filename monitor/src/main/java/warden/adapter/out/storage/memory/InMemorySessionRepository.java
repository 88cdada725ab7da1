package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.TerminationReason;
import warden.core.model.session.UserSession;
import warden.core.port.out.SessionRepository;

/**
 * In-memory implementation of SessionRepository.
 *
 * <p>Sessions are lost on restart and not shared across instances. Operations
 * spanning several sessions of one user run inside {@code compute} on the user
 * index entry, so they are serialized per user.
 */
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRepository.class);

    private static final Comparator<UserSession> OLDEST_FIRST =
            Comparator.comparing(UserSession::createdAt).thenComparing(UserSession::sessionToken);

    private final ConcurrentMap<String, UserSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> userIndex = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> saveIfAbsent(UserSession session) {
        return Uni.createFrom().item(() -> {
            final var saved = new boolean[1];
            userIndex.compute(session.userId(), (userId, tokens) -> {
                final var index = tokens != null ? tokens : ConcurrentHashMap.<String>newKeySet();
                if (sessions.putIfAbsent(session.sessionToken(), session) == null) {
                    index.add(session.sessionToken());
                    saved[0] = true;
                }
                return index;
            });
            if (!saved[0]) {
                LOG.debugf("Session token collision detected: %s", session.maskedToken());
            }
            return saved[0];
        });
    }

    @Override
    public Uni<Optional<UserSession>> findByToken(String sessionToken) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(sessionToken)));
    }

    @Override
    public Uni<Optional<UserSession>> update(String sessionToken, UnaryOperator<UserSession> update) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(
                        sessions.computeIfPresent(sessionToken, (key, session) -> update.apply(session))));
    }

    @Override
    public Uni<List<UserSession>> findByUser(String userId) {
        return Uni.createFrom().item(() -> sessionsOf(userId));
    }

    @Override
    public Uni<List<UserSession>> findActive() {
        return Uni.createFrom().item(() -> sessions.values().stream()
                .filter(UserSession::isActive)
                .sorted(OLDEST_FIRST)
                .toList());
    }

    @Override
    public Uni<List<UserSession>> enforceLimit(String userId, int maxActive, String keepToken, Instant now) {
        return Uni.createFrom().item(() -> {
            final var terminated = new ArrayList<UserSession>();
            userIndex.computeIfPresent(userId, (key, tokens) -> {
                final var active = sessionsOf(userId).stream().filter(UserSession::isActive).toList();
                var excess = active.size() - maxActive;
                for (var session : active) {
                    if (excess <= 0) {
                        break;
                    }
                    if (session.sessionToken().equals(keepToken)) {
                        continue;
                    }
                    terminate(session.sessionToken(), TerminationReason.SESSION_LIMIT, now).ifPresent(terminated::add);
                    excess--;
                }
                return tokens;
            });
            return terminated;
        });
    }

    @Override
    public Uni<List<UserSession>> terminateAll(
            String userId, String exceptToken, TerminationReason reason, Instant now) {
        return Uni.createFrom().item(() -> {
            final var terminated = new ArrayList<UserSession>();
            userIndex.computeIfPresent(userId, (key, tokens) -> {
                for (var token : tokens) {
                    if (!token.equals(exceptToken)) {
                        terminate(token, reason, now).ifPresent(terminated::add);
                    }
                }
                return tokens;
            });
            return terminated;
        });
    }

    @Override
    public Uni<Integer> purgeTerminatedBefore(Instant cutoff) {
        return Uni.createFrom().item(() -> {
            var removed = 0;
            for (var session : sessions.values()) {
                if (session.isActive() || session.terminatedAt() == null || !session.terminatedAt().isBefore(cutoff)) {
                    continue;
                }
                if (sessions.remove(session.sessionToken(), session)) {
                    userIndex.computeIfPresent(session.userId(), (userId, tokens) -> {
                        tokens.remove(session.sessionToken());
                        return tokens.isEmpty() ? null : tokens;
                    });
                    removed++;
                }
            }
            if (removed > 0) {
                LOG.debugf("Purged %d terminated sessions", removed);
            }
            return removed;
        });
    }

    /**
     * Return the number of stored sessions (for testing).
     */
    public int getSessionCount() {
        return sessions.size();
    }

    // Returns the session only if this call ended it.
    private Optional<UserSession> terminate(String token, TerminationReason reason, Instant now) {
        final var result = new UserSession[1];
        sessions.computeIfPresent(token, (key, session) -> {
            if (!session.isActive()) {
                return session;
            }
            result[0] = session.terminated(now, reason);
            return result[0];
        });
        return Optional.ofNullable(result[0]);
    }

    private List<UserSession> sessionsOf(String userId) {
        final var tokens = userIndex.get(userId);
        if (tokens == null) {
            return List.of();
        }
        return tokens.stream()
                .map(sessions::get)
                .filter(Objects::nonNull)
                .sorted(OLDEST_FIRST)
                .toList();
    }
}
