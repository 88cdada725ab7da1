package warden.core.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.telemetry.SecurityEventDispatcher;
import warden.core.config.InvalidConfigurationException;
import warden.core.config.SessionTrustConfig;
import warden.core.model.behavior.DeviceDescriptor;
import warden.core.model.session.SessionStatistics;
import warden.core.model.session.TerminationReason;
import warden.core.model.session.UserSession;
import warden.core.port.out.DeviceTrustRepository;
import warden.core.port.out.SessionRepository;
import warden.spi.SecurityEvent;

/**
 * Session lifecycle and trust management.
 *
 * <p>Handles session creation with token collision retry, the per-user
 * concurrent session limit, sliding expiration, suspicion marking, device trust
 * and termination. A session moves from ACTIVE to TERMINATED exactly once;
 * repeated terminations are no-ops.
 */
@ApplicationScoped
public class SessionTrustService {

    private static final Logger LOG = Logger.getLogger(SessionTrustService.class);

    static final String REASON_RAPID_CREATION = "Rapid session creation";
    static final String REASON_UNUSUAL_USER_AGENT = "Unusual or missing user agent";

    private final SessionRepository repository;
    private final DeviceTrustRepository deviceTrust;
    private final SessionTokenGenerator tokenGenerator;
    private final SessionTrustConfig config;
    private final SecurityEventDispatcher dispatcher;
    private final Clock clock;

    @Inject
    public SessionTrustService(
            SessionRepository repository,
            DeviceTrustRepository deviceTrust,
            SessionTokenGenerator tokenGenerator,
            SessionTrustConfig config,
            SecurityEventDispatcher dispatcher,
            Clock clock) {
        this.repository = repository;
        this.deviceTrust = deviceTrust;
        this.tokenGenerator = tokenGenerator;
        this.config = config;
        this.dispatcher = dispatcher;
        this.clock = clock;
        if (config.maxConcurrent() < 1) {
            throw new InvalidConfigurationException("warden.sessions.max-concurrent must be positive");
        }
        if (config.ttl().isNegative() || config.ttl().isZero()) {
            throw new InvalidConfigurationException("warden.sessions.ttl must be positive");
        }
    }

    /**
     * Create a session for a freshly authenticated user.
     *
     * <p>If the user already has the maximum number of active sessions, the
     * oldest are terminated. The new session is marked suspicious when the user
     * created several sessions in quick succession or the user agent is missing
     * or implausibly short, and starts trusted when its device is trusted.
     *
     * @param userId    the user
     * @param ipAddress client address
     * @param userAgent client user agent, may be null
     * @param location  resolved location, may be null
     * @return the new session
     */
    public Uni<UserSession> createSession(String userId, String ipAddress, String userAgent, String location) {
        final var now = clock.instant();
        final var device = DeviceDescriptor.parse(userAgent).id();

        return Uni.combine()
                .all()
                .unis(repository.findByUser(userId), deviceTrust.isTrusted(userId, device))
                .asTuple()
                .flatMap(tuple -> {
                    final var reasons = suspicionReasons(tuple.getItem1(), userAgent, now);
                    final var expiresAt = now.plus(config.ttl());
                    return createWithRetry(
                            userId, ipAddress, device, location, tuple.getItem2(), reasons, now, expiresAt, 0);
                })
                .call(session -> repository
                        .enforceLimit(userId, config.maxConcurrent(), session.sessionToken(), now)
                        .invoke(evicted -> evicted.forEach(this::reportTermination)))
                .invoke(session -> {
                    LOG.infof(
                            "Session created for user %s from %s. Suspicious: %s",
                            userId, ipAddress, session.isSuspicious());
                    session.suspicionReasons().forEach(reason -> reportSuspicion(session, reason));
                });
    }

    /**
     * Record activity on a session.
     *
     * <p>Extends the expiry by the session TTL unless the session has a fixed
     * duration. An expired session is terminated instead.
     *
     * @param sessionToken the session
     * @return the active session, or empty if it is unknown, terminated or just expired
     */
    public Uni<Optional<UserSession>> touch(String sessionToken) {
        final var now = clock.instant();
        final var expired = new boolean[1];
        return repository
                .update(sessionToken, session -> {
                    if (!session.isActive()) {
                        return session;
                    }
                    if (session.isExpired(now)) {
                        expired[0] = true;
                        return session.terminated(now, TerminationReason.EXPIRED);
                    }
                    final var expiresAt = session.fixedDuration() ? session.expiresAt() : now.plus(config.ttl());
                    return session.withActivity(now, expiresAt);
                })
                .map(updated -> {
                    if (expired[0]) {
                        updated.ifPresent(this::reportTermination);
                    }
                    return updated.filter(UserSession::isActive);
                });
    }

    /**
     * Flag an active session as suspicious.
     *
     * @param sessionToken the session
     * @param reason       why
     * @return true if the session is active and now flagged
     */
    public Uni<Boolean> markSuspicious(String sessionToken, String reason) {
        final var newlyFlagged = new boolean[1];
        return repository
                .update(sessionToken, session -> {
                    if (!session.isActive() || session.suspicionReasons().contains(reason)) {
                        return session;
                    }
                    newlyFlagged[0] = true;
                    return session.withSuspicion(reason);
                })
                .map(updated -> {
                    if (newlyFlagged[0]) {
                        LOG.warnf("Session %s marked as suspicious. Reason: %s", updated.get().maskedToken(), reason);
                        reportSuspicion(updated.get(), reason);
                    }
                    return updated.map(UserSession::isActive).orElse(false);
                });
    }

    /**
     * Terminate a session. Terminating an unknown or already terminated session is a no-op.
     *
     * @param sessionToken the session
     * @param reason       why
     * @return true if this call terminated the session
     */
    public Uni<Boolean> terminate(String sessionToken, TerminationReason reason) {
        final var now = clock.instant();
        final var changed = new boolean[1];
        return repository
                .update(sessionToken, session -> {
                    if (!session.isActive()) {
                        return session;
                    }
                    changed[0] = true;
                    return session.terminated(now, reason);
                })
                .map(updated -> {
                    if (changed[0]) {
                        reportTermination(updated.get());
                    } else {
                        LOG.debugf("Session %s already terminated or unknown", UserSession.mask(sessionToken));
                    }
                    return changed[0];
                });
    }

    /**
     * Terminate every active session of a user, optionally keeping one.
     *
     * @param userId      the user
     * @param exceptToken session to keep active, may be null
     * @return number of sessions terminated
     */
    public Uni<Integer> terminateAll(String userId, String exceptToken) {
        return repository
                .terminateAll(userId, exceptToken, TerminationReason.TERMINATE_ALL, clock.instant())
                .map(terminated -> {
                    terminated.forEach(this::reportTermination);
                    LOG.infof("All sessions terminated for user %s. Count: %d", userId, terminated.size());
                    return terminated.size();
                });
    }

    /**
     * Trust or distrust a device for a user and apply it to the user's active sessions on it.
     *
     * @param userId  the user
     * @param device  device identifier
     * @param trusted new trust state
     * @return number of active sessions updated
     */
    public Uni<Integer> setDeviceTrust(String userId, String device, boolean trusted) {
        return deviceTrust
                .setTrusted(userId, device, trusted)
                .flatMap(v -> repository.findByUser(userId))
                .flatMap(sessions -> {
                    final var updates = new ArrayList<Uni<Optional<UserSession>>>();
                    for (var session : sessions) {
                        if (session.isActive() && device.equals(session.device())) {
                            updates.add(repository.update(
                                    session.sessionToken(), s -> s.isActive() ? s.withTrusted(trusted) : s));
                        }
                    }
                    if (updates.isEmpty()) {
                        return Uni.createFrom().item(0);
                    }
                    return Uni.join().all(updates).andFailFast().map(List::size);
                })
                .invoke(count -> LOG.infof(
                        "Device %s %s for user %s (%d active sessions)",
                        device, trusted ? "trusted" : "distrusted", userId, count));
    }

    public Uni<Optional<UserSession>> getSession(String sessionToken) {
        return repository.findByToken(sessionToken);
    }

    /**
     * Sessions of a user, oldest first.
     *
     * @param userId     the user
     * @param activeOnly drop terminated sessions
     * @return the sessions
     */
    public Uni<List<UserSession>> listSessions(String userId, boolean activeOnly) {
        return repository
                .findByUser(userId)
                .map(sessions -> activeOnly
                        ? sessions.stream().filter(UserSession::isActive).toList()
                        : sessions);
    }

    public Uni<SessionStatistics> statistics() {
        return repository.findActive().map(active -> {
            final var users = new HashSet<String>();
            var suspicious = 0;
            var trusted = 0;
            for (var session : active) {
                users.add(session.userId());
                if (session.isSuspicious()) {
                    suspicious++;
                }
                if (session.isTrusted()) {
                    trusted++;
                }
            }
            return new SessionStatistics(active.size(), suspicious, trusted, users.size());
        });
    }

    /**
     * Terminate expired sessions and purge terminated ones past the retention period.
     */
    @Scheduled(
            every = "${warden.sessions.cleanup-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> cleanup() {
        final var now = clock.instant();
        return repository
                .findActive()
                .flatMap(active -> {
                    final var expired = active.stream()
                            .filter(session -> session.isExpired(now))
                            .map(session -> terminate(session.sessionToken(), TerminationReason.EXPIRED))
                            .toList();
                    if (expired.isEmpty()) {
                        return Uni.createFrom().item(0);
                    }
                    return Uni.join().all(expired).andCollectFailures().map(List::size);
                })
                .flatMap(expired -> repository
                        .purgeTerminatedBefore(now.minus(config.retention()))
                        .invoke(purged -> {
                            if (expired > 0 || purged > 0) {
                                LOG.infof("Session cleanup: %d expired, %d purged", expired, purged);
                            }
                        }))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warn("Session cleanup failed", error);
                    return 0;
                })
                .replaceWithVoid();
    }

    private List<String> suspicionReasons(List<UserSession> existing, String userAgent, Instant now) {
        final var reasons = new ArrayList<String>();
        final var windowStart = now.minus(config.rapidCreationWindow());
        final var recent = existing.stream()
                .filter(session -> session.createdAt().isAfter(windowStart))
                .count();
        if (recent >= config.rapidCreationThreshold()) {
            reasons.add(REASON_RAPID_CREATION);
        }
        if (userAgent == null || userAgent.isBlank() || userAgent.length() < config.minUserAgentLength()) {
            reasons.add(REASON_UNUSUAL_USER_AGENT);
        }
        return reasons;
    }

    private Uni<UserSession> createWithRetry(
            String userId,
            String ipAddress,
            String device,
            String location,
            boolean trusted,
            List<String> reasons,
            Instant createdAt,
            Instant expiresAt,
            int attempt) {
        final var maxAttempts = config.tokenGenerationAttempts();
        if (attempt >= maxAttempts) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session token after " + maxAttempts + " attempts"));
        }

        final var session = new UserSession(
                tokenGenerator.generate(),
                userId,
                ipAddress,
                device,
                location,
                trusted,
                !reasons.isEmpty(),
                reasons,
                null,
                config.fixedDuration(),
                createdAt,
                createdAt,
                expiresAt,
                null,
                null);

        return repository.saveIfAbsent(session).flatMap(saved -> {
            if (saved) {
                return Uni.createFrom().item(session);
            }
            LOG.warnf("Session token collision detected (attempt %d/%d), retrying", attempt + 1, maxAttempts);
            return createWithRetry(
                    userId, ipAddress, device, location, trusted, reasons, createdAt, expiresAt, attempt + 1);
        });
    }

    private void reportTermination(UserSession session) {
        final var reason = session.terminationReason() != null ? session.terminationReason().description() : null;
        LOG.infof("Session %s terminated. Reason: %s", session.maskedToken(), reason);
        dispatcher.dispatch(new SecurityEvent.SessionInvalidated(
                clock.instant(), session.ipAddress(), session.maskedToken(), session.userId(), reason));
    }

    private void reportSuspicion(UserSession session, String reason) {
        dispatcher.dispatch(new SecurityEvent.SessionFlagged(
                clock.instant(), session.ipAddress(), session.maskedToken(), session.userId(), reason));
    }


    /**
     * Thrown when no unused session token could be generated.
     */
    public static class SessionCreationException extends RuntimeException {

        public SessionCreationException(String message) {
            super(message);
        }
    }
}
