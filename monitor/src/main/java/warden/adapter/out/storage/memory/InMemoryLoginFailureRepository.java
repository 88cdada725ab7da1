package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.lockout.AccountLockoutState;
import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.lockout.LoginFailureRecord;
import warden.spi.LoginFailureRepository;

/**
 * In-memory implementation of {@link LoginFailureRepository}.
 *
 * <p>
 * Every state change of a credential is a single {@link ConcurrentMap#compute}
 * call. Failures and lockouts are lost on restart and not shared across instances.
 */
public class InMemoryLoginFailureRepository implements LoginFailureRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryLoginFailureRepository.class);

    private final ConcurrentMap<String, CredentialEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<LoginFailureRecord> history = new ConcurrentLinkedDeque<>();
    private final AtomicInteger historySize = new AtomicInteger();
    private final int maxHistory;
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    private volatile LockoutPolicy lastPolicy;

    public InMemoryLoginFailureRepository(Clock clock, int maxHistory) {
        this.clock = clock;
        this.maxHistory = Math.max(1, maxHistory);
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "login-failure-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory login failure repository");
    }

    @Override
    public Uni<AccountLockoutState> recordFailure(LoginFailureRecord failure, LockoutPolicy policy) {
        return Uni.createFrom().item(() -> {
            lastPolicy = policy;
            appendHistory(failure);

            final var now = failure.attemptTime();
            final var entry = entries.compute(failure.credentialKey(), (k, existing) -> {
                var current = existing;
                if (current != null && current.lockoutExpired(now)) {
                    current = null;
                }
                if (current != null && current.isLocked(now)) {
                    return current.withLockedAttempt(now);
                }

                final var attempts = new ArrayList<Instant>();
                if (current != null) {
                    attempts.addAll(current.windowOf(now, policy));
                }
                attempts.add(now);

                Instant lockoutUntil = null;
                if (attempts.size() >= policy.maxAttempts()) {
                    lockoutUntil = now.plus(policy.lockoutDuration());
                }
                return new CredentialEntry(List.copyOf(attempts), attempts.size(), lockoutUntil, now);
            });

            LOG.debugf(
                    "Recorded failed login for %s: count=%d, lockedUntil=%s",
                    failure.credentialKey(), entry.failedAttempts(), entry.lockoutUntil());
            return entry.toState(failure.credentialKey(), now);
        });
    }

    @Override
    public Uni<AccountLockoutState> getState(String credentialKey, LockoutPolicy policy) {
        return Uni.createFrom().item(() -> {
            lastPolicy = policy;
            final var now = clock.instant();
            final var entry = entries.computeIfPresent(credentialKey, (k, existing) -> existing.refresh(now, policy));
            if (entry == null) {
                return AccountLockoutState.clear(credentialKey);
            }
            return entry.toState(credentialKey, now);
        });
    }

    @Override
    public Uni<Void> clear(String credentialKey) {
        return Uni.createFrom().item(() -> {
            entries.remove(credentialKey);
            LOG.debugf("Cleared failed logins for %s", credentialKey);
            return null;
        });
    }

    @Override
    public Multi<AccountLockoutState> streamActiveLockouts() {
        final var now = clock.instant();
        return Multi.createFrom()
                .iterable(List.copyOf(entries.entrySet()))
                .filter(e -> e.getValue().isLocked(now))
                .map(e -> e.getValue().toState(e.getKey(), now));
    }

    @Override
    public Multi<LoginFailureRecord> streamFailuresSince(Instant since) {
        // history is newest first
        final var snapshot = new ArrayList<LoginFailureRecord>();
        for (var record : history) {
            if (record.attemptTime().isBefore(since)) {
                break;
            }
            snapshot.add(record);
        }
        return Multi.createFrom().iterable(snapshot);
    }

    private void appendHistory(LoginFailureRecord failure) {
        history.addFirst(failure);
        if (historySize.incrementAndGet() > maxHistory) {
            if (history.pollLast() != null) {
                historySize.decrementAndGet();
            }
        }
    }

    private void cleanupExpired() {
        final var policy = lastPolicy;
        if (policy == null) {
            return;
        }
        final var now = clock.instant();
        final var before = entries.size();
        entries.forEach((key, value) -> entries.computeIfPresent(key, (k, existing) -> existing.refresh(now, policy)));
        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired failed login entries", removed);
        }
    }

    @PreDestroy
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Get the number of tracked credentials (for testing).
     */
    public int getTrackedCredentialCount() {
        return entries.size();
    }

    private record CredentialEntry(List<Instant> attempts, int failedAttempts, Instant lockoutUntil, Instant lastAttempt) {

        boolean isLocked(Instant now) {
            return lockoutUntil != null && now.isBefore(lockoutUntil);
        }

        boolean lockoutExpired(Instant now) {
            return lockoutUntil != null && !now.isBefore(lockoutUntil);
        }

        List<Instant> windowOf(Instant now, LockoutPolicy policy) {
            final var cutoff = now.minus(policy.observationWindow());
            return attempts.stream().filter(a -> a.isAfter(cutoff)).toList();
        }

        CredentialEntry withLockedAttempt(Instant now) {
            return new CredentialEntry(attempts, failedAttempts + 1, lockoutUntil, now);
        }

        /**
         * Drop expired lockouts and aged-out failures; null removes the entry.
         */
        CredentialEntry refresh(Instant now, LockoutPolicy policy) {
            if (lockoutExpired(now)) {
                return null;
            }
            if (isLocked(now)) {
                return this;
            }
            final var window = windowOf(now, policy);
            if (window.isEmpty()) {
                return null;
            }
            return window.size() == attempts.size()
                    ? this
                    : new CredentialEntry(window, window.size(), null, lastAttempt);
        }

        AccountLockoutState toState(String credentialKey, Instant now) {
            final var locked = isLocked(now);
            return new AccountLockoutState(credentialKey, failedAttempts, locked ? lockoutUntil : null, lastAttempt, locked);
        }
    }
}
