package warden.core.service.behavior;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.telemetry.SecurityEventDispatcher;
import warden.core.config.AnomalyConfig;
import warden.core.model.behavior.UserBaseline;
import warden.core.port.out.BaselineRepository;
import warden.spi.SecurityEvent;

/**
 * Owner of per-user behavioral baselines.
 *
 * <p>The in-process Caffeine cache is the single read-modify-write point: every
 * update of a user runs inside {@code asMap().compute}, so concurrent events of
 * one user (two tabs) never lose an update. The {@link BaselineRepository} is
 * written behind, fire-and-forget; its failures are logged and reported as
 * {@link SecurityEvent.StoreFailure} without affecting the caller.
 *
 * <p>When a user's baseline cannot be loaded, learning continues on a provisional
 * in-memory baseline. Provisional baselines are never written to the store; the next
 * successful load replaces one with the stored baseline, or promotes it if nothing
 * was stored.
 */
@ApplicationScoped
public class BaselineStore {

    private static final Logger LOG = Logger.getLogger(BaselineStore.class);

    private final BaselineRepository repository;
    private final SecurityEventDispatcher dispatcher;
    private final Clock clock;
    private final Cache<String, UserBaseline> cache;
    private final AtomicLong persistenceFailures = new AtomicLong();
    private final Set<String> provisional = ConcurrentHashMap.newKeySet();

    @Inject
    public BaselineStore(
            BaselineRepository repository, AnomalyConfig config, SecurityEventDispatcher dispatcher, Clock clock) {
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.cacheSize())
                .expireAfterAccess(config.baselineTtl())
                .build();
    }

    /**
     * Make sure the cache holds the user's stored baseline, if any.
     *
     * @param userId the user
     * @return false if the store could not be read; the user's baseline is then provisional
     */
    public Uni<Boolean> ensureLoaded(String userId) {
        if (cache.getIfPresent(userId) != null && !provisional.contains(userId)) {
            return Uni.createFrom().item(true);
        }
        return repository
                .find(userId)
                .map(stored -> {
                    if (provisional.remove(userId)) {
                        stored.ifPresent(baseline -> cache.put(userId, baseline));
                        LOG.infof("Baseline store reachable again for user %s", userId);
                    } else {
                        stored.ifPresent(baseline -> cache.asMap().putIfAbsent(userId, baseline));
                    }
                    return true;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    provisional.add(userId);
                    reportFailure(userId, "load", error);
                    return false;
                });
    }

    public boolean isProvisional(String userId) {
        return provisional.contains(userId);
    }

    public Optional<UserBaseline> get(String userId) {
        return Optional.ofNullable(cache.getIfPresent(userId));
    }

    /**
     * Atomically apply an update to a user's baseline and write the result behind.
     *
     * @param userId the user
     * @param update receives the current baseline (null if none) and returns the new one
     * @return the new baseline
     */
    public UserBaseline update(String userId, UnaryOperator<UserBaseline> update) {
        final var updated = cache.asMap().compute(userId, (key, existing) -> update.apply(existing));
        if (updated != null && !provisional.contains(userId)) {
            persistAsync(updated);
        }
        return updated;
    }

    /**
     * Forget a user's baseline locally and in the store.
     *
     * @param userId the user
     * @return completion
     */
    public Uni<Void> reset(String userId) {
        cache.invalidate(userId);
        provisional.remove(userId);
        return repository.delete(userId);
    }

    /**
     * Number of write-behind failures since startup.
     */
    public long persistenceFailures() {
        return persistenceFailures.get();
    }

    private void persistAsync(UserBaseline baseline) {
        repository
                .save(baseline)
                .subscribe()
                .with(
                        written -> {
                            if (!written) {
                                LOG.debugf("Skipped stale baseline write for %s", baseline.userId());
                            }
                        },
                        error -> reportFailure(baseline.userId(), "save", error));
    }

    private void reportFailure(String userId, String operation, Throwable error) {
        persistenceFailures.incrementAndGet();
        LOG.warnv(error, "Baseline store unavailable during {0} for user {1}", operation, userId);
        dispatcher.dispatch(new SecurityEvent.StoreFailure(
                clock.instant(), userId, "baselines", operation, String.valueOf(error.getMessage())));
    }
}
