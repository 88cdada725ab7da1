package warden.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.ratelimit.EffectiveRateLimit;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.model.ratelimit.RateWindow;
import warden.core.port.out.RateLimiter;

/**
 * In-memory fixed-window rate limiter.
 *
 * <p>
 * Windows live in a concurrent hash map; every decision is a single
 * {@link ConcurrentMap#compute} call, so increments of one key are serialized
 * while different keys proceed in parallel. Expired windows are replaced on next
 * access and removed by a periodic sweep.
 *
 * <p>
 * State is not shared across instances. Use the Redis limiter for
 * multi-instance deployments.
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(InMemoryRateLimiter.class);

    private final ConcurrentMap<String, RateWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final boolean enabled;
    private final ScheduledExecutorService sweepExecutor;

    /**
     * Creates a limiter without a background sweep.
     *
     * @param clock   time source
     * @param enabled whether limiting is enabled
     */
    public InMemoryRateLimiter(Clock clock, boolean enabled) {
        this(clock, enabled, null);
    }

    /**
     * Creates a limiter that sweeps expired windows periodically.
     *
     * @param clock         time source
     * @param enabled       whether limiting is enabled
     * @param sweepInterval interval between sweeps, or null for no sweep
     */
    public InMemoryRateLimiter(Clock clock, boolean enabled, Duration sweepInterval) {
        this.clock = clock;
        this.enabled = enabled;
        if (sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative()) {
            this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                var t = new Thread(r, "rate-window-sweep");
                t.setDaemon(true);
                return t;
            });
            final var millis = sweepInterval.toMillis();
            sweepExecutor.scheduleAtFixedRate(this::sweepExpired, millis, millis, TimeUnit.MILLISECONDS);
        } else {
            this.sweepExecutor = null;
        }
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, EffectiveRateLimit limit) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }
        return Uni.createFrom().item(() -> consume(key, limit));
    }

    /**
     * Synchronous form of {@link #checkAndConsume}.
     *
     * @param key   window key
     * @param limit limit to apply
     * @return the decision
     */
    public RateLimitDecision consume(RateLimitKey key, EffectiveRateLimit limit) {
        final var now = clock.instant();
        final var window = windows.compute(key.toCacheKey(), (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return RateWindow.open(key, now, limit.windowSeconds());
            }
            return existing.increment();
        });
        return RateLimitDecision.fromWindow(window, limit, now);
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, EffectiveRateLimit limit) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var window = windows.get(key.toCacheKey());
            if (window == null || window.isExpired(now)) {
                return RateLimitDecision.allow(
                        limit.maxRequests(),
                        limit.maxRequests(),
                        limit.windowSeconds(),
                        now.plusSeconds(limit.windowSeconds()),
                        0);
            }
            return RateLimitDecision.fromWindow(window, limit, now);
        });
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        return Uni.createFrom().item(() -> {
            windows.remove(key.toCacheKey());
            return null;
        });
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Remove every window whose end has passed.
     *
     * @return number of windows removed
     */
    public int sweepExpired() {
        final var now = clock.instant();
        final var before = windows.size();
        // remove(key, value) only drops the window if no request replaced it meanwhile
        windows.forEach((key, window) -> {
            if (window.isExpired(now)) {
                windows.remove(key, window);
            }
        });
        final var removed = Math.max(0, before - windows.size());
        if (removed > 0) {
            LOG.debugf("Swept %d expired rate windows", removed);
        }
        return removed;
    }

    public int getWindowCount() {
        return windows.size();
    }

    public void clear() {
        windows.clear();
    }

    public void shutdown() {
        if (sweepExecutor == null) {
            return;
        }
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
