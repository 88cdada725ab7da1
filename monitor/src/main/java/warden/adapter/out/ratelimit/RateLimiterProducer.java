package warden.adapter.out.ratelimit;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import warden.adapter.out.ratelimit.redis.RedisRateLimiter;
import warden.core.config.RateLimitingConfig;
import warden.core.port.out.RateLimiter;

/**
 * CDI producer for the rate limiter.
 *
 * <p>Selects the implementation based on configuration and availability:
 * <ul>
 *   <li>Redis - when {@code warden.rate-limiting.redis.enabled} is set and a Redis client is resolvable</li>
 *   <li>In-memory - fallback, always available</li>
 * </ul>
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimitingConfig config;
    private final Clock clock;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public RateLimiterProducer(
            RateLimitingConfig config, Clock clock, Instance<ReactiveRedisDataSource> redisDataSource) {
        this.config = config;
        this.clock = clock;
        this.redisDataSource = redisDataSource;
    }

    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled");
            return new InMemoryRateLimiter(clock, false);
        }

        final var redis = createRedisLimiter();
        if (redis.isPresent()) {
            LOG.info("Using Redis rate limiter");
            return redis.get();
        }

        LOG.infov(
                "Using in-memory rate limiter, defaultLimit={0}/{1}s",
                config.defaultMaxRequests(), config.defaultWindowSeconds());
        return new InMemoryRateLimiter(clock, true, config.sweepInterval());
    }

    void disposeRateLimiter(@Disposes RateLimiter rateLimiter) {
        if (rateLimiter instanceof InMemoryRateLimiter) {
            ((InMemoryRateLimiter) rateLimiter).shutdown();
        }
    }

    private Optional<RateLimiter> createRedisLimiter() {
        if (!config.redis().enabled()) {
            return Optional.empty();
        }
        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis rate limiting enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }
        try {
            return Optional.of(new RedisRateLimiter(redisDataSource.get(), config.redis().keyPrefix(), clock, true));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis rate limiter, falling back to in-memory");
            return Optional.empty();
        }
    }
}
