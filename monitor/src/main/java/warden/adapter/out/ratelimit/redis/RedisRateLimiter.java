package warden.adapter.out.ratelimit.redis;

import java.time.Clock;
import java.time.Instant;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import warden.core.model.ratelimit.EffectiveRateLimit;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.port.out.RateLimiter;

/**
 * Redis-backed fixed-window rate limiter for multi-instance deployments.
 *
 * <p>A Lua script increments the window counter and sets its expiry in one atomic
 * step, so every instance sees the same count. The key's TTL doubles as the
 * window end; Redis removes expired windows itself.
 *
 * <p>Redis failures admit the request.
 *
 * <p>Key format: {@code {prefix}{identityKey}|{endpointKey}}
 */
public final class RedisRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(RedisRateLimiter.class);

    /**
     * KEYS[1] window key; ARGV[1] window length in milliseconds.
     *
     * <p>Returns [counter, remaining TTL in milliseconds].
     */
    private static final String FIXED_WINDOW_SCRIPT =
            """
            local counter = redis.call('INCR', KEYS[1])
            if counter == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
                ttl = tonumber(ARGV[1])
            end
            return {counter, ttl}
            """;

    private static final String STATUS_SCRIPT =
            """
            local counter = redis.call('GET', KEYS[1])
            if not counter then
                return {0, -2}
            end
            return {tonumber(counter), redis.call('PTTL', KEYS[1])}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final Clock clock;
    private final boolean enabled;

    public RedisRateLimiter(ReactiveRedisDataSource redisDataSource, String keyPrefix, Clock clock, boolean enabled) {
        this.redisDataSource = redisDataSource;
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        this.clock = clock;
        this.enabled = enabled;
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, EffectiveRateLimit limit) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }

        final var windowMillis = limit.windowSeconds() * 1000L;
        return redisDataSource
                .execute("EVAL", FIXED_WINDOW_SCRIPT, "1", redisKey(key), String.valueOf(windowMillis))
                .map(response -> toDecision(response, limit))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Redis rate limit check failed, allowing request");
                    return RateLimitDecision.allow();
                });
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, EffectiveRateLimit limit) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }

        return redisDataSource
                .execute("EVAL", STATUS_SCRIPT, "1", redisKey(key))
                .map(response -> {
                    final var counter = response.get(0).toInteger();
                    if (counter == 0) {
                        final var now = clock.instant();
                        return RateLimitDecision.allow(
                                limit.maxRequests(),
                                limit.maxRequests(),
                                limit.windowSeconds(),
                                now.plusSeconds(limit.windowSeconds()),
                                0);
                    }
                    return toDecision(response, limit);
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Redis rate limit status check failed");
                    return RateLimitDecision.allow();
                });
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        return keyCommands.del(redisKey(key)).replaceWithVoid();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    private String redisKey(RateLimitKey key) {
        return keyPrefix + key.toCacheKey();
    }

    private RateLimitDecision toDecision(Response response, EffectiveRateLimit limit) {
        if (response == null || response.size() < 2) {
            throw new IllegalStateException("Unexpected response from rate limit script");
        }
        final var counter = response.get(0).toLong();
        final var ttlMillis = Math.max(0, response.get(1).toLong());
        final var now = clock.instant();
        final Instant resetAt = now.plusMillis(ttlMillis);
        return RateLimitDecision.fromCounter((int) Math.min(Integer.MAX_VALUE, counter), resetAt, limit, now);
    }
}
