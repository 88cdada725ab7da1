package warden.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.list.ReactiveListCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import warden.core.model.lockout.AccountLockoutState;
import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.lockout.LoginFailureRecord;
import warden.spi.LoginFailureRepository;
import warden.spi.TransientStoreException;

/**
 * Redis implementation of {@link LoginFailureRepository}.
 *
 * <p>Key format:
 * <ul>
 *   <li>Failures: {@code {prefix}failures:{credential}} (sorted set scored by attempt time in ms)</li>
 *   <li>Lockout: {@code {prefix}lock:{credential}} (hash with until, count, last; TTL = lockout duration)</li>
 *   <li>History: {@code {prefix}history} (list of JSON records, newest first, trimmed)</li>
 * </ul>
 *
 * <p>Counting and lockout run in one Lua script per failure, so concurrent failures
 * for a credential from different instances cannot both miss the threshold.
 */
public class RedisLoginFailureRepository implements LoginFailureRepository {

    private static final Logger LOG = Logger.getLogger(RedisLoginFailureRepository.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * KEYS[1] failures zset, KEYS[2] lock hash; ARGV now ms, window ms, max attempts,
     * lockout ms, unique member.
     *
     * <p>Returns [failedAttempts, lockoutUntil ms or 0, lastAttempt ms].
     */
    private static final String RECORD_FAILURE_SCRIPT =
            """
            local now = tonumber(ARGV[1])
            local window = tonumber(ARGV[2])
            local max = tonumber(ARGV[3])
            local lock_ms = tonumber(ARGV[4])

            local lock_until = tonumber(redis.call('HGET', KEYS[2], 'until'))
            if lock_until and lock_until > now then
                local count = redis.call('HINCRBY', KEYS[2], 'count', 1)
                redis.call('HSET', KEYS[2], 'last', now)
                return {count, lock_until, now}
            end
            if lock_until then
                redis.call('DEL', KEYS[1], KEYS[2])
            end

            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', now - window)
            redis.call('ZADD', KEYS[1], now, ARGV[5])
            redis.call('PEXPIRE', KEYS[1], window)
            local count = redis.call('ZCARD', KEYS[1])

            if count >= max then
                local until_ms = now + lock_ms
                redis.call('HSET', KEYS[2], 'until', until_ms, 'count', count, 'last', now)
                redis.call('PEXPIRE', KEYS[2], lock_ms)
                redis.call('DEL', KEYS[1])
                return {count, until_ms, now}
            end
            return {count, 0, now}
            """;

    /**
     * KEYS[1] failures zset, KEYS[2] lock hash; ARGV now ms, window ms.
     */
    private static final String STATE_SCRIPT =
            """
            local now = tonumber(ARGV[1])
            local window = tonumber(ARGV[2])

            local lock_until = tonumber(redis.call('HGET', KEYS[2], 'until'))
            if lock_until and lock_until > now then
                local count = tonumber(redis.call('HGET', KEYS[2], 'count'))
                local last = tonumber(redis.call('HGET', KEYS[2], 'last'))
                return {count, lock_until, last}
            end

            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', now - window)
            local count = redis.call('ZCARD', KEYS[1])
            local last = 0
            if count > 0 then
                local newest = redis.call('ZRANGE', KEYS[1], -1, -1, 'WITHSCORES')
                last = tonumber(newest[2])
            end
            return {count, 0, last}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveListCommands<String, String> listCommands;
    private final String keyPrefix;
    private final int maxHistory;
    private final Clock clock;

    public RedisLoginFailureRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, int maxHistory, Clock clock) {
        this.redisDataSource = redisDataSource;
        this.keyCommands = redisDataSource.key(String.class);
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.listCommands = redisDataSource.list(String.class, String.class);
        this.keyPrefix = keyPrefix;
        this.maxHistory = Math.max(1, maxHistory);
        this.clock = clock;
        LOG.info("Initialized Redis login failure repository");
    }

    @Override
    public Uni<AccountLockoutState> recordFailure(LoginFailureRecord failure, LockoutPolicy policy) {
        final var credential = failure.credentialKey();
        return redisDataSource
                .execute(
                        "EVAL",
                        RECORD_FAILURE_SCRIPT,
                        "2",
                        failuresKey(credential),
                        lockKey(credential),
                        String.valueOf(failure.attemptTime().toEpochMilli()),
                        String.valueOf(policy.observationWindow().toMillis()),
                        String.valueOf(policy.maxAttempts()),
                        String.valueOf(policy.lockoutDuration().toMillis()),
                        failure.attemptTime().toEpochMilli() + ":" + UUID.randomUUID())
                .map(response -> toState(credential, response, failure.attemptTime()))
                .call(state -> appendHistory(failure))
                .onFailure()
                .transform(e -> new TransientStoreException("Failed to record login failure for " + credential, e));
    }

    @Override
    public Uni<AccountLockoutState> getState(String credentialKey, LockoutPolicy policy) {
        final var now = clock.instant();
        return redisDataSource
                .execute(
                        "EVAL",
                        STATE_SCRIPT,
                        "2",
                        failuresKey(credentialKey),
                        lockKey(credentialKey),
                        String.valueOf(now.toEpochMilli()),
                        String.valueOf(policy.observationWindow().toMillis()))
                .map(response -> toState(credentialKey, response, now))
                .onFailure()
                .transform(e -> new TransientStoreException("Failed to read lockout state for " + credentialKey, e));
    }

    @Override
    public Uni<Void> clear(String credentialKey) {
        return keyCommands
                .del(failuresKey(credentialKey), lockKey(credentialKey))
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Cleared failed logins for %s", credentialKey));
    }

    @Override
    public Multi<AccountLockoutState> streamActiveLockouts() {
        final var lockPrefix = keyPrefix + "lock:";
        final var args = new KeyScanArgs().match(lockPrefix + "*").count(1000);
        final var now = clock.instant();
        return keyCommands
                .scan(args)
                .toMulti()
                .onItem()
                .transformToUniAndMerge(redisKey -> hashCommands.hgetall(redisKey).map(fields -> {
                    if (fields == null || !fields.containsKey("until")) {
                        return null;
                    }
                    final var until = Instant.ofEpochMilli(Long.parseLong(fields.get("until")));
                    if (!now.isBefore(until)) {
                        return null;
                    }
                    final var last = fields.get("last");
                    return new AccountLockoutState(
                            redisKey.substring(lockPrefix.length()),
                            Integer.parseInt(fields.getOrDefault("count", "0")),
                            until,
                            last != null ? Instant.ofEpochMilli(Long.parseLong(last)) : null,
                            true);
                }))
                .select()
                .where(Objects::nonNull);
    }

    @Override
    public Multi<LoginFailureRecord> streamFailuresSince(Instant since) {
        return listCommands
                .lrange(historyKey(), 0, maxHistory - 1)
                .onItem()
                .transformToMulti(values -> Multi.createFrom().iterable(values))
                .map(this::deserialize)
                .select()
                .where(record -> record != null && !record.attemptTime().isBefore(since));
    }

    private Uni<Void> appendHistory(LoginFailureRecord failure) {
        final String json;
        try {
            json = OBJECT_MAPPER.writeValueAsString(failure);
        } catch (JsonProcessingException e) {
            LOG.warnf("Could not serialize failure record for %s: %s", failure.credentialKey(), e.getMessage());
            return Uni.createFrom().voidItem();
        }
        return listCommands
                .lpush(historyKey(), json)
                .call(size -> listCommands.ltrim(historyKey(), 0, maxHistory - 1))
                .replaceWithVoid();
    }

    private LoginFailureRecord deserialize(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, LoginFailureRecord.class);
        } catch (JsonProcessingException e) {
            LOG.debugf("Skipping unreadable failure record: %s", e.getMessage());
            return null;
        }
    }

    private AccountLockoutState toState(String credentialKey, Response response, Instant now) {
        final var count = response.get(0).toInteger();
        final var untilMs = response.get(1).toLong();
        final var lastMs = response.get(2).toLong();
        final var last = lastMs > 0 ? Instant.ofEpochMilli(lastMs) : null;
        if (untilMs > 0 && untilMs > now.toEpochMilli()) {
            return new AccountLockoutState(credentialKey, count, Instant.ofEpochMilli(untilMs), last, true);
        }
        if (count == 0) {
            return AccountLockoutState.clear(credentialKey);
        }
        return new AccountLockoutState(credentialKey, count, null, last, false);
    }

    private String failuresKey(String credentialKey) {
        return keyPrefix + "failures:" + credentialKey;
    }

    private String lockKey(String credentialKey) {
        return keyPrefix + "lock:" + credentialKey;
    }

    private String historyKey() {
        return keyPrefix + "history";
    }
}
