package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.behavior.UserBaseline;
import warden.core.port.out.BaselineRepository;
import warden.spi.TransientStoreException;

/**
 * Redis baseline storage shared by all instances.
 *
 * <p>Each baseline is a hash {@code {prefix}{userId}} with fields {@code version}
 * (the sample count) and {@code json}. A Lua script writes only when the incoming
 * version is not older than the stored one. Keys expire after the baseline TTL
 * without updates.
 */
public class RedisBaselineRepository implements BaselineRepository {

    private static final Logger LOG = Logger.getLogger(RedisBaselineRepository.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * KEYS[1] baseline hash; ARGV version, json, ttl seconds. Returns 1 if written.
     */
    private static final String SAVE_IF_NEWER_SCRIPT =
            """
            local stored = tonumber(redis.call('HGET', KEYS[1], 'version'))
            local incoming = tonumber(ARGV[1])
            if stored and stored > incoming then
                return 0
            end
            redis.call('HSET', KEYS[1], 'version', ARGV[1], 'json', ARGV[2])
            redis.call('EXPIRE', KEYS[1], ARGV[3])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisBaselineRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix, Duration ttl) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
        LOG.info("Initialized Redis baseline repository");
    }

    @Override
    public Uni<Optional<UserBaseline>> find(String userId) {
        return hashCommands
                .hget(keyPrefix + userId, "json")
                .map(json -> json == null ? Optional.<UserBaseline>empty() : Optional.of(deserialize(json)))
                .onFailure()
                .transform(e -> new TransientStoreException("Failed to load baseline for " + userId, e));
    }

    @Override
    public Uni<Boolean> save(UserBaseline baseline) {
        final String json;
        try {
            json = OBJECT_MAPPER.writeValueAsString(baseline);
        } catch (JsonProcessingException e) {
            return Uni.createFrom().failure(new TransientStoreException("Cannot serialize baseline", e));
        }

        return redisDataSource
                .execute(
                        "EVAL",
                        SAVE_IF_NEWER_SCRIPT,
                        "1",
                        keyPrefix + baseline.userId(),
                        String.valueOf(baseline.sampleCount()),
                        json,
                        String.valueOf(ttl.toSeconds()))
                .map(response -> response != null && response.toInteger() == 1)
                .onFailure()
                .transform(e -> new TransientStoreException("Failed to save baseline for " + baseline.userId(), e));
    }

    @Override
    public Uni<Void> delete(String userId) {
        return keyCommands.del(keyPrefix + userId).replaceWithVoid();
    }

    private UserBaseline deserialize(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, UserBaseline.class);
        } catch (JsonProcessingException e) {
            throw new TransientStoreException("Stored baseline is unreadable", e);
        }
    }
}
