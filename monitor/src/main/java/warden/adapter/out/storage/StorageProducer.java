package warden.adapter.out.storage;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.memory.InMemoryBaselineRepository;
import warden.adapter.out.storage.memory.InMemoryDeviceTrustRepository;
import warden.adapter.out.storage.memory.InMemoryLoginFailureRepository;
import warden.adapter.out.storage.memory.InMemorySessionRepository;
import warden.adapter.out.storage.redis.RedisBaselineRepository;
import warden.adapter.out.storage.redis.RedisLoginFailureRepository;
import warden.core.config.AnomalyConfig;
import warden.core.config.LockoutConfig;
import warden.core.port.out.BaselineRepository;
import warden.core.port.out.DeviceTrustRepository;
import warden.core.port.out.SessionRepository;
import warden.spi.LoginFailureRepository;

/**
 * CDI producer for the security core's repositories.
 *
 * <p>Failure counters and baselines use Redis when their {@code redis.enabled}
 * flag is set and a Redis client is resolvable, otherwise in-memory storage.
 * Sessions and device trust are held in memory.
 */
@ApplicationScoped
public class StorageProducer {

    private static final Logger LOG = Logger.getLogger(StorageProducer.class);

    private final LockoutConfig lockoutConfig;
    private final AnomalyConfig anomalyConfig;
    private final Clock clock;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public StorageProducer(
            LockoutConfig lockoutConfig,
            AnomalyConfig anomalyConfig,
            Clock clock,
            Instance<ReactiveRedisDataSource> redisDataSource) {
        this.lockoutConfig = lockoutConfig;
        this.anomalyConfig = anomalyConfig;
        this.clock = clock;
        this.redisDataSource = redisDataSource;
    }

    @Produces
    @ApplicationScoped
    public LoginFailureRepository loginFailureRepository() {
        if (useRedis(lockoutConfig.redis().enabled(), "login failure")) {
            return new RedisLoginFailureRepository(
                    redisDataSource.get(), lockoutConfig.redis().keyPrefix(), lockoutConfig.historySize(), clock);
        }
        LOG.info("Using in-memory login failure repository");
        return new InMemoryLoginFailureRepository(clock, lockoutConfig.historySize());
    }

    void disposeLoginFailureRepository(@Disposes LoginFailureRepository repository) {
        if (repository instanceof InMemoryLoginFailureRepository) {
            ((InMemoryLoginFailureRepository) repository).shutdown();
        }
    }

    @Produces
    @ApplicationScoped
    public BaselineRepository baselineRepository() {
        if (useRedis(anomalyConfig.redis().enabled(), "baseline")) {
            return new RedisBaselineRepository(
                    redisDataSource.get(), anomalyConfig.redis().keyPrefix(), anomalyConfig.baselineTtl());
        }
        LOG.info("Using in-memory baseline repository");
        return new InMemoryBaselineRepository();
    }

    @Produces
    @ApplicationScoped
    public SessionRepository sessionRepository() {
        return new InMemorySessionRepository();
    }

    @Produces
    @ApplicationScoped
    public DeviceTrustRepository deviceTrustRepository() {
        return new InMemoryDeviceTrustRepository();
    }

    private boolean useRedis(boolean enabled, String store) {
        if (!enabled) {
            return false;
        }
        if (!redisDataSource.isResolvable()) {
            LOG.warnf("Redis %s storage enabled but ReactiveRedisDataSource not available", store);
            return false;
        }
        LOG.infof("Using Redis %s repository", store);
        return true;
    }
}
