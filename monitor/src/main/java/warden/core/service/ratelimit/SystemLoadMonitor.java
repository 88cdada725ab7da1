package warden.core.service.ratelimit;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import warden.core.config.InvalidConfigurationException;
import warden.core.config.RateLimitingConfig;

/**
 * Tracks whether the host is under high CPU or heap load, based on the JVM and
 * system gauges Micrometer already publishes.
 *
 * <p>Gauges are sampled at most once per {@code check-interval}; between samples the
 * last verdict is reused. Missing gauges count as no load, so without a registry the
 * system is never considered loaded.
 */
@ApplicationScoped
public class SystemLoadMonitor {

    private static final Logger LOG = Logger.getLogger(SystemLoadMonitor.class);

    private final RateLimitingConfig.HighLoadConfig config;
    private final MeterRegistry registry;
    private final Clock clock;
    private final Object sampleLock = new Object();

    private volatile boolean highLoad;
    private volatile Instant nextSample = Instant.MIN;

    @Inject
    public SystemLoadMonitor(RateLimitingConfig config, MeterRegistry registry, Clock clock) {
        this.config = config.highLoad();
        this.registry = registry;
        this.clock = clock;
        if (this.config.enabled()) {
            validate(this.config);
        }
    }

    private static void validate(RateLimitingConfig.HighLoadConfig config) {
        if (config.reductionPercent() < 0 || config.reductionPercent() >= 100) {
            throw new InvalidConfigurationException(
                    "high-load.reduction-percent must be in [0, 100): " + config.reductionPercent());
        }
        if (config.minimumLimit() < 1) {
            throw new InvalidConfigurationException("high-load.minimum-limit must be positive: " + config.minimumLimit());
        }
        if (config.cpuThreshold() <= 0 || config.memoryThreshold() <= 0) {
            throw new InvalidConfigurationException("high-load thresholds must be positive");
        }
    }

    /**
     * Whether limits should currently be reduced.
     */
    public boolean isHighLoad() {
        if (!config.enabled() || registry == null) {
            return false;
        }
        final var now = clock.instant();
        if (now.isBefore(nextSample)) {
            return highLoad;
        }
        synchronized (sampleLock) {
            if (!now.isBefore(nextSample)) {
                nextSample = now.plus(config.checkInterval());
                sample();
            }
        }
        return highLoad;
    }

    public int reductionPercent() {
        return config.reductionPercent();
    }

    public int minimumLimit() {
        return config.minimumLimit();
    }

    private void sample() {
        final var cpu = cpuUsage();
        final var memory = heapUsage();
        final var wasHighLoad = highLoad;
        highLoad = cpu > config.cpuThreshold() || memory > config.memoryThreshold();

        if (highLoad && !wasHighLoad) {
            LOG.warnf(
                    "System under high load (cpu %.2f, heap %.2f), rate limits reduced by %d%%",
                    cpu, memory, config.reductionPercent());
        } else if (!highLoad && wasHighLoad) {
            LOG.infof("System load back to normal (cpu %.2f, heap %.2f), rate limits restored", cpu, memory);
        }
    }

    double cpuUsage() {
        final var system = valueOf(registry.find("system.cpu.usage").gauge());
        return system >= 0 ? system : Math.max(0.0, valueOf(registry.find("process.cpu.usage").gauge()));
    }

    double heapUsage() {
        var used = 0.0;
        var max = 0.0;
        for (var pool : registry.find("jvm.memory.max").tag("area", "heap").gauges()) {
            final var id = pool.getId().getTag("id");
            final var poolMax = pool.value();
            if (id == null || Double.isNaN(poolMax) || poolMax <= 0) {
                continue;
            }
            final var poolUsed = valueOf(registry.find("jvm.memory.used").tags("area", "heap", "id", id).gauge());
            if (poolUsed >= 0) {
                used += poolUsed;
                max += poolMax;
            }
        }
        return max > 0 ? used / max : 0.0;
    }

    // -1 when the gauge is missing or has no reading yet.
    private static double valueOf(Gauge gauge) {
        if (gauge == null) {
            return -1;
        }
        final var value = gauge.value();
        return Double.isNaN(value) ? -1 : value;
    }
}
