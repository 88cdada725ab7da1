package warden.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import warden.core.config.TelemetryConfig;
import warden.spi.SecurityEvent;
import warden.spi.SecurityEventHandler;

/**
 * Hands security events to the registered {@link SecurityEventHandler}s.
 *
 * <p>Handlers come from {@link ServiceLoader} and run in priority order, highest
 * first, on one background thread. The queue in front of that thread is bounded:
 * when handlers fall behind, new events are dropped and counted rather than
 * slowing down request processing. The drop count is exported as
 * {@code warden.security.events.dropped}.
 */
@ApplicationScoped
public class SecurityEventDispatcher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);
    private static final long DROP_LOG_INTERVAL = 1000;

    private final MeterRegistry meterRegistry;
    private final boolean enabled;
    private final int queueCapacity;
    private final SecurityEvent.Severity minimumSeverity;
    private final AtomicLong dropped = new AtomicLong();

    private List<SecurityEventHandler> handlers = List.of();
    private ThreadPoolExecutor executor;

    @Inject
    public SecurityEventDispatcher(TelemetryConfig config, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.enabled = config != null && config.security().enabled();
        this.queueCapacity = config != null ? Math.max(1, config.security().queueCapacity()) : 1;
        this.minimumSeverity = config != null ? config.security().minimumSeverity() : SecurityEvent.Severity.INFO;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.debug("Security events are disabled - event dispatcher inactive");
            return;
        }
        start(discoverHandlers());
    }

    /**
     * Start dispatching to the given handlers. Unavailable handlers are skipped.
     *
     * @param candidates handlers to dispatch to
     */
    void start(List<SecurityEventHandler> candidates) {
        handlers = candidates.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();

        if (handlers.isEmpty()) {
            LOG.warn("No security event handlers available - events will not be processed");
            return;
        }
        LOG.infof(
                "Dispatching security events (min severity %s, queue %d) to %s",
                minimumSeverity,
                queueCapacity,
                handlers.stream().map(h -> h.name() + "(priority=" + h.priority() + ")").toList());

        executor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    var thread = new Thread(r, "security-event-dispatcher");
                    thread.setDaemon(true);
                    return thread;
                },
                (task, pool) -> recordDrop());

        if (meterRegistry != null) {
            meterRegistry.gauge("warden.security.events.dropped", dropped);
        }
    }

    private List<SecurityEventHandler> discoverHandlers() {
        var loaded = ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
        for (var handler : loaded) {
            if (handler instanceof MetricsSecurityEventHandler) {
                ((MetricsSecurityEventHandler) handler).setMeterRegistry(meterRegistry);
            }
        }
        return loaded;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                    LOG.warnf("Discarding %d undelivered security event(s)", executor.shutdownNow().size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
        handlers.forEach(handler -> {
            try {
                handler.close();
            } catch (Exception e) {
                LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
            }
        });
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Queue an event for the handlers. Never blocks the caller.
     *
     * @param event the event to dispatch
     */
    public void dispatch(SecurityEvent event) {
        if (!enabled || executor == null || event.severity().compareTo(minimumSeverity) < 0) {
            return;
        }
        executor.execute(() -> deliver(event));
    }

    private void deliver(SecurityEvent event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                LOG.warnf("Handler %s failed to process %s: %s",
                        handler.name(), event.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void recordDrop() {
        final var count = dropped.incrementAndGet();
        if (count == 1 || count % DROP_LOG_INTERVAL == 0) {
            LOG.warnf("Security event queue full, %d event(s) dropped so far", count);
        }
    }

    /**
     * Number of events dropped because the queue was full.
     */
    public long droppedEvents() {
        return dropped.get();
    }

    public List<SecurityEventHandler> getHandlers() {
        return handlers;
    }
}
