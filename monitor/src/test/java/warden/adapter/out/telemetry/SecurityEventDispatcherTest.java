package warden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.config.TelemetryConfig;
import warden.spi.SecurityEvent;
import warden.spi.SecurityEventHandler;

@DisplayName("SecurityEventDispatcher")
class SecurityEventDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private SecurityEventDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
    }

    private static TelemetryConfig config(boolean enabled, int capacity, SecurityEvent.Severity minimum) {
        final var config = mock(TelemetryConfig.class);
        final var security = mock(TelemetryConfig.SecurityConfig.class);
        when(config.security()).thenReturn(security);
        when(security.enabled()).thenReturn(enabled);
        when(security.queueCapacity()).thenReturn(capacity);
        when(security.minimumSeverity()).thenReturn(minimum);
        return config;
    }

    private static SecurityEvent rateLimitEvent() {
        return new SecurityEvent.RateLimitExceeded(NOW, "user:alice", "auth", 6, 5, 60);
    }

    private static SecurityEvent floodEvent() {
        return new SecurityEvent.RateLimitExceeded(NOW, "ip:203.0.113.9", "auth", 15, 5, 60);
    }

    private static SecurityEvent sessionEndedEvent() {
        return new SecurityEvent.SessionInvalidated(NOW, "198.51.100.1", "abcdefgh...", "alice", "LOGOUT");
    }

    /** Records the events it sees and counts down once per event. */
    private static final class RecordingHandler implements SecurityEventHandler {

        private final String name;
        private final int priority;
        private final List<String> log;
        private final CountDownLatch latch;

        RecordingHandler(String name, int priority, List<String> log, CountDownLatch latch) {
            this.name = name;
            this.priority = priority;
            this.log = log;
            this.latch = latch;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public void handle(SecurityEvent event) {
            log.add(name + ":" + event.getClass().getSimpleName());
            latch.countDown();
        }
    }

    @Nested
    @DisplayName("Delivery")
    class Delivery {

        @Test
        @DisplayName("should deliver to handlers in priority order")
        void shouldDeliverInPriorityOrder() throws InterruptedException {
            final var log = new CopyOnWriteArrayList<String>();
            final var latch = new CountDownLatch(2);
            dispatcher = new SecurityEventDispatcher(config(true, 10, SecurityEvent.Severity.INFO), null);
            dispatcher.start(List.of(
                    new RecordingHandler("low", 1, log, latch), new RecordingHandler("high", 50, log, latch)));

            dispatcher.dispatch(rateLimitEvent());

            assertTrue(latch.await(1, TimeUnit.SECONDS));
            assertEquals(List.of("high:RateLimitExceeded", "low:RateLimitExceeded"), log);
        }

        @Test
        @DisplayName("should keep delivering when a handler throws")
        void shouldIsolateHandlerFailures() throws InterruptedException {
            final var log = new CopyOnWriteArrayList<String>();
            final var latch = new CountDownLatch(1);
            final var failing = new SecurityEventHandler() {
                @Override
                public String name() {
                    return "failing";
                }

                @Override
                public int priority() {
                    return 100;
                }

                @Override
                public void handle(SecurityEvent event) {
                    throw new IllegalStateException("boom");
                }
            };
            dispatcher = new SecurityEventDispatcher(config(true, 10, SecurityEvent.Severity.INFO), null);
            dispatcher.start(List.of(failing, new RecordingHandler("logging", 1, log, latch)));

            dispatcher.dispatch(rateLimitEvent());

            assertTrue(latch.await(1, TimeUnit.SECONDS));
            assertEquals(List.of("logging:RateLimitExceeded"), log);
        }

        @Test
        @DisplayName("should skip events below the minimum severity")
        void shouldFilterBySeverity() throws InterruptedException {
            final var log = new CopyOnWriteArrayList<String>();
            final var latch = new CountDownLatch(1);
            dispatcher = new SecurityEventDispatcher(config(true, 10, SecurityEvent.Severity.WARNING), null);
            dispatcher.start(List.of(new RecordingHandler("logging", 1, log, latch)));

            dispatcher.dispatch(sessionEndedEvent());
            dispatcher.dispatch(rateLimitEvent());
            dispatcher.dispatch(floodEvent());

            assertTrue(latch.await(1, TimeUnit.SECONDS));
            assertEquals(SecurityEvent.Severity.INFO, rateLimitEvent().severity());
            assertEquals(SecurityEvent.Severity.WARNING, floodEvent().severity());
            assertEquals(List.of("logging:RateLimitExceeded"), log);
        }

        @Test
        @DisplayName("should ignore handlers that are not available")
        void shouldIgnoreUnavailableHandlers() {
            dispatcher = new SecurityEventDispatcher(config(true, 10, SecurityEvent.Severity.INFO), null);
            dispatcher.start(List.of(new MetricsSecurityEventHandler()));

            assertTrue(dispatcher.getHandlers().isEmpty());
        }
    }

    @Nested
    @DisplayName("Back-pressure")
    class BackPressure {

        @Test
        @DisplayName("should drop and count events when the queue is full")
        void shouldDropWhenQueueFull() throws InterruptedException {
            final var started = new CountDownLatch(1);
            final var release = new CountDownLatch(1);
            final var blocking = new SecurityEventHandler() {
                @Override
                public String name() {
                    return "blocking";
                }

                @Override
                public void handle(SecurityEvent event) {
                    started.countDown();
                    try {
                        release.await(2, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            };
            final var registry = new SimpleMeterRegistry();
            dispatcher = new SecurityEventDispatcher(config(true, 1, SecurityEvent.Severity.INFO), registry);
            dispatcher.start(List.of(blocking));

            dispatcher.dispatch(rateLimitEvent());
            assertTrue(started.await(1, TimeUnit.SECONDS));
            dispatcher.dispatch(rateLimitEvent());
            dispatcher.dispatch(rateLimitEvent());
            dispatcher.dispatch(rateLimitEvent());
            release.countDown();

            assertEquals(2, dispatcher.droppedEvents());
            assertEquals(2.0, registry.get("warden.security.events.dropped").gauge().value());
        }
    }

    @Test
    @DisplayName("should do nothing when disabled")
    void shouldDoNothingWhenDisabled() {
        dispatcher = new SecurityEventDispatcher(config(false, 10, SecurityEvent.Severity.INFO), null);
        dispatcher.init();

        dispatcher.dispatch(rateLimitEvent());

        assertFalse(dispatcher.isEnabled());
        assertTrue(dispatcher.getHandlers().isEmpty());
        assertEquals(0, dispatcher.droppedEvents());
    }
}
