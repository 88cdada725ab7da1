package warden.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.ratelimit.EffectiveRateLimit;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.testing.MutableClock;

@DisplayName("InMemoryRateLimiter")
class InMemoryRateLimiterTest {

    private static final RateLimitKey KEY = new RateLimitKey("user:alice", "auth");
    private static final EffectiveRateLimit LIMIT = new EffectiveRateLimit(5, 60);

    private MutableClock clock;
    private InMemoryRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        limiter = new InMemoryRateLimiter(clock, true);
    }

    @AfterEach
    void tearDown() {
        limiter.shutdown();
    }

    @Nested
    @DisplayName("checkAndConsume()")
    class CheckAndConsumeTests {

        @Test
        @DisplayName("should admit exactly the limit and reject the next request")
        void shouldAdmitExactlyLimit() {
            for (int i = 1; i <= 5; i++) {
                final var decision =
                        limiter.checkAndConsume(KEY, LIMIT).await().atMost(Duration.ofSeconds(1));
                assertTrue(decision.allowed(), "request " + i + " should be admitted");
                assertEquals(5 - i, decision.remaining());
            }

            final var sixth = limiter.checkAndConsume(KEY, LIMIT).await().atMost(Duration.ofSeconds(1));

            assertFalse(sixth.allowed());
            assertEquals(0, sixth.remaining());
            assertEquals(60, sixth.retryAfterSeconds());
            assertEquals(6, sixth.requestCount());
        }

        @Test
        @DisplayName("should open a fresh window once the previous one ends")
        void shouldResetAfterWindow() {
            for (int i = 0; i < 6; i++) {
                limiter.consume(KEY, LIMIT);
            }
            assertFalse(limiter.consume(KEY, LIMIT).allowed());

            clock.advance(Duration.ofSeconds(60));
            final var decision = limiter.consume(KEY, LIMIT);

            assertTrue(decision.allowed());
            assertEquals(1, decision.requestCount());
            assertEquals(clock.instant().plusSeconds(60), decision.resetAt());
        }

        @Test
        @DisplayName("should report retry-after relative to the window end")
        void shouldReportRetryAfter() {
            limiter.consume(KEY, new EffectiveRateLimit(1, 60));
            clock.advance(Duration.ofSeconds(45));

            final var decision = limiter.consume(KEY, new EffectiveRateLimit(1, 60));

            assertFalse(decision.allowed());
            assertEquals(15, decision.retryAfterSeconds());
        }

        @Test
        @DisplayName("should keep separate windows per identity and endpoint")
        void shouldKeepSeparateWindows() {
            final var one = new EffectiveRateLimit(1, 60);
            limiter.consume(KEY, one);

            assertTrue(limiter.consume(new RateLimitKey("user:bob", "auth"), one).allowed());
            assertTrue(limiter.consume(new RateLimitKey("user:alice", "tasks"), one).allowed());
            assertFalse(limiter.consume(KEY, one).allowed());
        }

        @Test
        @DisplayName("should admit exactly min(N, limit) of concurrent requests")
        void shouldAdmitLimitUnderConcurrency() throws Exception {
            final var limit = new EffectiveRateLimit(50, 60);
            final var executor = Executors.newFixedThreadPool(8);
            try {
                final var tasks = new ArrayList<Callable<RateLimitDecision>>();
                for (int i = 0; i < 200; i++) {
                    tasks.add(() -> limiter.consume(KEY, limit));
                }
                var admitted = 0;
                for (var future : executor.invokeAll(tasks)) {
                    if (future.get().allowed()) {
                        admitted++;
                    }
                }
                assertEquals(50, admitted);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should always admit when disabled")
        void shouldAdmitWhenDisabled() {
            final var disabled = new InMemoryRateLimiter(clock, false);
            for (int i = 0; i < 10; i++) {
                final var decision = disabled.checkAndConsume(KEY, new EffectiveRateLimit(1, 60))
                        .await()
                        .atMost(Duration.ofSeconds(1));
                assertTrue(decision.allowed());
                assertFalse(decision.isTracked());
            }
        }
    }

    @Nested
    @DisplayName("getStatus()")
    class GetStatusTests {

        @Test
        @DisplayName("should report a full budget without counting a request")
        void shouldNotConsume() {
            final var status = limiter.getStatus(KEY, LIMIT).await().atMost(Duration.ofSeconds(1));

            assertTrue(status.allowed());
            assertEquals(5, status.remaining());
            assertEquals(0, limiter.getWindowCount());
        }

        @Test
        @DisplayName("should report the remaining budget of an open window")
        void shouldReportOpenWindow() {
            limiter.consume(KEY, LIMIT);
            limiter.consume(KEY, LIMIT);

            final var status = limiter.getStatus(KEY, LIMIT).await().atMost(Duration.ofSeconds(1));

            assertEquals(3, status.remaining());
            assertEquals(2, status.requestCount());
        }
    }

    @Nested
    @DisplayName("sweepExpired()")
    class SweepTests {

        @Test
        @DisplayName("should remove only expired windows")
        void shouldRemoveExpiredWindows() {
            limiter.consume(KEY, new EffectiveRateLimit(5, 10));
            limiter.consume(new RateLimitKey("ip:10.0.0.1", "default"), new EffectiveRateLimit(5, 120));

            clock.advance(Duration.ofSeconds(30));

            assertEquals(1, limiter.sweepExpired());
            assertEquals(1, limiter.getWindowCount());
        }

        @Test
        @DisplayName("reset should drop the window")
        void resetShouldDropWindow() {
            limiter.consume(KEY, new EffectiveRateLimit(1, 60));

            limiter.reset(KEY).await().atMost(Duration.ofSeconds(1));

            assertTrue(limiter.consume(KEY, new EffectiveRateLimit(1, 60)).allowed());
        }
    }
}
