package warden.core.service.lockout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.adapter.out.storage.memory.InMemoryLoginFailureRepository;
import warden.adapter.out.telemetry.SecurityEventDispatcher;
import warden.core.config.LockoutConfig;
import warden.core.model.lockout.AccountLockoutState;
import warden.spi.LoginFailureRepository;
import warden.spi.SecurityEvent;
import warden.testing.MutableClock;
import warden.testing.TestConfigs;

@DisplayName("LockoutService")
@ExtendWith(MockitoExtension.class)
class LockoutServiceTest {

    private static final String BROWSER = "Mozilla/5.0 (X11; Linux x86_64)";

    @Mock
    private SecurityEventDispatcher dispatcher;

    private MutableClock clock;
    private LockoutConfig config;
    private InMemoryLoginFailureRepository repository;
    private LockoutService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        config = TestConfigs.lockout();
        repository = new InMemoryLoginFailureRepository(clock, 1_000);
        service = new LockoutService(repository, config, dispatcher, clock);
    }

    @AfterEach
    void tearDown() {
        repository.shutdown();
    }

    private AccountLockoutState fail(String credential, String ip) {
        return service.recordFailure(credential, ip, "invalid_password", BROWSER, null)
                .await()
                .atMost(Duration.ofSeconds(1));
    }

    private AccountLockoutState state(String credential) {
        return service.checkLocked(credential).await().atMost(Duration.ofSeconds(1));
    }

    @Nested
    @DisplayName("recordFailure()")
    class RecordFailureTests {

        @Test
        @DisplayName("should lock the credential on the fifth failure")
        void shouldLockOnMaxAttempts() {
            for (int i = 0; i < 4; i++) {
                final var state = fail("alice", "198.51.100.1");
                assertFalse(state.isLocked());
                clock.advance(Duration.ofMinutes(1));
            }

            final var fifth = fail("alice", "198.51.100.1");

            assertTrue(fifth.isLocked());
            assertEquals(5, fifth.failedAttempts());
            assertEquals(Instant.parse("2026-03-02T10:19:00Z"), fifth.lockoutUntil());
            assertEquals(0, fifth.remainingAttempts(5));
        }

        @Test
        @DisplayName("should neither record nor lock when lockout is disabled")
        void shouldIgnoreFailuresWhenDisabled() {
            when(config.enabled()).thenReturn(false);

            AccountLockoutState last = null;
            for (int i = 0; i < 5; i++) {
                last = fail("bob", "198.51.100.1");
            }

            assertFalse(last.isLocked());
            assertEquals(0, last.failedAttempts());
            assertFalse(state("bob").isLocked());
            assertEquals(0, repository.getTrackedCredentialCount());
            verify(dispatcher, never()).dispatch(any());
        }

        @Test
        @DisplayName("should count failures during a lockout without extending it")
        void shouldNotExtendLockout() {
            for (int i = 0; i < 5; i++) {
                fail("alice", "198.51.100.1");
            }
            final var lockedUntil = state("alice").lockoutUntil();
            clock.advance(Duration.ofMinutes(5));

            final var sixth = fail("alice", "198.51.100.1");

            assertTrue(sixth.isLocked());
            assertEquals(6, sixth.failedAttempts());
            assertEquals(lockedUntil, sixth.lockoutUntil());
        }

        @Test
        @DisplayName("should start from a clean state once the lockout expired")
        void shouldResetAfterExpiry() {
            for (int i = 0; i < 5; i++) {
                fail("alice", "198.51.100.1");
            }
            clock.advance(Duration.ofMinutes(15));

            assertFalse(state("alice").isLocked());
            final var next = fail("alice", "198.51.100.1");

            assertFalse(next.isLocked());
            assertEquals(1, next.failedAttempts());
        }

        @Test
        @DisplayName("should not count failures outside the observation window")
        void shouldIgnoreOldFailures() {
            for (int i = 0; i < 4; i++) {
                fail("alice", "198.51.100.1");
            }
            clock.advance(Duration.ofMinutes(16));

            final var state = fail("alice", "198.51.100.1");

            assertFalse(state.isLocked());
            assertEquals(1, state.failedAttempts());
        }

        @Test
        @DisplayName("should never lock other credentials sharing the address")
        void shouldLockByCredentialOnly() {
            for (int i = 0; i < 5; i++) {
                fail("alice", "198.51.100.1");
            }

            assertTrue(state("alice").isLocked());
            assertFalse(state("bob").isLocked());
            assertFalse(fail("bob", "198.51.100.1").isLocked());
        }

        @Test
        @DisplayName("should publish a single lockout event")
        void shouldPublishLockoutOnce() {
            for (int i = 0; i < 7; i++) {
                fail("alice", "198.51.100.1");
            }

            final var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(dispatcher, atLeastOnce()).dispatch(captor.capture());
            final var lockouts = captor.getAllValues().stream()
                    .filter(SecurityEvent.AuthenticationLockout.class::isInstance)
                    .map(SecurityEvent.AuthenticationLockout.class::cast)
                    .toList();
            assertEquals(1, lockouts.size());
            assertEquals("alice", lockouts.get(0).credentialKey());
            assertEquals(5, lockouts.get(0).failedAttempts());
        }

        @Test
        @DisplayName("should flag an address targeting many accounts and short user agents")
        void shouldReportRiskFactors() {
            for (var account : new String[] {"a", "b", "c", "d"}) {
                fail(account, "203.0.113.50");
            }
            service.recordFailure("e", "203.0.113.50", "invalid_password", "curl", null)
                    .await()
                    .atMost(Duration.ofSeconds(1));

            final var captor = ArgumentCaptor.forClass(SecurityEvent.class);
            verify(dispatcher, atLeastOnce()).dispatch(captor.capture());
            final var last = captor.getAllValues().stream()
                    .filter(SecurityEvent.AuthenticationFailure.class::isInstance)
                    .map(SecurityEvent.AuthenticationFailure.class::cast)
                    .filter(e -> e.credentialKey().equals("e"))
                    .findFirst()
                    .orElseThrow();
            assertTrue(last.riskFactors().contains(LockoutService.RISK_MULTIPLE_ACCOUNTS));
            assertTrue(last.riskFactors().contains(LockoutService.RISK_UNUSUAL_USER_AGENT));
        }

        @Test
        @DisplayName("should treat the credential as unlocked when the store fails")
        void shouldFailOpen() {
            final var failing = mock(LoginFailureRepository.class);
            when(failing.recordFailure(any(), any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("down")));
            final var failOpen = new LockoutService(failing, config, dispatcher, clock);

            final var state = failOpen.recordFailure("alice", "198.51.100.1", "invalid_password")
                    .await()
                    .atMost(Duration.ofSeconds(1));

            assertFalse(state.isLocked());
            verify(dispatcher).dispatch(any(SecurityEvent.StoreFailure.class));
        }
    }

    @Nested
    @DisplayName("recordSuccess() and unlock()")
    class ClearTests {

        @Test
        @DisplayName("should clear failures after a successful login")
        void shouldClearOnSuccess() {
            for (int i = 0; i < 3; i++) {
                fail("alice", "198.51.100.1");
            }

            service.recordSuccess("alice").await().atMost(Duration.ofSeconds(1));

            final var state = state("alice");
            assertEquals(0, state.failedAttempts());
            assertNull(state.lockoutUntil());
        }

        @Test
        @DisplayName("should lift an active lockout")
        void shouldUnlock() {
            for (int i = 0; i < 5; i++) {
                fail("alice", "198.51.100.1");
            }

            service.unlock("alice").await().atMost(Duration.ofSeconds(1));

            assertFalse(state("alice").isLocked());
            assertEquals(Duration.ZERO, service.retryAfter(state("alice")));
        }
    }

    @Nested
    @DisplayName("summary()")
    class SummaryTests {

        @Test
        @DisplayName("should aggregate failures and suspicious addresses")
        void shouldSummarize() {
            for (int i = 0; i < 10; i++) {
                fail("user" + (i % 2), "203.0.113.7");
            }
            fail("carol", "198.51.100.2");

            final var summary = service.summary().await().atMost(Duration.ofSeconds(1));

            assertEquals(11, summary.totalFailures());
            assertEquals(3, summary.uniqueCredentials());
            assertEquals(2, summary.uniqueIps());
            assertEquals("203.0.113.7", summary.topSourceIps().get(0).key());
            assertEquals(10, summary.topSourceIps().get(0).failures());
            assertEquals(List.of("203.0.113.7"), summary.suspiciousIps());
            assertEquals(2, summary.activeLockouts());
            assertTrue(service.isSuspiciousIp("203.0.113.7").await().atMost(Duration.ofSeconds(1)));
            assertFalse(service.isSuspiciousIp("198.51.100.2").await().atMost(Duration.ofSeconds(1)));
        }
    }
}
