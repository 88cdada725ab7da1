package warden.core.service.decision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import warden.adapter.out.storage.memory.InMemoryBaselineRepository;
import warden.adapter.out.storage.memory.InMemoryDeviceTrustRepository;
import warden.adapter.out.storage.memory.InMemoryLoginFailureRepository;
import warden.adapter.out.storage.memory.InMemorySessionRepository;
import warden.adapter.out.telemetry.SecurityEventDispatcher;
import warden.core.config.RateLimitingConfig;
import warden.core.config.ThreatIntelConfig;
import warden.core.model.behavior.BehaviorEvent;
import warden.core.model.common.RiskLevel;
import warden.core.model.decision.BlockReason;
import warden.core.model.decision.DecisionAction;
import warden.core.model.decision.DecisionRequest;
import warden.core.model.decision.SecurityDecision;
import warden.core.model.identity.ClientIdentity;
import warden.core.port.out.ThreatFeedClient;
import warden.core.service.behavior.AnomalyScorer;
import warden.core.service.behavior.BaselineStore;
import warden.core.service.lockout.LockoutService;
import warden.core.service.ratelimit.EndpointClassifier;
import warden.core.service.ratelimit.RateLimitService;
import warden.core.service.ratelimit.SystemLoadMonitor;
import warden.core.service.session.SessionTokenGenerator;
import warden.core.service.session.SessionTrustService;
import warden.core.service.threat.ThreatIntelligenceCache;
import warden.spi.SecurityEvent;
import warden.testing.MutableClock;
import warden.testing.TestConfigs;

@DisplayName("DecisionAggregator")
@ExtendWith(MockitoExtension.class)
class DecisionAggregatorTest {

    private static final String CLIENT_IP = "198.51.100.20";
    private static final ClientIdentity ALICE = ClientIdentity.user("alice");

    @Mock
    private SecurityEventDispatcher dispatcher;

    @Mock
    private ThreatFeedClient feedClient;

    private MutableClock clock;
    private ThreatIntelConfig threatConfig;
    private RateLimitingConfig rateConfig;
    private InMemoryRateLimiter limiter;
    private InMemoryLoginFailureRepository failures;
    private ThreatIntelligenceCache threatCache;
    private LockoutService lockoutService;
    private RateLimitService rateLimitService;
    private AnomalyScorer anomalyScorer;
    private SessionTrustService sessionTrust;
    private EndpointClassifier classifier;
    private DecisionAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        threatConfig = TestConfigs.threatIntel();
        rateConfig = TestConfigs.rateLimiting();
        final var anomalyConfig = TestConfigs.anomaly();

        limiter = new InMemoryRateLimiter(clock, true);
        failures = new InMemoryLoginFailureRepository(clock, 1_000);
        threatCache = new ThreatIntelligenceCache(feedClient, threatConfig, clock);
        lockoutService = new LockoutService(failures, TestConfigs.lockout(), dispatcher, clock);
        rateLimitService = new RateLimitService(
                limiter, rateConfig, new SystemLoadMonitor(rateConfig, null, clock), dispatcher, clock);
        anomalyScorer = new AnomalyScorer(
                new BaselineStore(new InMemoryBaselineRepository(), anomalyConfig, dispatcher, clock),
                threatCache,
                anomalyConfig,
                dispatcher);
        sessionTrust = new SessionTrustService(
                new InMemorySessionRepository(),
                new InMemoryDeviceTrustRepository(),
                new SessionTokenGenerator(),
                TestConfigs.sessions(),
                dispatcher,
                clock);
        classifier = new EndpointClassifier(rateConfig);
        aggregator = new DecisionAggregator(
                threatCache, lockoutService, rateLimitService, anomalyScorer, sessionTrust, classifier, dispatcher, clock);
    }

    @AfterEach
    void tearDown() {
        failures.shutdown();
    }

    private SecurityDecision decide(DecisionRequest request) {
        return aggregator.decide(request).await().atMost(Duration.ofSeconds(1));
    }

    private static DecisionRequest request(String path, String ip) {
        return new DecisionRequest(ALICE, ip, path, "alice", null, null);
    }

    private static BehaviorEvent event(String time, String location, String device, double actionsPerMinute) {
        return new BehaviorEvent(
                "alice", CLIENT_IP, "GET /api/tasks", Instant.parse(time),
                Duration.ofMinutes(10), actionsPerMinute, location, device);
    }

    private void lockAlice() {
        for (int i = 0; i < 5; i++) {
            lockoutService.recordFailure("alice", CLIENT_IP, "invalid_password").await().atMost(Duration.ofSeconds(1));
        }
    }

    @Nested
    @DisplayName("threat checks")
    class ThreatTests {

        @Test
        @DisplayName("should block a blacklisted source before counting the request")
        void shouldBlockBlacklisted() {
            threatCache.blacklist("1.2.3.4", "credential stuffing");

            final var decision = decide(request("/api/auth/login", "1.2.3.4"));

            assertEquals(DecisionAction.BLOCK, decision.action());
            assertEquals(BlockReason.BLACKLISTED, decision.blockReason());
            assertEquals(401, decision.httpStatus());
            assertEquals(0, limiter.getWindowCount());
            verify(dispatcher).dispatch(any(SecurityEvent.ThreatBlocked.class));
        }

        @Test
        @DisplayName("should block every unknown source while stale and fail-closed")
        void shouldFailClosed() {
            when(threatConfig.failClosed()).thenReturn(true);

            final var decision = decide(request("/api/tasks", CLIENT_IP));

            assertEquals(BlockReason.THREAT_FEED_UNAVAILABLE, decision.blockReason());
            assertEquals(401, decision.httpStatus());
        }

        @Test
        @DisplayName("should allow a reported source with a finding and a reduced limit")
        void shouldFlagReportedSource() {
            threatCache.report(CLIENT_IP, "Scanner", RiskLevel.MEDIUM, 60, "port scan");

            final var decision = decide(request("/api/auth/login", CLIENT_IP));

            assertTrue(decision.isAllowed());
            assertTrue(decision.reasons().contains(DecisionAggregator.REASON_THREAT_SOURCE));
            assertEquals(2, decision.rateLimit().limit());
        }
    }

    @Nested
    @DisplayName("lockout checks")
    class LockoutTests {

        @Test
        @DisplayName("should block a locked credential on authentication endpoints")
        void shouldBlockLockedLogin() {
            lockAlice();

            final var decision = decide(request("/api/auth/login", CLIENT_IP));

            assertEquals(DecisionAction.BLOCK, decision.action());
            assertEquals(BlockReason.ACCOUNT_LOCKED, decision.blockReason());
            assertEquals(423, decision.httpStatus());
            assertEquals(900, decision.retryAfterSeconds());
        }

        @Test
        @DisplayName("should only report a locked credential elsewhere")
        void shouldReportLockElsewhere() {
            lockAlice();

            final var decision = decide(request("/api/tasks", CLIENT_IP));

            assertTrue(decision.isAllowed());
            assertEquals(200, decision.httpStatus());
            assertTrue(decision.reasons().contains(DecisionAggregator.REASON_ACCOUNT_LOCKED));
        }
    }

    @Nested
    @DisplayName("rate limit checks")
    class RateLimitTests {

        @Test
        @DisplayName("should reject the sixth login attempt in a minute")
        void shouldRejectOverLimit() {
            for (int i = 0; i < 5; i++) {
                assertTrue(decide(request("/api/auth/login", CLIENT_IP)).isAllowed());
            }

            final var decision = decide(request("/api/auth/login", CLIENT_IP));

            assertEquals(DecisionAction.BLOCK, decision.action());
            assertEquals(BlockReason.RATE_LIMITED, decision.blockReason());
            assertEquals(429, decision.httpStatus());
            assertEquals(60, decision.retryAfterSeconds());
            assertFalse(decision.rateLimit().allowed());
        }
    }

    @Nested
    @DisplayName("anomaly checks")
    class AnomalyTests {

        @Test
        @DisplayName("should challenge a critical anomaly and flag the session")
        void shouldChallengeCriticalAnomaly() {
            final var session = sessionTrust.createSession("alice", CLIENT_IP, "Mozilla/5.0 (X11; Linux x86_64) Firefox/121.0", "Berlin, DE")
                    .await()
                    .atMost(Duration.ofSeconds(1));
            decide(new DecisionRequest(
                    ALICE, CLIENT_IP, "/api/tasks", null,
                    event("2026-03-02T10:00:00Z", "Berlin, DE", session.device(), 2.0), session.sessionToken()));

            final var decision = decide(new DecisionRequest(
                    ALICE, CLIENT_IP, "/api/tasks", null,
                    event("2026-03-03T03:00:00Z", "Tokyo, JP", "Mobile_Safari_iOS", 100), session.sessionToken()));

            assertEquals(DecisionAction.CHALLENGE, decision.action());
            assertEquals(BlockReason.STEP_UP_REQUIRED, decision.blockReason());
            assertEquals(401, decision.httpStatus());
            assertEquals(RiskLevel.CRITICAL, decision.anomaly().riskLevel());
            final var stored = sessionTrust.getSession(session.sessionToken())
                    .await()
                    .atMost(Duration.ofSeconds(1))
                    .orElseThrow();
            assertTrue(stored.isSuspicious());
            assertTrue(stored.suspicionReasons().get(0).startsWith("Anomalous activity (CRITICAL)"));
        }

        @Test
        @DisplayName("should allow a high anomaly but flag the session")
        void shouldAllowHighAnomalyAndFlagSession() {
            final var session = sessionTrust.createSession("alice", CLIENT_IP, "Mozilla/5.0 (X11; Linux x86_64) Firefox/121.0", "Berlin, DE")
                    .await()
                    .atMost(Duration.ofSeconds(1));
            decide(new DecisionRequest(
                    ALICE, CLIENT_IP, "/api/tasks", null,
                    event("2026-03-02T10:00:00Z", "Berlin, DE", session.device(), 2.0), session.sessionToken()));

            final var decision = decide(new DecisionRequest(
                    ALICE, CLIENT_IP, "/api/tasks", null,
                    event("2026-03-02T10:05:00Z", "Oslo, NO", "Mobile_Safari_iOS", 2.0), session.sessionToken()));

            assertEquals(DecisionAction.ALLOW, decision.action());
            assertNull(decision.blockReason());
            assertEquals(RiskLevel.HIGH, decision.anomaly().riskLevel());
            assertEquals(0.55, decision.anomaly().score(), 1e-9);
            final var stored = sessionTrust.getSession(session.sessionToken())
                    .await()
                    .atMost(Duration.ofSeconds(1))
                    .orElseThrow();
            assertTrue(stored.isSuspicious());
            assertTrue(stored.suspicionReasons().get(0).startsWith("Anomalous activity (HIGH)"));
        }

        @Test
        @DisplayName("should allow usual behavior without findings")
        void shouldAllowUsualBehavior() {
            decide(new DecisionRequest(
                    ALICE, CLIENT_IP, "/api/tasks", null, event("2026-03-02T10:00:00Z", "Berlin, DE", "d1", 2.0), null));

            final var decision = decide(new DecisionRequest(
                    ALICE, CLIENT_IP, "/api/tasks", null, event("2026-03-02T10:05:00Z", "Berlin, DE", "d1", 2.0), null));

            assertTrue(decision.isAllowed());
            assertTrue(decision.reasons().isEmpty());
            assertEquals(0.0, decision.anomaly().score());
            assertNull(decision.blockReason());
        }
    }

    @Test
    @DisplayName("should allow the request when a check fails")
    void shouldDegradeOnFailure() {
        final var brokenLockout = mock(LockoutService.class);
        when(brokenLockout.checkLocked(any()))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("store down")));
        final var degraded = new DecisionAggregator(
                threatCache, brokenLockout, rateLimitService, anomalyScorer, sessionTrust, classifier, dispatcher, clock);

        final var decision = degraded.decide(request("/api/auth/login", CLIENT_IP))
                .await()
                .atMost(Duration.ofSeconds(1));

        assertTrue(decision.isAllowed());
        assertEquals(1, decision.reasons().size());
    }
}
