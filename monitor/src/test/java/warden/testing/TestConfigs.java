package warden.testing;

import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import warden.core.config.AnomalyConfig;
import warden.core.config.LockoutConfig;
import warden.core.config.RateLimitingConfig;
import warden.core.config.SessionTrustConfig;
import warden.core.config.ThreatIntelConfig;

/**
 * Config mappings stubbed with their documented defaults, except that high load
 * reduction starts disabled. Tests override single values with
 * {@code when(...)} on the returned mock.
 */
public final class TestConfigs {

    private TestConfigs() {}

    public static RateLimitingConfig rateLimiting() {
        final var config = mock(RateLimitingConfig.class);
        final var redis = mock(RateLimitingConfig.RedisConfig.class);
        lenient().when(config.enabled()).thenReturn(true);
        lenient().when(config.defaultMaxRequests()).thenReturn(30);
        lenient().when(config.defaultWindowSeconds()).thenReturn(60);
        final var auth = endpointClass(List.of("/api/auth"), 5, 60, true);
        final var tasks = endpointClass(List.of("/api/tasks"), 20, 30, false);
        lenient().when(config.endpointClasses()).thenReturn(Map.of("auth", auth, "tasks", tasks));
        lenient().when(config.exemptUsers()).thenReturn(Set.of("system"));
        lenient().when(config.threatLimitFactor()).thenReturn(0.5);
        lenient().when(config.sweepInterval()).thenReturn(Duration.ofMinutes(1));
        lenient().when(config.redis()).thenReturn(redis);
        lenient().when(redis.enabled()).thenReturn(false);
        lenient().when(redis.keyPrefix()).thenReturn("warden:ratelimit:");
        final var highLoad = mock(RateLimitingConfig.HighLoadConfig.class);
        lenient().when(config.highLoad()).thenReturn(highLoad);
        lenient().when(highLoad.enabled()).thenReturn(false);
        lenient().when(highLoad.cpuThreshold()).thenReturn(0.8);
        lenient().when(highLoad.memoryThreshold()).thenReturn(0.8);
        lenient().when(highLoad.reductionPercent()).thenReturn(50);
        lenient().when(highLoad.minimumLimit()).thenReturn(5);
        lenient().when(highLoad.checkInterval()).thenReturn(Duration.ofSeconds(30));
        return config;
    }

    public static RateLimitingConfig.EndpointClassConfig endpointClass(
            List<String> prefixes, int maxRequests, int windowSeconds, boolean authentication) {
        final var config = mock(RateLimitingConfig.EndpointClassConfig.class);
        lenient().when(config.pathPrefixes()).thenReturn(prefixes);
        lenient().when(config.maxRequests()).thenReturn(maxRequests);
        lenient().when(config.windowSeconds()).thenReturn(windowSeconds);
        lenient().when(config.authentication()).thenReturn(authentication);
        return config;
    }

    public static LockoutConfig lockout() {
        final var config = mock(LockoutConfig.class);
        final var redis = mock(LockoutConfig.RedisConfig.class);
        lenient().when(config.enabled()).thenReturn(true);
        lenient().when(config.maxAttempts()).thenReturn(5);
        lenient().when(config.observationWindow()).thenReturn(Duration.ofMinutes(15));
        lenient().when(config.lockoutDuration()).thenReturn(Duration.ofMinutes(15));
        lenient().when(config.reportingWindow()).thenReturn(Duration.ofHours(24));
        lenient().when(config.suspiciousIpThreshold()).thenReturn(10);
        lenient().when(config.multiAccountThreshold()).thenReturn(5);
        lenient().when(config.historySize()).thenReturn(10_000);
        lenient().when(config.redis()).thenReturn(redis);
        lenient().when(redis.enabled()).thenReturn(false);
        lenient().when(redis.keyPrefix()).thenReturn("warden:lockout:");
        return config;
    }

    public static AnomalyConfig anomaly() {
        final var config = mock(AnomalyConfig.class);
        final var weights = mock(AnomalyConfig.Weights.class);
        final var thresholds = mock(AnomalyConfig.Thresholds.class);
        final var smoothing = mock(AnomalyConfig.Smoothing.class);
        final var redis = mock(AnomalyConfig.RedisConfig.class);
        lenient().when(config.enabled()).thenReturn(true);
        lenient().when(config.weights()).thenReturn(weights);
        lenient().when(config.thresholds()).thenReturn(thresholds);
        lenient().when(config.smoothing()).thenReturn(smoothing);
        lenient().when(config.redis()).thenReturn(redis);
        lenient().when(config.anomalousThreshold()).thenReturn(0.5);
        lenient().when(config.velocityMultiplier()).thenReturn(3.0);
        lenient().when(config.minTypicalActionsPerMinute()).thenReturn(1.0);
        lenient().when(config.offHoursToleranceHours()).thenReturn(1);
        lenient().when(config.timeZone()).thenReturn("UTC");
        lenient().when(config.deviationThreshold()).thenReturn(0.7);
        lenient().when(config.maxTypicalValues()).thenReturn(20);
        lenient().when(config.baselineTtl()).thenReturn(Duration.ofDays(30));
        lenient().when(config.cacheSize()).thenReturn(10_000L);
        lenient().when(weights.newLocation()).thenReturn(0.3);
        lenient().when(weights.newDevice()).thenReturn(0.25);
        lenient().when(weights.offHours()).thenReturn(0.15);
        lenient().when(weights.highVelocity()).thenReturn(0.3);
        lenient().when(weights.outsideNormalPattern()).thenReturn(0.0);
        lenient().when(weights.knownThreatSource()).thenReturn(0.0);
        lenient().when(thresholds.medium()).thenReturn(0.25);
        lenient().when(thresholds.high()).thenReturn(0.5);
        lenient().when(thresholds.critical()).thenReturn(0.75);
        lenient().when(smoothing.minAlpha()).thenReturn(0.05);
        lenient().when(smoothing.anomalousRateFactor()).thenReturn(0.1);
        lenient().when(smoothing.sessionDurationWeight()).thenReturn(0.5);
        lenient().when(smoothing.actionsPerMinuteWeight()).thenReturn(0.5);
        lenient().when(redis.enabled()).thenReturn(false);
        lenient().when(redis.keyPrefix()).thenReturn("warden:baseline:");
        return config;
    }

    public static SessionTrustConfig sessions() {
        final var config = mock(SessionTrustConfig.class);
        lenient().when(config.ttl()).thenReturn(Duration.ofMinutes(120));
        lenient().when(config.fixedDuration()).thenReturn(false);
        lenient().when(config.maxConcurrent()).thenReturn(5);
        lenient().when(config.rapidCreationThreshold()).thenReturn(3);
        lenient().when(config.rapidCreationWindow()).thenReturn(Duration.ofMinutes(1));
        lenient().when(config.minUserAgentLength()).thenReturn(10);
        lenient().when(config.retention()).thenReturn(Duration.ofDays(7));
        lenient().when(config.cleanupInterval()).thenReturn(Duration.ofMinutes(5));
        lenient().when(config.tokenGenerationAttempts()).thenReturn(3);
        return config;
    }

    public static ThreatIntelConfig threatIntel() {
        final var config = mock(ThreatIntelConfig.class);
        final var feed = mock(ThreatIntelConfig.FeedConfig.class);
        lenient().when(config.enabled()).thenReturn(true);
        lenient().when(config.refreshInterval()).thenReturn(Duration.ofMinutes(5));
        lenient().when(config.entryTtl()).thenReturn(Duration.ofHours(1));
        lenient().when(config.staleAfter()).thenReturn(Duration.ofMinutes(30));
        lenient().when(config.failClosed()).thenReturn(false);
        lenient().when(config.feed()).thenReturn(feed);
        lenient().when(config.blacklist()).thenReturn(Optional.empty());
        lenient().when(config.whitelist()).thenReturn(Optional.empty());
        lenient().when(feed.url()).thenReturn(Optional.empty());
        lenient().when(feed.timeout()).thenReturn(Duration.ofSeconds(5));
        return config;
    }
}
