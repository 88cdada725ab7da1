package warden.core.service.lockout;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.telemetry.SecurityEventDispatcher;
import warden.core.config.LockoutConfig;
import warden.core.model.lockout.AccountLockoutState;
import warden.core.model.lockout.FailedLoginSummary;
import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.lockout.LoginFailureRecord;
import warden.spi.LoginFailureRepository;
import warden.spi.SecurityEvent;

/**
 * Failed-login tracking and credential lockout (brute force protection).
 *
 * <p>
 * Locks by credential only. The client IP of each failure is recorded for
 * reporting and risk factors but never locks anything, since legitimate users
 * share addresses and attackers rotate them.
 *
 * <p>
 * Store failures never fail a login: they are logged, reported as a
 * {@link SecurityEvent.StoreFailure}, and the credential is treated as unlocked.
 */
@ApplicationScoped
public class LockoutService {

    private static final Logger LOG = Logger.getLogger(LockoutService.class);

    static final String RISK_MULTIPLE_ACCOUNTS = "Multiple accounts targeted from same IP";
    static final String RISK_UNUSUAL_USER_AGENT = "Unusual or missing user agent";
    static final int MIN_USER_AGENT_LENGTH = 10;
    private static final int TOP_N = 10;

    private final LoginFailureRepository repository;
    private final LockoutConfig config;
    private final LockoutPolicy policy;
    private final SecurityEventDispatcher dispatcher;
    private final Clock clock;
    private final Cache<String, Set<String>> credentialsByIp;

    @Inject
    public LockoutService(
            LoginFailureRepository repository, LockoutConfig config, SecurityEventDispatcher dispatcher, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.policy = LockoutPolicy.from(config);
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.credentialsByIp = Caffeine.newBuilder()
                .expireAfterWrite(config.observationWindow())
                .maximumSize(100_000)
                .build();
    }

    /**
     * Record a failed login.
     *
     * @param credentialKey targeted credential
     * @param ip            client address
     * @param reason        failure reason
     * @return the credential state after this failure
     */
    public Uni<AccountLockoutState> recordFailure(String credentialKey, String ip, String reason) {
        return recordFailure(credentialKey, ip, reason, null, null);
    }

    /**
     * Record a failed login with client details used for risk factors.
     *
     * @param credentialKey targeted credential
     * @param ip            client address
     * @param reason        failure reason
     * @param userAgent     client user agent, may be null
     * @param geolocation   resolved location, may be null
     * @return the credential state after this failure; unlocked and not recorded
     *     when lockout is disabled
     */
    public Uni<AccountLockoutState> recordFailure(
            String credentialKey, String ip, String reason, String userAgent, String geolocation) {
        if (!config.enabled() || credentialKey == null) {
            return Uni.createFrom().item(AccountLockoutState.clear(credentialKey));
        }
        final var failure = new LoginFailureRecord(credentialKey, ip, clock.instant(), reason, geolocation, userAgent);
        final var riskFactors = riskFactors(failure);

        return repository
                .recordFailure(failure, policy)
                .invoke(state -> publishFailure(failure, state, riskFactors))
                .onFailure()
                .recoverWithItem(error -> {
                    reportStoreFailure(credentialKey, "recordFailure", error);
                    return AccountLockoutState.clear(credentialKey);
                });
    }

    /**
     * Read the lockout state of a credential.
     *
     * @param credentialKey the credential
     * @return the state; unlocked when lockout is disabled or the store fails
     */
    public Uni<AccountLockoutState> checkLocked(String credentialKey) {
        if (!config.enabled() || credentialKey == null) {
            return Uni.createFrom().item(AccountLockoutState.clear(credentialKey));
        }
        return repository.getState(credentialKey, policy).onFailure().recoverWithItem(error -> {
            reportStoreFailure(credentialKey, "checkLocked", error);
            return AccountLockoutState.clear(credentialKey);
        });
    }

    /**
     * Clear failures and any lockout after a successful login.
     *
     * @param credentialKey the credential
     * @return completion
     */
    public Uni<Void> recordSuccess(String credentialKey) {
        return repository.clear(credentialKey).onFailure().recoverWithItem(error -> {
            reportStoreFailure(credentialKey, "recordSuccess", error);
            return null;
        });
    }

    /**
     * Administratively lift a lockout.
     *
     * @param credentialKey the credential
     * @return completion
     */
    public Uni<Void> unlock(String credentialKey) {
        return repository.clear(credentialKey).invoke(() -> LOG.infof("Lockout cleared for %s", credentialKey));
    }

    public Multi<AccountLockoutState> activeLockouts() {
        return repository.streamActiveLockouts();
    }

    /**
     * Whether an address produced at least the suspicious threshold of failures in
     * the reporting window.
     *
     * @param ip the address
     * @return true if suspicious
     */
    public Uni<Boolean> isSuspiciousIp(String ip) {
        final var since = clock.instant().minus(config.reportingWindow());
        return repository
                .streamFailuresSince(since)
                .select()
                .where(record -> ip.equals(record.ipAddress()))
                .collect()
                .with(Collectors.counting())
                .map(count -> count >= config.suspiciousIpThreshold());
    }

    /**
     * Summarize failed logins in the reporting window.
     *
     * @return the summary
     */
    public Uni<FailedLoginSummary> summary() {
        final var since = clock.instant().minus(config.reportingWindow());
        final var failures = repository.streamFailuresSince(since).collect().asList();
        final var lockouts = repository.streamActiveLockouts().collect().asList();

        return Uni.combine().all().unis(failures, lockouts).asTuple().map(tuple -> {
            final var records = tuple.getItem1();
            final Map<String, Long> byCredential = new HashMap<>();
            final Map<String, Long> byIp = new HashMap<>();
            for (var record : records) {
                byCredential.merge(record.credentialKey(), 1L, Long::sum);
                if (record.ipAddress() != null) {
                    byIp.merge(record.ipAddress(), 1L, Long::sum);
                }
            }

            final var suspicious = byIp.entrySet().stream()
                    .filter(e -> e.getValue() >= config.suspiciousIpThreshold())
                    .map(Map.Entry::getKey)
                    .sorted()
                    .toList();

            return new FailedLoginSummary(
                    since,
                    records.size(),
                    byCredential.size(),
                    byIp.size(),
                    top(byCredential),
                    top(byIp),
                    suspicious,
                    tuple.getItem2().size());
        });
    }

    public LockoutPolicy policy() {
        return policy;
    }

    private List<String> riskFactors(LoginFailureRecord failure) {
        final var factors = new ArrayList<String>(2);
        if (failure.ipAddress() != null) {
            final var targets = credentialsByIp.get(failure.ipAddress(), ip -> ConcurrentHashMap.newKeySet());
            targets.add(failure.credentialKey());
            if (targets.size() >= config.multiAccountThreshold()) {
                factors.add(RISK_MULTIPLE_ACCOUNTS);
            }
        }
        final var userAgent = failure.userAgent();
        if (userAgent == null || userAgent.length() < MIN_USER_AGENT_LENGTH) {
            factors.add(RISK_UNUSUAL_USER_AGENT);
        }
        return List.copyOf(factors);
    }

    private void publishFailure(LoginFailureRecord failure, AccountLockoutState state, List<String> riskFactors) {
        dispatcher.dispatch(new SecurityEvent.AuthenticationFailure(
                failure.attemptTime(),
                failure.ipAddress(),
                failure.credentialKey(),
                failure.reason(),
                state.failedAttempts(),
                riskFactors));

        // The failure that reaches the maximum is the one that started the lockout
        if (state.isLocked() && state.failedAttempts() == policy.maxAttempts()) {
            LOG.infof(
                    "Locked %s until %s after %d failed logins",
                    failure.credentialKey(), state.lockoutUntil(), state.failedAttempts());
            dispatcher.dispatch(new SecurityEvent.AuthenticationLockout(
                    failure.attemptTime(),
                    failure.ipAddress(),
                    failure.credentialKey(),
                    state.failedAttempts(),
                    state.lockoutUntil()));
        }
    }

    private void reportStoreFailure(String credentialKey, String operation, Throwable error) {
        LOG.warnv(error, "Login failure store unavailable during {0} for {1}", operation, credentialKey);
        dispatcher.dispatch(new SecurityEvent.StoreFailure(
                clock.instant(), credentialKey, "login-failures", operation, String.valueOf(error.getMessage())));
    }

    private static List<FailedLoginSummary.Count> top(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .sorted(Comparator.comparing(Map.Entry<String, Long>::getValue)
                        .reversed()
                        .thenComparing(Map.Entry<String, Long>::getKey))
                .limit(TOP_N)
                .map(e -> new FailedLoginSummary.Count(e.getKey(), e.getValue()))
                .toList();
    }

    /**
     * Time until a locked credential may retry.
     *
     * @param state the state
     * @return remaining lockout
     */
    public Duration retryAfter(AccountLockoutState state) {
        return state.remaining(clock.instant());
    }
}
