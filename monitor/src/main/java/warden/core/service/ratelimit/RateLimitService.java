package warden.core.service.ratelimit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.telemetry.SecurityEventDispatcher;
import warden.core.config.InvalidConfigurationException;
import warden.core.config.RateLimitingConfig;
import warden.core.model.identity.ClientIdentity;
import warden.core.model.ratelimit.EffectiveRateLimit;
import warden.core.model.ratelimit.EndpointClass;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.model.threat.ReputationVerdict;
import warden.core.port.out.RateLimiter;
import warden.spi.SecurityEvent;

/**
 * Request admission control per (identity, endpoint class).
 *
 * <p>Applies exemptions for trusted system accounts, reduces the limit for
 * addresses the threat cache reports as threats and again while the
 * {@link SystemLoadMonitor} reports high load, and raises a security event on
 * every rejection. Limiter failures admit the request.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    private final RateLimiter rateLimiter;
    private final RateLimitingConfig config;
    private final SystemLoadMonitor loadMonitor;
    private final SecurityEventDispatcher dispatcher;
    private final Clock clock;

    @Inject
    public RateLimitService(
            RateLimiter rateLimiter,
            RateLimitingConfig config,
            SystemLoadMonitor loadMonitor,
            SecurityEventDispatcher dispatcher,
            Clock clock) {
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.loadMonitor = loadMonitor;
        this.dispatcher = dispatcher;
        this.clock = clock;
        final var factor = config.threatLimitFactor();
        if (factor <= 0 || factor > 1) {
            throw new InvalidConfigurationException("threat-limit-factor must be in (0, 1]: " + factor);
        }
    }

    /**
     * Count a request against a window with an explicit limit.
     *
     * @param identityKey   identity bucket
     * @param endpointKey   endpoint
     * @param limit         requests per window
     * @param windowSeconds window length
     * @return the decision
     * @throws InvalidConfigurationException if the limit or window is not positive
     */
    public Uni<RateLimitDecision> check(String identityKey, String endpointKey, int limit, int windowSeconds) {
        if (limit < 1 || windowSeconds < 1) {
            throw new InvalidConfigurationException(String.format(
                    "Rate limit for '%s' needs positive max-requests and window-seconds, got %d/%ds",
                    endpointKey, limit, windowSeconds));
        }
        return consume(new RateLimitKey(identityKey, endpointKey), new EffectiveRateLimit(limit, windowSeconds));
    }

    /**
     * Count a request from an identity against its endpoint class.
     *
     * @param identity      resolved client identity
     * @param endpointClass class of the requested endpoint
     * @param reputation    reputation of the client address, or null
     * @return the decision
     */
    public Uni<RateLimitDecision> check(
            ClientIdentity identity, EndpointClass endpointClass, ReputationVerdict reputation) {
        if (!rateLimiter.isEnabled() || isExempt(identity)) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }

        var limit = endpointClass.limit();
        if (reputation != null && reputation.isThreat() && !reputation.mustBlock()) {
            limit = limit.scaled(config.threatLimitFactor());
        }

        final var key = new RateLimitKey(identity.bucketKey(), endpointClass.name());
        return consume(key, limit);
    }

    /**
     * Current window of an identity without counting a request.
     */
    public Uni<RateLimitDecision> status(ClientIdentity identity, EndpointClass endpointClass) {
        final var highLoad = loadMonitor.isHighLoad();
        final var limit = highLoad ? reduceForLoad(endpointClass.limit()) : endpointClass.limit();
        return rateLimiter
                .getStatus(new RateLimitKey(identity.bucketKey(), endpointClass.name()), limit)
                .map(decision -> highLoad ? decision.asReduced() : decision);
    }

    public Uni<Void> reset(ClientIdentity identity, EndpointClass endpointClass) {
        return rateLimiter.reset(new RateLimitKey(identity.bucketKey(), endpointClass.name()));
    }

    public boolean isExempt(ClientIdentity identity) {
        return identity.isUser() && config.exemptUsers().contains(identity.key());
    }

    private EffectiveRateLimit reduceForLoad(EffectiveRateLimit limit) {
        return limit.reduced(loadMonitor.reductionPercent(), loadMonitor.minimumLimit());
    }

    private Uni<RateLimitDecision> consume(RateLimitKey key, EffectiveRateLimit configured) {
        final var highLoad = loadMonitor.isHighLoad();
        final var limit = highLoad ? reduceForLoad(configured) : configured;
        return rateLimiter
                .checkAndConsume(key, limit)
                .map(decision -> highLoad ? decision.asReduced() : decision)
                .invoke(decision -> {
                    if (!decision.allowed()) {
                        LOG.debugf(
                                "Rate limit exceeded for %s on %s (%d/%d)",
                                key.identityKey(), key.endpointKey(), decision.requestCount(), decision.limit());
                        dispatcher.dispatch(new SecurityEvent.RateLimitExceeded(
                                clock.instant(),
                                key.identityKey(),
                                key.endpointKey(),
                                decision.requestCount(),
                                decision.limit(),
                                decision.windowSeconds()));
                    }
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Rate limit check failed for {0}, allowing request", key.toCacheKey());
                    return RateLimitDecision.allow();
                });
    }
}
