package warden.core.service.decision;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.telemetry.SecurityEventDispatcher;
import warden.core.model.behavior.AnomalyResult;
import warden.core.model.common.RiskLevel;
import warden.core.model.decision.BlockReason;
import warden.core.model.decision.DecisionAction;
import warden.core.model.decision.DecisionRequest;
import warden.core.model.decision.SecurityDecision;
import warden.core.model.lockout.AccountLockoutState;
import warden.core.model.ratelimit.EndpointClass;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.threat.ReputationVerdict;
import warden.core.service.behavior.AnomalyScorer;
import warden.core.service.lockout.LockoutService;
import warden.core.service.ratelimit.EndpointClassifier;
import warden.core.service.ratelimit.RateLimitService;
import warden.core.service.session.SessionTrustService;
import warden.core.service.threat.ThreatIntelligenceCache;
import warden.spi.SecurityEvent;

/**
 * Combines the individual security checks into one decision per request.
 *
 * <p>Precedence, first match wins:
 * <ol>
 *   <li>blacklisted source, or stale threat data with fail-closed policy: BLOCK
 *   <li>locked credential: BLOCK on authentication endpoints, otherwise a finding only
 *   <li>rate limit exceeded: BLOCK with retry-after
 *   <li>CRITICAL anomaly: CHALLENGE, session marked suspicious
 *   <li>HIGH anomaly: ALLOW, session marked suspicious
 *   <li>otherwise ALLOW
 * </ol>
 *
 * <p>The lockout and rate limit checks run concurrently. Anomaly scoring only
 * runs when neither blocked. A failing check never blocks a request.
 */
@ApplicationScoped
public class DecisionAggregator {

    private static final Logger LOG = Logger.getLogger(DecisionAggregator.class);

    static final String REASON_ACCOUNT_LOCKED = "Account temporarily locked";
    static final String REASON_THREAT_SOURCE = "Request from address with poor reputation";

    private final ThreatIntelligenceCache threatCache;
    private final LockoutService lockoutService;
    private final RateLimitService rateLimitService;
    private final AnomalyScorer anomalyScorer;
    private final SessionTrustService sessionTrust;
    private final EndpointClassifier endpointClassifier;
    private final SecurityEventDispatcher dispatcher;
    private final Clock clock;

    @Inject
    public DecisionAggregator(
            ThreatIntelligenceCache threatCache,
            LockoutService lockoutService,
            RateLimitService rateLimitService,
            AnomalyScorer anomalyScorer,
            SessionTrustService sessionTrust,
            EndpointClassifier endpointClassifier,
            SecurityEventDispatcher dispatcher,
            Clock clock) {
        this.threatCache = threatCache;
        this.lockoutService = lockoutService;
        this.rateLimitService = rateLimitService;
        this.anomalyScorer = anomalyScorer;
        this.sessionTrust = sessionTrust;
        this.endpointClassifier = endpointClassifier;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Decide what to do with a request.
     *
     * @param request the request
     * @return the decision; never fails
     */
    public Uni<SecurityDecision> decide(DecisionRequest request) {
        final var endpointClass = endpointClassifier.classify(request.path());
        final var reputation = threatCache.checkReputation(request.clientIp());

        if (reputation.mustBlock()) {
            return Uni.createFrom().item(blockForThreat(request, reputation));
        }

        return Uni.combine()
                .all()
                .unis(
                        lockoutService.checkLocked(request.credentialKey()),
                        rateLimitService.check(request.identity(), endpointClass, reputation))
                .asTuple()
                .flatMap(tuple -> evaluate(request, endpointClass, reputation, tuple.getItem1(), tuple.getItem2()))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Security decision failed for {0}, allowing request", request.identity().key());
                    return SecurityDecision.allowDegraded("Security checks unavailable");
                });
    }

    private Uni<SecurityDecision> evaluate(
            DecisionRequest request,
            EndpointClass endpointClass,
            ReputationVerdict reputation,
            AccountLockoutState lockout,
            RateLimitDecision rateLimit) {
        final var reasons = new ArrayList<String>();
        if (reputation.isThreat()) {
            reasons.add(REASON_THREAT_SOURCE);
        }

        if (lockout.isLocked()) {
            reasons.add(REASON_ACCOUNT_LOCKED);
            if (endpointClass.authentication()) {
                final var retryAfter = Math.max(1, lockoutService.retryAfter(lockout).toSeconds());
                return Uni.createFrom()
                        .item(new SecurityDecision(
                                DecisionAction.BLOCK, BlockReason.ACCOUNT_LOCKED, reasons, retryAfter,
                                rateLimit, lockout, reputation, null));
            }
        }

        if (!rateLimit.allowed()) {
            reasons.add(BlockReason.RATE_LIMITED.message());
            return Uni.createFrom()
                    .item(new SecurityDecision(
                            DecisionAction.BLOCK, BlockReason.RATE_LIMITED, reasons, rateLimit.retryAfterSeconds(),
                            rateLimit, lockout, reputation, null));
        }

        if (request.event() == null) {
            return Uni.createFrom()
                    .item(new SecurityDecision(
                            DecisionAction.ALLOW, null, reasons, 0, rateLimit, lockout, reputation, null));
        }

        return anomalyScorer
                .score(request.event())
                .call(anomaly -> markSessionIfRisky(request, anomaly))
                .map(anomaly -> fromAnomaly(reasons, rateLimit, lockout, reputation, anomaly));
    }

    private SecurityDecision fromAnomaly(
            List<String> findings,
            RateLimitDecision rateLimit,
            AccountLockoutState lockout,
            ReputationVerdict reputation,
            AnomalyResult anomaly) {
        final var reasons = new ArrayList<>(findings);
        reasons.addAll(anomaly.reasons());
        if (anomaly.riskLevel() == RiskLevel.CRITICAL) {
            return new SecurityDecision(
                    DecisionAction.CHALLENGE, BlockReason.STEP_UP_REQUIRED, reasons, 0,
                    rateLimit, lockout, reputation, anomaly);
        }
        return new SecurityDecision(DecisionAction.ALLOW, null, reasons, 0, rateLimit, lockout, reputation, anomaly);
    }

    private Uni<Boolean> markSessionIfRisky(DecisionRequest request, AnomalyResult anomaly) {
        if (request.sessionToken() == null || !anomaly.riskLevel().isAtLeast(RiskLevel.HIGH)) {
            return Uni.createFrom().item(false);
        }
        final var reason = "Anomalous activity (" + anomaly.riskLevel() + "): " + String.join(", ", anomaly.reasons());
        return sessionTrust.markSuspicious(request.sessionToken(), reason).onFailure().recoverWithItem(error -> {
            LOG.warnv(error, "Could not mark session suspicious for user {0}", request.event().userId());
            return false;
        });
    }

    private SecurityDecision blockForThreat(DecisionRequest request, ReputationVerdict reputation) {
        final var reason = reputation.failClosed() ? BlockReason.THREAT_FEED_UNAVAILABLE : BlockReason.BLACKLISTED;
        LOG.warnf("Blocking request from %s: %s", request.clientIp(), reason.message());
        dispatcher.dispatch(new SecurityEvent.ThreatBlocked(
                clock.instant(),
                request.clientIp(),
                reputation.threatType(),
                reputation.confidence(),
                reputation.failClosed()));
        return new SecurityDecision(
                DecisionAction.BLOCK, reason, List.of(reason.message()), 0, null, null, reputation, null);
    }
}
