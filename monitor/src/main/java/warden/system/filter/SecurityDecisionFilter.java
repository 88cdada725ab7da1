package warden.system.filter;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import warden.adapter.in.problem.SecurityProblem;
import warden.core.model.behavior.BehaviorEvent;
import warden.core.model.behavior.DeviceDescriptor;
import warden.core.model.decision.DecisionAction;
import warden.core.model.decision.DecisionRequest;
import warden.core.model.decision.SecurityDecision;
import warden.core.model.identity.ClientIdentity;
import warden.core.model.identity.RequestMetadata;
import warden.core.model.session.UserSession;
import warden.core.port.out.GeolocationResolver;
import warden.core.service.behavior.ActivityTracker;
import warden.core.service.decision.DecisionAggregator;
import warden.core.service.identity.ClientIdentityResolver;
import warden.core.service.session.SessionTrustService;

/**
 * Reactive filter that runs the security decision for every request.
 *
 * <p>Resolves the client identity, touches the request's session, builds a
 * behavior event for authenticated users and asks the {@link DecisionAggregator}
 * for a verdict. Blocked and challenged requests are aborted with an
 * {@code application/problem+json} response; the decision is stored on the
 * request for {@link SecurityHeadersFilter}.
 *
 * <p>Runs after authentication so the authenticated user is known.
 */
@IfBuildProperty(name = "warden.filter.enabled", stringValue = "true", enableIfMissing = true)
public class SecurityDecisionFilter {

    private static final Logger LOG = Logger.getLogger(SecurityDecisionFilter.class);

    static final String DECISION_PROPERTY = "warden.security.decision";
    static final String SESSION_HEADER = "X-Session-Token";
    static final String CREDENTIAL_HEADER = "X-Credential-Id";
    private static final String NON_APPLICATION_PREFIX = "/q/";

    private final ClientIdentityResolver identityResolver;
    private final DecisionAggregator aggregator;
    private final SessionTrustService sessionTrust;
    private final ActivityTracker activityTracker;
    private final GeolocationResolver geolocationResolver;
    private final Clock clock;

    @Inject
    public SecurityDecisionFilter(
            ClientIdentityResolver identityResolver,
            DecisionAggregator aggregator,
            SessionTrustService sessionTrust,
            ActivityTracker activityTracker,
            GeolocationResolver geolocationResolver,
            Clock clock) {
        this.identityResolver = identityResolver;
        this.aggregator = aggregator;
        this.sessionTrust = sessionTrust;
        this.activityTracker = activityTracker;
        this.geolocationResolver = geolocationResolver;
        this.clock = clock;
    }

    /**
     * Reactive filter method for the security decision.
     *
     * @param requestContext the request context
     * @param request        the underlying HTTP request
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION + 100)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        final var path = requestContext.getUriInfo().getPath();
        if (path.startsWith(NON_APPLICATION_PREFIX)) {
            return Uni.createFrom().nullItem();
        }

        final var metadata = toMetadata(requestContext, request, path);
        final var identity = identityResolver.resolve(metadata);
        final var clientIp = identityResolver.resolveClientIp(metadata);
        final var sessionToken = metadata.header(SESSION_HEADER);
        final var credentialKey = metadata.header(CREDENTIAL_HEADER) != null
                ? metadata.header(CREDENTIAL_HEADER)
                : identity.isUser() ? identity.key() : null;
        final var action = requestContext.getMethod() + " " + path;

        return touchSession(sessionToken)
                .map(session -> buildEvent(identity, clientIp, action, metadata, session))
                .flatMap(event -> aggregator.decide(
                        new DecisionRequest(identity, clientIp, path, credentialKey, event, sessionToken)))
                .map(decision -> {
                    requestContext.setProperty(DECISION_PROPERTY, decision);
                    if (decision.isAllowed()) {
                        return null;
                    }
                    LOG.debugf(
                            "%s %s for %s: %s", decision.action(), action, identity.bucketKey(), decision.reasons());
                    return buildResponse(decision);
                });
    }

    /**
     * Get the decision stored on a request by this filter.
     *
     * @param ctx the request context
     * @return the decision, or empty if the filter did not run
     */
    public static Optional<SecurityDecision> getDecision(ContainerRequestContext ctx) {
        return Optional.ofNullable((SecurityDecision) ctx.getProperty(DECISION_PROPERTY));
    }

    private Uni<Optional<UserSession>> touchSession(String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return sessionTrust.touch(sessionToken).onFailure().recoverWithItem(error -> {
            LOG.warnv(error, "Could not touch session");
            return Optional.empty();
        });
    }

    private BehaviorEvent buildEvent(
            ClientIdentity identity,
            String clientIp,
            String action,
            RequestMetadata metadata,
            Optional<UserSession> session) {
        if (!identity.isUser()) {
            return null;
        }
        final var now = clock.instant();
        final var sessionDuration = session.map(s -> Duration.between(s.createdAt(), now)).orElse(Duration.ZERO);
        return new BehaviorEvent(
                identity.key(),
                clientIp,
                action,
                now,
                sessionDuration,
                activityTracker.recordAction(identity.key()),
                geolocationResolver.resolve(clientIp, metadata).orElse(null),
                DeviceDescriptor.parse(metadata.userAgent()).id());
    }

    private Response buildResponse(SecurityDecision decision) {
        final var reason = decision.blockReason();
        final var title = decision.action() == DecisionAction.CHALLENGE ? "Step-Up Required" : "Request Blocked";
        final var builder = SecurityProblem.response(reason.httpStatus(), title, reason.message());
        if (decision.retryAfterSeconds() > 0) {
            builder.header("Retry-After", decision.retryAfterSeconds());
        }
        if (decision.action() == DecisionAction.CHALLENGE) {
            builder.header(SecurityDecision.STEP_UP_HEADER, "true");
        }
        return builder.build();
    }

    private static RequestMetadata toMetadata(ContainerRequestContext ctx, HttpServerRequest request, String path) {
        final var headers = new HashMap<String, String>();
        ctx.getHeaders().forEach((name, values) -> {
            if (values != null && !values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });
        final var principal = ctx.getSecurityContext() != null
                ? ctx.getSecurityContext().getUserPrincipal()
                : null;
        final var remote = request != null && request.remoteAddress() != null
                ? request.remoteAddress().host()
                : null;
        return new RequestMetadata(principal != null ? principal.getName() : null, remote, path, headers);
    }
}
