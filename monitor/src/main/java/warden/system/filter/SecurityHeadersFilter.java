package warden.system.filter;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;

import io.quarkus.arc.properties.IfBuildProperty;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import warden.core.model.decision.DecisionAction;
import warden.core.model.decision.SecurityDecision;

/**
 * Adds rate limit and step-up headers derived from the request's security decision.
 *
 * <ul>
 *   <li>{@code X-RateLimit-Limit}, {@code X-RateLimit-Remaining}, {@code X-RateLimit-Reset} (epoch seconds)
 *   <li>{@code X-System-Load: high} and {@code X-Rate-Limit-Reduced: true} while limits are cut for load
 *   <li>{@code Retry-After} on rejected requests
 *   <li>{@code X-Step-Up-Required} on challenged requests
 * </ul>
 */
@IfBuildProperty(name = "warden.filter.enabled", stringValue = "true", enableIfMissing = true)
public class SecurityHeadersFilter {

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";
    static final String SYSTEM_LOAD_HEADER = "X-System-Load";
    static final String REDUCED_HEADER = "X-Rate-Limit-Reduced";

    @ServerResponseFilter
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        SecurityDecisionFilter.getDecision(requestContext)
                .ifPresent(decision -> apply(decision, responseContext));
    }

    static void apply(SecurityDecision decision, ContainerResponseContext responseContext) {
        final var headers = responseContext.getHeaders();
        final var rateLimit = decision.rateLimit();
        if (rateLimit != null && rateLimit.isTracked()) {
            headers.putSingle(LIMIT_HEADER, String.valueOf(rateLimit.limit()));
            headers.putSingle(REMAINING_HEADER, String.valueOf(rateLimit.remaining()));
            headers.putSingle(RESET_HEADER, String.valueOf(rateLimit.resetAt().getEpochSecond()));
            if (rateLimit.reduced()) {
                headers.putSingle(SYSTEM_LOAD_HEADER, "high");
                headers.putSingle(REDUCED_HEADER, "true");
            }
        }
        if (decision.retryAfterSeconds() > 0) {
            headers.putSingle("Retry-After", String.valueOf(decision.retryAfterSeconds()));
        }
        if (decision.action() == DecisionAction.CHALLENGE) {
            headers.putSingle(SecurityDecision.STEP_UP_HEADER, "true");
        }
    }
}
