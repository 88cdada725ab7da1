package warden.system.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.decision.BlockReason;
import warden.core.model.decision.DecisionAction;
import warden.core.model.decision.SecurityDecision;
import warden.core.model.ratelimit.RateLimitDecision;

@DisplayName("SecurityHeadersFilter")
class SecurityHeadersFilterTest {

    private static final Instant RESET = Instant.parse("2026-03-02T10:01:00Z");

    private SecurityHeadersFilter filter;
    private ContainerRequestContext requestContext;
    private ContainerResponseContext responseContext;
    private MultivaluedMap<String, Object> headers;

    @BeforeEach
    void setUp() {
        filter = new SecurityHeadersFilter();
        requestContext = mock(ContainerRequestContext.class);
        responseContext = mock(ContainerResponseContext.class);
        headers = new MultivaluedHashMap<>();
        when(responseContext.getHeaders()).thenReturn(headers);
    }

    private void withDecision(SecurityDecision decision) {
        when(requestContext.getProperty(SecurityDecisionFilter.DECISION_PROPERTY)).thenReturn(decision);
    }

    @Test
    @DisplayName("should add rate limit headers to allowed responses")
    void shouldAddRateLimitHeaders() {
        withDecision(new SecurityDecision(
                DecisionAction.ALLOW, null, List.of(), 0,
                RateLimitDecision.allow(3, 5, 60, RESET, 2), null, null, null));

        filter.filter(requestContext, responseContext);

        assertEquals("5", headers.getFirst(SecurityHeadersFilter.LIMIT_HEADER));
        assertEquals("3", headers.getFirst(SecurityHeadersFilter.REMAINING_HEADER));
        assertEquals(String.valueOf(RESET.getEpochSecond()), headers.getFirst(SecurityHeadersFilter.RESET_HEADER));
        assertFalse(headers.containsKey("Retry-After"));
        assertFalse(headers.containsKey(SecurityHeadersFilter.REDUCED_HEADER));
    }

    @Test
    @DisplayName("should flag limits reduced for system load")
    void shouldAddHighLoadHeaders() {
        withDecision(new SecurityDecision(
                DecisionAction.ALLOW, null, List.of(), 0,
                RateLimitDecision.allow(4, 5, 60, RESET, 1).asReduced(), null, null, null));

        filter.filter(requestContext, responseContext);

        assertEquals("high", headers.getFirst(SecurityHeadersFilter.SYSTEM_LOAD_HEADER));
        assertEquals("true", headers.getFirst(SecurityHeadersFilter.REDUCED_HEADER));
        assertEquals("5", headers.getFirst(SecurityHeadersFilter.LIMIT_HEADER));
    }

    @Test
    @DisplayName("should add retry-after to rejected responses")
    void shouldAddRetryAfter() {
        withDecision(new SecurityDecision(
                DecisionAction.BLOCK, BlockReason.RATE_LIMITED, List.of(), 42,
                RateLimitDecision.rejected(5, 60, RESET, 42, 6), null, null, null));

        filter.filter(requestContext, responseContext);

        assertEquals("42", headers.getFirst("Retry-After"));
        assertEquals("0", headers.getFirst(SecurityHeadersFilter.REMAINING_HEADER));
    }

    @Test
    @DisplayName("should mark challenged responses as requiring step-up")
    void shouldAddStepUpHeader() {
        withDecision(new SecurityDecision(
                DecisionAction.CHALLENGE, BlockReason.STEP_UP_REQUIRED, List.of(), 0,
                RateLimitDecision.allow(), null, null, null));

        filter.filter(requestContext, responseContext);

        assertEquals("true", headers.getFirst(SecurityDecision.STEP_UP_HEADER));
        assertFalse(headers.containsKey(SecurityHeadersFilter.LIMIT_HEADER));
    }

    @Test
    @DisplayName("should leave responses without a decision untouched")
    void shouldIgnoreMissingDecision() {
        filter.filter(requestContext, responseContext);

        assertTrue(headers.isEmpty());
    }
}
