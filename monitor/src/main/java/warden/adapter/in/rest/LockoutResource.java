package warden.adapter.in.rest;

import java.util.List;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import warden.adapter.in.problem.SecurityProblem;
import warden.core.model.lockout.AccountLockoutState;
import warden.core.model.lockout.FailedLoginSummary;
import warden.core.service.lockout.LockoutService;

/**
 * Admin endpoints for failed-login tracking and account lockouts.
 *
 * <p>Login flows report outcomes through {@code POST /failures} and
 * {@code POST /{credential}/success}.
 */
@Path("/admin/lockouts")
@Produces(MediaType.APPLICATION_JSON)
public class LockoutResource {

    @Inject
    LockoutService lockoutService;

    @GET
    public Uni<List<AccountLockoutState>> activeLockouts() {
        return lockoutService.activeLockouts().collect().asList();
    }

    @GET
    @Path("/summary")
    public Uni<FailedLoginSummary> summary() {
        return lockoutService.summary();
    }

    @GET
    @Path("/{credential}")
    public Uni<Response> status(@PathParam("credential") String credential) {
        final var maxAttempts = lockoutService.policy().maxAttempts();
        return lockoutService.checkLocked(credential).map(state -> Response.ok(new LockoutStatus(
                        state,
                        state.remainingAttempts(maxAttempts),
                        lockoutService.retryAfter(state).toSeconds()))
                .build());
    }

    /**
     * Record a failed login attempt.
     */
    @POST
    @Path("/failures")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> recordFailure(FailureReport report) {
        if (report == null || report.credentialKey() == null || report.credentialKey().isBlank()) {
            throw SecurityProblem.badRequest("credentialKey is required");
        }
        return lockoutService
                .recordFailure(
                        report.credentialKey(),
                        report.ipAddress(),
                        report.reason(),
                        report.userAgent(),
                        report.geolocation())
                .map(state -> Response.ok(state).build());
    }

    @POST
    @Path("/{credential}/success")
    public Uni<Response> recordSuccess(@PathParam("credential") String credential) {
        return lockoutService.recordSuccess(credential).map(v -> Response.noContent().build());
    }

    /**
     * Lift a lockout.
     */
    @DELETE
    @Path("/{credential}")
    public Uni<Response> unlock(@PathParam("credential") String credential) {
        return lockoutService.unlock(credential).map(v -> Response.noContent().build());
    }

    public record FailureReport(
            String credentialKey, String ipAddress, String reason, String userAgent, String geolocation) {}

    public record LockoutStatus(AccountLockoutState state, int remainingAttempts, long retryAfterSeconds) {}
}
