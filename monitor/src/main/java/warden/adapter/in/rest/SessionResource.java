package warden.adapter.in.rest;

import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.in.problem.SecurityProblem;
import warden.core.model.session.TerminationReason;
import warden.core.model.session.UserSession;
import warden.core.service.session.SessionTrustService;

/**
 * Admin endpoints for session trust management.
 */
@Path("/admin/sessions")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    private static final Logger LOG = Logger.getLogger(SessionResource.class);

    @Inject
    SessionTrustService sessionTrust;

    /**
     * Create a session for a user who just authenticated.
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> createSession(CreateSessionRequest request) {
        if (request == null || isBlank(request.userId())) {
            throw SecurityProblem.badRequest("userId is required");
        }
        return sessionTrust
                .createSession(request.userId(), request.ipAddress(), request.userAgent(), request.location())
                .map(session -> Response.status(Response.Status.CREATED).entity(session).build())
                .onFailure(SessionTrustService.SessionCreationException.class)
                .transform(error -> {
                    LOG.errorf("Failed to create session: %s", error.getMessage());
                    return SecurityProblem.internalError("Failed to create session");
                });
    }

    @GET
    public Uni<Response> listSessions(
            @QueryParam("userId") String userId, @QueryParam("activeOnly") @DefaultValue("true") boolean activeOnly) {
        if (isBlank(userId)) {
            throw SecurityProblem.badRequest("userId query parameter is required");
        }
        return sessionTrust.listSessions(userId, activeOnly).map(sessions -> Response.ok(sessions).build());
    }

    @GET
    @Path("/statistics")
    public Uni<Response> statistics() {
        return sessionTrust.statistics().map(stats -> Response.ok(stats).build());
    }

    @GET
    @Path("/{token}")
    public Uni<UserSession> getSession(@PathParam("token") String token) {
        return sessionTrust
                .getSession(token)
                .map(session -> session.orElseThrow(
                        () -> SecurityProblem.notFound("Session", UserSession.mask(token))));
    }

    /**
     * Flag a session as suspicious.
     */
    @POST
    @Path("/{token}/suspicious")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> markSuspicious(@PathParam("token") String token, SuspicionRequest request) {
        final var reason = request != null && !isBlank(request.reason()) ? request.reason() : "Flagged by administrator";
        return sessionTrust.markSuspicious(token, reason).map(flagged -> {
            if (!flagged) {
                throw SecurityProblem.notFound("Active session", UserSession.mask(token));
            }
            return Response.noContent().build();
        });
    }

    /**
     * Terminate a session. Terminating an already terminated session succeeds.
     */
    @DELETE
    @Path("/{token}")
    public Uni<Response> terminate(@PathParam("token") String token) {
        return sessionTrust
                .terminate(token, TerminationReason.ADMIN)
                .map(terminated -> Response.ok(Map.of("terminated", terminated)).build());
    }

    /**
     * Terminate all sessions of a user, optionally keeping one.
     */
    @DELETE
    public Uni<Response> terminateAll(@QueryParam("userId") String userId, @QueryParam("except") String exceptToken) {
        if (isBlank(userId)) {
            throw SecurityProblem.badRequest("userId query parameter is required");
        }
        return sessionTrust
                .terminateAll(userId, exceptToken)
                .map(count -> Response.ok(Map.of("terminated", count)).build());
    }

    @PUT
    @Path("/devices")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> setDeviceTrust(DeviceTrustRequest request) {
        if (request == null || isBlank(request.userId()) || isBlank(request.device())) {
            throw SecurityProblem.badRequest("userId and device are required");
        }
        return sessionTrust
                .setDeviceTrust(request.userId(), request.device(), request.trusted())
                .map(updated -> Response.ok(Map.of("updatedSessions", updated)).build());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }


    /**
     * Request body for creating a session.
     */
    public record CreateSessionRequest(String userId, String ipAddress, String userAgent, String location) {}

    public record SuspicionRequest(String reason) {}

    public record DeviceTrustRequest(String userId, String device, boolean trusted) {}
}
