package warden.adapter.in.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import warden.adapter.in.problem.SecurityProblem;
import warden.core.model.identity.ClientIdentity;
import warden.core.model.ratelimit.EndpointClass;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.service.ratelimit.EndpointClassifier;
import warden.core.service.ratelimit.RateLimitService;

/**
 * Admin endpoints for inspecting and clearing rate windows.
 *
 * <p>Windows are addressed by identity kind ({@code user} or {@code ip}), identity key
 * and endpoint class name.
 */
@Path("/admin/rate-limits/{kind}/{key}/{endpointClass}")
@Produces(MediaType.APPLICATION_JSON)
public class RateLimitResource {

    @Inject
    RateLimitService rateLimitService;

    @Inject
    EndpointClassifier classifier;

    @GET
    public Uni<RateLimitDecision> status(
            @PathParam("kind") String kind,
            @PathParam("key") String key,
            @PathParam("endpointClass") String endpointClass) {
        return rateLimitService.status(identity(kind, key), endpointClass(endpointClass));
    }

    /**
     * Drop the current window so the identity starts over.
     */
    @DELETE
    public Uni<Response> reset(
            @PathParam("kind") String kind,
            @PathParam("key") String key,
            @PathParam("endpointClass") String endpointClass) {
        return rateLimitService
                .reset(identity(kind, key), endpointClass(endpointClass))
                .map(v -> Response.noContent().build());
    }

    private static ClientIdentity identity(String kind, String key) {
        if (key == null || key.isBlank()) {
            throw SecurityProblem.badRequest("identity key is required");
        }
        return switch (kind) {
            case "user" -> ClientIdentity.user(key);
            case "ip" -> ClientIdentity.ip(key.trim());
            default -> throw SecurityProblem.badRequest("identity kind must be 'user' or 'ip', got '" + kind + "'");
        };
    }

    private EndpointClass endpointClass(String name) {
        final var resolved = classifier.byName(name);
        if (!resolved.name().equals(name)) {
            throw SecurityProblem.notFound("Endpoint class", name);
        }
        return resolved;
    }
}
