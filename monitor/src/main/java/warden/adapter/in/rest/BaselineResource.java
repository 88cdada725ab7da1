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
import warden.core.model.behavior.UserBaseline;
import warden.core.service.behavior.BaselineStore;

/**
 * Admin endpoints for learned behavior baselines.
 */
@Path("/admin/baselines")
@Produces(MediaType.APPLICATION_JSON)
public class BaselineResource {

    @Inject
    BaselineStore baselineStore;

    @GET
    public StoreHealth health() {
        return new StoreHealth(baselineStore.persistenceFailures());
    }

    /**
     * A user's baseline, loaded from the store if it is not cached yet.
     */
    @GET
    @Path("/{userId}")
    public Uni<BaselineView> baseline(@PathParam("userId") String userId) {
        return baselineStore.ensureLoaded(userId).map(loaded -> baselineStore
                .get(userId)
                .map(baseline -> new BaselineView(baseline, baselineStore.isProvisional(userId)))
                .orElseThrow(() -> SecurityProblem.notFound("Baseline", userId)));
    }

    /**
     * Forget a baseline so the user is learned again from scratch.
     */
    @DELETE
    @Path("/{userId}")
    public Uni<Response> reset(@PathParam("userId") String userId) {
        return baselineStore.reset(userId).map(v -> Response.noContent().build());
    }

    public record BaselineView(UserBaseline baseline, boolean provisional) {}

    public record StoreHealth(long persistenceFailures) {}
}
