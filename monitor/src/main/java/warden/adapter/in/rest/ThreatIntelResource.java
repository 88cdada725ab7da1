package warden.adapter.in.rest;

import java.util.Collection;
import java.util.Map;

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
import org.jboss.logging.Logger;

import warden.adapter.in.problem.SecurityProblem;
import warden.core.model.common.RiskLevel;
import warden.core.model.threat.ReputationVerdict;
import warden.core.model.threat.ThreatRecord;
import warden.core.service.threat.ThreatIntelligenceCache;

/**
 * Admin endpoints for the threat intelligence cache.
 */
@Path("/admin/threats")
@Produces(MediaType.APPLICATION_JSON)
public class ThreatIntelResource {

    private static final Logger LOG = Logger.getLogger(ThreatIntelResource.class);

    @Inject
    ThreatIntelligenceCache threatCache;

    @GET
    public Collection<ThreatRecord> entries() {
        return threatCache.entries();
    }

    @GET
    @Path("/status")
    public Map<String, Object> status() {
        return Map.of(
                "stale", threatCache.isStale(),
                "lastRefresh", threatCache.lastRefresh().map(Object::toString).orElse("never"),
                "entries", threatCache.entries().size());
    }

    @GET
    @Path("/{ip}")
    public ReputationVerdict reputation(@PathParam("ip") String ip) {
        return threatCache.checkReputation(ip);
    }

    @POST
    @Path("/blacklist")
    @Consumes(MediaType.APPLICATION_JSON)
    public ThreatRecord blacklist(OverrideRequest request) {
        requireIp(request != null ? request.ipAddress() : null);
        return threatCache.blacklist(request.ipAddress(), request.reason());
    }

    @POST
    @Path("/whitelist")
    @Consumes(MediaType.APPLICATION_JSON)
    public ThreatRecord whitelist(OverrideRequest request) {
        requireIp(request != null ? request.ipAddress() : null);
        return threatCache.whitelist(request.ipAddress(), request.reason());
    }

    /**
     * Report a threat sighting; merged into any existing record for the address.
     */
    @POST
    @Path("/reports")
    @Consumes(MediaType.APPLICATION_JSON)
    public ThreatRecord report(ThreatReport report) {
        requireIp(report != null ? report.ipAddress() : null);
        return threatCache.report(
                report.ipAddress(),
                report.threatType(),
                RiskLevel.parse(report.severity()),
                report.confidence() != null ? report.confidence() : 50,
                report.description());
    }

    @DELETE
    @Path("/{ip}")
    public Response remove(@PathParam("ip") String ip) {
        if (!threatCache.remove(ip)) {
            throw SecurityProblem.notFound("Threat record", ip);
        }
        return Response.noContent().build();
    }

    /**
     * Refresh the feed now.
     */
    @POST
    @Path("/refresh")
    public Uni<Response> refresh() {
        return threatCache
                .refresh()
                .map(count -> Response.ok(Map.of("loaded", count)).build())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Manual threat feed refresh failed: %s", error.getMessage());
                    return SecurityProblem.response(503, "Service Unavailable", "Threat feed unavailable")
                            .build();
                });
    }

    private static void requireIp(String ip) {
        if (ip == null || ip.isBlank()) {
            throw SecurityProblem.badRequest("ipAddress is required");
        }
    }

    public record OverrideRequest(String ipAddress, String reason) {}

    public record ThreatReport(
            String ipAddress, String threatType, String severity, Integer confidence, String description) {}
}
