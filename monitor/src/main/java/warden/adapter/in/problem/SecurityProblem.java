package warden.adapter.in.problem;

import java.util.LinkedHashMap;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

/**
 * RFC 7807 Problem Details factory for security and admin errors.
 *
 * <p>Factory methods return a {@link WebApplicationException} carrying an
 * {@code application/problem+json} response, so resources can {@code throw}
 * them directly; filters use {@link #response} to abort a request.
 */
public final class SecurityProblem {

    public static final String PROBLEM_JSON = "application/problem+json";

    private SecurityProblem() {
        // Utility class - prevent instantiation
    }

    public static WebApplicationException notFound(String resourceType, String resourceId) {
        return problem(404, "%s Not Found".formatted(resourceType), "%s not found: %s".formatted(resourceType, resourceId));
    }

    public static WebApplicationException badRequest(String detail) {
        return problem(400, "Bad Request", detail);
    }

    public static WebApplicationException featureDisabled(String feature) {
        return problem(404, "Feature Disabled", "%s is disabled".formatted(feature));
    }

    public static WebApplicationException internalError(String detail) {
        return problem(500, "Internal Server Error", detail);
    }

    /**
     * Build a problem response builder; callers may add headers before building.
     *
     * @param status HTTP status
     * @param title  short summary
     * @param detail explanation for this occurrence
     * @return the builder
     */
    public static Response.ResponseBuilder response(int status, String title, String detail) {
        final var body = new LinkedHashMap<String, Object>();
        body.put("title", title);
        body.put("status", status);
        body.put("detail", detail);
        return Response.status(status).type(PROBLEM_JSON).entity(body);
    }

    private static WebApplicationException problem(int status, String title, String detail) {
        return new WebApplicationException(detail, response(status, title, detail).build());
    }
}
