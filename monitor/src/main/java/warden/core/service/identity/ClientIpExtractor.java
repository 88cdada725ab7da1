package warden.core.service.identity;

import warden.core.model.identity.RequestMetadata;

/**
 * Extracts the originating client IP address from request metadata.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>RFC 7239 {@code Forwarded} header's {@code for} parameter</li>
 *   <li>{@code X-Forwarded-For} (first address in the chain)</li>
 *   <li>{@code X-Real-IP}</li>
 *   <li>the socket peer address</li>
 * </ol>
 */
public final class ClientIpExtractor {

    private ClientIpExtractor() {}

    /**
     * @param request the request
     * @return the client address, or null if none is available
     */
    public static String extract(RequestMetadata request) {
        var forwarded = request.header("Forwarded");
        if (forwarded != null) {
            var forValue = extractForwardedParam(forwarded, "for");
            if (forValue != null) {
                return stripPort(forValue);
            }
        }

        var xForwardedFor = request.header("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }

        var realIp = request.header("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }

        var remote = request.remoteAddress();
        return remote != null && !remote.isBlank() ? remote : null;
    }

    /**
     * Extract a parameter from the first element of an RFC 7239 Forwarded header.
     *
     * @param forwarded header value
     * @param param     parameter name, e.g. {@code for}
     * @return the unquoted value, or null if absent
     */
    public static String extractForwardedParam(String forwarded, String param) {
        var entries = forwarded.split(",");
        if (entries.length == 0) {
            return null;
        }

        var firstEntry = entries[0].trim();
        for (var part : firstEntry.split(";")) {
            var keyValue = part.trim().split("=", 2);
            if (keyValue.length == 2 && keyValue[0].trim().equalsIgnoreCase(param)) {
                var value = keyValue[1].trim();
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1);
                }
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    // "[2001:db8::1]:4711" -> "2001:db8::1", "192.0.2.1:8080" -> "192.0.2.1"
    private static String stripPort(String value) {
        if (value.startsWith("[")) {
            var end = value.indexOf(']');
            return end > 0 ? value.substring(1, end) : value;
        }
        var colon = value.indexOf(':');
        if (colon > 0 && value.indexOf(':', colon + 1) < 0) {
            return value.substring(0, colon);
        }
        return value;
    }
}
