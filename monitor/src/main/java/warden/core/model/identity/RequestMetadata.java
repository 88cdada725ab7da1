package warden.core.model.identity;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * The parts of an inbound request the security core needs.
 *
 * <p>Header names are matched case-insensitively.
 *
 * @param authenticatedUserId user id established by the authentication layer, or null
 * @param remoteAddress       socket peer address, or null when unknown
 * @param path                request path
 * @param headers             request headers (first value per name)
 */
public record RequestMetadata(String authenticatedUserId, String remoteAddress, String path, Map<String, String> headers) {

    public RequestMetadata {
        final var normalized = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            normalized.putAll(headers);
        }
        headers = Collections.unmodifiableMap(normalized);
        path = path != null ? path : "/";
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String userAgent() {
        return headers.get("User-Agent");
    }
}
