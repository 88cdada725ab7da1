package warden.adapter.out.geo;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import warden.core.model.identity.RequestMetadata;
import warden.core.port.out.GeolocationResolver;

/**
 * Reads the location an edge proxy or CDN attached to the request.
 *
 * <p>Uses {@code X-Geo-City} and {@code X-Geo-Country} when present, else
 * {@code CF-IPCountry}. Requests without either header have no location.
 */
@ApplicationScoped
public class HeaderGeolocationResolver implements GeolocationResolver {

    static final String CITY_HEADER = "X-Geo-City";
    static final String COUNTRY_HEADER = "X-Geo-Country";
    static final String CLOUDFLARE_COUNTRY_HEADER = "CF-IPCountry";

    @Override
    public Optional<String> resolve(String clientIp, RequestMetadata request) {
        final var city = trimToNull(request.header(CITY_HEADER));
        var country = trimToNull(request.header(COUNTRY_HEADER));
        if (country == null) {
            country = trimToNull(request.header(CLOUDFLARE_COUNTRY_HEADER));
        }
        // "XX" is Cloudflare's marker for an unknown country
        if (country == null || "XX".equalsIgnoreCase(country)) {
            return Optional.ofNullable(city);
        }
        return Optional.of(city != null ? city + ", " + country : country);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
