package warden.core.service.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.identity.ClientIdentity;
import warden.core.model.identity.RequestMetadata;

@DisplayName("ClientIdentityResolver")
class ClientIdentityResolverTest {

    private final ClientIdentityResolver resolver = new ClientIdentityResolver();

    @Nested
    @DisplayName("resolve()")
    class ResolveTests {

        @Test
        @DisplayName("should prefer the authenticated user id")
        void shouldPreferUserId() {
            final var request = new RequestMetadata("alice", "10.0.0.1", "/api/tasks", Map.of());

            final var identity = resolver.resolve(request);

            assertTrue(identity.isUser());
            assertEquals("user:alice", identity.bucketKey());
        }

        @Test
        @DisplayName("should fall back to the first forwarded address")
        void shouldUseForwardedFor() {
            final var request = new RequestMetadata(
                    null, "10.0.0.1", "/", Map.of("x-forwarded-for", "198.51.100.7, 10.0.0.2"));

            final var identity = resolver.resolve(request);

            assertFalse(identity.isUser());
            assertEquals("ip:198.51.100.7", identity.bucketKey());
        }

        @Test
        @DisplayName("should use the unknown bucket when no address exists")
        void shouldUseUnknownBucket() {
            final var request = new RequestMetadata(" ", null, "/", Map.of());

            final var identity = resolver.resolve(request);

            assertEquals(ClientIdentity.UNKNOWN_IP, identity.key());
        }
    }

    @Nested
    @DisplayName("ClientIpExtractor")
    class ExtractorTests {

        @Test
        @DisplayName("should prefer the Forwarded header and strip ports")
        void shouldParseForwarded() {
            final var request = new RequestMetadata(null, "10.0.0.1", "/", Map.of(
                    "Forwarded", "for=\"[2001:db8::1]:4711\";proto=https, for=10.0.0.3",
                    "X-Forwarded-For", "198.51.100.7"));

            assertEquals("2001:db8::1", ClientIpExtractor.extract(request));
        }

        @Test
        @DisplayName("should strip the port from an IPv4 Forwarded value")
        void shouldStripIpv4Port() {
            final var request = new RequestMetadata(null, null, "/", Map.of("Forwarded", "for=192.0.2.60:8080"));

            assertEquals("192.0.2.60", ClientIpExtractor.extract(request));
        }

        @Test
        @DisplayName("should fall back to X-Real-IP and then the peer address")
        void shouldFallBack() {
            assertEquals("192.0.2.1", ClientIpExtractor.extract(
                    new RequestMetadata(null, "10.0.0.1", "/", Map.of("X-Real-IP", "192.0.2.1"))));
            assertEquals("10.0.0.1", ClientIpExtractor.extract(new RequestMetadata(null, "10.0.0.1", "/", Map.of())));
        }
    }
}
