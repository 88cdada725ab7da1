package warden.core.port.out;

import java.util.Set;

import io.smallrye.mutiny.Uni;

/**
 * Outbound port for per-user device trust.
 */
public interface DeviceTrustRepository {

    Uni<Boolean> isTrusted(String userId, String device);

    /**
     * Trust or distrust a device for a user.
     *
     * @return completion
     */
    Uni<Void> setTrusted(String userId, String device, boolean trusted);

    Uni<Set<String>> trustedDevices(String userId);
}
