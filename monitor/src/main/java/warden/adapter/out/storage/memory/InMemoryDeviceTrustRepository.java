package warden.adapter.out.storage.memory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import warden.core.port.out.DeviceTrustRepository;

/**
 * In-memory implementation of DeviceTrustRepository.
 */
public class InMemoryDeviceTrustRepository implements DeviceTrustRepository {

    private final ConcurrentMap<String, Set<String>> trusted = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> isTrusted(String userId, String device) {
        return Uni.createFrom().item(() -> {
            final var devices = trusted.get(userId);
            return devices != null && devices.contains(device);
        });
    }

    @Override
    public Uni<Void> setTrusted(String userId, String device, boolean trust) {
        return Uni.createFrom().item(() -> {
            if (trust) {
                trusted.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(device);
            } else {
                trusted.computeIfPresent(userId, (k, devices) -> {
                    devices.remove(device);
                    return devices.isEmpty() ? null : devices;
                });
            }
            return null;
        });
    }

    @Override
    public Uni<Set<String>> trustedDevices(String userId) {
        return Uni.createFrom().item(() -> Set.copyOf(trusted.getOrDefault(userId, Set.of())));
    }
}
