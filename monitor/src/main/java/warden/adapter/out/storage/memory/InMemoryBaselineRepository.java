package warden.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.behavior.UserBaseline;
import warden.core.port.out.BaselineRepository;

/**
 * In-memory baseline storage for single-instance deployments and tests.
 */
public class InMemoryBaselineRepository implements BaselineRepository {

    private final ConcurrentMap<String, UserBaseline> baselines = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<UserBaseline>> find(String userId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(baselines.get(userId)));
    }

    @Override
    public Uni<Boolean> save(UserBaseline baseline) {
        return Uni.createFrom().item(() -> {
            final var stored = baselines.merge(
                    baseline.userId(),
                    baseline,
                    (existing, incoming) -> incoming.sampleCount() >= existing.sampleCount() ? incoming : existing);
            return stored == baseline;
        });
    }

    @Override
    public Uni<Void> delete(String userId) {
        return Uni.createFrom().item(() -> {
            baselines.remove(userId);
            return null;
        });
    }

    public int size() {
        return baselines.size();
    }
}
