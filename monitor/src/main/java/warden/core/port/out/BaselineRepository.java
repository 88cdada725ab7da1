package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.behavior.UserBaseline;

/**
 * Durable storage for behavioral baselines.
 *
 * <p>Writes arrive asynchronously and may be reordered; implementations must keep
 * the stored baseline with the highest {@code sampleCount} so that a late write
 * never rolls a baseline back.
 */
public interface BaselineRepository {

    Uni<Optional<UserBaseline>> find(String userId);

    /**
     * Store a baseline unless a newer one (higher sample count) is already stored.
     *
     * @param baseline the baseline
     * @return true if written
     */
    Uni<Boolean> save(UserBaseline baseline);

    Uni<Void> delete(String userId);
}
