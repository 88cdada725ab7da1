package warden.core.service.behavior;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import warden.core.config.AnomalyConfig;

/**
 * Per-user action rate over the last minute.
 */
@ApplicationScoped
public class ActivityTracker {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Clock clock;
    private final Cache<String, Deque<Instant>> history;

    @Inject
    public ActivityTracker(AnomalyConfig config, Clock clock) {
        this.clock = clock;
        this.history = Caffeine.newBuilder()
                .maximumSize(config.cacheSize())
                .expireAfterAccess(WINDOW.multipliedBy(2))
                .build();
    }

    /**
     * Record an action and return the user's actions in the last minute, including this one.
     *
     * @param userId the user
     * @return actions per minute
     */
    public double recordAction(String userId) {
        final var now = clock.instant();
        final var cutoff = now.minus(WINDOW);
        final var count = new int[1];
        history.asMap().compute(userId, (key, existing) -> {
            final var deque = existing != null ? existing : new ArrayDeque<Instant>();
            deque.addLast(now);
            while (!deque.isEmpty() && !deque.peekFirst().isAfter(cutoff)) {
                deque.pollFirst();
            }
            count[0] = deque.size();
            return deque;
        });
        return count[0];
    }

    public void forget(String userId) {
        history.invalidate(userId);
    }
}
