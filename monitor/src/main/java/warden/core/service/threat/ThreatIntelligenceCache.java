package warden.core.service.threat;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.ThreatIntelConfig;
import warden.core.model.common.RiskLevel;
import warden.core.model.threat.ReputationVerdict;
import warden.core.model.threat.ThreatRecord;
import warden.core.port.out.ThreatFeedClient;

/**
 * In-memory IP reputation cache refreshed from a {@link ThreatFeedClient}.
 *
 * <p>The cache state is an immutable snapshot behind an {@link AtomicReference}.
 * Lookups read the current snapshot without locking; refreshes and manual
 * changes build a new snapshot while holding {@code writeLock}.
 *
 * <p>Manual overrides ({@link #blacklist}, {@link #whitelist}, {@link #report})
 * take precedence over feed data and survive refreshes. Feed entries expire
 * after {@code entry-ttl}; a failed refresh keeps the previous snapshot.
 */
@ApplicationScoped
public class ThreatIntelligenceCache {

    private static final Logger LOG = Logger.getLogger(ThreatIntelligenceCache.class);

    private final ThreatFeedClient feedClient;
    private final ThreatIntelConfig config;
    private final Clock clock;
    private final Object writeLock = new Object();
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    @Inject
    public ThreatIntelligenceCache(ThreatFeedClient feedClient, ThreatIntelConfig config, Clock clock) {
        this.feedClient = feedClient;
        this.config = config;
        this.clock = clock;
    }

    void onStart(@Observes StartupEvent event) {
        scheduledRefresh()
                .subscribe()
                .with(v -> LOG.debug("Initial threat feed load finished"), e -> LOG.warn("Initial threat feed load failed", e));
    }

    /**
     * Look up the reputation of an address.
     *
     * <p>Whitelisted addresses are never threats. Blacklisted addresses are
     * critical threats. While the cache is stale and fail-closed is configured,
     * every other address is blocked.
     *
     * @param ipAddress the address to check
     * @return the verdict
     */
    public ReputationVerdict checkReputation(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return ReputationVerdict.clean(ipAddress, false);
        }
        if (!config.enabled()) {
            return ReputationVerdict.clean(ipAddress, false);
        }

        final var current = snapshot.get();
        final var now = clock.instant();
        final var stale = current.isStale(now, config);
        final var record = current.lookup(key(ipAddress), now);

        if (record.isPresent() && record.get().whitelisted()) {
            return ReputationVerdict.trusted(record.get(), stale);
        }
        if (record.isPresent() && record.get().blacklisted()) {
            return ReputationVerdict.fromRecord(record.get(), stale);
        }
        if (stale && config.failClosed()) {
            return ReputationVerdict.failClosed(ipAddress);
        }
        return record.map(r -> ReputationVerdict.fromRecord(r, stale))
                .orElseGet(() -> ReputationVerdict.clean(ipAddress, stale));
    }

    /**
     * Replace the feed data with a fresh fetch.
     *
     * @return number of feed entries loaded; fails with
     *     {@link ThreatFeedClient.ThreatFeedUnavailableException} when the feed cannot be read
     */
    public Uni<Integer> refresh() {
        return feedClient.fetch().map(records -> {
            final var now = clock.instant();
            final var expiresAt = now.plus(config.entryTtl());
            final var feed = new HashMap<String, FeedEntry>();
            for (var record : records) {
                feed.merge(
                        key(record.ipAddress()),
                        new FeedEntry(record, expiresAt),
                        (existing, added) -> new FeedEntry(existing.record().merge(added.record()), expiresAt));
            }
            synchronized (writeLock) {
                final var current = snapshot.get();
                snapshot.set(new Snapshot(Map.copyOf(feed), current.overrides(), now));
            }
            LOG.infof("Loaded %d threat records from %s feed", feed.size(), feedClient.name());
            return feed.size();
        });
    }

    /**
     * Periodic feed refresh. Failures are logged and the previous data is kept.
     */
    @Scheduled(
            every = "${warden.threat-intel.refresh-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> scheduledRefresh() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        return refresh()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            error,
                            "Threat feed refresh failed, serving data from {0}",
                            snapshot.get().refreshedAt());
                    return 0;
                })
                .replaceWithVoid();
    }

    public ThreatRecord blacklist(String ipAddress, String reason) {
        return putOverride(ThreatRecord.blacklisted(key(ipAddress), reason, clock.instant()));
    }

    public ThreatRecord whitelist(String ipAddress, String reason) {
        return putOverride(ThreatRecord.whitelisted(key(ipAddress), reason, clock.instant()));
    }

    /**
     * Record a threat report for an address, merging it into what is already known.
     *
     * @return the merged record
     */
    public ThreatRecord report(
            String ipAddress, String threatType, RiskLevel severity, int confidence, String description) {
        final var address = key(ipAddress);
        final var reported =
                ThreatRecord.reported(address, threatType, severity, confidence, description, clock.instant());
        synchronized (writeLock) {
            final var current = snapshot.get();
            final var merged = current.lookup(address, clock.instant())
                    .map(existing -> existing.merge(reported))
                    .orElse(reported);
            snapshot.set(current.withOverride(merged));
            return merged;
        }
    }

    /**
     * Drop any manual override and feed entry for an address.
     *
     * @return true if anything was removed
     */
    public boolean remove(String ipAddress) {
        final var address = key(ipAddress);
        if (address == null) {
            return false;
        }
        synchronized (writeLock) {
            final var current = snapshot.get();
            if (!current.overrides().containsKey(address) && !current.feed().containsKey(address)) {
                return false;
            }
            final var overrides = new HashMap<>(current.overrides());
            overrides.remove(address);
            final var feed = new HashMap<>(current.feed());
            feed.remove(address);
            snapshot.set(new Snapshot(Map.copyOf(feed), Map.copyOf(overrides), current.refreshedAt()));
            return true;
        }
    }

    public Optional<ThreatRecord> find(String ipAddress) {
        if (ipAddress == null) {
            return Optional.empty();
        }
        return snapshot.get().lookup(key(ipAddress), clock.instant());
    }

    /**
     * All live records, overrides taking precedence over feed entries.
     */
    public Collection<ThreatRecord> entries() {
        final var current = snapshot.get();
        final var now = clock.instant();
        final var result = new LinkedHashMap<String, ThreatRecord>();
        current.feed().forEach((ip, entry) -> {
            if (!entry.isExpired(now)) {
                result.put(ip, entry.record());
            }
        });
        result.putAll(current.overrides());
        return List.copyOf(result.values());
    }

    public boolean isStale() {
        return config.enabled() && snapshot.get().isStale(clock.instant(), config);
    }

    public Optional<Instant> lastRefresh() {
        return Optional.ofNullable(snapshot.get().refreshedAt());
    }

    // Every lookup and write goes through here so padded input hits the same entry.
    private static String key(String ipAddress) {
        return ipAddress == null ? null : ipAddress.trim();
    }

    private ThreatRecord putOverride(ThreatRecord record) {
        synchronized (writeLock) {
            snapshot.set(snapshot.get().withOverride(record));
        }
        LOG.infof("Manual threat override for %s: %s", record.ipAddress(), record.threatType());
        return record;
    }

    private record FeedEntry(ThreatRecord record, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private record Snapshot(Map<String, FeedEntry> feed, Map<String, ThreatRecord> overrides, Instant refreshedAt) {

        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of(), null);

        Optional<ThreatRecord> lookup(String ipAddress, Instant now) {
            final var override = overrides.get(ipAddress);
            if (override != null) {
                return Optional.of(override);
            }
            final var entry = feed.get(ipAddress);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.of(entry.record());
        }

        Snapshot withOverride(ThreatRecord record) {
            final var updated = new HashMap<>(overrides);
            updated.put(record.ipAddress(), record);
            return new Snapshot(feed, Map.copyOf(updated), refreshedAt);
        }

        // Never refreshed counts as stale.
        boolean isStale(Instant now, ThreatIntelConfig config) {
            return refreshedAt == null || !now.isBefore(refreshedAt.plus(config.staleAfter()));
        }
    }
}
