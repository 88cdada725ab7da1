package warden.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the threat intelligence cache.
 *
 * <p>Configuration prefix: {@code warden.threat-intel}
 *
 * <p>When {@code feed.url} is set, reputation data is pulled from that HTTP
 * endpoint; otherwise the static {@code blacklist} and {@code whitelist} entries
 * are used as the feed.
 *
 * @see warden.core.service.threat.ThreatIntelligenceCache
 */
@ConfigMapping(prefix = "warden.threat-intel")
public interface ThreatIntelConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Interval between feed refreshes.
     *
     * @return refresh interval (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration refreshInterval();

    /**
     * Lifetime of a cached feed entry. Expired entries are ignored until the next
     * successful refresh replaces them.
     *
     * @return entry TTL (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration entryTtl();

    /**
     * Time without a successful refresh after which the cache is stale.
     *
     * @return staleness threshold (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration staleAfter();

    /**
     * Block every non-whitelisted address while the cache is stale.
     *
     * @return true to fail closed (default: false)
     */
    @WithDefault("false")
    boolean failClosed();

    /**
     * External feed settings.
     */
    FeedConfig feed();

    /**
     * Addresses always treated as critical threats.
     */
    Optional<List<String>> blacklist();

    /**
     * Addresses never treated as threats.
     */
    Optional<List<String>> whitelist();

    interface FeedConfig {

        /**
         * URL returning a JSON array of threat records.
         */
        Optional<String> url();

        @WithDefault("PT5S")
        Duration timeout();
    }
}
