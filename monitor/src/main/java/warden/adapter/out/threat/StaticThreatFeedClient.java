package warden.adapter.out.threat;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.config.ThreatIntelConfig;
import warden.core.model.threat.ThreatRecord;
import warden.core.port.out.ThreatFeedClient;

/**
 * Feed built from the {@code warden.threat-intel.blacklist} and
 * {@code warden.threat-intel.whitelist} configuration entries.
 */
public class StaticThreatFeedClient implements ThreatFeedClient {

    private final List<String> blacklist;
    private final List<String> whitelist;
    private final Clock clock;

    public StaticThreatFeedClient(List<String> blacklist, List<String> whitelist, Clock clock) {
        this.blacklist = List.copyOf(blacklist);
        this.whitelist = List.copyOf(whitelist);
        this.clock = clock;
    }

    public static StaticThreatFeedClient from(ThreatIntelConfig config, Clock clock) {
        return new StaticThreatFeedClient(
                config.blacklist().orElse(List.of()), config.whitelist().orElse(List.of()), clock);
    }

    @Override
    public String name() {
        return "static";
    }

    @Override
    public Uni<List<ThreatRecord>> fetch() {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var records = new ArrayList<ThreatRecord>(blacklist.size() + whitelist.size());
            for (var ip : blacklist) {
                records.add(ThreatRecord.blacklisted(ip.trim(), "Configured blacklist", now));
            }
            for (var ip : whitelist) {
                records.add(ThreatRecord.whitelisted(ip.trim(), "Configured whitelist", now));
            }
            return records;
        });
    }
}
