package warden.adapter.out.threat;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import warden.core.config.ThreatIntelConfig;
import warden.core.port.out.ThreatFeedClient;

/**
 * Chooses the threat feed: HTTP when {@code warden.threat-intel.feed.url} is set,
 * otherwise the configured static lists.
 */
@ApplicationScoped
public class ThreatFeedClientProducer {

    private static final Logger LOG = Logger.getLogger(ThreatFeedClientProducer.class);

    private final ThreatIntelConfig config;
    private final Vertx vertx;
    private final Clock clock;

    @Inject
    public ThreatFeedClientProducer(ThreatIntelConfig config, Vertx vertx, Clock clock) {
        this.config = config;
        this.vertx = vertx;
        this.clock = clock;
    }

    @Produces
    @ApplicationScoped
    public ThreatFeedClient produceThreatFeedClient() {
        final var url = config.feed().url().filter(u -> !u.isBlank());
        if (url.isPresent()) {
            LOG.infof("Using HTTP threat feed at %s", url.get());
            return new HttpThreatFeedClient(vertx, url.get(), config.feed().timeout(), clock);
        }
        LOG.info("Using static threat feed from configuration");
        return StaticThreatFeedClient.from(config, clock);
    }
}
