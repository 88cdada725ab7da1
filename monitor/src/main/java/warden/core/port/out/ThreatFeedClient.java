package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.threat.ThreatRecord;

/**
 * Source of IP reputation data for the threat intelligence cache.
 */
public interface ThreatFeedClient {

    /**
     * Short name used in logs.
     */
    String name();

    /**
     * Fetch the full current feed.
     *
     * @return all records; fails with {@link ThreatFeedUnavailableException} when the feed cannot be read
     */
    Uni<List<ThreatRecord>> fetch();

    /**
     * Thrown when the feed cannot be fetched. The cache keeps serving its last snapshot.
     */
    class ThreatFeedUnavailableException extends RuntimeException {

        public ThreatFeedUnavailableException(String message) {
            super(message);
        }

        public ThreatFeedUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
