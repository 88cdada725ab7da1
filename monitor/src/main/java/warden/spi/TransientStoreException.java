package warden.spi;

/**
 * Exception raised when a backing store (baselines, sessions, failure counters)
 * is temporarily unavailable.
 *
 * <p>Callers log it and continue in degraded mode; it never fails a request.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
