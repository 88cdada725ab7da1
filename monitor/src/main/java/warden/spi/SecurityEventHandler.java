package warden.spi;

/**
 * Service Provider Interface for security event handlers.
 *
 * <p>Handlers are discovered through {@link java.util.ServiceLoader} and invoked
 * in descending priority order. Register an implementation in
 * {@code META-INF/services/warden.spi.SecurityEventHandler}.
 *
 * <p>Handlers run on the dispatcher thread, never on the request path. An
 * exception thrown by one handler is logged and does not stop the others.
 */
public interface SecurityEventHandler {

    /**
     * Unique handler name, used in logs.
     */
    String name();

    default String description() {
        return name() + " security event handler";
    }

    /**
     * Higher priorities run first.
     */
    default int priority() {
        return 0;
    }

    /**
     * Whether the handler can run in the current environment.
     */
    default boolean isAvailable() {
        return true;
    }

    void handle(SecurityEvent event);

    default void close() {}
}
