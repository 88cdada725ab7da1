package warden.core.config;

/**
 * Thrown at startup when a configured limit, weight or threshold is invalid.
 *
 * <p>This is the only error the security core lets escape to its callers; every
 * runtime fault degrades to a conservative default instead.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
