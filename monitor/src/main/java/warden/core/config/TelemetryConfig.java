package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.spi.SecurityEvent;

/**
 * Configuration for security event dispatching.
 *
 * <p>Configuration prefix: {@code warden.telemetry}
 */
@ConfigMapping(prefix = "warden.telemetry")
public interface TelemetryConfig {

    /**
     * Security event settings.
     */
    SecurityConfig security();

    interface SecurityConfig {

        /**
         * Dispatch security events to the registered handlers.
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Events waiting for the handler thread before new ones are dropped.
         */
        @WithDefault("1000")
        int queueCapacity();

        /**
         * Events below this severity are not dispatched.
         */
        @WithDefault("INFO")
        SecurityEvent.Severity minimumSeverity();
    }
}
