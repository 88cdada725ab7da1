package warden.core.service.ratelimit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.InvalidConfigurationException;
import warden.core.config.RateLimitingConfig;
import warden.core.model.ratelimit.EffectiveRateLimit;
import warden.core.model.ratelimit.EndpointClass;

/**
 * Maps request paths to configured endpoint classes.
 *
 * <p>The longest matching path prefix wins. Paths matching no class belong to
 * the {@code default} class.
 */
@ApplicationScoped
public class EndpointClassifier {

    private final List<PrefixRule> rules;
    private final EndpointClass defaultClass;

    @Inject
    public EndpointClassifier(RateLimitingConfig config) {
        this.defaultClass = new EndpointClass(
                EndpointClass.DEFAULT_NAME,
                limit(EndpointClass.DEFAULT_NAME, config.defaultMaxRequests(), config.defaultWindowSeconds()),
                false);

        final var collected = new ArrayList<PrefixRule>();
        config.endpointClasses().forEach((name, classConfig) -> {
            final var endpointClass = new EndpointClass(
                    name, limit(name, classConfig.maxRequests(), classConfig.windowSeconds()), classConfig.authentication());
            for (var prefix : classConfig.pathPrefixes()) {
                if (prefix == null || prefix.isBlank()) {
                    throw new InvalidConfigurationException("Endpoint class '" + name + "' has a blank path prefix");
                }
                collected.add(new PrefixRule(prefix.trim(), endpointClass));
            }
        });
        collected.sort(Comparator.comparingInt((PrefixRule r) -> r.prefix().length()).reversed());
        this.rules = List.copyOf(collected);
    }

    public EndpointClass classify(String path) {
        if (path == null) {
            return defaultClass;
        }
        for (var rule : rules) {
            if (path.startsWith(rule.prefix())) {
                return rule.endpointClass();
            }
        }
        return defaultClass;
    }

    public EndpointClass defaultClass() {
        return defaultClass;
    }

    /**
     * Look up a class by name, falling back to the default class.
     *
     * @param name class name
     * @return the class
     */
    public EndpointClass byName(String name) {
        for (var rule : rules) {
            if (rule.endpointClass().name().equals(name)) {
                return rule.endpointClass();
            }
        }
        return defaultClass;
    }

    private static EffectiveRateLimit limit(String name, int maxRequests, int windowSeconds) {
        if (maxRequests < 1 || windowSeconds < 1) {
            throw new InvalidConfigurationException(String.format(
                    "Endpoint class '%s' needs positive max-requests and window-seconds, got %d/%ds",
                    name, maxRequests, windowSeconds));
        }
        return new EffectiveRateLimit(maxRequests, windowSeconds);
    }

    private record PrefixRule(String prefix, EndpointClass endpointClass) {}
}
