package tech.charforge.generationworker.config;

import tech.charforge.generationworker.resilience.CircuitBreakerPolicy;
import tech.charforge.generationworker.resilience.EndpointOverride;
import tech.charforge.generationworker.resilience.RateLimitPolicy;
import tech.charforge.generationworker.resilience.ResilienceConfig;
import tech.charforge.generationworker.resilience.ResilienceDefaults;
import tech.charforge.generationworker.resilience.ResilienceSettings;
import tech.charforge.generationworker.resilience.RetryPolicy;

import java.util.Map;

/**
 * Builds {@link ResilienceSettings} from the {@code resilience.*} configuration,
 * layering configured values over the built-in table.
 */
public final class ResilienceSettingsFactory {

    private ResilienceSettingsFactory() {
        // Utility class
    }

    public static ResilienceSettings fromConfig(ResilienceConfigMapping mapping) {
        ResilienceSettings builtIn = ResilienceSettings.builtIn();

        ResilienceSettings settings = builtIn;
        if (mapping.defaults() != null) {
            // Resolve an unnamed endpoint so the configured defaults merge over the built-in ones
            ResilienceSettings defaultsOnly = new ResilienceSettings(builtIn.defaults(),
                Map.of("", toOverride(mapping.defaults())));
            var resolved = ResilienceConfig.getEndpointConfig("", defaultsOnly);
            settings = builtIn.withDefaults(new ResilienceDefaults(
                resolved.retry(), resolved.circuitBreaker(), resolved.rateLimit(), resolved.timeoutMs()));
        }

        for (Map.Entry<String, ResilienceConfigMapping.Section> entry : mapping.endpoints().entrySet()) {
            EndpointOverride configured = toOverride(entry.getValue());
            EndpointOverride builtInOverride = builtIn.endpoints().get(entry.getKey());
            settings = settings.withEndpoint(entry.getKey(), configured.over(builtInOverride));
        }
        return settings;
    }

    static EndpointOverride toOverride(ResilienceConfigMapping.Section section) {
        ResilienceConfigMapping.Retry retry = section.retry();
        ResilienceConfigMapping.CircuitBreaker circuitBreaker = section.circuitBreaker();
        ResilienceConfigMapping.RateLimit rateLimit = section.rateLimit();

        return new EndpointOverride(
            retry == null ? null : new RetryPolicy.Partial(
                retry.maxAttempts().orElse(null),
                retry.baseDelayMs().orElse(null),
                retry.maxDelayMs().orElse(null),
                retry.backoffMultiplier().orElse(null),
                retry.jitterFactor().orElse(null)),
            circuitBreaker == null ? null : new CircuitBreakerPolicy.Partial(
                circuitBreaker.failureThreshold().orElse(null),
                circuitBreaker.resetTimeoutMs().orElse(null),
                circuitBreaker.monitoringPeriodMs().orElse(null),
                circuitBreaker.minimumThroughput().orElse(null)),
            rateLimit == null ? null : new RateLimitPolicy.Partial(
                rateLimit.windowMs().orElse(null),
                rateLimit.maxRequests().orElse(null),
                rateLimit.skipSuccessfulRequests().orElse(null),
                rateLimit.skipFailedRequests().orElse(null)),
            section.timeoutMs().orElse(null)
        );
    }
}
