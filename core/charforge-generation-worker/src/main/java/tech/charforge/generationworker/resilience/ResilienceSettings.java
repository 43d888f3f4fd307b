package tech.charforge.generationworker.resilience;

import java.util.HashMap;
import java.util.Map;

/**
 * Process-wide resilience defaults plus named endpoint overrides.
 */
public record ResilienceSettings(
    ResilienceDefaults defaults,
    Map<String, EndpointOverride> endpoints
) {

    public static final String NANO_BANANA = "nanoBanana";
    public static final String DATABASE = "database";
    public static final String STORAGE = "storage";

    public static final ResilienceDefaults BUILT_IN_DEFAULTS = new ResilienceDefaults(
        new RetryPolicy(3, 1000, 30000, 2.0, 0.1),
        new CircuitBreakerPolicy(5, 60000, 10000, 10),
        new RateLimitPolicy(60000, 100, false, false),
        30000
    );

    private static final Map<String, EndpointOverride> BUILT_IN_ENDPOINTS = Map.of(
        NANO_BANANA, new EndpointOverride(
            new RetryPolicy.Partial(5, 2000L, 60000L, 2.5, 0.2),
            new CircuitBreakerPolicy.Partial(3, 120000L, 30000L, 5),
            new RateLimitPolicy.Partial(60000L, 10, false, true),
            120000L),
        DATABASE, new EndpointOverride(
            new RetryPolicy.Partial(3, 500L, 5000L, 1.5, 0.05),
            new CircuitBreakerPolicy.Partial(10, 30000L, 5000L, 20),
            null,
            10000L),
        STORAGE, new EndpointOverride(
            new RetryPolicy.Partial(4, 1500L, 20000L, 2.0, 0.15),
            new CircuitBreakerPolicy.Partial(7, 45000L, 15000L, 15),
            null,
            60000L)
    );

    private static final ResilienceSettings BUILT_IN = new ResilienceSettings(BUILT_IN_DEFAULTS, BUILT_IN_ENDPOINTS);

    public ResilienceSettings {
        endpoints = endpoints == null ? Map.of() : Map.copyOf(endpoints);
    }

    public static ResilienceSettings builtIn() {
        return BUILT_IN;
    }

    /**
     * Returns a copy with the given endpoint override added or replaced.
     */
    public ResilienceSettings withEndpoint(String name, EndpointOverride override) {
        Map<String, EndpointOverride> copy = new HashMap<>(endpoints);
        copy.put(name, override);
        return new ResilienceSettings(defaults, copy);
    }

    public ResilienceSettings withDefaults(ResilienceDefaults newDefaults) {
        return new ResilienceSettings(newDefaults, endpoints);
    }
}
