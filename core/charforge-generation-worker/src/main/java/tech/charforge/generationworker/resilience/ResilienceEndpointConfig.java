package tech.charforge.generationworker.resilience;

/**
 * Fully resolved resilience policy for a named endpoint.
 */
public record ResilienceEndpointConfig(
    String name,
    RetryPolicy retry,
    CircuitBreakerPolicy circuitBreaker,
    RateLimitPolicy rateLimit,
    long timeoutMs
) {
}
