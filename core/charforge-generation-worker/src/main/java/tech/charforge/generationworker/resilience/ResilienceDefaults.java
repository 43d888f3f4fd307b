package tech.charforge.generationworker.resilience;

/**
 * Process-wide resilience policy applied to endpoints without overrides.
 */
public record ResilienceDefaults(
    RetryPolicy retry,
    CircuitBreakerPolicy circuitBreaker,
    RateLimitPolicy rateLimit,
    long timeoutMs
) {
}
