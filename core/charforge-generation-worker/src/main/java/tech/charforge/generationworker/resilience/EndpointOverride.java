package tech.charforge.generationworker.resilience;

/**
 * Per-endpoint override. Each section, and each field inside a section, is optional.
 */
public record EndpointOverride(
    RetryPolicy.Partial retry,
    CircuitBreakerPolicy.Partial circuitBreaker,
    RateLimitPolicy.Partial rateLimit,
    Long timeoutMs
) {

    public static EndpointOverride none() {
        return new EndpointOverride(null, null, null, null);
    }

    /**
     * Overlay this override on {@code fallback}, field by field.
     */
    public EndpointOverride over(EndpointOverride fallback) {
        if (fallback == null) {
            return this;
        }
        return new EndpointOverride(
            retry != null ? retry.over(fallback.retry()) : fallback.retry(),
            circuitBreaker != null ? circuitBreaker.over(fallback.circuitBreaker()) : fallback.circuitBreaker(),
            rateLimit != null ? rateLimit.over(fallback.rateLimit()) : fallback.rateLimit(),
            timeoutMs != null ? timeoutMs : fallback.timeoutMs()
        );
    }
}
