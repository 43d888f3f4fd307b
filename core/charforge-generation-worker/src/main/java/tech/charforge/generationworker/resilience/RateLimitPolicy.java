package tech.charforge.generationworker.resilience;

/**
 * Rate limit for outbound calls to one endpoint.
 *
 * @param windowMs               length of a rate limit window
 * @param maxRequests            calls allowed per window
 * @param skipSuccessfulRequests successful calls do not count against the limit
 * @param skipFailedRequests     failed calls do not count against the limit
 */
public record RateLimitPolicy(
    long windowMs,
    int maxRequests,
    boolean skipSuccessfulRequests,
    boolean skipFailedRequests
) {

    public boolean countsUpFront() {
        return !skipSuccessfulRequests && !skipFailedRequests;
    }

    /**
     * Partial rate limit settings. Null fields fall back to the base policy.
     */
    public record Partial(
        Long windowMs,
        Integer maxRequests,
        Boolean skipSuccessfulRequests,
        Boolean skipFailedRequests
    ) {

        public RateLimitPolicy mergeOver(RateLimitPolicy base) {
            return new RateLimitPolicy(
                windowMs != null ? windowMs : base.windowMs(),
                maxRequests != null ? maxRequests : base.maxRequests(),
                skipSuccessfulRequests != null ? skipSuccessfulRequests : base.skipSuccessfulRequests(),
                skipFailedRequests != null ? skipFailedRequests : base.skipFailedRequests()
            );
        }

        public Partial over(Partial fallback) {
            if (fallback == null) {
                return this;
            }
            return new Partial(
                windowMs != null ? windowMs : fallback.windowMs(),
                maxRequests != null ? maxRequests : fallback.maxRequests(),
                skipSuccessfulRequests != null ? skipSuccessfulRequests : fallback.skipSuccessfulRequests(),
                skipFailedRequests != null ? skipFailedRequests : fallback.skipFailedRequests()
            );
        }
    }
}
