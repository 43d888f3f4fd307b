package tech.charforge.generationworker.resilience;

/**
 * Retry parameters for calls to one endpoint.
 *
 * @param maxAttempts       total attempts including the first call
 * @param baseDelayMs       delay before the second attempt
 * @param maxDelayMs        upper bound for any single delay
 * @param backoffMultiplier growth factor between consecutive delays
 * @param jitterFactor      relative random spread applied to each delay (0.1 = ±10%)
 */
public record RetryPolicy(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double backoffMultiplier,
    double jitterFactor
) {

    /**
     * Partial retry settings. Null fields fall back to the base policy.
     */
    public record Partial(
        Integer maxAttempts,
        Long baseDelayMs,
        Long maxDelayMs,
        Double backoffMultiplier,
        Double jitterFactor
    ) {

        public RetryPolicy mergeOver(RetryPolicy base) {
            return new RetryPolicy(
                maxAttempts != null ? maxAttempts : base.maxAttempts(),
                baseDelayMs != null ? baseDelayMs : base.baseDelayMs(),
                maxDelayMs != null ? maxDelayMs : base.maxDelayMs(),
                backoffMultiplier != null ? backoffMultiplier : base.backoffMultiplier(),
                jitterFactor != null ? jitterFactor : base.jitterFactor()
            );
        }

        /**
         * Field-by-field overlay: this override's fields win, gaps come from {@code fallback}.
         */
        public Partial over(Partial fallback) {
            if (fallback == null) {
                return this;
            }
            return new Partial(
                maxAttempts != null ? maxAttempts : fallback.maxAttempts(),
                baseDelayMs != null ? baseDelayMs : fallback.baseDelayMs(),
                maxDelayMs != null ? maxDelayMs : fallback.maxDelayMs(),
                backoffMultiplier != null ? backoffMultiplier : fallback.backoffMultiplier(),
                jitterFactor != null ? jitterFactor : fallback.jitterFactor()
            );
        }
    }
}
