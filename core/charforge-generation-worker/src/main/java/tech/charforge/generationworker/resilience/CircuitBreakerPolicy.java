package tech.charforge.generationworker.resilience;

/**
 * Circuit breaker parameters for one endpoint.
 *
 * @param failureThreshold   failures within the monitoring window that open the breaker
 * @param resetTimeoutMs     how long the breaker stays open before probing again
 * @param monitoringPeriodMs length of the sliding window of observed calls
 * @param minimumThroughput  calls required in the window before the breaker may open
 */
public record CircuitBreakerPolicy(
    int failureThreshold,
    long resetTimeoutMs,
    long monitoringPeriodMs,
    int minimumThroughput
) {

    /**
     * Failure threshold expressed as a percentage of the minimum throughput,
     * clamped to [1, 100].
     */
    public float failureRatePercent() {
        if (minimumThroughput <= 0) {
            return 100f;
        }
        float rate = 100f * failureThreshold / minimumThroughput;
        return Math.max(1f, Math.min(100f, rate));
    }

    /**
     * Partial circuit breaker settings. Null fields fall back to the base policy.
     */
    public record Partial(
        Integer failureThreshold,
        Long resetTimeoutMs,
        Long monitoringPeriodMs,
        Integer minimumThroughput
    ) {

        public CircuitBreakerPolicy mergeOver(CircuitBreakerPolicy base) {
            return new CircuitBreakerPolicy(
                failureThreshold != null ? failureThreshold : base.failureThreshold(),
                resetTimeoutMs != null ? resetTimeoutMs : base.resetTimeoutMs(),
                monitoringPeriodMs != null ? monitoringPeriodMs : base.monitoringPeriodMs(),
                minimumThroughput != null ? minimumThroughput : base.minimumThroughput()
            );
        }

        public Partial over(Partial fallback) {
            if (fallback == null) {
                return this;
            }
            return new Partial(
                failureThreshold != null ? failureThreshold : fallback.failureThreshold(),
                resetTimeoutMs != null ? resetTimeoutMs : fallback.resetTimeoutMs(),
                monitoringPeriodMs != null ? monitoringPeriodMs : fallback.monitoringPeriodMs(),
                minimumThroughput != null ? minimumThroughput : fallback.minimumThroughput()
            );
        }
    }
}
