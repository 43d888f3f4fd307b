package tech.charforge.generationworker.health;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Circuit breaker statistics
 */
@Schema(description = "Circuit breaker statistics and state for one provider endpoint")
public record CircuitBreakerStats(
    @Schema(description = "Endpoint name", example = "nanoBanana")
    String name,

    @Schema(description = "Circuit breaker state", example = "CLOSED")
    String state,

    @Schema(description = "Number of successful calls in the window", example = "120")
    long successfulCalls,

    @Schema(description = "Number of failed calls in the window", example = "0")
    long failedCalls,

    @Schema(description = "Number of calls rejected while open", example = "0")
    long rejectedCalls,

    @Schema(description = "Failure rate in percent, -1 until the minimum number of calls is reached",
        example = "-1.0")
    float failureRate,

    @Schema(description = "Number of calls in the sliding window", example = "5")
    int bufferedCalls,

    @Schema(description = "Remaining rate limit permits for the current window", example = "10")
    int availableRatePermits
) {}
