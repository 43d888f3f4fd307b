package tech.charforge.generationworker.config;

import io.smallrye.config.ConfigMapping;

import java.util.Map;
import java.util.Optional;

/**
 * Overrides for the built-in resilience policy. Every key is optional;
 * anything not set keeps its built-in value.
 *
 * <pre>
 * resilience.defaults.retry.max-attempts=4
 * resilience.endpoints.nanoBanana.rate-limit.max-requests=20
 * resilience.endpoints.nanoBanana.timeout-ms=90000
 * </pre>
 */
@ConfigMapping(prefix = "resilience")
public interface ResilienceConfigMapping {

    Section defaults();

    Map<String, Section> endpoints();

    interface Section {

        Retry retry();

        CircuitBreaker circuitBreaker();

        RateLimit rateLimit();

        Optional<Long> timeoutMs();
    }

    interface Retry {
        Optional<Integer> maxAttempts();

        Optional<Long> baseDelayMs();

        Optional<Long> maxDelayMs();

        Optional<Double> backoffMultiplier();

        Optional<Double> jitterFactor();
    }

    interface CircuitBreaker {
        Optional<Integer> failureThreshold();

        Optional<Long> resetTimeoutMs();

        Optional<Long> monitoringPeriodMs();

        Optional<Integer> minimumThroughput();
    }

    interface RateLimit {
        Optional<Long> windowMs();

        Optional<Integer> maxRequests();

        Optional<Boolean> skipSuccessfulRequests();

        Optional<Boolean> skipFailedRequests();
    }
}
