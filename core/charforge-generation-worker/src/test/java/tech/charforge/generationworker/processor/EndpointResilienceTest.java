package tech.charforge.generationworker.processor;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;
import tech.charforge.generationworker.provider.GenerationException;
import tech.charforge.generationworker.resilience.CircuitBreakerPolicy;
import tech.charforge.generationworker.resilience.RateLimitPolicy;
import tech.charforge.generationworker.resilience.ResilienceEndpointConfig;
import tech.charforge.generationworker.resilience.RetryPolicy;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the retry, rate limit and circuit breaker chain.
 * Delays are kept at a few milliseconds so retries do not slow the suite.
 */
class EndpointResilienceTest {

    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, 1, 5, 2.0, 0.0);
    private static final RetryPolicy NO_RETRY = new RetryPolicy(1, 1, 5, 2.0, 0.0);
    private static final CircuitBreakerPolicy LENIENT_BREAKER = new CircuitBreakerPolicy(100, 60000, 10000, 100);
    private static final RateLimitPolicy UNLIMITED = new RateLimitPolicy(60000, 1000, false, false);

    private static EndpointResilience resilience(RetryPolicy retry, CircuitBreakerPolicy breaker,
                                                 RateLimitPolicy rateLimit) {
        ResilienceEndpointConfig config = new ResilienceEndpointConfig("test", retry, breaker, rateLimit, 5000);
        return new EndpointResilience(config,
            Retry.of("test", ResilienceRegistry.retryConfig(retry)),
            RateLimiter.of("test", ResilienceRegistry.rateLimiterConfig(rateLimit)),
            CircuitBreaker.of("test", ResilienceRegistry.circuitBreakerConfig(breaker)));
    }

    private static Supplier<String> failingTimes(int failures, RuntimeException error, AtomicInteger calls) {
        return () -> {
            if (calls.incrementAndGet() <= failures) {
                throw error;
            }
            return "ok";
        };
    }

    @Test
    void shouldRetryTransientFailureUntilSuccess() {
        // Given
        EndpointResilience chain = resilience(FAST_RETRY, LENIENT_BREAKER, UNLIMITED);
        AtomicInteger calls = new AtomicInteger();

        // When
        String result = chain.execute(failingTimes(2,
            GenerationException.http(503, "SERVICE_UNAVAILABLE", "down", null), calls));

        // Then
        assertEquals("ok", result);
        assertEquals(3, calls.get(), "Two failures then one success");
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        EndpointResilience chain = resilience(FAST_RETRY, LENIENT_BREAKER, UNLIMITED);
        AtomicInteger calls = new AtomicInteger();

        GenerationException error = assertThrows(GenerationException.class, () -> chain.execute(
            failingTimes(10, GenerationException.http(502, "API_ERROR", "bad gateway", null), calls)));

        assertEquals("API_ERROR", error.code());
        assertEquals(3, calls.get());
    }

    @Test
    void shouldNotRetryPermanentFailure() {
        EndpointResilience chain = resilience(FAST_RETRY, LENIENT_BREAKER, UNLIMITED);
        AtomicInteger calls = new AtomicInteger();

        GenerationException error = assertThrows(GenerationException.class, () -> chain.execute(
            failingTimes(10, GenerationException.validation("Prompt is required"), calls)));

        assertEquals("VALIDATION_ERROR", error.code());
        assertEquals(1, calls.get());
    }

    @Test
    void shouldWrapUnexpectedExceptions() {
        EndpointResilience chain = resilience(NO_RETRY, LENIENT_BREAKER, UNLIMITED);

        GenerationException error = assertThrows(GenerationException.class, () -> chain.execute(() -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals("UNKNOWN_ERROR", error.code());
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldRejectCallsBeyondRateLimitWithoutRetrying() {
        // Given - two calls per minute, counted before the call
        EndpointResilience chain = resilience(FAST_RETRY, LENIENT_BREAKER, new RateLimitPolicy(60000, 2, false, false));
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> call = () -> {
            calls.incrementAndGet();
            return "ok";
        };

        // When
        chain.execute(call);
        chain.execute(call);
        GenerationException error = assertThrows(GenerationException.class, () -> chain.execute(call));

        // Then
        assertEquals("RATE_LIMITED", error.code());
        assertEquals(429, error.status());
        assertTrue(error.isRejectedLocally());
        assertEquals(2, calls.get(), "Rejected call must not reach the provider");
    }

    @Test
    void shouldNotCountFailedCallsWhenSkipFailedIsSet() {
        // Given - one call per minute, failures are free
        EndpointResilience chain = resilience(NO_RETRY, LENIENT_BREAKER, new RateLimitPolicy(60000, 1, false, true));

        // When
        for (int i = 0; i < 3; i++) {
            assertThrows(GenerationException.class, () -> chain.execute(() -> {
                throw GenerationException.validation("bad");
            }));
        }

        // Then - the permit is still there for one success, then it is gone
        assertEquals("ok", chain.execute(() -> "ok"));
        GenerationException error = assertThrows(GenerationException.class, () -> chain.execute(() -> "again"));
        assertEquals("RATE_LIMITED", error.code());
    }

    @Test
    void shouldOpenCircuitAfterRepeatedFailures() {
        // Given - two failures out of two calls open the breaker
        EndpointResilience chain = resilience(NO_RETRY, new CircuitBreakerPolicy(2, 60000, 10000, 2), UNLIMITED);
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> failing = () -> {
            calls.incrementAndGet();
            throw GenerationException.http(500, "API_ERROR", "internal error", null);
        };

        // When
        assertThrows(GenerationException.class, () -> chain.execute(failing));
        assertThrows(GenerationException.class, () -> chain.execute(failing));
        GenerationException rejected = assertThrows(GenerationException.class, () -> chain.execute(failing));

        // Then
        assertEquals(CircuitBreaker.State.OPEN, chain.circuitBreaker().getState());
        assertEquals("CIRCUIT_BREAKER_OPEN", rejected.code());
        assertTrue(rejected.isRejectedLocally());
        assertEquals(2, calls.get(), "Open breaker must not call the provider");
    }

    @Test
    void shouldNotOpenCircuitOnClientErrors() {
        EndpointResilience chain = resilience(NO_RETRY, new CircuitBreakerPolicy(2, 60000, 10000, 2), UNLIMITED);

        for (int i = 0; i < 5; i++) {
            assertThrows(GenerationException.class, () -> chain.execute(() -> {
                throw GenerationException.validation("bad prompt");
            }));
        }

        assertEquals(CircuitBreaker.State.CLOSED, chain.circuitBreaker().getState());
    }
}
