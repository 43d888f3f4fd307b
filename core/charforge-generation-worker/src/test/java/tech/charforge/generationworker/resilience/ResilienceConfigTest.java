package tech.charforge.generationworker.resilience;

import org.junit.jupiter.api.Test;
import tech.charforge.generationworker.provider.GenerationException;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ResilienceConfigTest {

    @Test
    void shouldMergeProviderOverrideOverDefaults() {
        ResilienceEndpointConfig config = ResilienceConfig.getEndpointConfig(ResilienceSettings.NANO_BANANA);

        assertEquals(5, config.retry().maxAttempts());
        assertEquals(2000, config.retry().baseDelayMs());
        assertEquals(2.5, config.retry().backoffMultiplier());
        assertEquals(3, config.circuitBreaker().failureThreshold());
        assertEquals(10, config.rateLimit().maxRequests());
        assertTrue(config.rateLimit().skipFailedRequests());
        assertEquals(120000, config.timeoutMs());
    }

    @Test
    void shouldResolveUnknownEndpointToDefaults() {
        ResilienceEndpointConfig config = ResilienceConfig.getEndpointConfig("does-not-exist");
        ResilienceDefaults defaults = ResilienceSettings.BUILT_IN_DEFAULTS;

        assertEquals("does-not-exist", config.name());
        assertEquals(defaults.retry(), config.retry());
        assertEquals(defaults.circuitBreaker(), config.circuitBreaker());
        assertEquals(defaults.rateLimit(), config.rateLimit());
        assertEquals(defaults.timeoutMs(), config.timeoutMs());
    }

    @Test
    void shouldKeepDefaultsForFieldsMissingFromOverride() {
        // Given - only maxAttempts overridden, and no rate limit section at all
        ResilienceSettings settings = ResilienceSettings.builtIn().withEndpoint("partial",
            new EndpointOverride(new RetryPolicy.Partial(7, null, null, null, null), null, null, null));

        // When
        ResilienceEndpointConfig config = ResilienceConfig.getEndpointConfig("partial", settings);

        // Then
        assertEquals(7, config.retry().maxAttempts());
        assertEquals(1000, config.retry().baseDelayMs());
        assertEquals(30000, config.retry().maxDelayMs());
        assertEquals(ResilienceSettings.BUILT_IN_DEFAULTS.rateLimit(), config.rateLimit());
        assertEquals(30000, config.timeoutMs());
    }

    @Test
    void shouldUseDatabaseDefaultsForRateLimit() {
        ResilienceEndpointConfig config = ResilienceConfig.getEndpointConfig(ResilienceSettings.DATABASE);

        assertEquals(100, config.rateLimit().maxRequests(), "Database has no rate limit override");
        assertEquals(10000, config.timeoutMs());
    }

    @Test
    void shouldClassifyRetryableErrors() {
        assertTrue(ResilienceConfig.isRetryableError(ProviderError.ofStatus(429, "Too Many Requests")));
        assertTrue(ResilienceConfig.isRetryableError(ProviderError.ofStatus(503, "x")));
        assertTrue(ResilienceConfig.isRetryableError(ProviderError.ofCode("ECONNRESET", "socket hang up")));
        assertTrue(ResilienceConfig.isRetryableError(new ProviderError(null, null, 504, "gateway")));
        assertTrue(ResilienceConfig.isRetryableError(ProviderError.ofCode(null, "Request Timeout while reading")),
            "Message patterns match case-insensitively");

        assertFalse(ResilienceConfig.isRetryableError(ProviderError.ofStatus(400, "Bad Request")));
        assertFalse(ResilienceConfig.isRetryableError(ProviderError.ofStatus(401, "Unauthorized")));
        assertFalse(ResilienceConfig.isRetryableError((ProviderError) null));
    }

    @Test
    void shouldClassifyThrowables() {
        assertTrue(ResilienceConfig.isRetryableError(new ConnectException("Connection refused")));
        assertTrue(ResilienceConfig.isRetryableError(new CompletionException(new IOException("broken pipe"))));
        assertTrue(ResilienceConfig.isRetryableError(GenerationException.rateLimited("nanoBanana")));
        assertFalse(ResilienceConfig.isRetryableError(GenerationException.validation("Prompt is required")));
        assertFalse(ResilienceConfig.isRetryableError((Throwable) null));
    }

    @Test
    void shouldCountAuthAndServerErrorsTowardCircuitBreaker() {
        ProviderError unauthorized = ProviderError.ofStatus(401, "Unauthorized");

        assertTrue(ResilienceConfig.isCircuitBreakerError(unauthorized));
        assertFalse(ResilienceConfig.isRetryableError(unauthorized), "401 trips the breaker but is not retried");

        assertTrue(ResilienceConfig.isCircuitBreakerError(ProviderError.ofStatus(403, "Forbidden")));
        assertTrue(ResilienceConfig.isCircuitBreakerError(ProviderError.ofStatus(500, "Internal")));
        assertTrue(ResilienceConfig.isCircuitBreakerError(ProviderError.ofCode("QUOTA_EXCEEDED", "quota")));
        assertFalse(ResilienceConfig.isCircuitBreakerError(ProviderError.ofStatus(400, "Bad Request")));
        assertFalse(ResilienceConfig.isCircuitBreakerError((ProviderError) null));
    }
}
