package tech.charforge.generationworker.resilience;

import org.junit.jupiter.api.Test;
import tech.charforge.generationworker.provider.GenerationException;

import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorTest {

    @Test
    void shouldMapNetworkExceptionsToCodes() {
        assertEquals("ETIMEDOUT", ProviderError.from(new HttpTimeoutException("request timed out")).code());
        assertEquals("ENOTFOUND", ProviderError.from(new UnknownHostException("api.invalid")).code());
        assertEquals("ECONNRESET", ProviderError.from(new SocketException("Connection reset")).code());
        assertEquals(ProviderError.UNKNOWN_ERROR, ProviderError.from(new IllegalStateException("boom")).code());
    }

    @Test
    void shouldUnwrapConcurrencyWrappers() {
        GenerationException cause = GenerationException.http(503, "SERVICE_UNAVAILABLE", "down", null);

        ProviderError error = ProviderError.from(new ExecutionException(new CompletionException(cause)));

        assertEquals("SERVICE_UNAVAILABLE", error.code());
        assertEquals(503, error.effectiveStatus());
        assertEquals("down", error.message());
    }

    @Test
    void shouldTakeStatusFromGenerationException() {
        ProviderError error = ProviderError.from(
            GenerationException.http(429, "RATE_LIMITED", "slow down", Duration.ofSeconds(30)));

        assertEquals(429, error.effectiveStatus());
        assertEquals("RATE_LIMITED", error.codeOrUnknown());
    }

    @Test
    void shouldFallBackToClassNameWhenMessageMissing() {
        ProviderError error = ProviderError.from(new IllegalArgumentException());

        assertEquals("IllegalArgumentException", error.message());
        assertNull(ProviderError.from(null));
        assertEquals(ProviderError.UNKNOWN_ERROR, ProviderError.ofStatus(500, "x").codeOrUnknown());
    }
}
