package tech.charforge.generationworker.provider;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.charforge.generationworker.warning.WarningCategory;
import tech.charforge.generationworker.warning.WarningService;
import tech.charforge.generationworker.warning.WarningSeverity;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests HttpImageProviderClient against a WireMock server on a dynamic port.
 */
class HttpImageProviderClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private WireMockServer wireMockServer;
    private WarningService warningService;
    private HttpImageProviderClient client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();

        warningService = mock(WarningService.class);
        client = new HttpImageProviderClient(new ImageProviderSettings(
            wireMockServer.baseUrl() + "/v1/", Optional.of("secret-key"), "nano-banana-2", "HTTP_1_1",
            Duration.ofSeconds(2)), warningService);
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
        wireMockServer.stop();
    }

    @Test
    void shouldPostRequestAndParseWrappedResult() {
        // Given
        wireMockServer.stubFor(post(urlEqualTo("/v1/generate"))
            .willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"success\":true,\"result\":{\"imageUrl\":\"https://cdn.test/x.png\","
                    + "\"width\":512,\"height\":512,\"format\":\"png\",\"seed\":99,\"cost\":0.04,"
                    + "\"unexpected\":\"ignored\"}}")));

        // When
        ProviderImage image = client.generate(GenerationRequest.ofPrompt("a lighthouse"), "job-42", TIMEOUT);

        // Then
        assertEquals("https://cdn.test/x.png", image.imageUrl());
        assertEquals(512, image.width());
        assertEquals(99L, image.seed());
        assertEquals(0, client.inFlightCount());

        wireMockServer.verify(postRequestedFor(urlEqualTo("/v1/generate"))
            .withHeader("Authorization", equalTo("Bearer secret-key"))
            .withHeader("X-Request-ID", equalTo("job-42"))
            .withHeader("Content-Type", equalTo("application/json"))
            .withRequestBody(matchingJsonPath("$.prompt", equalTo("a lighthouse")))
            .withRequestBody(matchingJsonPath("$.model", equalTo("nano-banana-2")))
            .withRequestBody(notContaining("negativePrompt")));
    }

    @Test
    void shouldParseUnwrappedResult() {
        wireMockServer.stubFor(post(urlEqualTo("/v1/generate"))
            .willReturn(okJson("{\"imageUrl\":\"https://cdn.test/plain.png\"}")));

        ProviderImage image = client.generate(GenerationRequest.ofPrompt("plain"), "job-1", TIMEOUT);

        assertEquals("https://cdn.test/plain.png", image.imageUrl());
        assertNull(image.width());
    }

    @Test
    void shouldRejectResponseWithoutImageUrl() {
        wireMockServer.stubFor(post(urlEqualTo("/v1/generate"))
            .willReturn(okJson("{\"result\":{\"width\":512}}")));

        GenerationException error = assertThrows(GenerationException.class,
            () -> client.generate(GenerationRequest.ofPrompt("x"), "job-1", TIMEOUT));

        assertEquals("INVALID_RESPONSE", error.code());
    }

    @Test
    void shouldMapRateLimitWithRetryAfter() {
        // Given
        wireMockServer.stubFor(post(urlEqualTo("/v1/generate"))
            .willReturn(aResponse()
                .withStatus(429)
                .withHeader("Retry-After", "30")
                .withHeader("Content-Type", "application/json")
                .withBody("{\"code\":\"RATE_LIMITED\",\"message\":\"Slow down\"}")));

        // When
        GenerationException error = assertThrows(GenerationException.class,
            () -> client.generate(GenerationRequest.ofPrompt("x"), "job-1", TIMEOUT));

        // Then
        assertEquals(429, error.status());
        assertEquals("RATE_LIMITED", error.code());
        assertEquals("Slow down", error.getMessage());
        assertEquals(Optional.of(Duration.ofSeconds(30)), error.retryAfter());
        assertFalse(error.isRejectedLocally());
        verifyNoInteractions(warningService);
    }

    @Test
    void shouldFallBackToGenericErrorWhenBodyIsNotJson() {
        wireMockServer.stubFor(post(urlEqualTo("/v1/generate"))
            .willReturn(aResponse().withStatus(502).withBody("<html>Bad Gateway</html>")));

        GenerationException error = assertThrows(GenerationException.class,
            () -> client.generate(GenerationRequest.ofPrompt("x"), "job-1", TIMEOUT));

        assertEquals(502, error.status());
        assertEquals("API_ERROR", error.code());
        assertEquals("Provider returned HTTP 502", error.getMessage());
        assertTrue(error.retryAfter().isEmpty());
    }

    @Test
    void shouldRaiseConfigurationWarningOnUnauthorized() {
        // Given
        wireMockServer.stubFor(post(urlEqualTo("/v1/generate"))
            .willReturn(aResponse()
                .withStatus(401)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"code\":\"UNAUTHORIZED\",\"message\":\"Invalid API key\"}")));

        // When
        GenerationException error = assertThrows(GenerationException.class,
            () -> client.generate(GenerationRequest.ofPrompt("x"), "job-1", TIMEOUT));

        // Then
        assertEquals(401, error.status());
        verify(warningService).addWarning(eq(WarningCategory.CONFIGURATION), eq(WarningSeverity.ERROR),
            contains("HTTP 401"), eq("HttpImageProviderClient"));
    }

    @Test
    void shouldMapSlowResponseToTimeout() {
        wireMockServer.stubFor(post(urlEqualTo("/v1/generate"))
            .willReturn(okJson("{\"imageUrl\":\"https://cdn.test/slow.png\"}").withFixedDelay(2000)));

        GenerationException error = assertThrows(GenerationException.class,
            () -> client.generate(GenerationRequest.ofPrompt("x"), "job-1", Duration.ofMillis(200)));

        assertEquals("ETIMEDOUT", error.code());
    }

    @Test
    void shouldCancelInFlightRequestOnShutdown() {
        // Given
        wireMockServer.stubFor(post(urlEqualTo("/v1/generate"))
            .willReturn(okJson("{\"imageUrl\":\"https://cdn.test/never.png\"}").withFixedDelay(10000)));
        CompletableFuture<ProviderImage> call = CompletableFuture.supplyAsync(
            () -> client.generate(GenerationRequest.ofPrompt("x"), "job-slow", Duration.ofSeconds(30)));
        await().until(() -> client.inFlightCount() == 1);

        // When
        client.shutdown();

        // Then
        CompletionException thrown = assertThrows(CompletionException.class, call::join);
        GenerationException error = assertInstanceOf(GenerationException.class, thrown.getCause());
        assertEquals("REQUEST_CANCELLED", error.code());
        assertEquals(499, error.status());
        assertTrue(error.isRejectedLocally(), "An aborted call never reached a provider response");
        assertEquals(0, client.inFlightCount());

        GenerationException rejected = assertThrows(GenerationException.class,
            () -> client.generate(GenerationRequest.ofPrompt("y"), "job-after", TIMEOUT));
        assertEquals("REQUEST_CANCELLED", rejected.code());
        verify(warningService, never()).addWarning(any(), any(), anyString(), anyString());
    }
}
