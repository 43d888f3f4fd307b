package tech.charforge.generationworker.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;
import tech.charforge.generationworker.warning.WarningCategory;
import tech.charforge.generationworker.warning.WarningService;
import tech.charforge.generationworker.warning.WarningSeverity;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Image provider client over {@link HttpClient}.
 *
 * <p>Sends {@code POST {baseUrl}/generate} and maps the response to a
 * {@link ProviderImage} or a {@link GenerationException}. In-flight exchanges
 * are tracked by request id so {@link #shutdown()} can abort them.
 */
public class HttpImageProviderClient implements ImageProviderClient {

    private static final Logger LOG = Logger.getLogger(HttpImageProviderClient.class);
    private static final String SOURCE = "HttpImageProviderClient";

    private final HttpClient httpClient;
    private final ExecutorService executorService;
    private final ImageProviderSettings settings;
    private final WarningService warningService;
    private final ObjectMapper objectMapper;
    private final ConcurrentMap<String, CompletableFuture<HttpResponse<String>>> inFlight = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public HttpImageProviderClient(ImageProviderSettings settings, WarningService warningService) {
        this.settings = settings;
        this.warningService = warningService;
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.executorService = Executors.newCachedThreadPool(providerThreadFactory());

        HttpClient.Version version = "HTTP_1_1".equalsIgnoreCase(settings.httpVersion())
            ? HttpClient.Version.HTTP_1_1
            : HttpClient.Version.HTTP_2;

        LOG.infof("Initializing HttpImageProviderClient for [%s] with HTTP version: %s, connect timeout: %dms",
            settings.baseUrl(), version, settings.connectTimeout().toMillis());

        this.httpClient = HttpClient.newBuilder()
            .version(version)
            .connectTimeout(settings.connectTimeout())
            .executor(executorService)
            .build();
    }

    @Override
    public ProviderImage generate(GenerationRequest request, String requestId, Duration timeout) {
        if (closed) {
            throw GenerationException.cancelled(requestId);
        }

        HttpRequest httpRequest = buildRequest(request, requestId, timeout);
        CompletableFuture<HttpResponse<String>> future =
            httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        inFlight.put(requestId, future);
        if (closed) {
            future.cancel(true);
        }

        long start = System.currentTimeMillis();
        HttpResponse<String> response;
        try {
            response = future.get();
        } catch (CancellationException e) {
            throw GenerationException.cancelled(requestId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw GenerationException.cancelled(requestId);
        } catch (ExecutionException e) {
            if (closed || e.getCause() instanceof CancellationException) {
                LOG.debugf("Provider request [%s] aborted by shutdown: %s", requestId, e.getCause());
                throw GenerationException.cancelled(requestId);
            }
            throw translate(e.getCause(), requestId, timeout);
        } finally {
            inFlight.remove(requestId, future);
        }

        LOG.debugf("Provider request [%s] completed in %dms with status %d",
            requestId, System.currentTimeMillis() - start, response.statusCode());
        return handleResponse(response, requestId);
    }

    private HttpRequest buildRequest(GenerationRequest request, String requestId, Duration timeout) {
        ObjectNode body = objectMapper.valueToTree(request);
        body.put("model", settings.model());

        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw GenerationException.validation("Request could not be serialised: " + e.getOriginalMessage());
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(trimTrailingSlash(settings.baseUrl()) + "/generate"))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("X-Request-ID", requestId)
            .timeout(timeout)
            .POST(HttpRequest.BodyPublishers.ofString(payload));
        settings.apiKey().ifPresent(key -> builder.header("Authorization", "Bearer " + key));
        return builder.build();
    }

    private ProviderImage handleResponse(HttpResponse<String> response, String requestId) {
        int statusCode = response.statusCode();

        if (statusCode >= 200 && statusCode < 300) {
            return parseImage(response.body(), requestId);
        }

        JsonNode error = readTreeQuietly(response.body());
        String code = error != null && error.hasNonNull("code") ? error.get("code").asText() : "API_ERROR";
        String message = error != null && error.hasNonNull("message")
            ? error.get("message").asText()
            : String.format("Provider returned HTTP %d", statusCode);
        Duration retryAfter = extractRetryAfterHeader(response);

        if (statusCode == 401 || statusCode == 403) {
            LOG.errorf("Provider request [%s] rejected with %d - check provider credentials", requestId, statusCode);
            warningService.addWarning(
                WarningCategory.CONFIGURATION,
                WarningSeverity.ERROR,
                String.format("Image provider rejected credentials: HTTP %d - %s - Target: %s",
                    statusCode, message, settings.baseUrl()),
                SOURCE
            );
        } else if (statusCode == 429) {
            LOG.warnf("Provider request [%s] rate limited (Retry-After=%s)", requestId,
                retryAfter != null ? retryAfter.toSeconds() + "s" : "none");
        } else {
            LOG.warnf("Provider request [%s] failed with status %d: %s", requestId, statusCode, message);
        }

        throw GenerationException.http(statusCode, code, message, retryAfter);
    }

    private ProviderImage parseImage(String body, String requestId) {
        JsonNode root = readTreeQuietly(body);
        if (root == null || !root.isObject()) {
            throw new GenerationException("INVALID_RESPONSE",
                "Provider returned an unreadable response for request " + requestId, null, null, false, null);
        }
        JsonNode image = root.has("result") && root.get("result").isObject() ? root.get("result") : root;
        try {
            ProviderImage parsed = objectMapper.treeToValue(image, ProviderImage.class);
            if (parsed.imageUrl() == null) {
                throw new GenerationException("INVALID_RESPONSE",
                    "Provider response for request " + requestId + " has no imageUrl", null, null, false, null);
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new GenerationException("INVALID_RESPONSE",
                "Provider response could not be parsed: " + e.getOriginalMessage(), null, null, false, e);
        }
    }

    private GenerationException translate(Throwable cause, String requestId, Duration timeout) {
        if (cause instanceof HttpTimeoutException) {
            LOG.warnf("Provider request [%s] timed out after %dms", requestId, timeout.toMillis());
            return GenerationException.timeout(timeout, cause);
        }
        LOG.warnf("Provider request [%s] failed: %s", requestId, cause.toString());
        return GenerationException.wrap(cause);
    }

    /**
     * Retry-After in delta-seconds. HTTP-date values are ignored.
     */
    private Duration extractRetryAfterHeader(HttpResponse<String> response) {
        return response.headers()
            .firstValue("Retry-After")
            .map(value -> {
                try {
                    return Duration.ofSeconds(Long.parseLong(value.trim()));
                } catch (NumberFormatException e) {
                    LOG.debugf("Retry-After header '%s' is not in delta-seconds format, ignoring", value);
                    return null;
                }
            })
            .orElse(null);
    }

    private JsonNode readTreeQuietly(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            LOG.debugf("Provider response body is not JSON: %s", e.getOriginalMessage());
            return null;
        }
    }

    @Override
    public void shutdown() {
        closed = true;
        int aborted = 0;
        for (CompletableFuture<HttpResponse<String>> future : inFlight.values()) {
            if (future.cancel(true)) {
                aborted++;
            }
        }
        inFlight.clear();
        LOG.infof("HttpImageProviderClient shut down, %d in-flight requests aborted", aborted);

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Provider client executor did not terminate within 5 seconds, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            LOG.warn("Interrupted while shutting down provider client executor");
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static ThreadFactory providerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "image-provider-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
