package tech.charforge.generationworker.resilience;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Resilience policy resolution and error classification.
 *
 * <p>Retry and circuit breaker decisions are related but distinct. A 401 is
 * never retried blindly, yet repeated 401s against one endpoint still count
 * toward opening its breaker.
 */
public final class ResilienceConfig {

    public static final Set<String> RETRYABLE_ERROR_CODES = Set.of(
        "ECONNRESET",
        "ENOTFOUND",
        "ECONNREFUSED",
        "ETIMEDOUT",
        "NETWORK_ERROR",
        "SERVICE_UNAVAILABLE",
        "RATE_LIMITED",
        "TEMPORARY_FAILURE"
    );

    public static final Set<Integer> RETRYABLE_HTTP_STATUSES = Set.of(
        408, 429, 502, 503, 504, 520, 521, 522, 523, 524
    );

    static final List<String> RETRYABLE_MESSAGE_PATTERNS = List.of(
        "timeout",
        "connection",
        "network",
        "temporary",
        "rate limit",
        "unavailable"
    );

    private ResilienceConfig() {
        // Utility class
    }

    /**
     * Resolve an endpoint against the built-in settings.
     */
    public static ResilienceEndpointConfig getEndpointConfig(String name) {
        return getEndpointConfig(name, ResilienceSettings.builtIn());
    }

    /**
     * Resolve an endpoint by merging its override, field by field, over the defaults.
     * Unknown endpoints resolve to exactly the defaults. Never fails.
     */
    public static ResilienceEndpointConfig getEndpointConfig(String name, ResilienceSettings settings) {
        ResilienceSettings effective = settings != null ? settings : ResilienceSettings.builtIn();
        ResilienceDefaults defaults = effective.defaults() != null
            ? effective.defaults()
            : ResilienceSettings.BUILT_IN_DEFAULTS;
        EndpointOverride override = name != null ? effective.endpoints().get(name) : null;
        if (override == null) {
            override = EndpointOverride.none();
        }

        return new ResilienceEndpointConfig(
            name,
            override.retry() != null ? override.retry().mergeOver(defaults.retry()) : defaults.retry(),
            override.circuitBreaker() != null
                ? override.circuitBreaker().mergeOver(defaults.circuitBreaker())
                : defaults.circuitBreaker(),
            override.rateLimit() != null ? override.rateLimit().mergeOver(defaults.rateLimit()) : defaults.rateLimit(),
            override.timeoutMs() != null && override.timeoutMs() > 0 ? override.timeoutMs() : defaults.timeoutMs()
        );
    }

    /**
     * Whether a failure is likely transient and worth another attempt.
     */
    public static boolean isRetryableError(ProviderError error) {
        if (error == null) {
            return false;
        }

        if (error.code() != null && RETRYABLE_ERROR_CODES.contains(error.code())) {
            return true;
        }
        if (error.status() != null && RETRYABLE_HTTP_STATUSES.contains(error.status())) {
            return true;
        }
        if (error.responseStatus() != null && RETRYABLE_HTTP_STATUSES.contains(error.responseStatus())) {
            return true;
        }
        if (error.message() != null) {
            String message = error.message().toLowerCase(Locale.ROOT);
            return RETRYABLE_MESSAGE_PATTERNS.stream().anyMatch(message::contains);
        }
        return false;
    }

    public static boolean isRetryableError(Throwable error) {
        return isRetryableError(ProviderError.from(error));
    }

    /**
     * Whether a failure is evidence that the endpoint itself is unhealthy.
     * Broader than {@link #isRetryableError(ProviderError)}: auth, quota and
     * every 5xx also count.
     */
    public static boolean isCircuitBreakerError(ProviderError error) {
        if (error == null) {
            return false;
        }
        if (isRetryableError(error)) {
            return true;
        }

        Integer status = error.effectiveStatus();
        if (status != null && (status == 401 || status == 403)) {
            return true;
        }
        if ((status != null && status == 429) || "QUOTA_EXCEEDED".equals(error.code())) {
            return true;
        }
        return status != null && status >= 500 && status <= 599;
    }

    public static boolean isCircuitBreakerError(Throwable error) {
        return isCircuitBreakerError(ProviderError.from(error));
    }
}
