package tech.charforge.generationworker.provider;

import tech.charforge.generationworker.resilience.ProviderError;
import tech.charforge.generationworker.resilience.ProviderFailure;

import java.time.Duration;
import java.util.Optional;

/**
 * Failure of a generation call, carrying the fields the resilience
 * classifiers inspect.
 *
 * <p>{@code rejectedLocally} marks failures produced by a local gate (rate
 * limiter, open circuit, shutdown) without reaching the provider. Such
 * failures are never retried within the same call.
 */
public class GenerationException extends RuntimeException implements ProviderFailure {

    private final String code;
    private final Integer status;
    private final Duration retryAfter;
    private final boolean rejectedLocally;

    public GenerationException(String code, String message, Integer status, Duration retryAfter,
                               boolean rejectedLocally, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
        this.retryAfter = retryAfter;
        this.rejectedLocally = rejectedLocally;
    }

    public static GenerationException http(int status, String code, String message, Duration retryAfter) {
        return new GenerationException(code, message, status, retryAfter, false, null);
    }

    public static GenerationException timeout(Duration timeout, Throwable cause) {
        return new GenerationException("ETIMEDOUT",
            String.format("Provider request timed out after %dms", timeout.toMillis()), null, null, false, cause);
    }

    public static GenerationException rateLimited(String endpoint) {
        return new GenerationException("RATE_LIMITED",
            "Rate limit exceeded for endpoint " + endpoint, 429, null, true, null);
    }

    public static GenerationException circuitOpen(String endpoint) {
        return new GenerationException("CIRCUIT_BREAKER_OPEN",
            "Circuit breaker is open for endpoint " + endpoint, 503, null, true, null);
    }

    public static GenerationException cancelled(String requestId) {
        return new GenerationException("REQUEST_CANCELLED",
            "Request " + requestId + " was cancelled", 499, null, true, null);
    }

    public static GenerationException validation(String message) {
        return new GenerationException("VALIDATION_ERROR", message, 400, null, false, null);
    }

    /**
     * Wrap an unexpected failure, deriving its code from the exception type.
     */
    public static GenerationException wrap(Throwable cause) {
        if (cause instanceof GenerationException generationException) {
            return generationException;
        }
        ProviderError error = ProviderError.from(cause);
        return new GenerationException(error.codeOrUnknown(), error.message(), null, null, false, cause);
    }

    public String code() {
        return code;
    }

    public Integer status() {
        return status;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isRejectedLocally() {
        return rejectedLocally;
    }

    @Override
    public ProviderError toProviderError() {
        return new ProviderError(code, status, null, getMessage());
    }
}
