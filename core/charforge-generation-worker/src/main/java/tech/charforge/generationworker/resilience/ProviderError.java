package tech.charforge.generationworker.resilience;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classification view of a failed provider call.
 *
 * @param code           error code tag such as ECONNRESET or RATE_LIMITED, may be null
 * @param status         HTTP status reported by the caller, may be null
 * @param responseStatus HTTP status of the provider response, may be null
 * @param message        error message, may be null
 */
public record ProviderError(
    String code,
    Integer status,
    Integer responseStatus,
    String message
) {

    public static final String UNKNOWN_ERROR = "UNKNOWN_ERROR";

    public static ProviderError ofCode(String code, String message) {
        return new ProviderError(code, null, null, message);
    }

    public static ProviderError ofStatus(int status, String message) {
        return new ProviderError(null, status, null, message);
    }

    /**
     * Normalise any throwable into a classifiable error. Wrappers from
     * concurrent execution are unwrapped first.
     */
    public static ProviderError from(Throwable error) {
        if (error == null) {
            return null;
        }

        Throwable cause = unwrap(error);
        if (cause instanceof ProviderFailure failure) {
            return failure.toProviderError();
        }

        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ProviderError(codeFor(cause), null, null, message);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String codeFor(Throwable cause) {
        if (cause instanceof HttpTimeoutException
                || cause instanceof SocketTimeoutException
                || cause instanceof TimeoutException) {
            return "ETIMEDOUT";
        }
        if (cause instanceof ConnectException) {
            return "ECONNREFUSED";
        }
        if (cause instanceof UnknownHostException || cause instanceof UnresolvedAddressException) {
            return "ENOTFOUND";
        }
        if (cause instanceof SocketException
                && cause.getMessage() != null
                && cause.getMessage().toLowerCase().contains("reset")) {
            return "ECONNRESET";
        }
        if (cause instanceof IOException) {
            return "NETWORK_ERROR";
        }
        return UNKNOWN_ERROR;
    }

    /**
     * Code to record on a job, never null.
     */
    public String codeOrUnknown() {
        return code != null ? code : UNKNOWN_ERROR;
    }

    /**
     * First non-null of {@code status} and {@code responseStatus}.
     */
    public Integer effectiveStatus() {
        return status != null ? status : responseStatus;
    }
}
