package tech.charforge.generationworker.processor;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import org.jboss.logging.Logger;
import tech.charforge.generationworker.provider.GenerationException;
import tech.charforge.generationworker.resilience.RateLimitPolicy;
import tech.charforge.generationworker.resilience.ResilienceEndpointConfig;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Resilience chain for calls to one endpoint: retry around rate limiting
 * around the circuit breaker.
 *
 * <p>Local rejections (rate limit, open circuit) surface as
 * {@link GenerationException} with {@code rejectedLocally} set, so the retry
 * layer leaves them to the queue instead of spinning on them.
 */
public class EndpointResilience {

    private static final Logger LOG = Logger.getLogger(EndpointResilience.class);

    private final ResilienceEndpointConfig config;
    private final Retry retry;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;

    public EndpointResilience(ResilienceEndpointConfig config, Retry retry, RateLimiter rateLimiter,
                              CircuitBreaker circuitBreaker) {
        this.config = config;
        this.retry = retry;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;

        retry.getEventPublisher().onRetry(event -> LOG.warnf(
            "Retrying call to [%s], attempt %d after %s: %s",
            config.name(), event.getNumberOfRetryAttempts(), event.getWaitInterval(),
            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        circuitBreaker.getEventPublisher().onStateTransition(event -> LOG.warnf(
            "Circuit breaker [%s] transitioned %s", config.name(), event.getStateTransition()));
    }

    /**
     * Run a call through the chain.
     *
     * @throws GenerationException when the call fails after all permitted attempts
     */
    public <T> T execute(Supplier<T> call) {
        Supplier<T> guarded = () -> throttle(() -> throughBreaker(call));
        try {
            return Retry.decorateSupplier(retry, guarded).get();
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw GenerationException.wrap(e);
        }
    }

    private <T> T throughBreaker(Supplier<T> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            LOG.warnf("Circuit breaker OPEN for endpoint [%s], call rejected", config.name());
            throw GenerationException.circuitOpen(config.name());
        }
    }

    private <T> T throttle(Supplier<T> call) {
        RateLimitPolicy policy = config.rateLimit();

        if (policy.countsUpFront()) {
            if (!rateLimiter.acquirePermission()) {
                throw rateLimited();
            }
            return call.get();
        }

        // Skip flags: check now, consume a permit only for outcomes that count
        if (rateLimiter.getMetrics().getAvailablePermissions() <= 0) {
            throw rateLimited();
        }
        T result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            if (!policy.skipFailedRequests()) {
                rateLimiter.acquirePermission();
            }
            throw e;
        }
        if (!policy.skipSuccessfulRequests()) {
            rateLimiter.acquirePermission();
        }
        return result;
    }

    private GenerationException rateLimited() {
        LOG.warnf("Rate limit reached for endpoint [%s] (%d requests per %dms)",
            config.name(), config.rateLimit().maxRequests(), config.rateLimit().windowMs());
        return GenerationException.rateLimited(config.name());
    }

    public Duration timeout() {
        return Duration.ofMillis(config.timeoutMs());
    }

    public ResilienceEndpointConfig config() {
        return config;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }
}
