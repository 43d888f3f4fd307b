package tech.charforge.generationworker.processor;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.jboss.logging.Logger;
import tech.charforge.generationworker.health.CircuitBreakerStats;
import tech.charforge.generationworker.provider.GenerationException;
import tech.charforge.generationworker.resilience.BackoffCalculator;
import tech.charforge.generationworker.resilience.CircuitBreakerPolicy;
import tech.charforge.generationworker.resilience.RateLimitPolicy;
import tech.charforge.generationworker.resilience.ResilienceConfig;
import tech.charforge.generationworker.resilience.ResilienceEndpointConfig;
import tech.charforge.generationworker.resilience.ResilienceSettings;
import tech.charforge.generationworker.resilience.RetryPolicy;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Builds and caches one {@link EndpointResilience} per endpoint name from the
 * resolved {@link ResilienceSettings}.
 */
public class ResilienceRegistry {

    private static final Logger LOG = Logger.getLogger(ResilienceRegistry.class);

    private final ResilienceSettings settings;
    private final CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
    private final RateLimiterRegistry rateLimiterRegistry = RateLimiterRegistry.ofDefaults();
    private final RetryRegistry retryRegistry = RetryRegistry.ofDefaults();
    private final ConcurrentMap<String, EndpointResilience> endpoints = new ConcurrentHashMap<>();

    public ResilienceRegistry(ResilienceSettings settings) {
        this.settings = settings != null ? settings : ResilienceSettings.builtIn();
    }

    public EndpointResilience forEndpoint(String name) {
        return endpoints.computeIfAbsent(name, this::create);
    }

    private EndpointResilience create(String name) {
        ResilienceEndpointConfig config = ResilienceConfig.getEndpointConfig(name, settings);
        LOG.infof("Creating resilience chain for endpoint [%s]: retry=%s, circuitBreaker=%s, rateLimit=%s, timeout=%dms",
            name, config.retry(), config.circuitBreaker(), config.rateLimit(), config.timeoutMs());

        Retry retry = retryRegistry.retry(name, retryConfig(config.retry()));
        RateLimiter rateLimiter = rateLimiterRegistry.rateLimiter(name, rateLimiterConfig(config.rateLimit()));
        CircuitBreaker circuitBreaker =
            circuitBreakerRegistry.circuitBreaker(name, circuitBreakerConfig(config.circuitBreaker()));
        return new EndpointResilience(config, retry, rateLimiter, circuitBreaker);
    }

    static RetryConfig retryConfig(RetryPolicy policy) {
        return RetryConfig.custom()
            .maxAttempts(Math.max(1, policy.maxAttempts()))
            .intervalFunction(attempt -> BackoffCalculator.delayMs(policy, attempt))
            .retryOnException(ResilienceRegistry::shouldRetryInCall)
            .build();
    }

    static RateLimiterConfig rateLimiterConfig(RateLimitPolicy policy) {
        return RateLimiterConfig.custom()
            .limitForPeriod(Math.max(1, policy.maxRequests()))
            .limitRefreshPeriod(Duration.ofMillis(Math.max(1, policy.windowMs())))
            .timeoutDuration(Duration.ZERO)
            .build();
    }

    static CircuitBreakerConfig circuitBreakerConfig(CircuitBreakerPolicy policy) {
        int windowSeconds = (int) Math.max(1, policy.monitoringPeriodMs() / 1000);
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
            .slidingWindowSize(windowSeconds)
            .minimumNumberOfCalls(Math.max(1, policy.minimumThroughput()))
            .failureRateThreshold(policy.failureRatePercent())
            .waitDurationInOpenState(Duration.ofMillis(Math.max(1, policy.resetTimeoutMs())))
            .permittedNumberOfCallsInHalfOpenState(1)
            .recordException(ResilienceConfig::isCircuitBreakerError)
            .build();
    }

    static boolean shouldRetryInCall(Throwable error) {
        if (error instanceof GenerationException generationException && generationException.isRejectedLocally()) {
            return false;
        }
        return ResilienceConfig.isRetryableError(error);
    }

    /**
     * Snapshot of every breaker created so far, sorted by endpoint name.
     */
    public List<CircuitBreakerStats> circuitBreakerStats() {
        return endpoints.values().stream()
            .map(endpoint -> {
                CircuitBreaker.Metrics metrics = endpoint.circuitBreaker().getMetrics();
                return new CircuitBreakerStats(
                    endpoint.config().name(),
                    endpoint.circuitBreaker().getState().name(),
                    metrics.getNumberOfSuccessfulCalls(),
                    metrics.getNumberOfFailedCalls(),
                    metrics.getNumberOfNotPermittedCalls(),
                    metrics.getFailureRate(),
                    metrics.getNumberOfBufferedCalls(),
                    endpoint.rateLimiter().getMetrics().getAvailablePermissions()
                );
            })
            .sorted(Comparator.comparing(CircuitBreakerStats::name))
            .toList();
    }

    public ResilienceSettings settings() {
        return settings;
    }
}
