package tech.charforge.generationworker.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the generation queue worker.
 */
@ConfigMapping(prefix = "generation-worker")
public interface GenerationWorkerConfig {

    /**
     * Whether the worker starts with the application.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Maximum number of jobs processed at the same time.
     */
    @WithDefault("4")
    int concurrency();

    /**
     * Delay between queue polls in milliseconds.
     */
    @WithDefault("5000")
    long pollIntervalMs();

    /**
     * Attempts a job gets before it is marked FAILED.
     */
    @WithDefault("3")
    int maxRetries();

    /**
     * Minimum delay before a failed job becomes eligible again.
     */
    @WithDefault("10000")
    long retryDelayMs();

    @WithDefault("30000")
    long healthCheckIntervalMs();

    /**
     * Processing time after which an active job is reported as stale.
     */
    @WithDefault("300000")
    long staleJobThresholdMs();

    /**
     * How long shutdown waits for active jobs before abandoning them.
     */
    @WithDefault("30000")
    long shutdownTimeoutMs();

    /**
     * Error rate percentage above which the worker reports DEGRADED.
     */
    @WithDefault("20")
    double degradedErrorRate();

    /**
     * Error rate percentage above which the worker reports UNHEALTHY.
     */
    @WithDefault("50")
    double unhealthyErrorRate();

    /**
     * Resilience endpoint used for provider calls.
     */
    @WithDefault("nanoBanana")
    String providerEndpoint();
}
