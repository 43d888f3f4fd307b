package tech.charforge.generationworker.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for the generation job store.
 */
@ConfigMapping(prefix = "generation-queue")
public interface GenerationQueueConfig {

    enum Store {
        /** SQLite file, survives restarts. */
        EMBEDDED,
        /** Process memory, for development and tests. */
        MEMORY
    }

    @WithDefault("EMBEDDED")
    Store store();

    /**
     * Path for the embedded SQLite database.
     */
    @WithDefault("./generation-queue.db")
    String embeddedDbPath();

    /**
     * Maximum number of PENDING plus QUEUED jobs.
     */
    @WithDefault("100")
    int maxQueueSize();

    @WithDefault("4")
    int maxBatchSize();

    /**
     * PROCESSING jobs older than this are failed by the maintenance task.
     */
    @WithDefault("30m")
    Duration staleJobThreshold();

    /**
     * Interval of the stale job check.
     * Uses Quarkus duration format (e.g., "5m", "60s").
     */
    @WithDefault("5m")
    String staleCheckInterval();

    /**
     * Terminal jobs older than this are deleted by the cleanup task.
     */
    @WithDefault("7d")
    Duration retention();

    @WithDefault("1h")
    String cleanupInterval();
}
