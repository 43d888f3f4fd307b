package tech.charforge.queue.embedded;

import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite schema for the embedded generation job store.
 * Timestamps are stored as epoch milliseconds, JSON documents as text.
 */
public final class EmbeddedGenerationQueueSchema {

    private static final Logger LOG = Logger.getLogger(EmbeddedGenerationQueueSchema.class);

    private EmbeddedGenerationQueueSchema() {
        // Utility class
    }

    /**
     * Create tables and indexes if they don't exist. Idempotent.
     */
    public static void initialize(Connection conn) throws SQLException {
        LOG.debug("Initializing embedded generation queue schema...");

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS generation_jobs (
                    id TEXT PRIMARY KEY,
                    user_id TEXT NOT NULL,
                    type TEXT NOT NULL,
                    status TEXT NOT NULL,
                    priority INTEGER NOT NULL,
                    payload_json TEXT NOT NULL,
                    error_json TEXT,
                    result_json TEXT,
                    created_at INTEGER NOT NULL,
                    updated_at INTEGER NOT NULL,
                    scheduled_at INTEGER,
                    next_eligible_at INTEGER,
                    started_at INTEGER,
                    completed_at INTEGER
                )
                """);

            // Dequeue scan: pending jobs by priority, oldest first
            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_jobs_dequeue
                ON generation_jobs(status, priority DESC, created_at)
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_jobs_user
                ON generation_jobs(user_id, created_at)
                """);

            LOG.debug("Embedded generation queue schema initialized successfully");
        }
    }
}
