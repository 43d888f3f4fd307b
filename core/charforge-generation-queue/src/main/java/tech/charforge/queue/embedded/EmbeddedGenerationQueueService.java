package tech.charforge.queue.embedded;

import org.jboss.logging.Logger;
import tech.charforge.queue.GenerationQueueService;
import tech.charforge.queue.JobCancellationException;
import tech.charforge.queue.JobValidator;
import tech.charforge.queue.QueueException;
import tech.charforge.queue.QueueInitException;
import tech.charforge.queue.QueueSettings;
import tech.charforge.queue.model.GenerationJob;
import tech.charforge.queue.model.JobError;
import tech.charforge.queue.model.JobPriority;
import tech.charforge.queue.model.JobQuery;
import tech.charforge.queue.model.JobStatus;
import tech.charforge.queue.model.JobType;
import tech.charforge.queue.model.JobUpdate;
import tech.charforge.queue.model.NewGenerationJob;
import tech.charforge.queue.model.QueueMetrics;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed job store for single-node deployments.
 *
 * <p>Owns one JDBC connection. Every operation runs under a lock and inside a
 * transaction, which gives atomic read-modify-write for updates and a
 * consistent view for dequeue.
 */
public class EmbeddedGenerationQueueService implements GenerationQueueService {

    private static final Logger LOG = Logger.getLogger(EmbeddedGenerationQueueService.class);

    private static final String SELECT_COLUMNS = """
        SELECT id, user_id, type, status, priority, payload_json, error_json, result_json,
               created_at, updated_at, scheduled_at, next_eligible_at, started_at, completed_at
        FROM generation_jobs
        """;

    private final String dbPath;
    private final QueueSettings settings;
    private final Clock clock;
    private final JobJsonCodec json = new JobJsonCodec();
    private final ReentrantLock lock = new ReentrantLock();
    private Connection connection;

    public EmbeddedGenerationQueueService(String dbPath) {
        this(dbPath, QueueSettings.defaults(), Clock.systemUTC());
    }

    public EmbeddedGenerationQueueService(String dbPath, QueueSettings settings, Clock clock) {
        this.dbPath = dbPath;
        this.settings = settings;
        this.clock = clock;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    @Override
    public void initialize() {
        lock.lock();
        try {
            if (connection != null) {
                return;
            }
            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try {
                EmbeddedGenerationQueueSchema.initialize(conn);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
            connection = conn;
            LOG.infof("Embedded generation queue initialized at [%s]", dbPath);
        } catch (SQLException e) {
            throw new QueueInitException("Failed to open embedded generation queue at " + dbPath, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public GenerationJob enqueue(NewGenerationJob request) {
        JobValidator.validate(request, settings);

        return inTransaction(conn -> {
            long waiting;
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT COUNT(*) FROM generation_jobs WHERE status IN ('PENDING', 'QUEUED')");
                 ResultSet rs = stmt.executeQuery()) {
                waiting = rs.next() ? rs.getLong(1) : 0;
            }
            JobValidator.checkCapacity(waiting, settings);

            Instant now = clock.instant();
            boolean scheduled = request.scheduledAt() != null && request.scheduledAt().isAfter(now);
            GenerationJob job = new GenerationJob(
                UUID.randomUUID().toString(),
                request.userId(),
                request.type(),
                scheduled ? JobStatus.QUEUED : JobStatus.PENDING,
                request.priority(),
                request.payload(),
                null,
                null,
                now,
                now,
                request.scheduledAt(),
                null,
                null,
                null
            );
            insert(conn, job);
            LOG.debugf("Enqueued job [%s] type=%s priority=%s status=%s",
                job.id(), job.type(), job.priority(), job.status());
            return job;
        });
    }

    @Override
    public Optional<GenerationJob> getJob(String id) {
        return inTransaction(conn -> find(conn, id));
    }

    @Override
    public List<GenerationJob> getNextJobs(int limit) {
        if (limit <= 0) {
            return List.of();
        }

        return inTransaction(conn -> {
            long now = clock.millis();

            try (PreparedStatement promote = conn.prepareStatement("""
                    UPDATE generation_jobs SET status = 'PENDING', updated_at = ?
                    WHERE status = 'QUEUED' AND (scheduled_at IS NULL OR scheduled_at <= ?)
                    """)) {
                promote.setLong(1, now);
                promote.setLong(2, now);
                int promoted = promote.executeUpdate();
                if (promoted > 0) {
                    LOG.debugf("Promoted %d scheduled jobs to PENDING", promoted);
                }
            }

            try (PreparedStatement stmt = conn.prepareStatement(SELECT_COLUMNS + """
                    WHERE status = 'PENDING' AND (next_eligible_at IS NULL OR next_eligible_at <= ?)
                    ORDER BY priority DESC, created_at ASC, rowid ASC
                    LIMIT ?
                    """)) {
                stmt.setLong(1, now);
                stmt.setInt(2, limit);
                return readAll(stmt);
            }
        });
    }

    @Override
    public Optional<GenerationJob> claimJob(String id) {
        return inTransaction(conn -> {
            Optional<GenerationJob> found = find(conn, id);
            if (found.isEmpty() || found.get().status() != JobStatus.PENDING) {
                LOG.debugf("Job [%s] is not claimable", id);
                return Optional.empty();
            }

            GenerationJob claimed = found.get().apply(JobUpdate.processing(), clock.instant());
            write(conn, claimed);
            return Optional.of(claimed);
        });
    }

    @Override
    public Optional<GenerationJob> updateJob(String id, JobUpdate update) {
        return inTransaction(conn -> {
            Optional<GenerationJob> found = find(conn, id);
            if (found.isEmpty()) {
                LOG.debugf("Update for unknown job [%s] ignored", id);
                return Optional.empty();
            }

            GenerationJob current = found.get();
            if (current.status().isTerminal() && update.status() != null && update.status() != current.status()) {
                LOG.warnf("Refusing transition of job [%s] from terminal status %s to %s",
                    id, current.status(), update.status());
                return found;
            }

            GenerationJob updated = current.apply(update, clock.instant());
            write(conn, updated);
            return Optional.of(updated);
        });
    }

    @Override
    public Optional<GenerationJob> cancelJob(String id, String userId) {
        return inTransaction(conn -> {
            Optional<GenerationJob> found = find(conn, id);
            if (found.isEmpty()) {
                return Optional.empty();
            }

            GenerationJob current = found.get();
            if (!current.userId().equals(userId)) {
                throw JobCancellationException.unauthorized();
            }
            if (!current.status().isCancellable()) {
                throw JobCancellationException.notCancellable();
            }

            GenerationJob cancelled = current.apply(JobUpdate.cancelled(), clock.instant());
            write(conn, cancelled);
            LOG.debugf("Cancelled job [%s] for user [%s]", id, userId);
            return Optional.of(cancelled);
        });
    }

    @Override
    public List<GenerationJob> getUserJobs(String userId, JobQuery query) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE user_id = ?");
        query.status().ifPresent(s -> sql.append(" AND status = ?"));
        query.type().ifPresent(t -> sql.append(" AND type = ?"));
        sql.append(" ORDER BY created_at DESC, rowid DESC LIMIT ? OFFSET ?");

        return inTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
                int index = 1;
                stmt.setString(index++, userId);
                if (query.status().isPresent()) {
                    stmt.setString(index++, query.status().get().name());
                }
                if (query.type().isPresent()) {
                    stmt.setString(index++, query.type().get().name());
                }
                stmt.setInt(index++, query.limit());
                stmt.setInt(index, query.offset());
                return readAll(stmt);
            }
        });
    }

    @Override
    public QueueMetrics getMetrics() {
        return inTransaction(conn -> {
            long pending = 0;
            long processing = 0;
            long completed = 0;
            long failed = 0;

            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT status, COUNT(*) FROM generation_jobs GROUP BY status");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    long count = rs.getLong(2);
                    switch (JobStatus.valueOf(rs.getString(1))) {
                        case PENDING, QUEUED -> pending += count;
                        case PROCESSING -> processing += count;
                        case COMPLETED -> completed += count;
                        case FAILED, CANCELLED -> failed += count;
                    }
                }
            }

            long averageWait = scalar(conn,
                "SELECT AVG(started_at - created_at) FROM generation_jobs WHERE started_at IS NOT NULL", null);
            long averageProcessing = scalar(conn, """
                SELECT AVG(completed_at - started_at) FROM generation_jobs
                WHERE started_at IS NOT NULL AND completed_at IS NOT NULL
                """, null);
            long throughput = scalar(conn,
                "SELECT COUNT(*) FROM generation_jobs WHERE status = 'COMPLETED' AND completed_at > ?",
                clock.millis() - Duration.ofHours(1).toMillis());

            return new QueueMetrics(pending, processing, completed, failed, averageWait, averageProcessing, throughput);
        });
    }

    @Override
    public int processStaleJobs(Duration threshold) {
        return inTransaction(conn -> {
            Instant now = clock.instant();
            List<GenerationJob> stale;
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_COLUMNS +
                    "WHERE status = 'PROCESSING' AND started_at < ?")) {
                stmt.setLong(1, now.minus(threshold).toEpochMilli());
                stale = readAll(stmt);
            }

            for (GenerationJob job : stale) {
                JobError error = JobError.permanent("TIMEOUT",
                    String.format("Job timed out after %d minutes", threshold.toMinutes()), job.retryCount(), now);
                write(conn, job.apply(JobUpdate.failed(error), now));
            }

            if (!stale.isEmpty()) {
                LOG.warnf("Marked %d stale processing jobs as failed", stale.size());
            }
            return stale.size();
        });
    }

    @Override
    public int cleanup(Duration olderThan) {
        return inTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("""
                    DELETE FROM generation_jobs
                    WHERE status IN ('COMPLETED', 'FAILED', 'CANCELLED') AND updated_at < ?
                    """)) {
                stmt.setLong(1, clock.millis() - olderThan.toMillis());
                int removed = stmt.executeUpdate();
                if (removed > 0) {
                    LOG.infof("Cleaned up %d finished jobs older than %s", removed, olderThan);
                }
                return removed;
            }
        });
    }

    @Override
    public void shutdown() {
        lock.lock();
        try {
            if (connection != null) {
                try {
                    connection.close();
                    LOG.info("Embedded generation queue shut down");
                } catch (SQLException e) {
                    LOG.warnf("Error closing embedded generation queue connection: %s", e.getMessage());
                } finally {
                    connection = null;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // JDBC helpers
    // ========================================================================

    private <T> T inTransaction(SqlWork<T> work) {
        lock.lock();
        try {
            if (connection == null) {
                throw new QueueException("Embedded generation queue is not initialized");
            }
            connection.setAutoCommit(false);
            try {
                T result = work.execute(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new QueueException("Embedded generation queue operation failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private Optional<GenerationJob> find(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_COLUMNS + "WHERE id = ?")) {
            stmt.setString(1, id);
            List<GenerationJob> jobs = readAll(stmt);
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        }
    }

    private long scalar(Connection conn, String sql, Long parameter) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (parameter != null) {
                stmt.setLong(1, parameter);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Math.round(rs.getDouble(1)) : 0;
            }
        }
    }

    private void insert(Connection conn, GenerationJob job) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("""
                INSERT INTO generation_jobs
                (id, user_id, type, status, priority, payload_json, error_json, result_json,
                 created_at, updated_at, scheduled_at, next_eligible_at, started_at, completed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """)) {
            stmt.setString(1, job.id());
            stmt.setString(2, job.userId());
            stmt.setString(3, job.type().name());
            stmt.setString(4, job.status().name());
            stmt.setInt(5, job.priority().weight());
            stmt.setString(6, json.writePayload(job.payload()));
            stmt.setString(7, json.writeError(job.error()));
            stmt.setString(8, json.writeResult(job.result()));
            stmt.setLong(9, job.createdAt().toEpochMilli());
            stmt.setLong(10, job.updatedAt().toEpochMilli());
            setInstant(stmt, 11, job.scheduledAt());
            setInstant(stmt, 12, job.nextEligibleAt());
            setInstant(stmt, 13, job.startedAt());
            setInstant(stmt, 14, job.completedAt());
            stmt.executeUpdate();
        }
    }

    private void write(Connection conn, GenerationJob job) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("""
                UPDATE generation_jobs
                SET status = ?, error_json = ?, result_json = ?, updated_at = ?,
                    next_eligible_at = ?, started_at = ?, completed_at = ?
                WHERE id = ?
                """)) {
            stmt.setString(1, job.status().name());
            stmt.setString(2, json.writeError(job.error()));
            stmt.setString(3, json.writeResult(job.result()));
            stmt.setLong(4, job.updatedAt().toEpochMilli());
            setInstant(stmt, 5, job.nextEligibleAt());
            setInstant(stmt, 6, job.startedAt());
            setInstant(stmt, 7, job.completedAt());
            stmt.setString(8, job.id());
            stmt.executeUpdate();
        }
    }

    private List<GenerationJob> readAll(PreparedStatement stmt) throws SQLException {
        List<GenerationJob> jobs = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                jobs.add(new GenerationJob(
                    rs.getString("id"),
                    rs.getString("user_id"),
                    JobType.valueOf(rs.getString("type")),
                    JobStatus.valueOf(rs.getString("status")),
                    JobPriority.fromWeight(rs.getInt("priority")),
                    json.readPayload(rs.getString("payload_json")),
                    json.readError(rs.getString("error_json")),
                    json.readResult(rs.getString("result_json")),
                    getInstant(rs, "created_at"),
                    getInstant(rs, "updated_at"),
                    getInstant(rs, "scheduled_at"),
                    getInstant(rs, "next_eligible_at"),
                    getInstant(rs, "started_at"),
                    getInstant(rs, "completed_at")
                ));
            }
        }
        return jobs;
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }
}
