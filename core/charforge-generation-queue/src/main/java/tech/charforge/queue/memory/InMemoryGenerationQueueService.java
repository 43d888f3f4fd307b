package tech.charforge.queue.memory;

import org.jboss.logging.Logger;
import tech.charforge.queue.GenerationQueueService;
import tech.charforge.queue.JobCancellationException;
import tech.charforge.queue.JobValidator;
import tech.charforge.queue.QueueSettings;
import tech.charforge.queue.model.GenerationJob;
import tech.charforge.queue.model.JobError;
import tech.charforge.queue.model.JobQuery;
import tech.charforge.queue.model.JobStatus;
import tech.charforge.queue.model.JobUpdate;
import tech.charforge.queue.model.NewGenerationJob;
import tech.charforge.queue.model.QueueMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local job store for development, tests and single-node deployments.
 *
 * <p>All operations run under one lock, so {@link #getNextJobs(int)} followed by
 * an update to PROCESSING is safe against other callers in the same process.
 */
public class InMemoryGenerationQueueService implements GenerationQueueService {

    private static final Logger LOG = Logger.getLogger(InMemoryGenerationQueueService.class);

    static final Comparator<GenerationJob> DEQUEUE_ORDER = Comparator
        .comparingInt((GenerationJob job) -> job.priority().weight()).reversed()
        .thenComparing(GenerationJob::createdAt);

    private final Map<String, GenerationJob> jobs = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final QueueSettings settings;
    private final Clock clock;
    private volatile boolean initialized = false;

    public InMemoryGenerationQueueService() {
        this(QueueSettings.defaults(), Clock.systemUTC());
    }

    public InMemoryGenerationQueueService(QueueSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void initialize() {
        if (!initialized) {
            initialized = true;
            LOG.info("In-memory generation queue initialized");
        }
    }

    @Override
    public GenerationJob enqueue(NewGenerationJob request) {
        JobValidator.validate(request, settings);

        lock.lock();
        try {
            long waiting = jobs.values().stream()
                .filter(job -> job.status() == JobStatus.PENDING || job.status() == JobStatus.QUEUED)
                .count();
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
            jobs.put(job.id(), job);
            LOG.debugf("Enqueued job [%s] type=%s priority=%s status=%s",
                job.id(), job.type(), job.priority(), job.status());
            return job;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<GenerationJob> getJob(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(jobs.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<GenerationJob> getNextJobs(int limit) {
        if (limit <= 0) {
            return List.of();
        }

        lock.lock();
        try {
            Instant now = clock.instant();
            promoteDueJobs(now);

            return jobs.values().stream()
                .filter(job -> job.isEligibleAt(now))
                .sorted(DEQUEUE_ORDER)
                .limit(limit)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    private void promoteDueJobs(Instant now) {
        for (GenerationJob job : new ArrayList<>(jobs.values())) {
            if (job.isDueAt(now)) {
                jobs.put(job.id(), job.withStatus(JobStatus.PENDING, now));
                LOG.debugf("Promoted scheduled job [%s] to PENDING", job.id());
            }
        }
    }

    @Override
    public Optional<GenerationJob> claimJob(String id) {
        lock.lock();
        try {
            GenerationJob current = jobs.get(id);
            if (current == null || current.status() != JobStatus.PENDING) {
                LOG.debugf("Job [%s] is not claimable", id);
                return Optional.empty();
            }

            GenerationJob claimed = current.apply(JobUpdate.processing(), clock.instant());
            jobs.put(id, claimed);
            return Optional.of(claimed);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<GenerationJob> updateJob(String id, JobUpdate update) {
        lock.lock();
        try {
            GenerationJob current = jobs.get(id);
            if (current == null) {
                LOG.debugf("Update for unknown job [%s] ignored", id);
                return Optional.empty();
            }
            if (current.status().isTerminal() && update.status() != null && update.status() != current.status()) {
                LOG.warnf("Refusing transition of job [%s] from terminal status %s to %s",
                    id, current.status(), update.status());
                return Optional.of(current);
            }

            GenerationJob updated = current.apply(update, clock.instant());
            jobs.put(id, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<GenerationJob> cancelJob(String id, String userId) {
        lock.lock();
        try {
            GenerationJob current = jobs.get(id);
            if (current == null) {
                return Optional.empty();
            }
            if (!current.userId().equals(userId)) {
                throw JobCancellationException.unauthorized();
            }
            if (!current.status().isCancellable()) {
                throw JobCancellationException.notCancellable();
            }

            GenerationJob cancelled = current.apply(JobUpdate.cancelled(), clock.instant());
            jobs.put(id, cancelled);
            LOG.debugf("Cancelled job [%s] for user [%s]", id, userId);
            return Optional.of(cancelled);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<GenerationJob> getUserJobs(String userId, JobQuery query) {
        lock.lock();
        try {
            return jobs.values().stream()
                .filter(job -> job.userId().equals(userId))
                .filter(query::matches)
                .sorted(Comparator.comparing(GenerationJob::createdAt).reversed())
                .skip(query.offset())
                .limit(query.limit())
                .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueMetrics getMetrics() {
        lock.lock();
        try {
            return QueueMetricsCalculator.calculate(jobs.values(), clock.instant());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int processStaleJobs(Duration threshold) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Instant cutoff = now.minus(threshold);
            int count = 0;

            for (GenerationJob job : new ArrayList<>(jobs.values())) {
                if (job.status() == JobStatus.PROCESSING
                        && job.startedAt() != null
                        && job.startedAt().isBefore(cutoff)) {
                    JobError error = JobError.permanent("TIMEOUT",
                        String.format("Job timed out after %d minutes", threshold.toMinutes()), job.retryCount(), now);
                    jobs.put(job.id(), job.apply(JobUpdate.failed(error), now));
                    count++;
                }
            }

            if (count > 0) {
                LOG.warnf("Marked %d stale processing jobs as failed", count);
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int cleanup(Duration olderThan) {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(olderThan);
            int before = jobs.size();
            jobs.values().removeIf(job -> job.status().isTerminal() && job.updatedAt().isBefore(cutoff));
            int removed = before - jobs.size();
            if (removed > 0) {
                LOG.infof("Cleaned up %d finished jobs older than %s", removed, olderThan);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void shutdown() {
        if (initialized) {
            initialized = false;
            LOG.info("In-memory generation queue shut down");
        }
    }
}
