package tech.charforge.generationworker.worker;

import org.jboss.logging.Logger;
import tech.charforge.generationworker.event.WorkerEvent;
import tech.charforge.generationworker.event.WorkerEventBus;
import tech.charforge.generationworker.processor.BatchProcessorService;
import tech.charforge.generationworker.provider.GenerationException;
import tech.charforge.generationworker.resilience.ProviderError;
import tech.charforge.generationworker.resilience.ResilienceConfig;
import tech.charforge.queue.GenerationQueueService;
import tech.charforge.queue.model.GenerationJob;
import tech.charforge.queue.model.JobError;
import tech.charforge.queue.model.JobResult;
import tech.charforge.queue.model.JobStatus;
import tech.charforge.queue.model.JobUpdate;
import tech.charforge.queue.model.QueueMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Polls the generation queue and runs jobs on a bounded pool.
 *
 * <h2>Loops</h2>
 * <ul>
 *   <li>Poll loop (fixed delay): claims up to {@code concurrency - activeJobs}
 *       eligible jobs by marking them PROCESSING, then runs each asynchronously.</li>
 *   <li>Health loop (fixed rate): counts stale active jobs, refreshes queue
 *       metrics and publishes a {@link WorkerEvent.HealthCheck}.</li>
 * </ul>
 *
 * <h2>Outcomes</h2>
 * A failed job goes back to PENDING with a deferred {@code nextEligibleAt}
 * while the error is retryable and the attempt count stays below
 * {@code maxRetries}; otherwise it is FAILED for good.
 *
 * <h2>Shutdown</h2>
 * {@link #stop()} waits up to {@code shutdownTimeoutMs} for active jobs. Jobs
 * still running after that are abandoned: their outcome is still written to
 * the queue but no longer counted or published.
 */
public class QueueWorker {

    private static final Logger LOG = Logger.getLogger(QueueWorker.class);
    private static final long STOP_POLL_MS = 100;

    private final GenerationQueueService queueService;
    private final BatchProcessorService batchProcessor;
    private final WorkerSettings settings;
    private final WorkerEventBus events;
    private final Clock clock;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final ReentrantLock pollLock = new ReentrantLock();
    private volatile WorkerState state = WorkerState.STOPPED;

    private final ConcurrentMap<String, ActiveJob> activeJobs = new ConcurrentHashMap<>();

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong totalProcessingTimeMs = new AtomicLong();

    private volatile Instant startedAt;
    private volatile Instant lastProcessedAt;
    private volatile String lastError;
    private volatile Instant lastErrorAt;
    private volatile QueueMetrics lastQueueMetrics = QueueMetrics.empty();

    private ScheduledExecutorService scheduler;
    private ExecutorService jobExecutor;
    private ScheduledFuture<?> pollTask;
    private ScheduledFuture<?> healthTask;

    private record ActiveJob(GenerationJob job, Instant startedAt) {
    }

    public QueueWorker(GenerationQueueService queueService, BatchProcessorService batchProcessor,
                       WorkerSettings settings, WorkerEventBus events, Clock clock) {
        this.queueService = queueService;
        this.batchProcessor = batchProcessor;
        this.settings = settings;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Initialise the queue and start both loops. Ignored unless the worker is STOPPED.
     *
     * @throws RuntimeException if queue initialisation fails; the worker stays STOPPED
     */
    public void start() {
        stateLock.lock();
        try {
            if (state != WorkerState.STOPPED) {
                LOG.warnf("Worker is %s, ignoring start request", state);
                return;
            }
            state = WorkerState.STARTING;
        } finally {
            stateLock.unlock();
        }

        LOG.infof("Starting generation worker: concurrency=%d, pollInterval=%dms, maxRetries=%d",
            settings.concurrency(), settings.pollIntervalMs(), settings.maxRetries());

        try {
            queueService.initialize();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Queue initialisation failed, worker not started");
            state = WorkerState.STOPPED;
            throw e;
        }

        scheduler = Executors.newScheduledThreadPool(2, threadFactory("generation-worker-scheduler"));
        jobExecutor = Executors.newFixedThreadPool(settings.concurrency(), threadFactory("generation-worker-job"));
        startedAt = clock.instant();
        state = WorkerState.RUNNING;
        events.publish(new WorkerEvent.WorkerStarted(startedAt));

        pollTask = scheduler.scheduleWithFixedDelay(
            this::pollTick, 0, settings.pollIntervalMs(), TimeUnit.MILLISECONDS);
        healthTask = scheduler.scheduleAtFixedRate(
            this::healthTick, settings.healthCheckIntervalMs(), settings.healthCheckIntervalMs(), TimeUnit.MILLISECONDS);

        LOG.info("Generation worker started");
    }

    /**
     * Stop both loops, drain active jobs and release the queue and the processor.
     * Ignored unless the worker is RUNNING.
     */
    public void stop() {
        stateLock.lock();
        try {
            if (state != WorkerState.RUNNING) {
                LOG.warnf("Worker is %s, ignoring stop request", state);
                return;
            }
            state = WorkerState.STOPPING;
        } finally {
            stateLock.unlock();
        }

        LOG.infof("Stopping generation worker, %d active jobs", activeJobs.size());
        pollTask.cancel(false);
        healthTask.cancel(false);

        // Let an in-progress poll observe STOPPING before waiting on its jobs
        pollLock.lock();
        pollLock.unlock();

        boolean drained = awaitActiveJobs();
        int abandoned = 0;
        if (!drained) {
            abandoned = activeJobs.size();
            LOG.warnf("Forced stop: abandoning %d jobs still processing after %dms: %s",
                abandoned, settings.shutdownTimeoutMs(), activeJobs.keySet());
            activeJobs.clear();
        }

        scheduler.shutdownNow();
        jobExecutor.shutdown();

        try {
            batchProcessor.shutdown();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error shutting down batch processor");
        }
        try {
            queueService.shutdown();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error shutting down queue service");
        }

        state = WorkerState.STOPPED;
        LOG.infof("Generation worker stopped%s", drained ? "" : " (forced)");
        events.publish(new WorkerEvent.WorkerStopped(!drained, abandoned, clock.instant()));
    }

    private boolean awaitActiveJobs() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.shutdownTimeoutMs());
        while (!activeJobs.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(STOP_POLL_MS);
            } catch (InterruptedException e) {
                LOG.warn("Interrupted while waiting for active jobs to finish");
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private void pollTick() {
        try {
            pollOnce();
        } catch (Exception e) {
            reportUncaught("poll", e);
        }
    }

    private void healthTick() {
        try {
            runHealthCheck();
        } catch (Exception e) {
            reportUncaught("health-check", e);
        }
    }

    /**
     * One poll pass. Serialised with the scheduled poll loop.
     *
     * @return number of jobs started
     */
    int pollOnce() {
        pollLock.lock();
        try {
            if (state != WorkerState.RUNNING) {
                return 0;
            }

            int capacity = settings.concurrency() - activeJobs.size();
            if (capacity <= 0) {
                LOG.debugf("Worker at capacity (%d active), skipping poll", activeJobs.size());
                return 0;
            }

            List<GenerationJob> candidates = queueService.getNextJobs(capacity);
            int started = 0;
            for (GenerationJob candidate : candidates) {
                if (state != WorkerState.RUNNING) {
                    break;
                }

                Optional<GenerationJob> claimed = queueService.claimJob(candidate.id());
                if (claimed.isEmpty()) {
                    LOG.debugf("Job [%s] could not be claimed, skipping", candidate.id());
                    continue;
                }

                GenerationJob job = claimed.get();
                ActiveJob active = new ActiveJob(job, clock.instant());
                activeJobs.put(job.id(), active);
                LOG.infof("Job [%s] started (%s, priority %s, attempt %d)",
                    job.id(), job.type(), job.priority(), job.retryCount() + 1);
                events.publish(new WorkerEvent.JobStarted(job.id(), job, active.startedAt()));

                if (launch(active)) {
                    started++;
                }
            }
            return started;
        } finally {
            pollLock.unlock();
        }
    }

    private boolean launch(ActiveJob active) {
        String jobId = active.job().id();
        try {
            CompletableFuture.runAsync(() -> runJob(active), jobExecutor)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        Throwable reason = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                        activeJobs.remove(jobId, active);
                        LOG.errorf(reason, "Job [%s] failed while recording its outcome", jobId);
                        events.publish(new WorkerEvent.UnhandledRejection(jobId, reason, clock.instant()));
                    }
                });
            return true;
        } catch (RejectedExecutionException e) {
            activeJobs.remove(jobId, active);
            LOG.warnf("Job executor rejected job [%s], returning it to the queue", jobId);
            queueService.updateJob(jobId, new JobUpdate(JobStatus.PENDING, null, null, null));
            return false;
        }
    }

    private void runJob(ActiveJob active) {
        JobResult result;
        try {
            result = batchProcessor.processJob(active.job());
        } catch (Exception e) {
            handleFailure(active, e);
            return;
        }
        handleSuccess(active, result);
    }

    private void handleSuccess(ActiveJob active, JobResult result) {
        GenerationJob job = active.job();
        Instant now = clock.instant();
        long elapsedMs = Duration.between(active.startedAt(), now).toMillis();

        GenerationJob updated = queueService.updateJob(job.id(), JobUpdate.completed(result)).orElse(job);
        if (!activeJobs.remove(job.id(), active)) {
            LOG.infof("Abandoned job [%s] completed after stop, outcome recorded but not counted", job.id());
            return;
        }

        processed.incrementAndGet();
        successful.incrementAndGet();
        totalProcessingTimeMs.addAndGet(elapsedMs);
        lastProcessedAt = now;

        LOG.infof("Job [%s] completed in %dms with %d images%s", job.id(), elapsedMs, result.images().size(),
            result.isPartial() ? String.format(" (%d failed)", result.failedCount()) : "");
        events.publish(new WorkerEvent.JobCompleted(job.id(), updated, result, elapsedMs, now));
    }

    private void handleFailure(ActiveJob active, Exception cause) {
        GenerationJob job = active.job();
        Instant now = clock.instant();
        ProviderError error = ProviderError.from(cause);
        int retryCount = job.retryCount() + 1;

        lastError = error.message();
        lastErrorAt = now;

        if (ResilienceConfig.isRetryableError(error) && retryCount < settings.maxRetries()) {
            long delayMs = Math.max(settings.retryDelayMs(), retryAfterMs(cause));
            Instant nextEligibleAt = now.plusMillis(delayMs);
            JobError jobError = JobError.retryable(error.codeOrUnknown(), error.message(), retryCount, now);

            GenerationJob updated = queueService.updateJob(job.id(), JobUpdate.retry(jobError, nextEligibleAt))
                .orElse(job);
            if (!activeJobs.remove(job.id(), active)) {
                LOG.infof("Abandoned job [%s] failed after stop, returned to queue", job.id());
                return;
            }

            retried.incrementAndGet();
            LOG.warnf("Job [%s] failed (attempt %d of %d), retry not before %s: [%s] %s",
                job.id(), retryCount, settings.maxRetries(), nextEligibleAt, jobError.code(), jobError.message());
            events.publish(new WorkerEvent.JobRetried(job.id(), updated, jobError, retryCount, nextEligibleAt, now));
            return;
        }

        JobError jobError = JobError.permanent(error.codeOrUnknown(), error.message(), retryCount, now);
        GenerationJob updated = queueService.updateJob(job.id(), JobUpdate.failed(jobError)).orElse(job);
        if (!activeJobs.remove(job.id(), active)) {
            LOG.infof("Abandoned job [%s] failed after stop, outcome recorded but not counted", job.id());
            return;
        }

        processed.incrementAndGet();
        failed.incrementAndGet();
        totalProcessingTimeMs.addAndGet(Duration.between(active.startedAt(), now).toMillis());
        lastProcessedAt = now;

        LOG.errorf("Job [%s] failed permanently after %d attempts: [%s] %s",
            job.id(), retryCount, jobError.code(), jobError.message());
        events.publish(new WorkerEvent.JobFailed(job.id(), updated, jobError, cause, now));
    }

    private static long retryAfterMs(Throwable cause) {
        if (cause instanceof GenerationException generationException) {
            return generationException.retryAfter().map(Duration::toMillis).orElse(0L);
        }
        return 0L;
    }

    /**
     * One health pass. Publishes a {@link WorkerEvent.HealthCheck}.
     */
    WorkerHealth runHealthCheck() {
        Instant now = clock.instant();
        int stale = countStaleJobs(now);
        if (stale > 0) {
            LOG.warnf("%d jobs have been processing for longer than %dms", stale, settings.staleJobThresholdMs());
        }

        try {
            lastQueueMetrics = queueService.getMetrics();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not refresh queue metrics, using last known values");
        }

        WorkerHealth health = health(stale);
        WorkerMetrics metrics = metrics(now, stale);
        if (health.status() != HealthLevel.HEALTHY) {
            LOG.warnf("Worker health %s: errorRate=%.1f%%, activeJobs=%d, staleJobs=%d",
                health.status(), health.errorRate(), health.activeJobs(), stale);
        } else {
            LOG.debugf("Worker health %s: errorRate=%.1f%%, activeJobs=%d",
                health.status(), health.errorRate(), health.activeJobs());
        }
        events.publish(new WorkerEvent.HealthCheck(health, metrics, now));
        return health;
    }

    public WorkerStatus getStatus() {
        Instant now = clock.instant();
        int stale = countStaleJobs(now);
        return new WorkerStatus(isRunning(), state, activeJobs.size(), metrics(now, stale), health(stale));
    }

    public boolean isRunning() {
        WorkerState current = state;
        return current == WorkerState.RUNNING || current == WorkerState.STOPPING;
    }

    public WorkerState getState() {
        return state;
    }

    public Set<String> getActiveJobIds() {
        return Set.copyOf(activeJobs.keySet());
    }

    /**
     * Failed over processed, in percent. Zero until a job has been processed.
     */
    public double errorRate() {
        long total = processed.get();
        return total == 0 ? 0.0 : 100.0 * failed.get() / total;
    }

    private int countStaleJobs(Instant now) {
        long threshold = settings.staleJobThresholdMs();
        return (int) activeJobs.values().stream()
            .filter(active -> Duration.between(active.startedAt(), now).toMillis() > threshold)
            .count();
    }

    private WorkerHealth health(int staleJobs) {
        double errorRate = errorRate();
        HealthLevel level;
        if (errorRate > settings.unhealthyErrorRate()) {
            level = HealthLevel.UNHEALTHY;
        } else if (staleJobs > 0 || errorRate > settings.degradedErrorRate()) {
            level = HealthLevel.DEGRADED;
        } else {
            level = HealthLevel.HEALTHY;
        }
        return new WorkerHealth(level, activeJobs.size(), lastQueueMetrics.pending(), errorRate, lastError, lastErrorAt);
    }

    private WorkerMetrics metrics(Instant now, int staleJobs) {
        long total = processed.get();
        Instant since = startedAt;
        QueueMetrics queueMetrics = lastQueueMetrics;
        return new WorkerMetrics(
            total,
            successful.get(),
            failed.get(),
            retried.get(),
            total == 0 ? 0.0 : (double) totalProcessingTimeMs.get() / total,
            since == null ? 0 : Duration.between(since, now).toSeconds(),
            Math.min(1.0, (double) activeJobs.size() / settings.concurrency()),
            lastProcessedAt,
            new WorkerMetrics.QueueHealth(queueMetrics.pending(), queueMetrics.processing(), staleJobs)
        );
    }

    private void reportUncaught(String source, Throwable error) {
        LOG.errorf(error, "Uncaught error in worker %s", source);
        events.publish(new WorkerEvent.UncaughtError(source, error, clock.instant()));
    }

    private ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, error) -> reportUncaught(t.getName(), error));
            return thread;
        };
    }
}
