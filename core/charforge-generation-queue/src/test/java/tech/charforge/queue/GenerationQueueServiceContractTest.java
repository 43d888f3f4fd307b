package tech.charforge.queue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.charforge.queue.model.GenerationJob;
import tech.charforge.queue.model.GenerationResult;
import tech.charforge.queue.model.JobError;
import tech.charforge.queue.model.JobPriority;
import tech.charforge.queue.model.JobQuery;
import tech.charforge.queue.model.JobResult;
import tech.charforge.queue.model.JobStatus;
import tech.charforge.queue.model.JobType;
import tech.charforge.queue.model.JobUpdate;
import tech.charforge.queue.model.NewGenerationJob;
import tech.charforge.queue.model.QueueMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link GenerationQueueService} store must share.
 * Subclasses provide the store under test.
 */
public abstract class GenerationQueueServiceContractTest {

    protected MutableClock clock;
    protected GenerationQueueService queue;

    protected abstract GenerationQueueService createQueue(QueueSettings settings, MutableClock clock);

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        queue = createQueue(new QueueSettings(5, 4), clock);
        queue.initialize();
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    protected GenerationJob enqueueSingle(String userId, JobPriority priority) {
        return queue.enqueue(new NewGenerationJob(userId, JobType.SINGLE, priority,
            Map.of("prompt", "a knight in silver armor"), null));
    }

    @Test
    void shouldEnqueueAsPending() {
        GenerationJob job = enqueueSingle("user-1", JobPriority.NORMAL);

        assertNotNull(job.id());
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals("a knight in silver armor", queue.getJob(job.id()).orElseThrow().payload().get("prompt"));
    }

    @Test
    void shouldReturnEmptyForUnknownJob() {
        assertTrue(queue.getJob("missing").isEmpty());
        assertTrue(queue.updateJob("missing", JobUpdate.processing()).isEmpty());
    }

    @Test
    void shouldRejectBatchLargerThanLimit() {
        List<Map<String, Object>> requests = List.of(
            Map.of("prompt", "1"), Map.of("prompt", "2"), Map.of("prompt", "3"),
            Map.of("prompt", "4"), Map.of("prompt", "5"));

        JobValidationException e = assertThrows(JobValidationException.class, () ->
            queue.enqueue(NewGenerationJob.of("user-1", JobType.BATCH, Map.of("requests", requests))));

        assertEquals("Batch cannot exceed 4 requests", e.getMessage());
    }

    @Test
    void shouldRejectWhenQueueIsFull() {
        for (int i = 0; i < 5; i++) {
            enqueueSingle("user-1", JobPriority.NORMAL);
        }

        JobValidationException e = assertThrows(JobValidationException.class, () ->
            enqueueSingle("user-1", JobPriority.NORMAL));

        assertEquals("Queue is full. Please try again later.", e.getMessage());
    }

    @Test
    void shouldOrderByPriorityThenAge() {
        GenerationJob oldLow = enqueueSingle("user-1", JobPriority.LOW);
        clock.advance(Duration.ofSeconds(1));
        GenerationJob oldHigh = enqueueSingle("user-1", JobPriority.HIGH);
        clock.advance(Duration.ofSeconds(1));
        GenerationJob newUrgent = enqueueSingle("user-1", JobPriority.URGENT);
        clock.advance(Duration.ofSeconds(1));
        GenerationJob newHigh = enqueueSingle("user-1", JobPriority.HIGH);

        List<String> ids = queue.getNextJobs(10).stream().map(GenerationJob::id).toList();

        assertEquals(List.of(newUrgent.id(), oldHigh.id(), newHigh.id(), oldLow.id()), ids);
    }

    @Test
    void shouldHonourLimitAndNotTransition() {
        enqueueSingle("user-1", JobPriority.NORMAL);
        enqueueSingle("user-1", JobPriority.NORMAL);
        enqueueSingle("user-1", JobPriority.NORMAL);

        List<GenerationJob> next = queue.getNextJobs(2);

        assertEquals(2, next.size());
        next.forEach(job -> assertEquals(JobStatus.PENDING, queue.getJob(job.id()).orElseThrow().status()));
        assertTrue(queue.getNextJobs(0).isEmpty());
    }

    @Test
    void shouldSkipProcessingJobs() {
        GenerationJob first = enqueueSingle("user-1", JobPriority.NORMAL);
        GenerationJob second = enqueueSingle("user-1", JobPriority.NORMAL);

        GenerationJob claimed = queue.claimJob(first.id()).orElseThrow();

        assertEquals(JobStatus.PROCESSING, claimed.status());
        assertNotNull(claimed.startedAt());
        assertEquals(List.of(second.id()), queue.getNextJobs(5).stream().map(GenerationJob::id).toList());
    }

    @Test
    void shouldRefuseSecondClaimOfSameJob() {
        GenerationJob job = enqueueSingle("user-1", JobPriority.NORMAL);
        List<GenerationJob> seenByFirstWorker = queue.getNextJobs(1);
        List<GenerationJob> seenBySecondWorker = queue.getNextJobs(1);
        assertEquals(seenByFirstWorker.get(0).id(), seenBySecondWorker.get(0).id());

        Optional<GenerationJob> first = queue.claimJob(job.id());
        clock.advance(Duration.ofSeconds(1));
        Optional<GenerationJob> second = queue.claimJob(job.id());

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty(), "A PROCESSING job must not be claimed again");
        assertEquals(first.get().startedAt(), queue.getJob(job.id()).orElseThrow().startedAt());
    }

    @Test
    void shouldRefuseClaimOfMissingCancelledOrScheduledJob() {
        GenerationJob cancelled = enqueueSingle("user-1", JobPriority.NORMAL);
        queue.cancelJob(cancelled.id(), "user-1");
        GenerationJob scheduled = queue.enqueue(new NewGenerationJob("user-1", JobType.SINGLE, JobPriority.NORMAL,
            Map.of("prompt", "later"), clock.instant().plus(Duration.ofMinutes(10))));

        assertTrue(queue.claimJob("missing").isEmpty());
        assertTrue(queue.claimJob(cancelled.id()).isEmpty());
        assertTrue(queue.claimJob(scheduled.id()).isEmpty());
        assertEquals(JobStatus.QUEUED, queue.getJob(scheduled.id()).orElseThrow().status());
    }

    @Test
    void shouldHoldScheduledJobsUntilDue() {
        GenerationJob scheduled = queue.enqueue(new NewGenerationJob("user-1", JobType.SINGLE, JobPriority.NORMAL,
            Map.of("prompt", "later"), clock.instant().plus(Duration.ofMinutes(10))));

        assertEquals(JobStatus.QUEUED, scheduled.status());
        assertTrue(queue.getNextJobs(5).isEmpty());

        clock.advance(Duration.ofMinutes(10));

        List<GenerationJob> next = queue.getNextJobs(5);
        assertEquals(1, next.size());
        assertEquals(JobStatus.PENDING, next.get(0).status());
    }

    @Test
    void shouldDeferRetriedJobUntilEligible() {
        GenerationJob job = enqueueSingle("user-1", JobPriority.NORMAL);
        queue.updateJob(job.id(), JobUpdate.processing());
        JobError error = JobError.retryable("NETWORK_ERROR", "socket closed", 1, clock.instant());

        GenerationJob retried = queue.updateJob(job.id(),
            JobUpdate.retry(error, clock.instant().plus(Duration.ofSeconds(30)))).orElseThrow();

        assertEquals(JobStatus.PENDING, retried.status());
        assertEquals(1, retried.retryCount());
        assertTrue(queue.getNextJobs(5).isEmpty(), "Job must not be handed out before nextEligibleAt");

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, queue.getNextJobs(5).size());
    }

    @Test
    void shouldRecordCompletionAndRefuseLeavingTerminalState() {
        GenerationJob job = enqueueSingle("user-1", JobPriority.NORMAL);
        queue.updateJob(job.id(), JobUpdate.processing());
        clock.advance(Duration.ofSeconds(5));

        GenerationResult image = new GenerationResult("result_1", "https://cdn/img.png", null,
            new GenerationResult.Metadata(new GenerationResult.Dimensions(1024, 1024), "png", 2048, 4000, 42,
                "nanoBanana-v1", "NANOBANANA_API", null),
            clock.instant());
        GenerationJob completed = queue.updateJob(job.id(), JobUpdate.completed(JobResult.of(image, 5000))).orElseThrow();

        assertEquals(JobStatus.COMPLETED, completed.status());
        assertNotNull(completed.completedAt());
        assertEquals("https://cdn/img.png", queue.getJob(job.id()).orElseThrow().result().images().get(0).imageUrl());

        GenerationJob unchanged = queue.updateJob(job.id(), JobUpdate.processing()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, unchanged.status());
    }

    @Test
    void shouldCancelPendingJobOfOwner() {
        GenerationJob job = enqueueSingle("user-1", JobPriority.NORMAL);

        GenerationJob cancelled = queue.cancelJob(job.id(), "user-1").orElseThrow();

        assertEquals(JobStatus.CANCELLED, cancelled.status());
        assertNotNull(cancelled.completedAt());
        assertTrue(queue.getNextJobs(5).isEmpty());
    }

    @Test
    void shouldRejectCancellationByOtherUser() {
        GenerationJob job = enqueueSingle("user-1", JobPriority.NORMAL);

        JobCancellationException e = assertThrows(JobCancellationException.class,
            () -> queue.cancelJob(job.id(), "user-2"));

        assertEquals(JobCancellationException.Reason.UNAUTHORIZED, e.reason());
        assertEquals("Unauthorized to cancel this job", e.getMessage());
    }

    @Test
    void shouldRejectCancellationOfProcessingJob() {
        GenerationJob job = enqueueSingle("user-1", JobPriority.NORMAL);
        queue.updateJob(job.id(), JobUpdate.processing());

        JobCancellationException e = assertThrows(JobCancellationException.class,
            () -> queue.cancelJob(job.id(), "user-1"));

        assertEquals(JobCancellationException.Reason.NOT_CANCELLABLE, e.reason());
        assertEquals("Job cannot be cancelled in its current state", e.getMessage());
        assertEquals(Optional.empty(), queue.cancelJob("missing", "user-1"));
    }

    @Test
    void shouldListUserJobsNewestFirstWithFilters() {
        GenerationJob first = enqueueSingle("user-1", JobPriority.NORMAL);
        clock.advance(Duration.ofSeconds(1));
        GenerationJob second = enqueueSingle("user-1", JobPriority.NORMAL);
        clock.advance(Duration.ofSeconds(1));
        enqueueSingle("user-2", JobPriority.NORMAL);
        queue.updateJob(first.id(), JobUpdate.processing());

        List<GenerationJob> all = queue.getUserJobs("user-1", JobQuery.all());
        List<GenerationJob> processing = queue.getUserJobs("user-1", JobQuery.byStatus(JobStatus.PROCESSING));

        assertEquals(List.of(second.id(), first.id()), all.stream().map(GenerationJob::id).toList());
        assertEquals(List.of(first.id()), processing.stream().map(GenerationJob::id).toList());
    }

    @Test
    void shouldFailStaleProcessingJobs() {
        GenerationJob stale = enqueueSingle("user-1", JobPriority.NORMAL);
        queue.updateJob(stale.id(), JobUpdate.processing());
        clock.advance(Duration.ofMinutes(31));
        GenerationJob fresh = enqueueSingle("user-1", JobPriority.NORMAL);
        queue.updateJob(fresh.id(), JobUpdate.processing());

        int count = queue.processStaleJobs(Duration.ofMinutes(30));

        assertEquals(1, count);
        GenerationJob failed = queue.getJob(stale.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals("TIMEOUT", failed.error().code());
        assertEquals("Job timed out after 30 minutes", failed.error().message());
        assertEquals(JobStatus.PROCESSING, queue.getJob(fresh.id()).orElseThrow().status());
    }

    @Test
    void shouldKeepRetryCountWhenFailingStaleJob() {
        GenerationJob job = enqueueSingle("user-1", JobPriority.NORMAL);
        queue.claimJob(job.id());
        queue.updateJob(job.id(), JobUpdate.retry(
            JobError.retryable("NETWORK_ERROR", "socket closed", 2, clock.instant()), clock.instant()));
        queue.claimJob(job.id()).orElseThrow();
        clock.advance(Duration.ofMinutes(31));

        queue.processStaleJobs(Duration.ofMinutes(30));

        GenerationJob failed = queue.getJob(job.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(2, failed.retryCount(), "Retry count never decreases");
        assertFalse(failed.error().retryable(), "A failed job is not retryable");
    }

    @Test
    void shouldCleanupOldFinishedJobsOnly() {
        GenerationJob done = enqueueSingle("user-1", JobPriority.NORMAL);
        queue.updateJob(done.id(), JobUpdate.failed(JobError.permanent("VALIDATION_ERROR", "bad", 1, clock.instant())));
        GenerationJob waiting = enqueueSingle("user-1", JobPriority.NORMAL);
        clock.advance(Duration.ofDays(8));

        int removed = queue.cleanup(Duration.ofDays(7));

        assertEquals(1, removed);
        assertTrue(queue.getJob(done.id()).isEmpty());
        assertTrue(queue.getJob(waiting.id()).isPresent());
    }

    @Test
    void shouldAggregateMetrics() {
        GenerationJob completed = enqueueSingle("user-1", JobPriority.NORMAL);
        GenerationJob failed = enqueueSingle("user-1", JobPriority.NORMAL);
        GenerationJob cancelled = enqueueSingle("user-1", JobPriority.NORMAL);
        GenerationJob processing = enqueueSingle("user-1", JobPriority.NORMAL);
        queue.enqueue(new NewGenerationJob("user-1", JobType.SINGLE, JobPriority.LOW,
            Map.of("prompt", "later"), clock.instant().plus(Duration.ofHours(1))));

        clock.advance(Duration.ofSeconds(2));
        queue.updateJob(completed.id(), JobUpdate.processing());
        queue.updateJob(failed.id(), JobUpdate.processing());
        queue.updateJob(processing.id(), JobUpdate.processing());
        clock.advance(Duration.ofSeconds(4));
        queue.updateJob(completed.id(), JobUpdate.completed(new JobResult(List.of(), 0, 4000)));
        queue.updateJob(failed.id(), JobUpdate.failed(JobError.permanent("API_ERROR", "boom", 1, clock.instant())));
        queue.cancelJob(cancelled.id(), "user-1");

        QueueMetrics metrics = queue.getMetrics();

        assertEquals(1, metrics.pending(), "Scheduled jobs count as pending");
        assertEquals(1, metrics.processing());
        assertEquals(1, metrics.completed());
        assertEquals(2, metrics.failed(), "Cancelled jobs count as failed");
        assertEquals(2000, metrics.averageWaitTimeMs());
        assertEquals(4000, metrics.averageProcessingTimeMs());
        assertEquals(1, metrics.throughputPerHour());
    }
}
