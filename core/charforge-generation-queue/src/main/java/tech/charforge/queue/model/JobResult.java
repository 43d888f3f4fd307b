package tech.charforge.queue.model;

import java.util.List;

/**
 * Outcome of a successfully processed job.
 *
 * @param images        generated images, one per successful provider request
 * @param failedCount   batch entries that failed while others succeeded
 * @param totalTimeMs   wall clock time spent processing the job
 */
public record JobResult(
    List<GenerationResult> images,
    int failedCount,
    long totalTimeMs
) {

    public JobResult {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static JobResult of(GenerationResult image, long totalTimeMs) {
        return new JobResult(List.of(image), 0, totalTimeMs);
    }

    public boolean isPartial() {
        return failedCount > 0;
    }
}
