package tech.charforge.generationworker.processor;

import tech.charforge.generationworker.provider.GenerationException;
import tech.charforge.queue.model.GenerationJob;
import tech.charforge.queue.model.JobResult;

/**
 * Executes one generation job against the image provider.
 */
public interface BatchProcessorService {

    /**
     * Process a job according to its type.
     *
     * @return generated images; for BATCH jobs possibly a partial result
     * @throws GenerationException if the job produced no image
     */
    JobResult processJob(GenerationJob job);

    /**
     * Cancel in-flight provider calls. Later calls fail with REQUEST_CANCELLED.
     */
    void shutdown();
}
