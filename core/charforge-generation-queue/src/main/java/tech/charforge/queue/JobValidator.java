package tech.charforge.queue;

import tech.charforge.queue.model.NewGenerationJob;

import java.util.List;
import java.util.Map;

/**
 * Payload checks shared by all queue stores.
 */
public final class JobValidator {

    public static final String QUEUE_FULL_MESSAGE = "Queue is full. Please try again later.";

    private JobValidator() {
        // Utility class
    }

    public static void validate(NewGenerationJob request, QueueSettings settings) {
        if (request.userId() == null || request.userId().isBlank()) {
            throw new JobValidationException("User ID is required");
        }
        if (request.type() == null) {
            throw new JobValidationException("Job type is required");
        }

        Map<String, Object> payload = request.payload();
        switch (request.type()) {
            case SINGLE -> {
                if (!(payload.get("prompt") instanceof String prompt) || prompt.isBlank()) {
                    throw new JobValidationException("Prompt is required");
                }
            }
            case CHARACTER -> {
                if (!(payload.get("characterSpecs") instanceof Map<?, ?>)) {
                    throw new JobValidationException("Character specifications are required");
                }
            }
            case BATCH -> {
                if (!(payload.get("requests") instanceof List<?> requests) || requests.isEmpty()) {
                    throw new JobValidationException("Batch must contain at least one request");
                }
                if (requests.size() > settings.maxBatchSize()) {
                    throw new JobValidationException(
                        String.format("Batch cannot exceed %d requests", settings.maxBatchSize()));
                }
            }
        }
    }

    public static void checkCapacity(long waitingJobs, QueueSettings settings) {
        if (waitingJobs >= settings.maxQueueSize()) {
            throw new JobValidationException(QUEUE_FULL_MESSAGE);
        }
    }
}
