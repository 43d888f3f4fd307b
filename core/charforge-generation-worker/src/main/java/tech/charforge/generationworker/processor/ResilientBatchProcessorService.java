package tech.charforge.generationworker.processor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.charforge.generationworker.provider.GenerationException;
import tech.charforge.generationworker.provider.GenerationRequest;
import tech.charforge.generationworker.provider.ImageProviderClient;
import tech.charforge.generationworker.provider.ProviderImage;
import tech.charforge.queue.model.GenerationJob;
import tech.charforge.queue.model.GenerationResult;
import tech.charforge.queue.model.JobResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch processor that sends every provider call through an
 * {@link EndpointResilience} chain.
 *
 * <p>BATCH jobs are processed sequentially so a single job never holds more
 * than one rate limit permit at a time.
 */
public class ResilientBatchProcessorService implements BatchProcessorService {

    private static final Logger LOG = Logger.getLogger(ResilientBatchProcessorService.class);

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int DEFAULT_DIMENSION = 1024;
    private static final String DEFAULT_FORMAT = "png";

    private final ImageProviderClient client;
    private final EndpointResilience resilience;
    private final ProcessorSettings settings;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ResilientBatchProcessorService(ImageProviderClient client, EndpointResilience resilience,
                                          ProcessorSettings settings, Clock clock) {
        this.client = client;
        this.resilience = resilience;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public JobResult processJob(GenerationJob job) {
        if (closed.get()) {
            throw GenerationException.cancelled(job.id());
        }

        long start = clock.millis();
        LOG.debugf("Processing %s job [%s] for user [%s]", job.type(), job.id(), job.userId());
        return switch (job.type()) {
            case SINGLE -> processSingle(job, start);
            case CHARACTER -> processCharacter(job, start);
            case BATCH -> processBatch(job, start);
        };
    }

    private JobResult processSingle(GenerationJob job, long start) {
        GenerationRequest request = toRequest(job.payload());
        if (!request.hasPrompt()) {
            throw GenerationException.validation("Prompt is required");
        }
        GenerationResult result = generate(request, job.id(), start);
        return JobResult.of(result, clock.millis() - start);
    }

    private JobResult processCharacter(GenerationJob job, long start) {
        Object rawSpecs = job.payload().get("characterSpecs");
        if (!(rawSpecs instanceof Map<?, ?>)) {
            throw GenerationException.validation("Character specifications are required");
        }

        CharacterSpecs specs;
        try {
            specs = objectMapper.convertValue(rawSpecs, CharacterSpecs.class);
        } catch (IllegalArgumentException e) {
            throw GenerationException.validation("Invalid character specifications: " + e.getMessage());
        }

        Object params = job.payload().get("generationParams");
        GenerationRequest base = params instanceof Map<?, ?> map
            ? toRequest(castToPayload(map))
            : GenerationRequest.ofPrompt(null);
        GenerationRequest request = base
            .withPrompt(PromptBuilder.characterPrompt(specs))
            .withDefaults("high", "1:1", DEFAULT_FORMAT, "realistic");

        GenerationResult result = generate(request, job.id(), start);
        return JobResult.of(result, clock.millis() - start);
    }

    private JobResult processBatch(GenerationJob job, long start) {
        if (!(job.payload().get("requests") instanceof List<?> entries) || entries.isEmpty()) {
            throw GenerationException.validation("Batch must contain at least one request");
        }
        if (entries.size() > settings.maxBatchSize()) {
            throw GenerationException.validation(String.format(
                "Batch size %d exceeds maximum of %d", entries.size(), settings.maxBatchSize()));
        }

        List<GenerationResult> images = new ArrayList<>();
        GenerationException firstFailure = null;
        int failed = 0;

        for (int i = 0; i < entries.size(); i++) {
            String requestId = job.id() + "-" + (i + 1);
            try {
                if (!(entries.get(i) instanceof Map<?, ?> entry)) {
                    throw GenerationException.validation("Batch entry " + (i + 1) + " is not an object");
                }
                GenerationRequest request = toRequest(castToPayload(entry));
                if (!request.hasPrompt()) {
                    throw GenerationException.validation("Prompt is required for batch entry " + (i + 1));
                }
                images.add(generate(request, requestId, clock.millis()));
            } catch (GenerationException e) {
                failed++;
                if (firstFailure == null) {
                    firstFailure = e;
                }
                LOG.warnf("Batch job [%s] entry %d/%d failed: [%s] %s",
                    job.id(), i + 1, entries.size(), e.code(), e.getMessage());
            }
        }

        if (images.isEmpty()) {
            throw firstFailure;
        }
        if (failed > 0) {
            LOG.infof("Batch job [%s] partially succeeded: %d of %d images generated",
                job.id(), images.size(), entries.size());
        }
        return new JobResult(images, failed, clock.millis() - start);
    }

    private GenerationResult generate(GenerationRequest request, String requestId, long start) {
        if (closed.get()) {
            throw GenerationException.cancelled(requestId);
        }
        ProviderImage image = resilience.execute(() -> client.generate(request, requestId, resilience.timeout()));
        return toResult(image, request, clock.millis() - start);
    }

    private GenerationResult toResult(ProviderImage image, GenerationRequest request, long elapsedMs) {
        GenerationResult.Dimensions dimensions = new GenerationResult.Dimensions(
            image.width() != null ? image.width() : DEFAULT_DIMENSION,
            image.height() != null ? image.height() : DEFAULT_DIMENSION
        );
        GenerationResult.Metadata metadata = new GenerationResult.Metadata(
            dimensions,
            image.format() != null ? image.format() : DEFAULT_FORMAT,
            image.fileSize() != null ? image.fileSize() : 0L,
            image.generationTime() != null ? image.generationTime() : elapsedMs,
            image.seed() != null ? image.seed() : (request.seed() != null ? request.seed() : 0L),
            image.model() != null ? image.model() : settings.defaultModel(),
            settings.providerName(),
            image.cost()
        );
        return new GenerationResult(newResultId(), image.imageUrl(), image.thumbnailUrl(), metadata, clock.instant());
    }

    /**
     * Flatten an optional nested {@code generationParams} map into the request fields.
     */
    private GenerationRequest toRequest(Map<String, Object> payload) {
        Map<String, Object> flat = new HashMap<>(payload);
        if (payload.get("generationParams") instanceof Map<?, ?> params) {
            params.forEach((key, value) -> flat.putIfAbsent(String.valueOf(key), value));
        }
        flat.remove("generationParams");
        try {
            return objectMapper.convertValue(flat, GenerationRequest.class);
        } catch (IllegalArgumentException e) {
            throw GenerationException.validation("Invalid generation request: " + e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castToPayload(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }

    String newResultId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "result_" + clock.millis() + "_" + suffix;
    }

    @Override
    public void shutdown() {
        if (closed.compareAndSet(false, true)) {
            LOG.info("Shutting down batch processor, cancelling in-flight provider calls");
            client.shutdown();
        }
    }

    public boolean isShutdown() {
        return closed.get();
    }
}
