package tech.charforge.generationworker.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.charforge.generationworker.event.WorkerEventBus;
import tech.charforge.generationworker.metrics.MicrometerWorkerMetrics;
import tech.charforge.generationworker.processor.BatchProcessorService;
import tech.charforge.generationworker.processor.ProcessorSettings;
import tech.charforge.generationworker.processor.ResilienceRegistry;
import tech.charforge.generationworker.processor.ResilientBatchProcessorService;
import tech.charforge.generationworker.provider.HttpImageProviderClient;
import tech.charforge.generationworker.provider.ImageProviderClient;
import tech.charforge.generationworker.provider.ImageProviderSettings;
import tech.charforge.generationworker.warning.WarningService;
import tech.charforge.generationworker.worker.QueueWorker;
import tech.charforge.generationworker.worker.WorkerSettings;
import tech.charforge.queue.GenerationQueueService;
import tech.charforge.queue.QueueSettings;
import tech.charforge.queue.embedded.EmbeddedGenerationQueueService;
import tech.charforge.queue.memory.InMemoryGenerationQueueService;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the queue, provider client, processor and worker from configuration.
 */
@ApplicationScoped
public class GenerationWorkerProducer {

    private static final Logger LOG = Logger.getLogger(GenerationWorkerProducer.class);

    @Inject
    GenerationWorkerConfig workerConfig;

    @Inject
    GenerationQueueConfig queueConfig;

    @Inject
    ImageProviderConfig providerConfig;

    @Inject
    ResilienceConfigMapping resilienceConfig;

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    GenerationQueueService generationQueueService(Clock clock) {
        QueueSettings settings = new QueueSettings(queueConfig.maxQueueSize(), queueConfig.maxBatchSize());
        return switch (queueConfig.store()) {
            case EMBEDDED -> {
                LOG.infof("Using embedded SQLite generation queue at %s", queueConfig.embeddedDbPath());
                yield new EmbeddedGenerationQueueService(queueConfig.embeddedDbPath(), settings, clock);
            }
            case MEMORY -> {
                LOG.warn("Using in-memory generation queue - jobs do not survive restarts");
                yield new InMemoryGenerationQueueService(settings, clock);
            }
        };
    }

    @Produces
    @Singleton
    ResilienceRegistry resilienceRegistry() {
        return new ResilienceRegistry(ResilienceSettingsFactory.fromConfig(resilienceConfig));
    }

    @Produces
    @Singleton
    ImageProviderClient imageProviderClient(WarningService warningService) {
        ImageProviderSettings settings = new ImageProviderSettings(
            providerConfig.baseUrl(),
            providerConfig.apiKey(),
            providerConfig.model(),
            providerConfig.httpVersion(),
            Duration.ofMillis(providerConfig.connectTimeoutMs())
        );
        if (settings.apiKey().isEmpty()) {
            LOG.warn("No image provider API key configured - requests are sent without authorization");
        }
        return new HttpImageProviderClient(settings, warningService);
    }

    @Produces
    @Singleton
    BatchProcessorService batchProcessorService(ImageProviderClient client, ResilienceRegistry registry, Clock clock) {
        ProcessorSettings settings = new ProcessorSettings(
            workerConfig.providerEndpoint(),
            providerConfig.model(),
            providerConfig.providerName(),
            queueConfig.maxBatchSize()
        );
        return new ResilientBatchProcessorService(client, registry.forEndpoint(settings.endpoint()), settings, clock);
    }

    @Produces
    @Singleton
    WorkerEventBus workerEventBus() {
        return new WorkerEventBus();
    }

    @Produces
    @Singleton
    QueueWorker queueWorker(GenerationQueueService queueService, BatchProcessorService batchProcessor,
                            WorkerEventBus events, Clock clock) {
        return new QueueWorker(queueService, batchProcessor, workerSettings(), events, clock);
    }

    @Produces
    @Singleton
    MicrometerWorkerMetrics workerMetrics(MeterRegistry meterRegistry, QueueWorker worker, WorkerEventBus events) {
        MicrometerWorkerMetrics metrics = new MicrometerWorkerMetrics(meterRegistry);
        metrics.bind(worker, events);
        return metrics;
    }

    WorkerSettings workerSettings() {
        return new WorkerSettings(
            workerConfig.concurrency(),
            workerConfig.pollIntervalMs(),
            workerConfig.maxRetries(),
            workerConfig.retryDelayMs(),
            workerConfig.healthCheckIntervalMs(),
            workerConfig.staleJobThresholdMs(),
            workerConfig.shutdownTimeoutMs(),
            workerConfig.degradedErrorRate(),
            workerConfig.unhealthyErrorRate()
        );
    }
}
