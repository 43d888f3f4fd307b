package tech.charforge.generationworker.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.jboss.logging.Logger;
import tech.charforge.generationworker.event.WorkerEvent;
import tech.charforge.generationworker.event.WorkerEventBus;
import tech.charforge.generationworker.worker.QueueWorker;
import tech.charforge.queue.model.GenerationJob;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Publishes worker activity to Micrometer by listening on the worker event bus.
 */
public class MicrometerWorkerMetrics {

    private static final Logger LOG = Logger.getLogger(MicrometerWorkerMetrics.class);

    static final String JOBS_STARTED = "charforge.worker.jobs.started";
    static final String JOBS_COMPLETED = "charforge.worker.jobs.completed";
    static final String JOBS_RETRIED = "charforge.worker.jobs.retried";
    static final String JOBS_FAILED = "charforge.worker.jobs.failed";
    static final String JOB_DURATION = "charforge.worker.job.duration";
    static final String JOBS_ACTIVE = "charforge.worker.jobs.active";
    static final String ERROR_RATE = "charforge.worker.error.rate";

    private final MeterRegistry meterRegistry;
    private final List<WorkerEventBus.Subscription> subscriptions = new ArrayList<>();

    public MicrometerWorkerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Register gauges for the worker and start counting its events.
     */
    public void bind(QueueWorker worker, WorkerEventBus events) {
        Gauge.builder(JOBS_ACTIVE, worker, w -> w.getActiveJobIds().size())
            .description("Jobs currently processing")
            .register(meterRegistry);
        Gauge.builder(ERROR_RATE, worker, QueueWorker::errorRate)
            .description("Failed over processed jobs, in percent")
            .baseUnit("percent")
            .register(meterRegistry);

        subscriptions.add(events.subscribe(WorkerEvent.JobStarted.class,
            event -> counter(JOBS_STARTED, event.job()).increment()));
        subscriptions.add(events.subscribe(WorkerEvent.JobCompleted.class, event -> {
            counter(JOBS_COMPLETED, event.job()).increment();
            timer(event.job(), "completed").record(Duration.ofMillis(event.processingTimeMs()));
        }));
        subscriptions.add(events.subscribe(WorkerEvent.JobRetried.class,
            event -> Counter.builder(JOBS_RETRIED)
                .tag("type", event.job().type().name())
                .tag("errorCode", event.error().code())
                .register(meterRegistry)
                .increment()));
        subscriptions.add(events.subscribe(WorkerEvent.JobFailed.class,
            event -> Counter.builder(JOBS_FAILED)
                .tag("type", event.job().type().name())
                .tag("errorCode", event.error().code())
                .register(meterRegistry)
                .increment()));

        LOG.debug("Worker metrics bound to event bus");
    }

    public void unbind() {
        subscriptions.forEach(WorkerEventBus.Subscription::cancel);
        subscriptions.clear();
    }

    private Counter counter(String name, GenerationJob job) {
        return Counter.builder(name)
            .tag("type", job.type().name())
            .register(meterRegistry);
    }

    private Timer timer(GenerationJob job, String outcome) {
        return Timer.builder(JOB_DURATION)
            .tag("type", job.type().name())
            .tag("outcome", outcome)
            .register(meterRegistry);
    }
}
