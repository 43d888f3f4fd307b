package tech.charforge.generationworker.endpoint;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.charforge.generationworker.health.CircuitBreakerStats;
import tech.charforge.generationworker.processor.ResilienceRegistry;
import tech.charforge.generationworker.warning.Warning;
import tech.charforge.generationworker.warning.WarningService;
import tech.charforge.generationworker.worker.HealthLevel;
import tech.charforge.generationworker.worker.QueueWorker;
import tech.charforge.generationworker.worker.WorkerHealth;
import tech.charforge.generationworker.worker.WorkerStatus;
import tech.charforge.queue.GenerationQueueService;
import tech.charforge.queue.model.QueueMetrics;

import java.util.List;
import java.util.Map;

@Path("/monitoring/worker")
@Tag(name = "Worker Monitoring", description = "Generation worker status, health and queue metrics")
public class WorkerMonitoringResource {

    @Inject
    QueueWorker worker;

    @Inject
    GenerationQueueService queueService;

    @Inject
    ResilienceRegistry resilienceRegistry;

    @Inject
    WarningService warningService;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get worker status", description = "Returns state, counters and health of the generation worker")
    public WorkerStatus getStatus() {
        return worker.getStatus();
    }

    @GET
    @Path("/health")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get worker health", description = "Returns 200 while healthy or degraded, 503 when unhealthy or stopped")
    @APIResponse(responseCode = "200", description = "Worker is healthy or degraded")
    @APIResponse(responseCode = "503", description = "Worker is unhealthy or not running")
    public Response getHealth() {
        WorkerStatus status = worker.getStatus();
        WorkerHealth health = status.health();
        boolean available = status.running() && health.status() != HealthLevel.UNHEALTHY;
        return Response.status(available ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE)
            .entity(health)
            .build();
    }

    @GET
    @Path("/queue")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get queue metrics", description = "Returns job counts and timing aggregates of the generation queue")
    @APIResponse(responseCode = "503", description = "Queue is not available")
    public Response getQueueMetrics() {
        if (!worker.isRunning()) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(Map.of("error", "Generation worker is not running"))
                .build();
        }
        QueueMetrics metrics = queueService.getMetrics();
        return Response.ok(metrics).build();
    }

    @GET
    @Path("/circuit-breakers")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get circuit breaker statistics", description = "Returns breaker state and rate limit headroom per provider endpoint")
    public List<CircuitBreakerStats> getCircuitBreakers() {
        return resilienceRegistry.circuitBreakerStats();
    }

    @GET
    @Path("/warnings")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get all warnings", description = "Returns worker warnings, newest first")
    public List<Warning> getWarnings() {
        return warningService.getAllWarnings();
    }

    @POST
    @Path("/warnings/{warningId}/acknowledge")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Acknowledge a warning")
    @APIResponse(responseCode = "404", description = "Warning not found")
    public Response acknowledgeWarning(@PathParam("warningId") String warningId) {
        if (warningService.acknowledgeWarning(warningId)) {
            return Response.ok(Map.of("status", "success")).build();
        }
        return Response.status(Response.Status.NOT_FOUND)
            .entity(Map.of("status", "error", "message", "Warning not found"))
            .build();
    }
}
