package tech.charforge.queue.model;

import java.util.Optional;

/**
 * Filter for listing a user's jobs.
 */
public record JobQuery(
    Optional<JobStatus> status,
    Optional<JobType> type,
    int limit,
    int offset
) {

    public static final int DEFAULT_LIMIT = 20;

    public JobQuery {
        status = status == null ? Optional.empty() : status;
        type = type == null ? Optional.empty() : type;
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        if (offset < 0) {
            offset = 0;
        }
    }

    public static JobQuery all() {
        return new JobQuery(Optional.empty(), Optional.empty(), DEFAULT_LIMIT, 0);
    }

    public static JobQuery byStatus(JobStatus status) {
        return new JobQuery(Optional.of(status), Optional.empty(), DEFAULT_LIMIT, 0);
    }

    public boolean matches(GenerationJob job) {
        return status.map(s -> s == job.status()).orElse(true)
            && type.map(t -> t == job.type()).orElse(true);
    }
}
