package tech.charforge.queue.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One generated image as returned to clients.
 */
public record GenerationResult(
    String id,
    String imageUrl,
    String thumbnailUrl,
    Metadata metadata,
    Instant createdAt
) {

    public record Dimensions(int width, int height) {
    }

    public record Metadata(
        Dimensions dimensions,
        String format,
        long fileSize,
        long generationTimeMs,
        long seed,
        String model,
        String provider,
        BigDecimal cost
    ) {
    }
}
