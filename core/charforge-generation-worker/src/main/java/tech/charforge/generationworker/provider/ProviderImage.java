package tech.charforge.generationworker.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * Image description returned by the provider. Absent fields are null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderImage(
    String imageUrl,
    String thumbnailUrl,
    Integer width,
    Integer height,
    String format,
    Long fileSize,
    Long generationTime,
    Long seed,
    String model,
    BigDecimal cost
) {
}
