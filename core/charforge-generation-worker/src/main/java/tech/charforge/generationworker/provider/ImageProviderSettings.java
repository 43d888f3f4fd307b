package tech.charforge.generationworker.provider;

import java.time.Duration;
import java.util.Optional;

/**
 * Connection settings for {@link HttpImageProviderClient}.
 */
public record ImageProviderSettings(
    String baseUrl,
    Optional<String> apiKey,
    String model,
    String httpVersion,
    Duration connectTimeout
) {

    public ImageProviderSettings {
        apiKey = apiKey == null ? Optional.empty() : apiKey;
    }
}
