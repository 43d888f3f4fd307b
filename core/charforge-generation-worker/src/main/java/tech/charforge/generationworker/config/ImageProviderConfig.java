package tech.charforge.generationworker.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Connection settings for the external image provider.
 */
@ConfigMapping(prefix = "image-provider")
public interface ImageProviderConfig {

    /**
     * Base URL; requests go to {@code {baseUrl}/generate}.
     */
    String baseUrl();

    /**
     * Bearer token. Requests are sent without authorization when absent.
     */
    Optional<String> apiKey();

    @WithDefault("nanoBanana-v1")
    String model();

    /**
     * Provider tag recorded on generated results.
     */
    @WithDefault("NANOBANANA_API")
    String providerName();

    /**
     * HTTP_2 or HTTP_1_1.
     */
    @WithDefault("HTTP_2")
    String httpVersion();

    @WithDefault("10000")
    long connectTimeoutMs();
}
