package tech.charforge.generationworker.provider;

import java.time.Duration;

/**
 * Outbound call to the external image generation provider.
 */
public interface ImageProviderClient {

    /**
     * Generate one image.
     *
     * @param request   image request
     * @param requestId correlation id sent to the provider
     * @param timeout   limit for the whole exchange
     * @throws GenerationException on any failure
     */
    ProviderImage generate(GenerationRequest request, String requestId, Duration timeout);

    /**
     * Abort in-flight calls and reject new ones. Best-effort.
     */
    void shutdown();
}
