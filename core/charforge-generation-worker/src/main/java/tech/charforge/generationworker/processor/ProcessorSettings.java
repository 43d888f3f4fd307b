package tech.charforge.generationworker.processor;

/**
 * @param endpoint     resilience endpoint used for provider calls
 * @param defaultModel model reported when the provider omits one
 * @param providerName provider tag recorded on every result
 * @param maxBatchSize largest accepted BATCH job
 */
public record ProcessorSettings(
    String endpoint,
    String defaultModel,
    String providerName,
    int maxBatchSize
) {

    public static ProcessorSettings defaults() {
        return new ProcessorSettings("nanoBanana", "nanoBanana-v1", "NANOBANANA_API", 4);
    }
}
