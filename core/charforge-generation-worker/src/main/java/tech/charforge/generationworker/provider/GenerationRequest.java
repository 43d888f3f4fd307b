package tech.charforge.generationworker.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One image request as sent to the provider.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerationRequest(
    String prompt,
    String negativePrompt,
    Integer width,
    Integer height,
    String style,
    String quality,
    String aspectRatio,
    String outputFormat,
    Long seed,
    Integer variations,
    String inputImage
) {

    public static GenerationRequest ofPrompt(String prompt) {
        return new GenerationRequest(prompt, null, null, null, null, null, null, null, null, null, null);
    }

    public GenerationRequest withPrompt(String newPrompt) {
        return new GenerationRequest(newPrompt, negativePrompt, width, height, style, quality, aspectRatio,
            outputFormat, seed, variations, inputImage);
    }

    /**
     * Fill unset presentation fields with the given defaults.
     */
    public GenerationRequest withDefaults(String defaultQuality, String defaultAspectRatio,
                                          String defaultOutputFormat, String defaultStyle) {
        return new GenerationRequest(prompt, negativePrompt, width, height,
            style != null ? style : defaultStyle,
            quality != null ? quality : defaultQuality,
            aspectRatio != null ? aspectRatio : defaultAspectRatio,
            outputFormat != null ? outputFormat : defaultOutputFormat,
            seed,
            variations != null ? variations : Integer.valueOf(1),
            inputImage);
    }

    public boolean hasPrompt() {
        return prompt != null && !prompt.isBlank();
    }
}
