package tech.charforge.generationworker.processor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Character description carried in the payload of a CHARACTER job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CharacterSpecs(
    String name,
    String description,
    Appearance appearance,
    List<String> personality,
    List<String> traits
) {

    public CharacterSpecs {
        personality = personality == null ? List.of() : List.copyOf(personality);
        traits = traits == null ? List.of() : List.copyOf(traits);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Appearance(
        String age,
        String gender,
        String build,
        String hair,
        String eyes,
        String skin,
        String clothing,
        List<String> accessories
    ) {
    }
}
