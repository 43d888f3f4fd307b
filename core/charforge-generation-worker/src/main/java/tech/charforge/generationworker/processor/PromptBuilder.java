package tech.charforge.generationworker.processor;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns character specs into a provider prompt.
 */
public final class PromptBuilder {

    private PromptBuilder() {
        // Utility class
    }

    /**
     * Description first, then appearance, personality and traits, each
     * separated by ", ". Absent sections are left out.
     */
    public static String characterPrompt(CharacterSpecs specs) {
        StringBuilder prompt = new StringBuilder(specs.description() != null ? specs.description() : "");

        CharacterSpecs.Appearance appearance = specs.appearance();
        if (appearance != null) {
            List<String> parts = new ArrayList<>();
            addIfPresent(parts, appearance.age(), "%s years old");
            addIfPresent(parts, appearance.gender(), "%s");
            addIfPresent(parts, appearance.build(), "%s build");
            addIfPresent(parts, appearance.hair(), "%s hair");
            addIfPresent(parts, appearance.eyes(), "%s eyes");
            addIfPresent(parts, appearance.skin(), "%s skin");
            addIfPresent(parts, appearance.clothing(), "wearing %s");
            if (!parts.isEmpty()) {
                prompt.append(", ").append(String.join(", ", parts));
            }
        }

        if (!specs.personality().isEmpty()) {
            prompt.append(", personality: ").append(String.join(", ", specs.personality()));
        }
        if (!specs.traits().isEmpty()) {
            prompt.append(", traits: ").append(String.join(", ", specs.traits()));
        }
        return prompt.toString();
    }

    private static void addIfPresent(List<String> parts, String value, String format) {
        if (value != null && !value.isBlank()) {
            parts.add(String.format(format, value));
        }
    }
}
