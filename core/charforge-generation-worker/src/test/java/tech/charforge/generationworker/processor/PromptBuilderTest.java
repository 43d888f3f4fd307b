package tech.charforge.generationworker.processor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    @Test
    void shouldBuildFullCharacterPrompt() {
        CharacterSpecs specs = new CharacterSpecs("Aria", "A brave elven ranger",
            new CharacterSpecs.Appearance("25", "female", "athletic", "silver", "green", "pale",
                "leather armor", List.of("bow")),
            List.of("curious", "loyal"), List.of("archery"));

        String prompt = PromptBuilder.characterPrompt(specs);

        assertEquals("A brave elven ranger, 25 years old, female, athletic build, silver hair, green eyes, "
            + "pale skin, wearing leather armor, personality: curious, loyal, traits: archery", prompt);
    }

    @Test
    void shouldLeaveOutMissingSections() {
        CharacterSpecs specs = new CharacterSpecs(null, "A wizard",
            new CharacterSpecs.Appearance(null, null, null, "white", null, null, null, null),
            null, null);

        assertEquals("A wizard, white hair", PromptBuilder.characterPrompt(specs));
    }

    @Test
    void shouldHandleDescriptionOnly() {
        CharacterSpecs specs = new CharacterSpecs("Bob", "A farmer", null, List.of(), List.of());

        assertEquals("A farmer", PromptBuilder.characterPrompt(specs));
    }
}
