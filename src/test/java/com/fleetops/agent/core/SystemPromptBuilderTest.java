package com.fleetops.agent.core;

import com.fleetops.agent.config.AgentProperties;
import com.fleetops.agent.memory.Memory;
import com.fleetops.agent.memory.MemoryType;
import com.fleetops.agent.pattern.LearnedPattern;
import com.fleetops.agent.pattern.PatternMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SystemPromptBuilderTest {

    private final SystemPromptBuilder builder = new SystemPromptBuilder(new AgentProperties());

    private static PatternMatch match(String trigger, String response, double confidence, double similarity) {
        return new PatternMatch(LearnedPattern.builder()
                .trigger(trigger).response(response).confidence(confidence).build(), similarity);
    }

    @Test
    void build_withoutContext_isJustInstructions() {
        assertThat(builder.build(List.of(), List.of())).isEqualTo(SystemPromptBuilder.DEFAULT_INSTRUCTIONS);
    }

    @Test
    void build_appendsMemoriesWithType() {
        String prompt = builder.build(List.of(Memory.builder()
                .memoryType(MemoryType.PREFERENCE).content("Prefers dry runs before bulk changes").build()), null);

        assertThat(prompt).contains(SystemPromptBuilder.MEMORY_HEADER)
                .contains("- [preference] Prefers dry runs before bulk changes\n");
    }

    @Test
    void build_includesOnlyPatternsAboveThreshold() {
        String prompt = builder.build(null, List.of(
                match("archive the devices in lab rack 4 that have been offline for more than 30 days",
                        "archive_devices", 0.9, 0.85),
                match("show subscriptions", "list_subscriptions", 0.8, 0.7)));

        assertThat(prompt).contains(SystemPromptBuilder.PATTERN_HEADER)
                .contains("- When asked similar to 'archive the devices in lab rack 4 that have been o...', "
                        + "used 'archive_devices' (confidence: 90%)")
                .doesNotContain("list_subscriptions");
    }

    @Test
    void build_noPatternAboveThreshold_omitsHeader() {
        String prompt = builder.build(null, List.of(match("x", "y", 0.9, 0.5)));

        assertThat(prompt).doesNotContain(SystemPromptBuilder.PATTERN_HEADER);
    }

    @Test
    void configuredPrompt_replacesDefaultInstructions() {
        AgentProperties properties = new AgentProperties();
        properties.getOrchestrator().setSystemPrompt("Custom instructions.");

        assertThat(new SystemPromptBuilder(properties).build(List.of(), List.of())).isEqualTo("Custom instructions.");
    }
}
