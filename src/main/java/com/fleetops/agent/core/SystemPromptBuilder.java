package com.fleetops.agent.core;

import com.fleetops.agent.config.AgentProperties;
import com.fleetops.agent.memory.Memory;
import com.fleetops.agent.pattern.PatternMatch;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Instruction block plus optional memory and pattern context.
 * Each context block is appended only when it has at least one line.
 */
@Component
public class SystemPromptBuilder {

    static final String MEMORY_HEADER = "\n\nRelevant context from previous conversations:\n";
    static final String PATTERN_HEADER = "\n\nSuccessful patterns from previous interactions:\n";

    static final String DEFAULT_INSTRUCTIONS = """
            You are an assistant for a device and subscription inventory.

            You ONLY handle requests about:
            1. Data queries: devices, subscriptions, tags, sync history
            2. Device operations: adding devices, tag updates, application and subscription assignment, archiving
            3. Status of earlier operations

            For anything else, explain briefly that you can only help with the inventory.

            Rules:
            - Use the read tools for every data question; never guess counts or identifiers.
            - Write tools change real devices. State what will change before calling one.
            - Offer dry_run=true when the user is unsure about a bulk change.
            - If a write tool returns confirmation_required, tell the user what needs approval and wait.
            - If a tool returns an error, explain it and suggest a fix instead of repeating the same call.
            - Large changes are capped per request; split them into batches when asked.
            """;

    private final String instructions;
    private final double similarityThreshold;

    public SystemPromptBuilder(AgentProperties properties) {
        String configured = properties.getOrchestrator().getSystemPrompt();
        this.instructions = configured != null && !configured.isBlank() ? configured : DEFAULT_INSTRUCTIONS;
        this.similarityThreshold = properties.getOrchestrator().getPatternSimilarityThreshold();
    }

    public String build(List<Memory> memories, List<PatternMatch> patterns) {
        StringBuilder prompt = new StringBuilder(instructions);

        if (memories != null && !memories.isEmpty()) {
            prompt.append(MEMORY_HEADER);
            for (Memory memory : memories) {
                prompt.append("- [").append(memory.getMemoryType().wireName()).append("] ")
                        .append(memory.getContent()).append('\n');
            }
        }

        if (patterns != null) {
            StringBuilder lines = new StringBuilder();
            for (PatternMatch match : patterns) {
                if (match.similarity() > similarityThreshold) {
                    String trigger = match.pattern().getTrigger();
                    String preview = trigger.length() > 50 ? trigger.substring(0, 50) + "..." : trigger;
                    lines.append(String.format(Locale.ROOT,
                            "- When asked similar to '%s', used '%s' (confidence: %.0f%%)\n",
                            preview, match.pattern().getResponse(), match.pattern().getConfidence() * 100));
                }
            }
            if (lines.length() > 0) {
                prompt.append(PATTERN_HEADER).append(lines);
            }
        }

        return prompt.toString();
    }
}
