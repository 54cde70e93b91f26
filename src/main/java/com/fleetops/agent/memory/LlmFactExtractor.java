package com.fleetops.agent.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetops.agent.llm.LlmProvider;
import com.fleetops.agent.llm.LlmStreamEvent;
import com.fleetops.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Asks the LLM for memorable facts in a response and parses its answer.
 *
 * Three guards run before JSON parsing: blank reply, reply that is not a JSON
 * array after stripping markdown fences, malformed JSON. Each yields no facts.
 */
@Component
@Slf4j
public class LlmFactExtractor implements FactExtractor {

    static final int MIN_CONTENT_LENGTH = 20;
    static final double MIN_CONFIDENCE = 0.5;
    static final int MAX_FACTS = 10;

    private static final Duration EXTRACTION_TIMEOUT = Duration.ofSeconds(60);

    private static final String SYSTEM_PROMPT =
            "You are a memory extraction assistant. Output only valid JSON arrays. Nothing else.";

    private static final String EXTRACTION_PROMPT = """
            Analyze the following text and extract information worth remembering for future conversations
            about this device inventory.

            Extract only these kinds of items:
            - fact: objective information (e.g. "The us-west region has 50 switches")
            - preference: how the user likes to work (e.g. "Prefers a dry run before bulk changes")
            - entity: named things worth remembering (e.g. "San Jose data center", "Switch model 6200F")
            - procedure: how-to knowledge (e.g. "Archived devices are restored with unarchive_devices")

            Skip trivial statements, one-off requests and error messages.

            Respond with ONLY a JSON array. No explanation, no markdown. Example:
            [
              {"type": "fact", "content": "Site A hosts 12 access points", "confidence": 0.8, "reasoning": "inventory size"}
            ]
            If nothing is worth remembering, respond with exactly: []

            Text:
            """;

    private final LlmProvider llmProvider;
    private final ObjectMapper objectMapper;

    public LlmFactExtractor(LlmProvider llmProvider, ObjectMapper objectMapper) {
        this.llmProvider = llmProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ExtractedFact> extract(String content) {
        if (content == null || content.length() < MIN_CONTENT_LENGTH) {
            return List.of();
        }

        try {
            String raw = complete(EXTRACTION_PROMPT + content);
            return parse(raw).stream()
                    .filter(f -> f.content() != null && !f.content().isBlank())
                    .filter(f -> f.confidence() >= MIN_CONFIDENCE)
                    .limit(MAX_FACTS)
                    .toList();
        } catch (Exception e) {
            log.warn("Fact extraction failed: {}", e.getMessage());
            return List.of();
        }
    }

    List<ExtractedFact> parse(String raw) {
        // Guard 1: null/blank
        if (raw == null || raw.isBlank()) {
            log.debug("Empty extraction response, skipping");
            return List.of();
        }

        String cleaned = raw.strip()
                .replaceAll("(?s)^```json\\s*", "")
                .replaceAll("(?s)^```\\s*", "")
                .replaceAll("(?s)```\\s*$", "")
                .strip();

        // Guard 2: prose instead of an array
        if (!cleaned.startsWith("[")) {
            log.warn("Extraction response is not a JSON array, skipping. First 100 chars: '{}'",
                    cleaned.substring(0, Math.min(100, cleaned.length())));
            return List.of();
        }

        // Guard 3: malformed JSON
        try {
            return objectMapper.readValue(cleaned, new TypeReference<List<ExtractedFact>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse extraction JSON, skipping. Error: {}", e.getMessage());
            return List.of();
        }
    }

    private String complete(String prompt) {
        Message user = Message.builder()
                .role(Message.Role.user)
                .content(prompt)
                .build();

        List<String> chunks = llmProvider.chat(List.of(user), List.of(), SYSTEM_PROMPT, 0.3, 1000)
                .filter(event -> event.getType() == LlmStreamEvent.Type.TEXT_DELTA)
                .map(event -> Objects.requireNonNullElse(event.getContent(), ""))
                .collectList()
                .block(EXTRACTION_TIMEOUT);

        return chunks == null ? "" : chunks.stream().collect(Collectors.joining());
    }
}
