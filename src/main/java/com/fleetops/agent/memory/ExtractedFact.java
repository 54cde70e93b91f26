package com.fleetops.agent.memory;

import com.fleetops.agent.model.UserContext;

import java.time.Instant;
import java.util.UUID;

/**
 * One item the extractor judged worth remembering.
 */
public record ExtractedFact(MemoryType type, String content, double confidence, String reasoning) {

    public Memory toMemory(UserContext context, String conversationId, String messageId, Instant now) {
        return Memory.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(context.tenantId())
                .userId(context.userId())
                .memoryType(type != null ? type : MemoryType.FACT)
                .content(content)
                .confidence(confidence)
                .sourceConversationId(conversationId)
                .sourceMessageId(messageId)
                .createdAt(now)
                .build();
    }
}
