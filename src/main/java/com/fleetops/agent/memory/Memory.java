package com.fleetops.agent.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A long-term memory item scoped to one tenant and user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Memory {

    private String id;
    private String tenantId;
    private String userId;
    private MemoryType memoryType;
    private String content;
    private double confidence;
    private String sourceConversationId;
    private String sourceMessageId;
    private Instant createdAt;
}
