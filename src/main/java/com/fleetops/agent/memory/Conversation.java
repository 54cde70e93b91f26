package com.fleetops.agent.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    private String id;
    private String tenantId;
    private String userId;
    private String title;
    private int messageCount;
    private Instant createdAt;
    private Instant updatedAt;
}
