package com.fleetops.agent.confirmation;

import com.fleetops.agent.model.ToolCall;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A write operation waiting for the operator's answer.
 * Holds enough of the original tool call to rebuild the operation after a restart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingConfirmation {

    private String operationId;
    private String conversationId;
    private ToolCall toolCall;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Instant createdAt;
}
