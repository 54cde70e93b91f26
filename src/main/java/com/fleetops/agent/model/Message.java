package com.fleetops.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private String conversationId;

    private Role role;
    private String content;

    /** Redacted chain-of-thought summary. Raw thinking is never stored. */
    private String thinkingSummary;

    /**
     * Present when role = assistant and the LLM requested tool calls,
     * or role = tool carrying the executed call with its result.
     */
    private List<ToolCall> toolCalls;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    private Integer tokensUsed;
    private Long latencyMs;

    @Builder.Default
    private Instant createdAt = Instant.now();
}
