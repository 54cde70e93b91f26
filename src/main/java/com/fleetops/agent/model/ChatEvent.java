package com.fleetops.agent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One event of the canonical stream returned to the chat transport.
 * Sequence numbers are assigned by {@code ChatEventEmitter}; fields are populated per type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatEvent {

    private ChatEventType type;
    private long sequence;
    private String correlationId;

    private String content;
    private String toolCallId;
    private String toolName;
    private Map<String, Object> toolArguments;
    private ErrorKind errorKind;
    private Map<String, Object> metadata;
}
