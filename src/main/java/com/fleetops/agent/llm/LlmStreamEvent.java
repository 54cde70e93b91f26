package com.fleetops.agent.llm;

import com.fleetops.agent.model.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Vendor-neutral streaming chunk emitted by an {@link LlmProvider}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmStreamEvent {

    public enum Type {
        TEXT_DELTA, THINKING_DELTA, TOOL_CALL_START, TOOL_CALL_DELTA, TOOL_CALL_END, ERROR, DONE
    }

    private Type type;

    /** Text for TEXT_DELTA / THINKING_DELTA, message for ERROR */
    private String content;

    private String toolCallId;

    /** Set on TOOL_CALL_START */
    private String toolName;

    /** Partial JSON of the arguments, set on TOOL_CALL_DELTA */
    private String argumentsDelta;

    /** Fully parsed arguments, optionally set on TOOL_CALL_END */
    private Map<String, Object> arguments;

    private ErrorKind errorKind;

    private Integer promptTokens;
    private Integer completionTokens;

    public static LlmStreamEvent text(String content) {
        return LlmStreamEvent.builder().type(Type.TEXT_DELTA).content(content).build();
    }

    public static LlmStreamEvent thinking(String content) {
        return LlmStreamEvent.builder().type(Type.THINKING_DELTA).content(content).build();
    }

    public static LlmStreamEvent toolCallStart(String id, String name) {
        return LlmStreamEvent.builder().type(Type.TOOL_CALL_START).toolCallId(id).toolName(name).build();
    }

    public static LlmStreamEvent toolCallDelta(String id, String argumentsJson) {
        return LlmStreamEvent.builder().type(Type.TOOL_CALL_DELTA).toolCallId(id).argumentsDelta(argumentsJson).build();
    }

    public static LlmStreamEvent toolCallEnd(String id, Map<String, Object> arguments) {
        return LlmStreamEvent.builder().type(Type.TOOL_CALL_END).toolCallId(id).arguments(arguments).build();
    }

    public static LlmStreamEvent error(String message, ErrorKind kind) {
        return LlmStreamEvent.builder().type(Type.ERROR).content(message).errorKind(kind).build();
    }

    public static LlmStreamEvent done() {
        return LlmStreamEvent.builder().type(Type.DONE).build();
    }
}
