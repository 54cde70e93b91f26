package com.fleetops.agent.core;

import com.fleetops.agent.model.ChatEvent;
import com.fleetops.agent.model.ChatEventType;
import com.fleetops.agent.model.ErrorKind;
import com.fleetops.agent.model.ToolCall;
import reactor.core.publisher.FluxSink;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes ChatEvents for one chat() or confirmOperation() call into its sink.
 *
 * Sequence numbers start at 1 and grow by exactly 1 per emitted event.
 * An emitter is used from a single thread only.
 */
public class ChatEventEmitter {

    private final FluxSink<ChatEvent> sink;
    private final String correlationId;
    private long sequence;

    public ChatEventEmitter(FluxSink<ChatEvent> sink, String correlationId) {
        this.sink = sink;
        this.correlationId = correlationId;
    }

    public ChatEvent text(String content) {
        return emit(ChatEvent.builder().type(ChatEventType.TEXT_DELTA).content(content));
    }

    public ChatEvent thinking(String redactedContent) {
        return emit(ChatEvent.builder().type(ChatEventType.THINKING_DELTA).content(redactedContent));
    }

    public ChatEvent toolCallStart(String toolCallId, String toolName) {
        return emit(ChatEvent.builder()
                .type(ChatEventType.TOOL_CALL_START)
                .toolCallId(toolCallId)
                .toolName(toolName));
    }

    public ChatEvent toolCallEnd(ToolCall toolCall) {
        return emit(ChatEvent.builder()
                .type(ChatEventType.TOOL_CALL_END)
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .toolArguments(toolCall.getArguments()));
    }

    public ChatEvent toolResult(String toolCallId, String toolName, String content) {
        return emit(ChatEvent.builder()
                .type(ChatEventType.TOOL_RESULT)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content));
    }

    public ChatEvent confirmationRequired(ToolCall toolCall, String message, String operationId, String riskLevel) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("operation_id", operationId);
        metadata.put("risk_level", riskLevel);
        return emit(ChatEvent.builder()
                .type(ChatEventType.CONFIRMATION_REQUIRED)
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .toolArguments(toolCall.getArguments())
                .content(message)
                .metadata(metadata));
    }

    public ChatEvent confirmationResponse(boolean confirmed, String operationId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("confirmed", confirmed);
        metadata.put("operation_id", operationId);
        return emit(ChatEvent.builder().type(ChatEventType.CONFIRMATION_RESPONSE).metadata(metadata));
    }

    public ChatEvent error(String message, ErrorKind kind) {
        return emit(ChatEvent.builder().type(ChatEventType.ERROR).content(message).errorKind(kind));
    }

    public ChatEvent done(Map<String, Object> metadata) {
        return emit(ChatEvent.builder().type(ChatEventType.DONE).metadata(metadata));
    }

    public void complete() {
        sink.complete();
    }

    public boolean isCancelled() {
        return sink.isCancelled();
    }

    public long lastSequence() {
        return sequence;
    }

    private ChatEvent emit(ChatEvent.ChatEventBuilder builder) {
        ChatEvent event = builder.sequence(++sequence).correlationId(correlationId).build();
        sink.next(event);
        return event;
    }
}
