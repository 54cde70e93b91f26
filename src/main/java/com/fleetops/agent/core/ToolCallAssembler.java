package com.fleetops.agent.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetops.agent.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Rebuilds complete tool calls from one turn's streamed start / delta / end events.
 *
 * Calls are keyed by the provider's id. Completed calls keep the order in which
 * their end events arrived. Not thread-safe; one assembler per turn.
 */
@Slf4j
class ToolCallAssembler {

    private static final class OpenCall {
        private final String id;
        private final String name;
        private final StringBuilder argumentsJson = new StringBuilder();

        private OpenCall(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }

    private final ObjectMapper objectMapper;
    private final Map<String, OpenCall> open = new LinkedHashMap<>();
    private final List<ToolCall> completed = new ArrayList<>();

    ToolCallAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** @return the id the call is tracked under; generated when the provider sent none */
    String start(String id, String name) {
        String key = id != null ? id : "call_" + UUID.randomUUID();
        open.put(key, new OpenCall(key, name));
        return key;
    }

    void appendArguments(String id, String delta) {
        OpenCall call = resolve(id);
        if (call != null && delta != null) {
            call.argumentsJson.append(delta);
        }
    }

    /**
     * Closes the call. Arguments supplied with the end event win; otherwise the
     * accumulated deltas are parsed as a JSON object.
     *
     * @return the completed call, or null when no matching call is open
     */
    ToolCall end(String id, Map<String, Object> arguments) {
        OpenCall call = resolve(id);
        if (call == null) {
            log.warn("Tool call end without matching start [id={}]", id);
            return null;
        }
        open.remove(call.id);

        Map<String, Object> args = arguments != null ? new LinkedHashMap<>(arguments) : parse(call);
        ToolCall toolCall = ToolCall.builder()
                .id(call.id)
                .name(call.name)
                .arguments(args)
                .build();
        completed.add(toolCall);
        return toolCall;
    }

    List<ToolCall> completed() {
        return completed;
    }

    boolean hasOpenCalls() {
        return !open.isEmpty();
    }

    int openCount() {
        return open.size();
    }

    /** A null id addresses the only open call, if there is exactly one. */
    private OpenCall resolve(String id) {
        if (id != null) {
            return open.get(id);
        }
        return open.size() == 1 ? open.values().iterator().next() : null;
    }

    private Map<String, Object> parse(OpenCall call) {
        String json = call.argumentsJson.toString().strip();
        if (json.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unparseable arguments for tool call [{}] {}: {}", call.name, call.id, e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }
}
