package com.fleetops.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatEventType {
    TEXT_DELTA("text_delta"),
    THINKING_DELTA("thinking_delta"),
    TOOL_CALL_START("tool_call_start"),
    TOOL_CALL_END("tool_call_end"),
    TOOL_RESULT("tool_result"),
    CONFIRMATION_REQUIRED("confirmation_required"),
    CONFIRMATION_RESPONSE("confirmation_response"),
    ERROR("error"),
    DONE("done");

    private final String wireName;

    ChatEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
