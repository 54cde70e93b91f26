package com.fleetops.agent.pattern;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PatternType {
    /** A tool call that worked for a given request */
    TOOL_SUCCESS("tool_success"),
    QUERY_RESPONSE("query_response"),
    ERROR_RECOVERY("error_recovery"),
    /** Several steps executed for one request */
    WORKFLOW("workflow");

    private final String value;

    PatternType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
