package com.fleetops.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag on error events so a caller can decide whether retrying the whole turn makes sense.
 */
public enum ErrorKind {
    RECOVERABLE("recoverable"),
    FATAL("fatal"),
    TIMEOUT("timeout"),
    RATE_LIMIT("rate_limit");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isRetryable() {
        return this == TIMEOUT || this == RATE_LIMIT;
    }
}
