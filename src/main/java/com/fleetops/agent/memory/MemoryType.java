package com.fleetops.agent.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MemoryType {
    FACT,
    PREFERENCE,
    ENTITY,
    PROCEDURE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient: accepts any case, unknown values become FACT. */
    @JsonCreator
    public static MemoryType parse(String value) {
        if (value == null) {
            return FACT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FACT;
        }
    }
}
