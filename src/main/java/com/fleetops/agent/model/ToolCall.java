package com.fleetops.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Provider-assigned id; correlates start/delta/end events and the tool result message */
    private String id;

    private String name;

    @Builder.Default
    private Map<String, Object> arguments = new LinkedHashMap<>();

    /** Populated after execution. See {@link ToolResults} for the recognised shapes. */
    private Map<String, Object> result;
}
