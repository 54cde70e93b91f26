package com.fleetops.agent.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the LLM.
 * Catalog entries come from the read tool executor and the write operation engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolDefinition {

    private String name;
    private String description;

    /** JSON Schema: type, properties, required, descriptions */
    private Map<String, Object> parameters;

    @Builder.Default
    private boolean readOnly = true;

    private boolean requiresConfirmation;
}
