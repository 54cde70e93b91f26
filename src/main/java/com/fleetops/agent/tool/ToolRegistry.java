package com.fleetops.agent.tool;

import com.fleetops.agent.model.ToolCall;
import com.fleetops.agent.model.ToolResults;
import com.fleetops.agent.model.UserContext;
import com.fleetops.agent.write.WriteOperationEngine;
import com.fleetops.agent.write.WriteOperationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merged catalog of read and write tools, and the router for tool calls.
 *
 * Write tools go to the {@link WriteOperationEngine}; everything else goes to the
 * read executor. Dispatch never throws: failures come back as error results so
 * the LLM can react to them and the turn carries on.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final ReadToolGateway readTools;
    private final WriteOperationEngine writeEngine;

    private volatile List<ToolDefinition> cachedTools;

    public ToolRegistry(ReadToolGateway readTools, WriteOperationEngine writeEngine) {
        this.readTools = readTools;
        this.writeEngine = writeEngine;
    }

    public List<ToolDefinition> getAllTools() {
        List<ToolDefinition> tools = cachedTools;
        if (tools == null) {
            List<ToolDefinition> merged = new ArrayList<>(readTools.listTools());
            merged.addAll(writeEngine.getToolDefinitions());
            tools = List.copyOf(merged);
            cachedTools = tools;
            log.info("Tool catalog loaded: {} read, {} write",
                    tools.stream().filter(ToolDefinition::isReadOnly).count(),
                    tools.stream().filter(t -> !t.isReadOnly()).count());
        }
        return tools;
    }

    public List<ToolDefinition> getReadTools() {
        return getAllTools().stream().filter(ToolDefinition::isReadOnly).toList();
    }

    public List<ToolDefinition> getWriteTools() {
        return getAllTools().stream().filter(t -> !t.isReadOnly()).toList();
    }

    public boolean isWriteTool(String toolName) {
        return WriteOperationType.fromToolName(toolName).isPresent();
    }

    public Optional<ToolDefinition> getTool(String toolName) {
        return getAllTools().stream().filter(t -> t.getName().equals(toolName)).findFirst();
    }

    public void clearCache() {
        cachedTools = null;
        log.info("Tool catalog cache cleared");
    }

    /**
     * Routes the call, stores the result map on {@code toolCall} and returns it.
     */
    public Map<String, Object> executeToolCall(ToolCall toolCall, UserContext context) {
        log.info("Executing tool: [{}] [tenant={}]", toolCall.getName(), context.tenantId());

        Map<String, Object> result;
        try {
            if (isWriteTool(toolCall.getName())) {
                result = writeEngine.executeToolCall(toolCall, context);
            } else if (isUnknownReadTool(toolCall.getName())) {
                log.warn("Unknown tool requested: [{}]", toolCall.getName());
                result = ToolResults.error("Unknown tool: " + toolCall.getName(), false);
            } else {
                result = readTools.call(toolCall.getName(), toolCall.getArguments(), context);
            }
        } catch (Exception e) {
            log.error("Unexpected error in tool [{}]", toolCall.getName(), e);
            result = ToolResults.error("Tool execution failed: " + e.getMessage(), true);
        }

        toolCall.setResult(result);
        return result;
    }

    /** A name is only rejected when the read catalog is known and does not list it. */
    private boolean isUnknownReadTool(String toolName) {
        List<ToolDefinition> reads = getReadTools();
        return !reads.isEmpty() && reads.stream().noneMatch(t -> t.getName().equals(toolName));
    }
}
