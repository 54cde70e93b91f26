package com.fleetops.agent.tool;

import com.fleetops.agent.model.UserContext;

import java.util.List;
import java.util.Map;

/**
 * Read-only query tools served by the separate inventory read service.
 */
public interface ReadToolExecutor {

    List<ToolDefinition> listTools();

    Object call(String toolName, Map<String, Object> arguments, UserContext context);
}
