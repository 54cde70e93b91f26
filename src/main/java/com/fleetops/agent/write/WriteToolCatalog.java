package com.fleetops.agent.write;

import com.fleetops.agent.tool.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static catalog of mutating tools offered to the LLM.
 */
@Component
public class WriteToolCatalog {

    private final List<ToolDefinition> definitions;

    public WriteToolCatalog() {
        this.definitions = List.of(
                define(WriteOperationType.ADD_DEVICE,
                        "Add a new device to the workspace",
                        props(
                                "serial_number", Map.of("type", "string", "description", "Device serial number"),
                                "device_type", Map.of("type", "string",
                                        "enum", List.of("COMPUTE", "NETWORK", "STORAGE"),
                                        "description", "Type of device"),
                                "part_number", Map.of("type", "string",
                                        "description", "Part number (required for COMPUTE/STORAGE)"),
                                "mac_address", Map.of("type", "string",
                                        "description", "MAC address (required for NETWORK)"),
                                "tags", Map.of("type", "object", "description", "Optional tags as key-value pairs")),
                        false),
                define(WriteOperationType.UPDATE_TAGS,
                        "Add, update, or remove tags on devices. Set a tag value to null to remove it.",
                        props(
                                "device_ids", deviceIds(),
                                "tags", Map.of("type", "object",
                                        "description", "Tags to add/update (set value to null to remove)")),
                        false),
                define(WriteOperationType.UPDATE_TAGS_BATCH,
                        "Apply several independent tag updates, each to its own set of devices",
                        props("updates", Map.of(
                                "type", "array",
                                "description", "List of {device_ids, tags} updates",
                                "items", Map.of("type", "object", "properties", props(
                                        "device_ids", deviceIds(),
                                        "tags", Map.of("type", "object"))))),
                        false),
                define(WriteOperationType.ASSIGN_APPLICATION,
                        "Assign an application (region) to devices",
                        props(
                                "device_ids", deviceIds(),
                                "application_id", Map.of("type", "string",
                                        "description", "UUID of the application to assign"),
                                "region", Map.of("type", "string", "description", "Optional region name")),
                        true),
                define(WriteOperationType.UNASSIGN_APPLICATION,
                        "Remove application assignment from devices",
                        props("device_ids", deviceIds()),
                        true),
                define(WriteOperationType.ARCHIVE_DEVICES,
                        "Archive devices (soft delete). Archived devices can be restored.",
                        props("device_ids", deviceIds()),
                        true),
                define(WriteOperationType.UNARCHIVE_DEVICES,
                        "Restore archived devices",
                        props("device_ids", deviceIds()),
                        true),
                define(WriteOperationType.ASSIGN_SUBSCRIPTION,
                        "Assign a subscription to devices",
                        props(
                                "device_ids", deviceIds(),
                                "subscription_key", Map.of("type", "string",
                                        "description", "Subscription key to assign")),
                        true),
                define(WriteOperationType.UNASSIGN_SUBSCRIPTION,
                        "Remove subscription from devices. This may affect device functionality.",
                        props(
                                "device_ids", deviceIds(),
                                "subscription_key", Map.of("type", "string",
                                        "description", "Subscription key to remove")),
                        true)
        );
    }

    public List<ToolDefinition> definitions() {
        return definitions;
    }

    private static ToolDefinition define(WriteOperationType type, String description,
                                         Map<String, Object> properties, boolean requiresConfirmation) {
        Map<String, Object> withDryRun = new LinkedHashMap<>(properties);
        withDryRun.put("dry_run", Map.of("type", "boolean",
                "description", "Validate against the API without applying the change"));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", withDryRun);
        schema.put("required", type.requiredArguments());

        return ToolDefinition.builder()
                .name(type.toolName())
                .description(description)
                .parameters(schema)
                .readOnly(false)
                .requiresConfirmation(requiresConfirmation)
                .build();
    }

    private static Map<String, Object> deviceIds() {
        return Map.of("type", "array",
                "items", Map.of("type", "string"),
                "description", "List of device UUIDs");
    }

    private static Map<String, Object> props(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
