package com.fleetops.agent.write;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Mutations the agent may request against the device-management API,
 * with the tool name the LLM uses and the arguments that must be present.
 */
public enum WriteOperationType {

    ADD_DEVICE("add_device", "add_device", RiskLevel.LOW, List.of("serial_number", "device_type")),
    UPDATE_TAGS("update_tags", "update_device_tags", RiskLevel.LOW, List.of("device_ids", "tags")),
    UPDATE_TAGS_BATCH("update_tags_batch", "update_device_tags_batch", RiskLevel.MEDIUM, List.of("updates")),
    ASSIGN_APPLICATION("assign_application", "assign_application", RiskLevel.MEDIUM, List.of("device_ids", "application_id")),
    UNASSIGN_APPLICATION("unassign_application", "unassign_application", RiskLevel.MEDIUM, List.of("device_ids")),
    ARCHIVE_DEVICES("archive_devices", "archive_devices", RiskLevel.HIGH, List.of("device_ids")),
    UNARCHIVE_DEVICES("unarchive_devices", "unarchive_devices", RiskLevel.MEDIUM, List.of("device_ids")),
    ASSIGN_SUBSCRIPTION("assign_subscription", "assign_subscription", RiskLevel.MEDIUM, List.of("device_ids", "subscription_key")),
    UNASSIGN_SUBSCRIPTION("unassign_subscription", "unassign_subscription", RiskLevel.HIGH, List.of("device_ids", "subscription_key"));

    private final String value;
    private final String toolName;
    private final RiskLevel baseRisk;
    private final List<String> requiredArguments;

    WriteOperationType(String value, String toolName, RiskLevel baseRisk, List<String> requiredArguments) {
        this.value = value;
        this.toolName = toolName;
        this.baseRisk = baseRisk;
        this.requiredArguments = requiredArguments;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String toolName() {
        return toolName;
    }

    public RiskLevel baseRisk() {
        return baseRisk;
    }

    public List<String> requiredArguments() {
        return requiredArguments;
    }

    public static Optional<WriteOperationType> fromToolName(String toolName) {
        return Arrays.stream(values())
                .filter(t -> t.toolName.equals(toolName))
                .findFirst();
    }
}
