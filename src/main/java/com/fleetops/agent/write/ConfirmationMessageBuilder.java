package com.fleetops.agent.write;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Human-readable summary shown to the operator before a risky mutation runs.
 */
@Component
public class ConfirmationMessageBuilder {

    public String build(WriteOperationType type, Map<String, Object> arguments, int deviceCount, RiskLevel riskLevel) {
        String base = switch (type) {
            case ARCHIVE_DEVICES -> String.format(
                    "Are you sure you want to archive %d device(s)? Archived devices will no longer receive updates.",
                    deviceCount);
            case UNARCHIVE_DEVICES -> String.format("Restore %d archived device(s)?", deviceCount);
            case UNASSIGN_APPLICATION -> String.format(
                    "Are you sure you want to remove the application from %d device(s)? "
                            + "This may affect device management capabilities.", deviceCount);
            case UNASSIGN_SUBSCRIPTION -> String.format(
                    "Are you sure you want to remove the subscription from %d device(s)? "
                            + "This may affect device functionality and support.", deviceCount);
            case ASSIGN_APPLICATION -> String.format("Assign application to %d device(s)?", deviceCount);
            case ASSIGN_SUBSCRIPTION -> String.format("Assign subscription to %d device(s)?", deviceCount);
            case UPDATE_TAGS -> String.format("Update tags on %d device(s)?", deviceCount)
                    + describeTags(List.of(WriteArguments.tags(arguments.get("tags"))));
            case UPDATE_TAGS_BATCH -> describeBatch(WriteArguments.tagUpdates(arguments.get("updates")), deviceCount);
            case ADD_DEVICE -> String.format("Add device %s to the workspace?", arguments.get("serial_number"));
        };

        if (riskLevel == RiskLevel.CRITICAL) {
            return String.format("WARNING: High-risk operation affecting %d devices. %s", deviceCount, base);
        }
        return base;
    }

    private String describeBatch(List<TagUpdate> updates, int deviceCount) {
        List<Map<String, String>> tagMaps = updates.stream()
                .map(TagUpdate::tags)
                .toList();
        return String.format("Apply %d tag update(s) across %d device(s)?", updates.size(), deviceCount)
                + describeTags(tagMaps);
    }

    /** Keys are listed once each, in first-seen order across all maps. */
    private String describeTags(List<Map<String, String>> tagMaps) {
        Set<String> upserts = new LinkedHashSet<>();
        Set<String> removals = new LinkedHashSet<>();
        for (Map<String, String> tags : tagMaps) {
            tags.forEach((key, value) -> {
                if (value != null) {
                    upserts.add(key);
                } else {
                    removals.add(key);
                }
            });
        }

        StringBuilder sb = new StringBuilder();
        if (!upserts.isEmpty()) {
            sb.append(" Tags added/updated: ").append(String.join(", ", upserts)).append('.');
        }
        if (!removals.isEmpty()) {
            sb.append(" Tags removed: ").append(String.join(", ", removals)).append('.');
        }
        return sb.toString();
    }
}
