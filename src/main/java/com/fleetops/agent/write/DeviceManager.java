package com.fleetops.agent.write;

import java.util.List;
import java.util.Map;

/**
 * Upstream device-management API. Implemented outside the agent core.
 *
 * Every call is issued at most once per confirmed operation; implementations
 * are idempotent only as far as the upstream API is.
 */
public interface DeviceManager {

    Object addDevice(String serialNumber, String deviceType, String partNumber, String macAddress,
                     Map<String, String> tags, String locationId, boolean dryRun);

    Object updateTags(List<String> deviceIds, Map<String, String> tags, boolean dryRun);

    Object updateTagsBatch(List<TagUpdate> updates, boolean dryRun);

    Object assignApplication(List<String> deviceIds, String applicationId, String region,
                             String tenantWorkspaceId, boolean dryRun);

    Object unassignApplication(List<String> deviceIds, boolean dryRun);

    Object archiveDevices(List<String> deviceIds, boolean dryRun);

    Object unarchiveDevices(List<String> deviceIds, boolean dryRun);

    Object assignSubscription(List<String> deviceIds, String subscriptionKey, boolean dryRun);

    Object unassignSubscription(List<String> deviceIds, String subscriptionKey, boolean dryRun);
}
