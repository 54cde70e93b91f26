package com.fleetops.agent.write;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Routes a prepared operation to the matching {@link DeviceManager} call.
 *
 * Guarded by a circuit breaker only. Mutations are never retried here, so a
 * confirmed operation reaches the upstream API at most once.
 */
@Component
@Slf4j
public class DeviceManagerGateway {

    private final DeviceManager deviceManager;

    public DeviceManagerGateway(DeviceManager deviceManager) {
        this.deviceManager = deviceManager;
    }

    @CircuitBreaker(name = "deviceManager")
    public Object dispatch(WriteOperation operation) {
        Map<String, Object> args = operation.getArguments();
        boolean dryRun = operation.isDryRun();

        log.debug("Dispatching {} [operation={}, dryRun={}]",
                operation.getOperationType().value(), operation.getId(), dryRun);

        return switch (operation.getOperationType()) {
            case ADD_DEVICE -> deviceManager.addDevice(
                    WriteArguments.string(args, "serial_number"),
                    WriteArguments.string(args, "device_type"),
                    WriteArguments.string(args, "part_number"),
                    WriteArguments.string(args, "mac_address"),
                    WriteArguments.tags(args.get("tags")),
                    WriteArguments.string(args, "location_id"),
                    dryRun);
            case UPDATE_TAGS -> deviceManager.updateTags(
                    WriteArguments.stringList(args.get("device_ids")),
                    WriteArguments.tags(args.get("tags")),
                    dryRun);
            case UPDATE_TAGS_BATCH -> deviceManager.updateTagsBatch(
                    WriteArguments.tagUpdates(args.get("updates")),
                    dryRun);
            case ASSIGN_APPLICATION -> deviceManager.assignApplication(
                    WriteArguments.stringList(args.get("device_ids")),
                    WriteArguments.string(args, "application_id"),
                    WriteArguments.string(args, "region"),
                    WriteArguments.string(args, "tenant_workspace_id"),
                    dryRun);
            case UNASSIGN_APPLICATION -> deviceManager.unassignApplication(
                    WriteArguments.stringList(args.get("device_ids")), dryRun);
            case ARCHIVE_DEVICES -> deviceManager.archiveDevices(
                    WriteArguments.stringList(args.get("device_ids")), dryRun);
            case UNARCHIVE_DEVICES -> deviceManager.unarchiveDevices(
                    WriteArguments.stringList(args.get("device_ids")), dryRun);
            case ASSIGN_SUBSCRIPTION -> deviceManager.assignSubscription(
                    WriteArguments.stringList(args.get("device_ids")),
                    WriteArguments.string(args, "subscription_key"),
                    dryRun);
            case UNASSIGN_SUBSCRIPTION -> deviceManager.unassignSubscription(
                    WriteArguments.stringList(args.get("device_ids")),
                    WriteArguments.string(args, "subscription_key"),
                    dryRun);
        };
    }
}
