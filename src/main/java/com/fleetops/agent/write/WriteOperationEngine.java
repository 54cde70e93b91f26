package com.fleetops.agent.write;

import com.fleetops.agent.audit.AuditLog;
import com.fleetops.agent.config.AgentProperties;
import com.fleetops.agent.exception.ConfirmationRequiredException;
import com.fleetops.agent.exception.DeviceLimitExceededException;
import com.fleetops.agent.exception.OperationNotFoundException;
import com.fleetops.agent.exception.QuotaExceededException;
import com.fleetops.agent.model.ToolCall;
import com.fleetops.agent.model.ToolResults;
import com.fleetops.agent.model.UserContext;
import com.fleetops.agent.quota.TenantQuotaTracker;
import com.fleetops.agent.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The only path from a write tool call to the device-management API.
 *
 * prepare: validate arguments, deduplicate device ids, classify risk,
 *          enforce the tier ceiling. Never charges quota, never calls upstream.
 * execute: confirmation gate, quota, dispatch, audit. Runs at most once per operation.
 */
@Service
@Slf4j
public class WriteOperationEngine {

    private static final int AUDIT_RESULT_PREVIEW = 500;

    private final RiskClassifier riskClassifier;
    private final DeviceIdValidator deviceIdValidator;
    private final ConfirmationMessageBuilder messageBuilder;
    private final DeviceManagerGateway gateway;
    private final TenantQuotaTracker quotaTracker;
    private final AuditLog auditLog;
    private final WriteToolCatalog toolCatalog;
    private final Clock clock;
    private final Duration retention;

    private final Map<String, WriteOperation> operations = new ConcurrentHashMap<>();

    public WriteOperationEngine(RiskClassifier riskClassifier,
                                DeviceIdValidator deviceIdValidator,
                                ConfirmationMessageBuilder messageBuilder,
                                DeviceManagerGateway gateway,
                                TenantQuotaTracker quotaTracker,
                                AuditLog auditLog,
                                WriteToolCatalog toolCatalog,
                                AgentProperties properties,
                                Clock clock) {
        this.riskClassifier = riskClassifier;
        this.deviceIdValidator = deviceIdValidator;
        this.messageBuilder = messageBuilder;
        this.gateway = gateway;
        this.quotaTracker = quotaTracker;
        this.auditLog = auditLog;
        this.toolCatalog = toolCatalog;
        this.clock = clock;
        this.retention = Duration.ofMinutes(properties.getWrite().getOperationRetentionMinutes());
    }

    public List<ToolDefinition> getToolDefinitions() {
        return toolCatalog.definitions();
    }

    public WriteOperation prepare(WriteOperationType type, Map<String, Object> arguments) {
        return prepare(type, arguments, UUID.randomUUID().toString());
    }

    /**
     * @throws IllegalArgumentException     on a missing required argument or an empty device list
     * @throws DeviceLimitExceededException if the deduplicated count exceeds the tier ceiling
     */
    WriteOperation prepare(WriteOperationType type, Map<String, Object> arguments, String operationId) {
        Map<String, Object> args = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
        requireArguments(type, args);

        int deviceCount = normalizeDevices(type, args);
        if (deviceCount == 0) {
            throw new IllegalArgumentException(
                    "Operation '" + type.value() + "' requires at least one device id");
        }

        // Escalate first, then cap: both run on every prepare
        RiskLevel risk = riskClassifier.classify(type, deviceCount);
        deviceIdValidator.enforceLimit(deviceCount, risk, type.value());

        WriteOperation operation = WriteOperation.builder()
                .id(operationId)
                .operationType(type)
                .arguments(args)
                .deviceCount(deviceCount)
                .riskLevel(risk)
                .requiresConfirmation(risk.requiresConfirmation())
                .confirmationMessage(messageBuilder.build(type, args, deviceCount, risk))
                .createdAt(clock.instant())
                .build();

        evictExpired();
        operations.put(operation.getId(), operation);

        log.info("Prepared {} [operation={}, devices={}, risk={}, confirmation={}]",
                type.value(), operation.getId(), deviceCount, risk, operation.isRequiresConfirmation());
        return operation;
    }

    /**
     * Runs a prepared operation. Upstream failures are recorded on the operation,
     * not thrown; calling again after execution returns the same operation untouched.
     *
     * @throws ConfirmationRequiredException if the operation needs approval and has none
     * @throws QuotaExceededException        if the tenant's daily quota is used up
     */
    public WriteOperation execute(WriteOperation operation, UserContext context) {
        synchronized (operation) {
            if (operation.isRequiresConfirmation() && !operation.isConfirmed()) {
                throw new ConfirmationRequiredException(operation.getId());
            }
            if (operation.isExecuted()) {
                log.info("Operation {} already executed, returning cached outcome", operation.getId());
                return operation;
            }

            if (!operation.isDryRun()) {
                quotaTracker.checkAndIncrement(context.tenantId(), operation.getDeviceCount());
            }

            auditLog.log(AuditLog.OPERATION_START, context.tenantId(), context.userId(), auditDetails(operation));

            try {
                Object result = gateway.dispatch(operation);
                operation.setResult(result);
                auditLog.log(AuditLog.OPERATION_SUCCESS, context.tenantId(), context.userId(),
                        withEntry(auditDetails(operation), "result_preview", preview(result)));
                log.info("Executed {} [operation={}, tenant={}, dryRun={}]",
                        operation.getOperationType().value(), operation.getId(),
                        context.tenantId(), operation.isDryRun());
            } catch (Exception e) {
                operation.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                auditLog.log(AuditLog.OPERATION_FAILED, context.tenantId(), context.userId(),
                        withEntry(auditDetails(operation), "error", operation.getError()));
                log.error("Operation {} failed [type={}, tenant={}]",
                        operation.getId(), operation.getOperationType().value(), context.tenantId(), e);
            } finally {
                operation.setExecuted(true);
                operation.setExecutedAt(clock.instant());
            }
            return operation;
        }
    }

    /**
     * Approves and runs an operation prepared earlier in this process.
     *
     * @throws OperationNotFoundException if the id is unknown or was cancelled
     */
    public WriteOperation confirm(String operationId, UserContext context) {
        WriteOperation operation = operations.get(operationId);
        if (operation == null) {
            throw new OperationNotFoundException(operationId);
        }
        return approveAndExecute(operation, context);
    }

    /**
     * Approves an operation, rebuilding it from its tool call when it is no longer
     * held in memory (for example after a restart). The rebuilt operation keeps the
     * same id and recomputes the same risk level.
     */
    public WriteOperation confirm(String operationId, ToolCall toolCall, UserContext context) {
        WriteOperation operation = operations.get(operationId);
        if (operation == null) {
            WriteOperationType type = WriteOperationType.fromToolName(toolCall.getName())
                    .orElseThrow(() -> new OperationNotFoundException(operationId));
            log.info("Operation {} not in memory, re-preparing from stored tool call [{}]",
                    operationId, toolCall.getName());
            WriteOperation rebuilt = prepare(type, toolCall.getArguments(), operationId);
            WriteOperation existing = operations.putIfAbsent(operationId, rebuilt);
            operation = existing != null ? existing : rebuilt;
        }
        return approveAndExecute(operation, context);
    }

    public boolean cancel(String operationId) {
        WriteOperation removed = operations.remove(operationId);
        if (removed != null) {
            log.info("Cancelled operation {} [type={}]", operationId, removed.getOperationType().value());
            return true;
        }
        return false;
    }

    public Optional<WriteOperation> getOperation(String operationId) {
        return Optional.ofNullable(operations.get(operationId));
    }

    /**
     * Tool-call adapter used by the registry. Never throws: every outcome is a result map.
     * A risky operation is prepared but not run; the returned payload carries
     * {@code status=confirmation_required} and the operation id to approve.
     */
    public Map<String, Object> executeToolCall(ToolCall toolCall, UserContext context) {
        Optional<WriteOperationType> type = WriteOperationType.fromToolName(toolCall.getName());
        if (type.isEmpty()) {
            return ToolResults.error("Unknown write tool: " + toolCall.getName(), false, "validation");
        }

        try {
            WriteOperation operation = prepare(type.get(), toolCall.getArguments());
            if (operation.isRequiresConfirmation()) {
                return ToolResults.confirmationRequired(
                        operation.getId(), operation.getConfirmationMessage(), operation.getRiskLevel().wireName());
            }

            execute(operation, context);
            if (operation.getError() != null) {
                return ToolResults.error(operation.getError(), true, "upstream");
            }
            return ToolResults.success(operation.getId(), operation.getResult());

        } catch (DeviceLimitExceededException | IllegalArgumentException e) {
            return ToolResults.error(e.getMessage(), false, "validation");
        } catch (QuotaExceededException e) {
            return ToolResults.error(e.getMessage(), false, "quota");
        } catch (Exception e) {
            log.error("Write tool [{}] failed unexpectedly", toolCall.getName(), e);
            return ToolResults.error(e.getMessage(), true, "upstream");
        }
    }

    private WriteOperation approveAndExecute(WriteOperation operation, UserContext context) {
        synchronized (operation) {
            operation.setConfirmed(true);
        }
        log.info("Operation {} confirmed by user={} [tenant={}]",
                operation.getId(), context.userId(), context.tenantId());
        return execute(operation, context);
    }

    private void requireArguments(WriteOperationType type, Map<String, Object> args) {
        for (String name : type.requiredArguments()) {
            Object value = args.get(name);
            boolean missing = value == null
                    || (value instanceof String s && s.isBlank())
                    || (value instanceof Collection<?> c && c.isEmpty())
                    || (value instanceof Map<?, ?> m && m.isEmpty());
            if (missing) {
                throw new IllegalArgumentException(
                        "Missing required argument '" + name + "' for operation '" + type.value() + "'");
            }
        }
    }

    /**
     * Replaces device id lists in {@code args} with their deduplicated form
     * and returns the number of distinct devices touched.
     */
    @SuppressWarnings("unchecked")
    private int normalizeDevices(WriteOperationType type, Map<String, Object> args) {
        switch (type) {
            case ADD_DEVICE:
                return 1;
            case UPDATE_TAGS_BATCH: {
                if (!(args.get("updates") instanceof List<?> updates)) {
                    throw new IllegalArgumentException("Argument 'updates' must be a list");
                }
                Set<String> union = new LinkedHashSet<>();
                List<Map<String, Object>> normalized = new ArrayList<>();
                for (Object raw : updates) {
                    if (!(raw instanceof Map<?, ?> update)) {
                        continue;
                    }
                    Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) update);
                    List<String> ids = deviceIdValidator.deduplicate(WriteArguments.stringList(copy.get("device_ids")));
                    copy.put("device_ids", ids);
                    union.addAll(ids);
                    normalized.add(copy);
                }
                args.put("updates", normalized);
                return union.size();
            }
            default: {
                List<String> ids = deviceIdValidator.deduplicate(WriteArguments.stringList(args.get("device_ids")));
                args.put("device_ids", ids);
                return ids.size();
            }
        }
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        operations.values().removeIf(op -> op.getCreatedAt().isBefore(cutoff));
    }

    private Map<String, Object> auditDetails(WriteOperation operation) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation_id", operation.getId());
        details.put("operation_type", operation.getOperationType().value());
        details.put("arguments", operation.getArguments());
        details.put("risk_level", operation.getRiskLevel().wireName());
        details.put("device_count", operation.getDeviceCount());
        details.put("dry_run", operation.isDryRun());
        return details;
    }

    private static Map<String, Object> withEntry(Map<String, Object> details, String key, Object value) {
        details.put(key, value);
        return details;
    }

    private static String preview(Object result) {
        String text = String.valueOf(result);
        return text.length() > AUDIT_RESULT_PREVIEW ? text.substring(0, AUDIT_RESULT_PREVIEW) : text;
    }
}
