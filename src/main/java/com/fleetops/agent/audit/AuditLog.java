package com.fleetops.agent.audit;

import java.util.Map;

/**
 * Append-only record of mutating actions. Implementations must not throw:
 * a failing audit write is logged, never allowed to fail the operation.
 */
public interface AuditLog {

    String OPERATION_START = "operation_start";
    String OPERATION_SUCCESS = "operation_success";
    String OPERATION_FAILED = "operation_failed";

    void log(String eventType, String tenantId, String userId, Map<String, Object> details);
}
