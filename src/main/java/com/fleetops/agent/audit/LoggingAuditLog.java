package com.fleetops.agent.audit;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Audit sink that writes to the application log. Used when no audit database is configured.
 */
@Slf4j
public class LoggingAuditLog implements AuditLog {

    @Override
    public void log(String eventType, String tenantId, String userId, Map<String, Object> details) {
        log.info("AUDIT {} [tenant={}, user={}] {}", eventType, tenantId, userId, details);
    }
}
