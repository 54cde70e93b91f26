package com.fleetops.agent.audit;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Persists audit entries to MongoDB.
 */
@Slf4j
public class MongoAuditLog implements AuditLog {

    private final AuditEntryRepository repository;

    public MongoAuditLog(AuditEntryRepository repository) {
        this.repository = repository;
    }

    @Override
    public void log(String eventType, String tenantId, String userId, Map<String, Object> details) {
        try {
            Object operationId = details.get("operation_id");
            repository.save(AuditEntry.builder()
                    .eventType(eventType)
                    .tenantId(tenantId)
                    .userId(userId)
                    .operationId(operationId != null ? operationId.toString() : null)
                    .details(details)
                    .build());
        } catch (Exception e) {
            // Audit persistence must never fail the audited operation
            log.error("Failed to persist audit entry {} [tenant={}]", eventType, tenantId, e);
        }
    }

    public List<AuditEntry> entriesForOperation(String operationId) {
        return repository.findByOperationIdOrderByCreatedAtAsc(operationId);
    }
}
