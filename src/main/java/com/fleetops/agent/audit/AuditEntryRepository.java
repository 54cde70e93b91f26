package com.fleetops.agent.audit;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditEntryRepository extends MongoRepository<AuditEntry, String> {

    List<AuditEntry> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    List<AuditEntry> findByOperationIdOrderByCreatedAtAsc(String operationId);
}
