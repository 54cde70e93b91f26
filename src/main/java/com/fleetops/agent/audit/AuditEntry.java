package com.fleetops.agent.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "agent_audit_log")
@CompoundIndex(name = "idx_audit_tenant_created", def = "{'tenantId': 1, 'createdAt': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {

    @Id
    private String id;

    private String eventType;
    private String tenantId;
    private String userId;

    /** Copied out of details so entries for one operation can be looked up together */
    @Indexed
    private String operationId;

    private Map<String, Object> details;

    @CreatedDate
    private Instant createdAt;
}
