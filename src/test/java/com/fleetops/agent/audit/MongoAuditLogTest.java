package com.fleetops.agent.audit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoAuditLogTest {

    @Mock AuditEntryRepository repository;

    @InjectMocks
    MongoAuditLog auditLog;

    @Test
    void log_copiesOperationIdOutOfDetails() {
        auditLog.log(AuditLog.OPERATION_START, "tenant-a", "alice",
                Map.of("operation_id", "op-1", "device_count", 3));

        ArgumentCaptor<AuditEntry> saved = ArgumentCaptor.forClass(AuditEntry.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getOperationId()).isEqualTo("op-1");
        assertThat(saved.getValue().getEventType()).isEqualTo("operation_start");
        assertThat(saved.getValue().getDetails()).containsEntry("device_count", 3);
    }

    @Test
    void log_withoutOperationId_leavesItNull() {
        auditLog.log(AuditLog.OPERATION_FAILED, "tenant-a", "alice", Map.of("error", "x"));

        ArgumentCaptor<AuditEntry> saved = ArgumentCaptor.forClass(AuditEntry.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getOperationId()).isNull();
    }

    @Test
    void log_repositoryFailure_doesNotThrow() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("mongo down"));

        auditLog.log(AuditLog.OPERATION_SUCCESS, "tenant-a", "alice", Map.of("operation_id", "op-1"));
    }

    @Test
    void entriesForOperation_readsInCreationOrder() {
        AuditEntry start = AuditEntry.builder().eventType("operation_start").operationId("op-1").build();
        when(repository.findByOperationIdOrderByCreatedAtAsc("op-1")).thenReturn(List.of(start));

        assertThat(auditLog.entriesForOperation("op-1")).containsExactly(start);
    }
}
