package com.fleetops.agent.write;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A prepared mutation. The id doubles as the single-use confirmation token.
 *
 * riskLevel is fixed at prepare time. {@code confirmed} and {@code executed}
 * each flip from false to true at most once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WriteOperation {

    private String id;
    private WriteOperationType operationType;

    @Builder.Default
    private Map<String, Object> arguments = new LinkedHashMap<>();

    /** Post-deduplication device count; what the quota is charged */
    private int deviceCount;

    private RiskLevel riskLevel;
    private boolean requiresConfirmation;
    private String confirmationMessage;

    private boolean confirmed;
    private boolean executed;

    private Object result;
    private String error;

    private Instant createdAt;
    private Instant executedAt;

    public boolean isDryRun() {
        return Boolean.TRUE.equals(arguments.get("dry_run"));
    }

    public boolean succeeded() {
        return executed && error == null;
    }
}
