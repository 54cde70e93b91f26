package com.fleetops.agent.quota;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Snapshot of a tenant's daily counters. Counters belong to {@code resetDate} (UTC)
 * and start from zero on the first check of a new day.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TenantQuota {

    private String tenantId;
    private int dailyLimit;
    private long operationsToday;
    private long devicesToday;
    private LocalDate resetDate;

    /** UTC midnight after {@code resetDate}, when the counters start over */
    public Instant resetAt() {
        return resetDate.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public long remaining() {
        return Math.max(0, dailyLimit - operationsToday);
    }
}
