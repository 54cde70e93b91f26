package com.fleetops.agent.quota;

import com.fleetops.agent.exception.QuotaExceededException;

/**
 * Per-tenant daily operation and device counters.
 *
 * {@link #checkAndIncrement} is a single atomic step in every implementation.
 * A separate check followed by an increment would let concurrent requests
 * slip past the limit.
 */
public interface TenantQuotaTracker {

    /**
     * Charges one operation and {@code deviceCount} devices to today's counters.
     *
     * @return the counters after the increment
     * @throws QuotaExceededException if today's operation count already reached the limit;
     *                                nothing is incremented in that case
     */
    TenantQuota checkAndIncrement(String tenantId, int deviceCount);

    /** Current counters without charging anything */
    TenantQuota getQuota(String tenantId);
}
