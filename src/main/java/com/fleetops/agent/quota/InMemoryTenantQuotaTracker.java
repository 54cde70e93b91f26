package com.fleetops.agent.quota;

import com.fleetops.agent.exception.QuotaExceededException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-instance quota tracker. Counters are lost on restart and are not
 * shared between instances; use {@link RedisTenantQuotaTracker} for that.
 */
@Slf4j
public class InMemoryTenantQuotaTracker implements TenantQuotaTracker {

    private final int dailyLimit;
    private final Clock clock;
    private final Map<String, TenantQuota> quotas = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public InMemoryTenantQuotaTracker(int dailyLimit, Clock clock) {
        this.dailyLimit = dailyLimit;
        this.clock = clock;
    }

    @Override
    public TenantQuota checkAndIncrement(String tenantId, int deviceCount) {
        lock.lock();
        try {
            TenantQuota quota = currentFor(tenantId);

            if (quota.getOperationsToday() >= quota.getDailyLimit()) {
                log.warn("Daily quota exceeded for tenant={}: {}/{}",
                        tenantId, quota.getOperationsToday(), quota.getDailyLimit());
                throw new QuotaExceededException(
                        tenantId, quota.getOperationsToday(), quota.getDailyLimit(), quota.resetAt());
            }

            quota.setOperationsToday(quota.getOperationsToday() + 1);
            quota.setDevicesToday(quota.getDevicesToday() + deviceCount);

            log.debug("Tenant {} quota (in-memory): {}/{} operations, {} devices",
                    tenantId, quota.getOperationsToday(), quota.getDailyLimit(), quota.getDevicesToday());
            return quota.toBuilder().build();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TenantQuota getQuota(String tenantId) {
        lock.lock();
        try {
            return currentFor(tenantId).toBuilder().build();
        } finally {
            lock.unlock();
        }
    }

    /** Must be called with the lock held. Applies the lazy daily reset. */
    private TenantQuota currentFor(String tenantId) {
        LocalDate today = LocalDate.now(clock);
        TenantQuota quota = quotas.computeIfAbsent(tenantId, id -> fresh(id, today));
        if (!today.equals(quota.getResetDate())) {
            quota.setOperationsToday(0);
            quota.setDevicesToday(0);
            quota.setResetDate(today);
        }
        return quota;
    }

    private TenantQuota fresh(String tenantId, LocalDate today) {
        return TenantQuota.builder()
                .tenantId(tenantId)
                .dailyLimit(dailyLimit)
                .resetDate(today)
                .build();
    }
}
