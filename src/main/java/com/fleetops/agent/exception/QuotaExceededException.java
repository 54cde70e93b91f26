package com.fleetops.agent.exception;

import lombok.Getter;

import java.time.Instant;

@Getter
public class QuotaExceededException extends AgentException {

    private final String tenantId;
    private final long current;
    private final long limit;
    private final Instant resetAt;

    public QuotaExceededException(String tenantId, long current, long limit, Instant resetAt) {
        super(String.format(
                "Daily operation quota exceeded for tenant '%s': %d/%d operations used. Quota resets at %s.",
                tenantId, current, limit, resetAt));
        this.tenantId = tenantId;
        this.current = current;
        this.limit = limit;
        this.resetAt = resetAt;
    }
}
