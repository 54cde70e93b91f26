package com.fleetops.agent.model;

/**
 * Caller identity threaded through every call for tenant isolation and audit.
 * Never produced by the agent core, only consumed.
 */
public record UserContext(String tenantId, String userId, String sessionId) {

    public UserContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }

    public static UserContext of(String tenantId, String userId) {
        return new UserContext(tenantId, userId, null);
    }
}
