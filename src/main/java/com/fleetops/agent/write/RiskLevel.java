package com.fleetops.agent.write;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk tier of a mutating operation. Declaration order is severity order.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * One step up for bulk operations. Bulk escalation stops at HIGH;
     * only the mass threshold produces CRITICAL.
     */
    public RiskLevel escalateForBulk() {
        return switch (this) {
            case LOW -> MEDIUM;
            case MEDIUM, HIGH -> HIGH;
            case CRITICAL -> CRITICAL;
        };
    }

    public boolean requiresConfirmation() {
        return this == HIGH || this == CRITICAL;
    }
}
