package com.fleetops.agent.write;

import com.fleetops.agent.config.AgentProperties;
import org.springframework.stereotype.Component;

/**
 * Pure mapping from (operation type, deduplicated device count) to a risk tier.
 *
 * The tier is monotonic in the device count: more devices never lowers it.
 */
@Component
public class RiskClassifier {

    private final int bulkThreshold;
    private final int massThreshold;

    public RiskClassifier(AgentProperties properties) {
        this.bulkThreshold = properties.getWrite().getBulkThreshold();
        this.massThreshold = properties.getWrite().getMassThreshold();
    }

    public RiskLevel classify(WriteOperationType type, int deviceCount) {
        if (deviceCount > massThreshold) {
            return RiskLevel.CRITICAL;
        }
        RiskLevel base = type.baseRisk();
        return deviceCount > bulkThreshold ? base.escalateForBulk() : base;
    }
}
