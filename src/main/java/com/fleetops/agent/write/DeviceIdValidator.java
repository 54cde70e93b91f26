package com.fleetops.agent.write;

import com.fleetops.agent.config.AgentProperties;
import com.fleetops.agent.exception.DeviceLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Deduplicates device id lists and enforces the per-tier device ceiling.
 *
 * The ceiling is checked against the deduplicated count, so repeated ids never count twice.
 */
@Component
@Slf4j
public class DeviceIdValidator {

    private final EnumMap<RiskLevel, Integer> deviceLimits;

    public DeviceIdValidator(AgentProperties properties) {
        this.deviceLimits = properties.getWrite().deviceLimitTable();
    }

    /**
     * Removes duplicates, keeping the first occurrence of each id in its original position.
     * Null and blank entries are dropped.
     */
    public List<String> deduplicate(Collection<?> deviceIds) {
        if (deviceIds == null || deviceIds.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        deviceIds.stream()
                .filter(Objects::nonNull)
                .map(id -> id.toString().trim())
                .filter(id -> !id.isEmpty())
                .forEach(unique::add);
        return new ArrayList<>(unique);
    }

    public int limitFor(RiskLevel riskLevel) {
        return deviceLimits.get(riskLevel);
    }

    /**
     * @throws DeviceLimitExceededException if {@code deviceCount} exceeds the tier's ceiling
     */
    public void enforceLimit(int deviceCount, RiskLevel riskLevel, String operationName) {
        int limit = limitFor(riskLevel);
        if (deviceCount > limit) {
            log.warn("Device limit exceeded for {}: {} > {} (risk={})",
                    operationName, deviceCount, limit, riskLevel);
            throw new DeviceLimitExceededException(deviceCount, limit, operationName);
        }
    }
}
