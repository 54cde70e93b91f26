package com.fleetops.agent.pattern;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearnedPattern {

    private String id;
    private String tenantId;
    private PatternType patternType;
    /** What the user asked, or the error that occurred */
    private String trigger;
    /** What the agent did about it */
    private String response;

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    private int successCount;
    private int failureCount;
    private double confidence;

    public double successRate() {
        int total = successCount + failureCount;
        return total > 0 ? (double) successCount / total : 0.0;
    }
}
