package com.fleetops.agent.config;

import com.fleetops.agent.write.RiskLevel;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Strongly-typed configuration for the agent core.
 * Bound from application.yml under the "agent" prefix.
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private Orchestrator orchestrator = new Orchestrator();
    private Write write = new Write();
    private Quota quota = new Quota();
    private Confirmation confirmation = new Confirmation();
    private Conversation conversation = new Conversation();
    private Audit audit = new Audit();
    private SideEffects sideEffects = new SideEffects();

    @PostConstruct
    public void validate() {
        write.validate();
        if (orchestrator.getMaxTurns() < 1) {
            throw new IllegalStateException("agent.orchestrator.max-turns must be at least 1");
        }
        if (orchestrator.getMaxToolCallsPerTurn() < 1) {
            throw new IllegalStateException("agent.orchestrator.max-tool-calls-per-turn must be at least 1");
        }
    }

    @Data
    public static class Orchestrator {
        private int maxTurns = 10;
        private int maxToolCallsPerTurn = 5;
        private double temperature = 0.7;
        private int maxTokens = 4096;

        private boolean memorySearchEnabled = true;
        private int memorySearchLimit = 5;
        private double memoryMinConfidence = 0.5;
        /** Memories are only matched against embeddings from this model */
        private String embeddingModel = "text-embedding-3-large";

        private boolean patternMatchingEnabled = true;
        private boolean patternLearningEnabled = true;
        private double patternMinConfidence = 0.6;
        private int patternMatchLimit = 3;
        /** Patterns at or below this similarity are left out of the prompt */
        private double patternSimilarityThreshold = 0.7;

        private boolean factExtractionEnabled = true;

        private int thinkingSummaryMaxLength = 500;
        private int toolResultPreviewLength = 1000;

        /** Replaces the built-in instruction block when set */
        private String systemPrompt;
    }

    @Data
    public static class Write {
        /** More devices than this escalates the risk tier by one */
        private int bulkThreshold = 5;
        /** More devices than this forces CRITICAL */
        private int massThreshold = 20;
        private Map<RiskLevel, Integer> deviceLimits = defaultDeviceLimits();
        /** How long prepared operations stay available for confirm in this process */
        private long operationRetentionMinutes = 120;

        /**
         * Every tier must carry a positive ceiling, otherwise the context refuses to start.
         */
        public void validate() {
            for (RiskLevel level : RiskLevel.values()) {
                Integer limit = deviceLimits.get(level);
                if (limit == null || limit <= 0) {
                    throw new IllegalStateException(
                            "agent.write.device-limits." + level.name() + " must be a positive integer");
                }
            }
            if (bulkThreshold >= massThreshold) {
                throw new IllegalStateException("agent.write.bulk-threshold must be below mass-threshold");
            }
        }

        public EnumMap<RiskLevel, Integer> deviceLimitTable() {
            return new EnumMap<>(deviceLimits);
        }

        private static Map<RiskLevel, Integer> defaultDeviceLimits() {
            EnumMap<RiskLevel, Integer> limits = new EnumMap<>(RiskLevel.class);
            limits.put(RiskLevel.LOW, 50);
            limits.put(RiskLevel.MEDIUM, 25);
            limits.put(RiskLevel.HIGH, 10);
            limits.put(RiskLevel.CRITICAL, 5);
            return limits;
        }
    }

    @Data
    public static class Quota {
        /** memory | redis */
        private String store = "memory";
        private int dailyOperationLimit = 500;
    }

    @Data
    public static class Confirmation {
        /** memory | redis */
        private String store = "memory";
        private long ttlSeconds = 3600;
    }

    @Data
    public static class Conversation {
        /** memory | redis */
        private String store = "memory";
        private long ttlMinutes = 1440;
        private int maxMessages = 50;
    }

    @Data
    public static class Audit {
        /** log | mongo */
        private String store = "log";
    }

    @Data
    public static class SideEffects {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
    }
}
