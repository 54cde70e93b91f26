package com.fleetops.agent.pattern;

import com.fleetops.agent.config.AgentProperties;
import com.fleetops.agent.model.UserContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pattern matching before a turn and pattern learning after tool outcomes.
 * Learning runs on the side-effect pool and never reports failure to the caller.
 */
@Service
@Slf4j
public class PatternService {

    private static final int PREVIEW_LENGTH = 200;

    private final ObjectProvider<PatternStore> patternStoreProvider;
    private final AgentProperties.Orchestrator settings;

    public PatternService(ObjectProvider<PatternStore> patternStoreProvider, AgentProperties properties) {
        this.patternStoreProvider = patternStoreProvider;
        this.settings = properties.getOrchestrator();
    }

    public List<PatternMatch> findSimilar(String query, UserContext context) {
        PatternStore store = patternStoreProvider.getIfAvailable();
        if (!settings.isPatternMatchingEnabled() || store == null) {
            return List.of();
        }
        try {
            return store.findSimilar(context.tenantId(), query, null,
                    settings.getPatternMatchLimit(), settings.getPatternMinConfidence());
        } catch (Exception e) {
            log.warn("Pattern search failed [tenant={}]: {}", context.tenantId(), e.getMessage());
            return List.of();
        }
    }

    @Async("sideEffectExecutor")
    public void learnToolSuccess(String tenantId, String trigger, String toolName,
                                 Map<String, Object> arguments, Object result) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("arguments", arguments);
        context.put("result_preview", preview(result));
        learn(tenantId, PatternType.TOOL_SUCCESS, trigger, toolName, context, true);
    }

    @Async("sideEffectExecutor")
    public void learnErrorRecovery(String tenantId, String toolName, String error) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("error", error);
        context.put("tool", toolName);
        learn(tenantId, PatternType.ERROR_RECOVERY,
                "Tool '" + toolName + "' failed: " + error,
                "Retry or escalate: " + toolName,
                context, false);
    }

    private void learn(String tenantId, PatternType type, String trigger, String response,
                       Map<String, Object> context, boolean success) {
        PatternStore store = patternStoreProvider.getIfAvailable();
        if (!settings.isPatternLearningEnabled() || store == null) {
            return;
        }
        try {
            LearnedPattern pattern = store.learn(tenantId, type, trigger, response, context, success);
            log.debug("Learned pattern {} [tenant={}, confidence={}, successRate={}]",
                    type.value(), tenantId, pattern.getConfidence(), pattern.successRate());
        } catch (Exception e) {
            log.warn("Failed to learn pattern {} [tenant={}]: {}", type.value(), tenantId, e.getMessage());
        }
    }

    private static String preview(Object result) {
        String text = String.valueOf(result);
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) : text;
    }
}
