package com.fleetops.agent.pattern;

import java.util.List;
import java.util.Map;

/**
 * Store of (trigger, response, outcome) tuples learned from past interactions,
 * searched by semantic similarity. Implemented outside this service.
 */
public interface PatternStore {

    /** Records a new pattern or reinforces an existing one with the same trigger. */
    LearnedPattern learn(String tenantId, PatternType type, String trigger, String response,
                         Map<String, Object> context, boolean success);

    /**
     * @param type null for any type
     * @return matches, most similar first
     */
    List<PatternMatch> findSimilar(String tenantId, String query, PatternType type, int limit, double minConfidence);
}
