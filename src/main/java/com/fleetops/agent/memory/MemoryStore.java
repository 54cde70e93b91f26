package com.fleetops.agent.memory;

import com.fleetops.agent.model.UserContext;

import java.util.List;

/**
 * Long-term semantic memory. Implemented outside this service; the agent only
 * reads relevant memories into its prompt and writes extracted facts back.
 */
public interface MemoryStore {

    Memory store(Memory memory);

    /**
     * Memories relevant to {@code query}, most relevant first, restricted to the
     * caller's tenant and to embeddings produced by {@code embeddingModel}.
     */
    List<Memory> search(String query, UserContext context, String embeddingModel, int limit, double minConfidence);
}
