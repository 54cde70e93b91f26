package com.fleetops.agent.memory;

import com.fleetops.agent.config.AgentProperties;
import com.fleetops.agent.model.UserContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Long-term memory as seen by the orchestrator: recall before a turn,
 * fact extraction after it. Both work without a {@link MemoryStore}, doing nothing.
 *
 * Failures are logged and swallowed; memory is best-effort context, never part
 * of the answer's correctness.
 */
@Service
@Slf4j
public class MemoryService {

    private final ObjectProvider<MemoryStore> memoryStoreProvider;
    private final FactExtractor factExtractor;
    private final AgentProperties.Orchestrator settings;
    private final Clock clock;

    public MemoryService(ObjectProvider<MemoryStore> memoryStoreProvider,
                         FactExtractor factExtractor,
                         AgentProperties properties,
                         Clock clock) {
        this.memoryStoreProvider = memoryStoreProvider;
        this.factExtractor = factExtractor;
        this.settings = properties.getOrchestrator();
        this.clock = clock;
    }

    public List<Memory> recall(String query, UserContext context) {
        MemoryStore store = memoryStoreProvider.getIfAvailable();
        if (!settings.isMemorySearchEnabled() || store == null) {
            return List.of();
        }
        try {
            List<Memory> memories = store.search(query, context, settings.getEmbeddingModel(),
                    settings.getMemorySearchLimit(), settings.getMemoryMinConfidence());
            log.debug("Recalled {} memories [tenant={}]", memories.size(), context.tenantId());
            return memories;
        } catch (Exception e) {
            log.warn("Memory search failed [tenant={}]: {}", context.tenantId(), e.getMessage());
            return List.of();
        }
    }

    @Async("sideEffectExecutor")
    public void extractAndStore(String content, String conversationId, String messageId, UserContext context) {
        MemoryStore store = memoryStoreProvider.getIfAvailable();
        if (!settings.isFactExtractionEnabled() || store == null || content == null || content.isBlank()) {
            return;
        }

        try {
            List<ExtractedFact> facts = factExtractor.extract(content);
            facts.forEach(fact -> store.store(fact.toMemory(context, conversationId, messageId, clock.instant())));
            if (!facts.isEmpty()) {
                log.info("Extracted and stored {} facts [conversation={}, tenant={}]",
                        facts.size(), conversationId, context.tenantId());
            }
        } catch (Exception e) {
            log.warn("Fact extraction failed [conversation={}]: {}", conversationId, e.getMessage());
        }
    }
}
