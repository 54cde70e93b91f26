package com.fleetops.agent.memory;

import com.fleetops.agent.config.AgentProperties;
import com.fleetops.agent.model.UserContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MemoryServiceTest {

    private static final UserContext CTX = UserContext.of("tenant-a", "alice");

    @Mock ObjectProvider<MemoryStore> provider;
    @Mock MemoryStore memoryStore;
    @Mock FactExtractor factExtractor;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-10T10:00:00Z"), ZoneOffset.UTC);
    private final AgentProperties properties = new AgentProperties();

    private MemoryService service() {
        return new MemoryService(provider, factExtractor, properties, clock);
    }

    @Test
    void recall_usesConfiguredModelLimitAndConfidence() {
        when(provider.getIfAvailable()).thenReturn(memoryStore);
        Memory memory = Memory.builder().content("Prefers dry runs").memoryType(MemoryType.PREFERENCE).build();
        when(memoryStore.search("archive lab", CTX, "text-embedding-3-large", 5, 0.5)).thenReturn(List.of(memory));

        assertThat(service().recall("archive lab", CTX)).containsExactly(memory);
    }

    @Test
    void recall_withoutStore_isEmpty() {
        when(provider.getIfAvailable()).thenReturn(null);

        assertThat(service().recall("anything", CTX)).isEmpty();
    }

    @Test
    void recall_storeFailure_isEmpty() {
        when(provider.getIfAvailable()).thenReturn(memoryStore);
        when(memoryStore.search(anyString(), any(), anyString(), anyInt(), anyDouble()))
                .thenThrow(new IllegalStateException("vector index offline"));

        assertThat(service().recall("anything", CTX)).isEmpty();
    }

    @Test
    void extractAndStore_storesEachFactWithProvenance() {
        when(provider.getIfAvailable()).thenReturn(memoryStore);
        when(factExtractor.extract("final answer text")).thenReturn(List.of(
                new ExtractedFact(MemoryType.ENTITY, "San Jose data center", 0.8, "named site")));

        service().extractAndStore("final answer text", "conv-1", "msg-1", CTX);

        verify(memoryStore).store(argThat(m -> m.getMemoryType() == MemoryType.ENTITY
                && "tenant-a".equals(m.getTenantId())
                && "conv-1".equals(m.getSourceConversationId())
                && "msg-1".equals(m.getSourceMessageId())
                && clock.instant().equals(m.getCreatedAt())));
    }

    @Test
    void extractAndStore_disabled_doesNothing() {
        properties.getOrchestrator().setFactExtractionEnabled(false);
        when(provider.getIfAvailable()).thenReturn(memoryStore);

        service().extractAndStore("final answer text", "conv-1", "msg-1", CTX);

        verifyNoInteractions(factExtractor, memoryStore);
    }

    @Test
    void extractAndStore_extractorFailure_doesNotThrow() {
        when(provider.getIfAvailable()).thenReturn(memoryStore);
        when(factExtractor.extract(anyString())).thenThrow(new IllegalStateException("boom"));

        service().extractAndStore("final answer text", "conv-1", "msg-1", CTX);

        verify(memoryStore, never()).store(any());
    }
}
