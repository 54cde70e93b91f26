package com.fleetops.agent.confirmation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetops.agent.model.ToolCall;
import com.fleetops.agent.model.UserContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings({"unchecked", "rawtypes"})
class RedisConfirmationBackendTest {

    private static final UserContext CTX = UserContext.of("tenant-a", "alice");

    @Mock StringRedisTemplate redisTemplate;
    @Mock ZSetOperations<String, String> zSetOperations;
    @Mock ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private RedisConfirmationBackend backend;

    @BeforeEach
    void setUp() {
        backend = new RedisConfirmationBackend(redisTemplate, objectMapper);
    }

    private PendingConfirmation pending(String operationId) {
        return PendingConfirmation.builder()
                .operationId(operationId)
                .conversationId("c1")
                .toolCall(ToolCall.builder().id("call-1").name("archive_devices")
                        .arguments(Map.of("device_ids", List.of("d1", "d2"))).build())
                .createdAt(Instant.parse("2026-03-10T10:00:00Z"))
                .build();
    }

    @Test
    void store_writesValueAndIndexInOneScript() {
        backend.store(CTX, pending("op-1"), Duration.ofSeconds(3600));

        verify(redisTemplate).execute(any(RedisScript.class),
                eq(List.of("agent:confirmation:tenant-a:alice:c1:op-1", "agent:confirmation-index:tenant-a:alice:c1")),
                anyString(), eq("3600"), eq(String.valueOf(Instant.parse("2026-03-10T10:00:00Z").toEpochMilli())),
                eq("op-1"));
    }

    @Test
    void getAndDelete_byId_deserializesRecord() throws Exception {
        String json = objectMapper.writeValueAsString(pending("op-1"));
        when(redisTemplate.execute(any(RedisScript.class), anyList(), eq("op-1"))).thenReturn(json);

        PendingConfirmation found = backend.getAndDelete(CTX, "c1", "op-1").orElseThrow();

        assertThat(found.getOperationId()).isEqualTo("op-1");
        assertThat(found.getToolCall().getName()).isEqualTo("archive_devices");
        assertThat(found.getToolCall().getArguments()).containsEntry("device_ids", List.of("d1", "d2"));
    }

    @Test
    void getAndDelete_withoutId_popsEarliestUsingConversationPrefix() {
        when(redisTemplate.execute(any(RedisScript.class),
                eq(List.of("agent:confirmation-index:tenant-a:alice:c1")),
                eq("agent:confirmation:tenant-a:alice:c1:")))
                .thenReturn(null);

        assertThat(backend.getAndDelete(CTX, "c1", null)).isEmpty();
    }

    @Test
    void list_skipsExpiredAndUnreadableValues() throws Exception {
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(zSetOperations.range("agent:confirmation-index:tenant-a:alice:c1", 0, -1))
                .thenReturn(new LinkedHashSet<>(List.of("op-1", "op-2", "op-3")));
        when(valueOperations.multiGet(anyList()))
                .thenReturn(Arrays.asList(objectMapper.writeValueAsString(pending("op-1")), null, "{not json"));

        assertThat(backend.list(CTX, "c1"))
                .extracting(PendingConfirmation::getOperationId)
                .containsExactly("op-1");
    }

    @Test
    void cleanup_returnsScriptCount() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), anyString())).thenReturn(4L);

        assertThat(backend.cleanup(CTX, "c1")).isEqualTo(4);
    }
}
