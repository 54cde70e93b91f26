package com.fleetops.agent.quota;

import com.fleetops.agent.exception.QuotaExceededException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisTenantQuotaTrackerTest {

    @Mock StringRedisTemplate redisTemplate;
    @Mock HashOperations<String, Object, Object> hashOperations;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-10T08:00:00Z"), ZoneOffset.UTC);

    @Test
    void checkAndIncrement_allowed_usesDatedKeyAndReturnsCounters() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<String>>any(), anyList(), any(), any(), any()))
                .thenReturn("1:3:12");
        RedisTenantQuotaTracker tracker = new RedisTenantQuotaTracker(redisTemplate, 500, clock);

        TenantQuota quota = tracker.checkAndIncrement("acme", 4);

        assertThat(quota.getOperationsToday()).isEqualTo(3);
        assertThat(quota.getDevicesToday()).isEqualTo(12);
        verify(redisTemplate).execute(ArgumentMatchers.<RedisScript<String>>any(),
                eq(List.of("agent:quota:acme:2026-03-10")), eq("500"), eq("4"), eq("172800"));
    }

    @Test
    void checkAndIncrement_rejected_throwsQuotaExceeded() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<String>>any(), anyList(), any(), any(), any()))
                .thenReturn("0:500:900");
        RedisTenantQuotaTracker tracker = new RedisTenantQuotaTracker(redisTemplate, 500, clock);

        assertThatThrownBy(() -> tracker.checkAndIncrement("acme", 1))
                .isInstanceOf(QuotaExceededException.class)
                .hasMessageContaining("500/500");
    }

    @Test
    void checkAndIncrement_unexpectedScriptResult_failsLoudly() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<String>>any(), anyList(), any(), any(), any()))
                .thenReturn(null);
        RedisTenantQuotaTracker tracker = new RedisTenantQuotaTracker(redisTemplate, 500, clock);

        assertThatThrownBy(() -> tracker.checkAndIncrement("acme", 1))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void checkAndIncrement_truncatedScriptResult_failsLoudly() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<String>>any(), anyList(), any(), any(), any()))
                .thenReturn("1:3");
        RedisTenantQuotaTracker tracker = new RedisTenantQuotaTracker(redisTemplate, 500, clock);

        assertThatThrownBy(() -> tracker.checkAndIncrement("acme", 1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1:3");
    }

    @Test
    void getQuota_readsHashFields() {
        doReturn(hashOperations).when(redisTemplate).opsForHash();
        when(hashOperations.entries("agent:quota:acme:2026-03-10"))
                .thenReturn(Map.of("operations", "7", "devices", "40"));
        RedisTenantQuotaTracker tracker = new RedisTenantQuotaTracker(redisTemplate, 500, clock);

        TenantQuota quota = tracker.getQuota("acme");

        assertThat(quota.getOperationsToday()).isEqualTo(7);
        assertThat(quota.getDevicesToday()).isEqualTo(40);
        assertThat(quota.remaining()).isEqualTo(493);
    }
}
