package com.fleetops.agent.quota;

import com.fleetops.agent.exception.QuotaExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Redis-backed quota tracker shared by every instance of the service.
 *
 * Key pattern: agent:quota:{tenantId}:{yyyy-MM-dd}, a hash with
 * "operations" and "devices" fields. The date in the key is the daily reset;
 * old keys expire on their own.
 */
@Slf4j
public class RedisTenantQuotaTracker implements TenantQuotaTracker {

    private static final String KEY_PREFIX = "agent:quota:";
    private static final Duration KEY_TTL = Duration.ofHours(48);

    // Returns "allowed:operations:devices", allowed being 0 or 1
    private static final RedisScript<String> CHECK_AND_INCREMENT = new DefaultRedisScript<>("""
            local ops = tonumber(redis.call('HGET', KEYS[1], 'operations') or '0')
            local limit = tonumber(ARGV[1])
            if ops >= limit then
              local devices = tonumber(redis.call('HGET', KEYS[1], 'devices') or '0')
              return '0:' .. ops .. ':' .. devices
            end
            ops = redis.call('HINCRBY', KEYS[1], 'operations', 1)
            local devices = redis.call('HINCRBY', KEYS[1], 'devices', tonumber(ARGV[2]))
            redis.call('EXPIRE', KEYS[1], tonumber(ARGV[3]))
            return '1:' .. ops .. ':' .. devices
            """, String.class);

    private final StringRedisTemplate redisTemplate;
    private final int dailyLimit;
    private final Clock clock;

    public RedisTenantQuotaTracker(StringRedisTemplate redisTemplate, int dailyLimit, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.dailyLimit = dailyLimit;
        this.clock = clock;
    }

    @Override
    public TenantQuota checkAndIncrement(String tenantId, int deviceCount) {
        LocalDate today = LocalDate.now(clock);
        String reply = redisTemplate.execute(
                CHECK_AND_INCREMENT,
                List.of(buildKey(tenantId, today)),
                String.valueOf(dailyLimit),
                String.valueOf(deviceCount),
                String.valueOf(KEY_TTL.toSeconds()));

        String[] result = reply == null ? new String[0] : reply.split(":");
        if (result.length < 3) {
            throw new IllegalStateException("Unexpected quota script result for tenant " + tenantId + ": " + reply);
        }

        boolean allowed = toLong(result[0]) == 1L;
        TenantQuota quota = TenantQuota.builder()
                .tenantId(tenantId)
                .dailyLimit(dailyLimit)
                .operationsToday(toLong(result[1]))
                .devicesToday(toLong(result[2]))
                .resetDate(today)
                .build();

        if (!allowed) {
            log.warn("Daily quota exceeded for tenant={}: {}/{}", tenantId, quota.getOperationsToday(), dailyLimit);
            throw new QuotaExceededException(tenantId, quota.getOperationsToday(), dailyLimit, quota.resetAt());
        }

        log.debug("Tenant {} quota: {}/{} operations, {} devices",
                tenantId, quota.getOperationsToday(), dailyLimit, quota.getDevicesToday());
        return quota;
    }

    @Override
    public TenantQuota getQuota(String tenantId) {
        LocalDate today = LocalDate.now(clock);
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(buildKey(tenantId, today));
        return TenantQuota.builder()
                .tenantId(tenantId)
                .dailyLimit(dailyLimit)
                .operationsToday(toLong(fields.get("operations")))
                .devicesToday(toLong(fields.get("devices")))
                .resetDate(today)
                .build();
    }

    private String buildKey(String tenantId, LocalDate day) {
        return KEY_PREFIX + tenantId + ":" + day;
    }

    private static long toLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        return Long.parseLong(value.toString());
    }
}
