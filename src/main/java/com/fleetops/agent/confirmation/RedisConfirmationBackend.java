package com.fleetops.agent.confirmation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetops.agent.model.UserContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed confirmations that survive a restart and are visible to every instance.
 *
 * Key patterns:
 * - agent:confirmation:{tenant}:{user}:{conversation}:{operation}  JSON value with TTL
 * - agent:confirmation-index:{tenant}:{user}:{conversation}        ZSET of operation ids scored by creation millis
 *
 * Each mutation is one Lua script so consumption stays single-use under concurrency.
 * The scripts derive value keys from the prefix passed in ARGV, so all keys of a
 * conversation must live on one Redis node.
 */
@Slf4j
public class RedisConfirmationBackend implements ConfirmationBackend {

    private static final String KEY_PREFIX = "agent:confirmation:";
    private static final String INDEX_PREFIX = "agent:confirmation-index:";

    private static final RedisScript<Long> STORE = new DefaultRedisScript<>("""
            redis.call('SET', KEYS[1], ARGV[1], 'EX', tonumber(ARGV[2]))
            redis.call('ZADD', KEYS[2], tonumber(ARGV[3]), ARGV[4])
            redis.call('EXPIRE', KEYS[2], tonumber(ARGV[2]))
            return 1
            """, Long.class);

    private static final RedisScript<String> GET_AND_DELETE = new DefaultRedisScript<>("""
            local value = redis.call('GET', KEYS[1])
            if value then
              redis.call('DEL', KEYS[1])
            end
            redis.call('ZREM', KEYS[2], ARGV[1])
            return value
            """, String.class);

    // Skips index entries whose value already expired
    private static final RedisScript<String> POP_EARLIEST = new DefaultRedisScript<>("""
            local ids = redis.call('ZRANGE', KEYS[1], 0, -1)
            for _, id in ipairs(ids) do
              local key = ARGV[1] .. id
              local value = redis.call('GET', key)
              redis.call('ZREM', KEYS[1], id)
              if value then
                redis.call('DEL', key)
                return value
              end
            end
            return false
            """, String.class);

    private static final RedisScript<Long> CLEANUP = new DefaultRedisScript<>("""
            local ids = redis.call('ZRANGE', KEYS[1], 0, -1)
            local removed = 0
            for _, id in ipairs(ids) do
              removed = removed + redis.call('DEL', ARGV[1] .. id)
            end
            redis.call('DEL', KEYS[1])
            return removed
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisConfirmationBackend(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public void store(UserContext context, PendingConfirmation confirmation, Duration ttl) {
        String conversationId = confirmation.getConversationId();
        String json;
        try {
            json = objectMapper.writeValueAsString(confirmation);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize confirmation " + confirmation.getOperationId(), e);
        }

        redisTemplate.execute(STORE,
                List.of(valueKey(context, conversationId, confirmation.getOperationId()),
                        indexKey(context, conversationId)),
                json,
                String.valueOf(ttl.toSeconds()),
                String.valueOf(confirmation.getCreatedAt().toEpochMilli()),
                confirmation.getOperationId());
        log.debug("Stored confirmation in Redis: {}:{} (TTL: {}s)",
                conversationId, confirmation.getOperationId(), ttl.toSeconds());
    }

    @Override
    public Optional<PendingConfirmation> getAndDelete(UserContext context, String conversationId, String operationId) {
        String json;
        if (operationId != null) {
            json = redisTemplate.execute(GET_AND_DELETE,
                    List.of(valueKey(context, conversationId, operationId), indexKey(context, conversationId)),
                    operationId);
        } else {
            json = redisTemplate.execute(POP_EARLIEST,
                    List.of(indexKey(context, conversationId)),
                    valuePrefix(context, conversationId));
        }
        return Optional.ofNullable(json).map(this::deserialize);
    }

    @Override
    public List<PendingConfirmation> list(UserContext context, String conversationId) {
        Set<String> ids = redisTemplate.opsForZSet().range(indexKey(context, conversationId), 0, -1);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> keys = new ArrayList<>(ids.size());
        ids.forEach(id -> keys.add(valueKey(context, conversationId, id)));

        List<String> values = redisTemplate.opsForValue().multiGet(keys);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(this::deserialize)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public int cleanup(UserContext context, String conversationId) {
        Long removed = redisTemplate.execute(CLEANUP,
                List.of(indexKey(context, conversationId)),
                valuePrefix(context, conversationId));
        return removed == null ? 0 : removed.intValue();
    }

    private PendingConfirmation deserialize(String json) {
        try {
            return objectMapper.readValue(json, PendingConfirmation.class);
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable confirmation record", e);
            return null;
        }
    }

    private static String valuePrefix(UserContext context, String conversationId) {
        return KEY_PREFIX + context.tenantId() + ":" + context.userId() + ":" + conversationId + ":";
    }

    private static String valueKey(UserContext context, String conversationId, String operationId) {
        return valuePrefix(context, conversationId) + operationId;
    }

    private static String indexKey(UserContext context, String conversationId) {
        return INDEX_PREFIX + context.tenantId() + ":" + context.userId() + ":" + conversationId;
    }
}
