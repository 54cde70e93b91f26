package com.fleetops.agent.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetops.agent.model.Message;
import com.fleetops.agent.model.UserContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis-backed conversations.
 *
 * Key patterns:
 * - agent:conversation:{tenant}:{conversation}:meta      Conversation JSON
 * - agent:conversation:{tenant}:{conversation}:messages  JSON array, sliding window of maxMessages
 *
 * TTL is reset on every write, so idle conversations expire on their own.
 */
@Slf4j
public class RedisConversationStore implements ConversationStore {

    private static final String KEY_PREFIX = "agent:conversation:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final int maxMessages;
    private final Clock clock;

    public RedisConversationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                  Duration ttl, int maxMessages, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.maxMessages = maxMessages;
        this.clock = clock;
    }

    @Override
    public Conversation getOrCreate(UserContext context, String conversationId) {
        if (conversationId != null) {
            Optional<Conversation> existing = find(context, conversationId);
            if (existing.isPresent()) {
                return existing.get();
            }
        }
        Conversation conversation = Conversation.builder()
                .id(conversationId != null ? conversationId : UUID.randomUUID().toString())
                .tenantId(context.tenantId())
                .userId(context.userId())
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        writeMeta(context, conversation);
        log.debug("Created conversation {} [tenant={}]", conversation.getId(), context.tenantId());
        return conversation;
    }

    @Override
    public Optional<Conversation> find(UserContext context, String conversationId) {
        String json = redisTemplate.opsForValue().get(metaKey(context, conversationId));
        if (json == null) {
            return Optional.empty();
        }
        try {
            Conversation conversation = objectMapper.readValue(json, Conversation.class);
            if (!context.userId().equals(conversation.getUserId())) {
                return Optional.empty();
            }
            return Optional.of(conversation);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize conversation {}", conversationId, e);
            return Optional.empty();
        }
    }

    @Override
    public void append(UserContext context, String conversationId, List<Message> messages) {
        Conversation conversation = getOrCreate(context, conversationId);

        List<Message> all = history(context, conversationId);
        all.addAll(messages);
        if (all.size() > maxMessages) {
            all = new ArrayList<>(all.subList(all.size() - maxMessages, all.size()));
        }

        try {
            redisTemplate.opsForValue().set(messagesKey(context, conversationId),
                    objectMapper.writeValueAsString(all), ttl);
        } catch (JsonProcessingException e) {
            // History write failure must not break the turn
            log.error("Failed to serialize messages for conversation {}", conversationId, e);
            return;
        }

        conversation.setMessageCount(conversation.getMessageCount() + messages.size());
        conversation.setUpdatedAt(clock.instant());
        writeMeta(context, conversation);
    }

    @Override
    public List<Message> history(UserContext context, String conversationId) {
        String json = redisTemplate.opsForValue().get(messagesKey(context, conversationId));
        if (json == null) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<Message>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize messages for conversation {}. Returning empty.", conversationId, e);
            return new ArrayList<>();
        }
    }

    @Override
    public void delete(UserContext context, String conversationId) {
        redisTemplate.delete(List.of(metaKey(context, conversationId), messagesKey(context, conversationId)));
        log.info("Deleted conversation {} [tenant={}]", conversationId, context.tenantId());
    }

    private void writeMeta(UserContext context, Conversation conversation) {
        try {
            redisTemplate.opsForValue().set(metaKey(context, conversation.getId()),
                    objectMapper.writeValueAsString(conversation), ttl);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize conversation {}", conversation.getId(), e);
        }
    }

    private static String metaKey(UserContext context, String conversationId) {
        return KEY_PREFIX + context.tenantId() + ":" + conversationId + ":meta";
    }

    private static String messagesKey(UserContext context, String conversationId) {
        return KEY_PREFIX + context.tenantId() + ":" + conversationId + ":messages";
    }
}
