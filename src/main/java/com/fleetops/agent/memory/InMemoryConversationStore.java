package com.fleetops.agent.memory;

import com.fleetops.agent.model.Message;
import com.fleetops.agent.model.UserContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local conversations. History is capped at {@code maxMessages}, oldest dropped first.
 */
@Slf4j
public class InMemoryConversationStore implements ConversationStore {

    private record Stored(Conversation conversation, List<Message> messages) {
    }

    private final int maxMessages;
    private final Clock clock;
    private final Map<String, Stored> conversations = new ConcurrentHashMap<>();

    public InMemoryConversationStore(int maxMessages, Clock clock) {
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
        String id = conversationId != null ? conversationId : UUID.randomUUID().toString();
        Conversation conversation = Conversation.builder()
                .id(id)
                .tenantId(context.tenantId())
                .userId(context.userId())
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        conversations.put(key(context, id), new Stored(conversation, new ArrayList<>()));
        log.debug("Created conversation {} [tenant={}]", id, context.tenantId());
        return conversation;
    }

    @Override
    public Optional<Conversation> find(UserContext context, String conversationId) {
        Stored stored = conversations.get(key(context, conversationId));
        if (stored == null || !stored.conversation().getUserId().equals(context.userId())) {
            return Optional.empty();
        }
        return Optional.of(stored.conversation());
    }

    @Override
    public void append(UserContext context, String conversationId, List<Message> messages) {
        Stored stored = conversations.get(key(context, conversationId));
        if (stored == null) {
            getOrCreate(context, conversationId);
            stored = conversations.get(key(context, conversationId));
        }
        synchronized (stored) {
            stored.messages().addAll(messages);
            int overflow = stored.messages().size() - maxMessages;
            if (overflow > 0) {
                stored.messages().subList(0, overflow).clear();
            }
            stored.conversation().setMessageCount(stored.conversation().getMessageCount() + messages.size());
            stored.conversation().setUpdatedAt(clock.instant());
        }
    }

    @Override
    public List<Message> history(UserContext context, String conversationId) {
        Stored stored = conversations.get(key(context, conversationId));
        if (stored == null) {
            return new ArrayList<>();
        }
        synchronized (stored) {
            return new ArrayList<>(stored.messages());
        }
    }

    @Override
    public void delete(UserContext context, String conversationId) {
        conversations.remove(key(context, conversationId));
    }

    private static String key(UserContext context, String conversationId) {
        return context.tenantId() + ":" + conversationId;
    }
}
