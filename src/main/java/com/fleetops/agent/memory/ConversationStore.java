package com.fleetops.agent.memory;

import com.fleetops.agent.model.Message;
import com.fleetops.agent.model.UserContext;

import java.util.List;
import java.util.Optional;

/**
 * Conversation records and their message history, scoped by tenant.
 */
public interface ConversationStore {

    /**
     * Returns the conversation when it exists for the caller's tenant and user,
     * otherwise creates one. A null id always creates a new conversation.
     */
    Conversation getOrCreate(UserContext context, String conversationId);

    Optional<Conversation> find(UserContext context, String conversationId);

    void append(UserContext context, String conversationId, List<Message> messages);

    /** Stored messages, oldest first */
    List<Message> history(UserContext context, String conversationId);

    void delete(UserContext context, String conversationId);
}
