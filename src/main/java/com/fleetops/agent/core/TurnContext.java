package com.fleetops.agent.core;

import com.fleetops.agent.model.Message;
import com.fleetops.agent.model.UserContext;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Holds all mutable state for a single chat() run.
 * Passed through the turn loop instead of scattered fields on the orchestrator.
 */
@Data
@Builder
@Slf4j
public class TurnContext {

    private String conversationId;
    private UserContext userContext;
    private String userMessage;
    private List<Message> messages;
    private String systemPrompt;

    @Builder.Default
    private TurnState state = TurnState.AWAITING_LLM;

    private int turn;

    /** Text of the most recent assistant message */
    private String lastResponseText;
    private String lastAssistantMessageId;

    public void transition(TurnState next) {
        log.debug("Conversation {} turn {}: {} -> {}", conversationId, turn, state, next);
        this.state = next;
    }
}
