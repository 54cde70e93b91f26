package com.fleetops.agent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChatRequest {

    @NotBlank(message = "message must not be blank")
    private String message;

    /**
     * Optional. If provided, the chat continues this conversation.
     * If null, a new conversation is created.
     */
    private String conversationId;
}
