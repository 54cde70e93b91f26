package com.fleetops.agent.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ConfirmRequest {

    @NotBlank(message = "conversationId must not be blank")
    private String conversationId;

    @NotNull(message = "confirmed must be set")
    private Boolean confirmed;

    /** Optional. When null the earliest pending operation of the conversation is answered. */
    private String operationId;
}
