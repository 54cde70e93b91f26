package com.fleetops.agent.exception;

import lombok.Getter;

@Getter
public class ConfirmationRequiredException extends AgentException {

    private final String operationId;

    public ConfirmationRequiredException(String operationId) {
        super("Operation " + operationId + " requires confirmation before execution");
        this.operationId = operationId;
    }
}
