package com.fleetops.agent.exception;

public class OperationNotFoundException extends AgentException {

    public OperationNotFoundException(String operationId) {
        super("Operation not found: " + operationId);
    }
}
