package com.fleetops.agent.llm;

import com.fleetops.agent.exception.AgentException;
import com.fleetops.agent.model.ErrorKind;
import lombok.Getter;

/**
 * Raised (or signalled through the stream) by provider implementations.
 * The kind lets the orchestrator tell rate limits and timeouts apart from fatal errors.
 */
@Getter
public class LlmProviderException extends AgentException {

    private final ErrorKind kind;

    public LlmProviderException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }

    public LlmProviderException(String message, ErrorKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
