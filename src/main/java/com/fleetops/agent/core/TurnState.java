package com.fleetops.agent.core;

/**
 * States of one chat() run.
 *
 * AWAITING_LLM -> STREAMING -> EXECUTING_TOOLS | DONE | ERROR
 * EXECUTING_TOOLS -> AWAITING_CONFIRMATION | AWAITING_LLM | DONE
 *
 * AWAITING_CONFIRMATION ends the run; the conversation resumes through confirmOperation.
 */
public enum TurnState {
    AWAITING_LLM,
    STREAMING,
    EXECUTING_TOOLS,
    AWAITING_CONFIRMATION,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == AWAITING_CONFIRMATION || this == DONE || this == ERROR;
    }
}
