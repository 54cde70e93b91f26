package com.fleetops.agent.exception;

import lombok.Getter;

/**
 * The deduplicated device list is larger than the ceiling for the operation's risk tier.
 * Never retried; the message tells the caller how to batch.
 */
@Getter
public class DeviceLimitExceededException extends AgentException {

    private final int count;
    private final int limit;
    private final String operation;

    public DeviceLimitExceededException(int count, int limit, String operation) {
        super(String.format(
                "Operation '%s' exceeds maximum device limit. Got %d devices, maximum is %d. "
                        + "Please split into smaller batches of %d or fewer.",
                operation, count, limit, limit));
        this.count = count;
        this.limit = limit;
        this.operation = operation;
    }
}
