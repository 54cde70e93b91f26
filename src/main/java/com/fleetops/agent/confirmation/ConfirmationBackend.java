package com.fleetops.agent.confirmation;

import com.fleetops.agent.model.UserContext;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One storage strategy for pending confirmations. Entries are scoped by
 * tenant, user and conversation; an entry is visible only inside its scope.
 *
 * {@link #getAndDelete} must be atomic: an entry handed out once is gone for every caller.
 */
public interface ConfirmationBackend {

    String name();

    void store(UserContext context, PendingConfirmation confirmation, Duration ttl);

    /**
     * Removes and returns the entry for {@code operationId}, or the earliest-created
     * entry of the conversation when {@code operationId} is null.
     */
    Optional<PendingConfirmation> getAndDelete(UserContext context, String conversationId, String operationId);

    /** Live entries, earliest first */
    List<PendingConfirmation> list(UserContext context, String conversationId);

    /** @return number of entries removed */
    int cleanup(UserContext context, String conversationId);
}
