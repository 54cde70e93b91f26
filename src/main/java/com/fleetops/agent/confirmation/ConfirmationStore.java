package com.fleetops.agent.confirmation;

import com.fleetops.agent.model.UserContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Holding area for operations awaiting the operator's approval.
 *
 * Backends are consulted in order, durable first. A store lands in the first
 * backend that accepts it; a lookup is served by the first backend that has a
 * match, and that match is consumed there only, so an approval is delivered once.
 */
@Slf4j
public class ConfirmationStore {

    private final List<ConfirmationBackend> backends;
    private final Duration ttl;
    private final Clock clock;

    public ConfirmationStore(List<ConfirmationBackend> backends, Duration ttl, Clock clock) {
        if (backends.isEmpty()) {
            throw new IllegalArgumentException("At least one confirmation backend is required");
        }
        this.backends = List.copyOf(backends);
        this.ttl = ttl;
        this.clock = clock;
    }

    public PendingConfirmation store(UserContext context, PendingConfirmation confirmation) {
        if (confirmation.getCreatedAt() == null) {
            confirmation.setCreatedAt(clock.instant());
        }

        RuntimeException lastFailure = null;
        for (ConfirmationBackend backend : backends) {
            try {
                backend.store(context, confirmation, ttl);
                log.info("Stored pending confirmation [conversation={}, operation={}, backend={}]",
                        confirmation.getConversationId(), confirmation.getOperationId(), backend.name());
                return confirmation;
            } catch (RuntimeException e) {
                log.warn("Confirmation backend {} rejected store, falling back [operation={}]: {}",
                        backend.name(), confirmation.getOperationId(), e.getMessage());
                lastFailure = e;
            }
        }
        throw lastFailure;
    }

    /**
     * Consumes the pending confirmation for {@code operationId}, or the earliest
     * one in the conversation when no id is given.
     */
    public Optional<PendingConfirmation> getAndDelete(UserContext context, String conversationId, String operationId) {
        for (ConfirmationBackend backend : backends) {
            try {
                Optional<PendingConfirmation> found = backend.getAndDelete(context, conversationId, operationId);
                if (found.isPresent()) {
                    log.info("Consumed pending confirmation [conversation={}, operation={}, backend={}]",
                            conversationId, found.get().getOperationId(), backend.name());
                    return found;
                }
            } catch (RuntimeException e) {
                log.warn("Confirmation backend {} failed on lookup [conversation={}]: {}",
                        backend.name(), conversationId, e.getMessage());
            }
        }
        return Optional.empty();
    }

    public List<PendingConfirmation> list(UserContext context, String conversationId) {
        List<PendingConfirmation> all = new ArrayList<>();
        for (ConfirmationBackend backend : backends) {
            try {
                all.addAll(backend.list(context, conversationId));
            } catch (RuntimeException e) {
                log.warn("Confirmation backend {} failed on list [conversation={}]: {}",
                        backend.name(), conversationId, e.getMessage());
            }
        }
        return all;
    }

    public boolean hasPending(UserContext context, String conversationId) {
        return !list(context, conversationId).isEmpty();
    }

    /** @return total entries removed across all backends */
    public int cleanupConversation(UserContext context, String conversationId) {
        int removed = 0;
        for (ConfirmationBackend backend : backends) {
            try {
                removed += backend.cleanup(context, conversationId);
            } catch (RuntimeException e) {
                log.warn("Confirmation backend {} failed on cleanup [conversation={}]: {}",
                        backend.name(), conversationId, e.getMessage());
            }
        }
        log.info("Cleaned up {} pending confirmation(s) for conversation {}", removed, conversationId);
        return removed;
    }
}
