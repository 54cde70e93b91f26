package com.fleetops.agent.confirmation;

import com.fleetops.agent.model.UserContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local confirmations. Lost on restart.
 * Insertion order of each conversation's map is creation order.
 */
@Slf4j
public class InMemoryConfirmationBackend implements ConfirmationBackend {

    private record Entry(PendingConfirmation confirmation, Instant expiresAt) {
    }

    private final Clock clock;
    private final Map<String, LinkedHashMap<String, Entry>> byConversation = new HashMap<>();

    public InMemoryConfirmationBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public synchronized void store(UserContext context, PendingConfirmation confirmation, Duration ttl) {
        byConversation
                .computeIfAbsent(scope(context, confirmation.getConversationId()), k -> new LinkedHashMap<>())
                .put(confirmation.getOperationId(), new Entry(confirmation, clock.instant().plus(ttl)));
        log.debug("Stored confirmation in memory: {}:{}", confirmation.getConversationId(), confirmation.getOperationId());
    }

    @Override
    public synchronized Optional<PendingConfirmation> getAndDelete(UserContext context, String conversationId,
                                                                   String operationId) {
        String scope = scope(context, conversationId);
        LinkedHashMap<String, Entry> entries = liveEntries(scope);
        if (entries == null) {
            return Optional.empty();
        }

        Entry entry;
        if (operationId != null) {
            entry = entries.remove(operationId);
        } else {
            Iterator<Entry> it = entries.values().iterator();
            entry = it.hasNext() ? it.next() : null;
            if (entry != null) {
                it.remove();
            }
        }

        if (entries.isEmpty()) {
            byConversation.remove(scope);
        }
        return Optional.ofNullable(entry).map(Entry::confirmation);
    }

    @Override
    public synchronized List<PendingConfirmation> list(UserContext context, String conversationId) {
        LinkedHashMap<String, Entry> entries = liveEntries(scope(context, conversationId));
        if (entries == null) {
            return List.of();
        }
        return entries.values().stream().map(Entry::confirmation).toList();
    }

    @Override
    public synchronized int cleanup(UserContext context, String conversationId) {
        String scope = scope(context, conversationId);
        LinkedHashMap<String, Entry> live = liveEntries(scope);
        if (live == null) {
            return 0;
        }
        byConversation.remove(scope);
        return live.size();
    }

    /** Drops expired entries of one scope; null when nothing live is left. */
    private LinkedHashMap<String, Entry> liveEntries(String scope) {
        LinkedHashMap<String, Entry> entries = byConversation.get(scope);
        if (entries == null) {
            return null;
        }
        Instant now = clock.instant();
        entries.values().removeIf(e -> !e.expiresAt().isAfter(now));
        if (entries.isEmpty()) {
            byConversation.remove(scope);
            return null;
        }
        return entries;
    }

    private static String scope(UserContext context, String conversationId) {
        return context.tenantId() + ":" + context.userId() + ":" + conversationId;
    }
}
