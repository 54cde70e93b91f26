package com.fleetops.agent.api;

import com.fleetops.agent.core.ConversationOrchestrator;
import com.fleetops.agent.model.ChatEvent;
import com.fleetops.agent.model.ChatRequest;
import com.fleetops.agent.model.ConfirmRequest;
import com.fleetops.agent.model.UserContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Chat endpoints. Events are streamed as server-sent events, one ChatEvent per frame.
 *
 * POST /api/v1/agent/chat
 * POST /api/v1/agent/confirm
 * POST /api/v1/agent/conversations/{conversationId}/cancel
 * GET  /api/v1/agent/health
 *
 * Required headers: X-Tenant-Id, X-User-Id. Optional: X-Session-Id, used as the
 * correlation id of the returned events.
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final ConversationOrchestrator orchestrator;

    @PostMapping(value = "/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ChatEvent> chat(
            @Valid @RequestBody ChatRequest request,
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader("X-User-Id") String userId,
            @RequestHeader(value = "X-Session-Id", required = false) String sessionId) {

        log.info("Chat request [conversation={}, tenant={}, user={}]",
                request.getConversationId(), tenantId, userId);
        return orchestrator.chat(request.getMessage(), new UserContext(tenantId, userId, sessionId),
                request.getConversationId());
    }

    @PostMapping(value = "/confirm", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ChatEvent> confirm(
            @Valid @RequestBody ConfirmRequest request,
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader("X-User-Id") String userId,
            @RequestHeader(value = "X-Session-Id", required = false) String sessionId) {

        log.info("Confirm request [conversation={}, operation={}, confirmed={}, tenant={}]",
                request.getConversationId(), request.getOperationId(), request.getConfirmed(), tenantId);
        return orchestrator.confirmOperation(request.getConversationId(), request.getConfirmed(),
                new UserContext(tenantId, userId, sessionId), request.getOperationId());
    }

    @PostMapping("/conversations/{conversationId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(
            @PathVariable String conversationId,
            @RequestHeader("X-Tenant-Id") String tenantId,
            @RequestHeader("X-User-Id") String userId) {

        int removed = orchestrator.cancelChat(conversationId, UserContext.of(tenantId, userId));
        return ResponseEntity.ok(Map.of(
                "conversation_id", conversationId,
                "cancelled_confirmations", removed));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
