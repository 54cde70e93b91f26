package com.fleetops.agent.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetops.agent.config.AgentProperties;
import com.fleetops.agent.confirmation.ConfirmationStore;
import com.fleetops.agent.confirmation.InMemoryConfirmationBackend;
import com.fleetops.agent.confirmation.PendingConfirmation;
import com.fleetops.agent.llm.LlmProvider;
import com.fleetops.agent.llm.LlmProviderException;
import com.fleetops.agent.llm.LlmStreamEvent;
import com.fleetops.agent.memory.InMemoryConversationStore;
import com.fleetops.agent.memory.MemoryService;
import com.fleetops.agent.model.ChatEvent;
import com.fleetops.agent.model.ChatEventType;
import com.fleetops.agent.model.ErrorKind;
import com.fleetops.agent.model.Message;
import com.fleetops.agent.model.ToolCall;
import com.fleetops.agent.model.ToolResults;
import com.fleetops.agent.model.UserContext;
import com.fleetops.agent.pattern.PatternService;
import com.fleetops.agent.security.CotRedactor;
import com.fleetops.agent.tool.ToolRegistry;
import com.fleetops.agent.write.WriteOperation;
import com.fleetops.agent.write.WriteOperationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationOrchestratorTest {

    private static final UserContext CTX = new UserContext("tenant-a", "alice", "session-1");
    private static final Duration WAIT = Duration.ofSeconds(5);

    @Mock LlmProvider llmProvider;
    @Mock ToolRegistry toolRegistry;
    @Mock WriteOperationEngine writeEngine;
    @Mock MemoryService memoryService;
    @Mock PatternService patternService;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-10T10:00:00Z"), ZoneOffset.UTC);
    private ConfirmationStore confirmationStore;
    private InMemoryConversationStore conversationStore;
    private ConversationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        confirmationStore = new ConfirmationStore(
                List.of(new InMemoryConfirmationBackend(clock)), Duration.ofHours(1), clock);
        conversationStore = new InMemoryConversationStore(50, clock);
        orchestrator = new ConversationOrchestrator(llmProvider, toolRegistry, writeEngine,
                confirmationStore, conversationStore, memoryService, patternService,
                new SystemPromptBuilder(properties), new CotRedactor(), new ObjectMapper(), properties);
    }

    @SafeVarargs
    private void llmReplies(Flux<LlmStreamEvent> first, Flux<LlmStreamEvent>... rest) {
        when(llmProvider.chat(anyList(), anyList(), anyString(), anyDouble(), anyInt())).thenReturn(first, rest);
    }

    private List<ChatEvent> chat(String message, String conversationId) {
        return orchestrator.chat(message, CTX, conversationId).collectList().block(WAIT);
    }

    private static List<ChatEventType> types(List<ChatEvent> events) {
        return events.stream().map(ChatEvent::getType).toList();
    }

    private static void assertGaplessSequence(List<ChatEvent> events) {
        assertThat(events).extracting(ChatEvent::getSequence)
                .containsExactlyElementsOf(LongStream.rangeClosed(1, events.size()).boxed().toList());
    }

    private static Flux<LlmStreamEvent> toolCallTurn(String id, String name, String argumentsJson) {
        return Flux.just(
                LlmStreamEvent.toolCallStart(id, name),
                LlmStreamEvent.toolCallDelta(id, argumentsJson),
                LlmStreamEvent.toolCallEnd(id, null),
                LlmStreamEvent.done());
    }

    /** Runs a chat that stops on a confirmation for op-1 and returns its conversation id. */
    private String suspendOnArchive() {
        llmReplies(toolCallTurn("call-1", "archive_devices", "{\"device_ids\":[\"d1\",\"d2\"]}"));
        when(toolRegistry.executeToolCall(any(ToolCall.class), eq(CTX)))
                .thenReturn(ToolResults.confirmationRequired("op-1", "Archive 2 device(s)?", "high"));
        List<ChatEvent> events = chat("archive d1 and d2", "conv-1");
        assertThat(types(events)).containsExactly(
                ChatEventType.TOOL_CALL_START, ChatEventType.TOOL_CALL_END, ChatEventType.CONFIRMATION_REQUIRED);
        return "conv-1";
    }

    @Test
    void chat_plainAnswer_streamsTextThenDone() {
        llmReplies(Flux.just(LlmStreamEvent.text("Hello "), LlmStreamEvent.text("there"), LlmStreamEvent.done()));

        List<ChatEvent> events = chat("hi", null);

        assertThat(types(events)).containsExactly(
                ChatEventType.TEXT_DELTA, ChatEventType.TEXT_DELTA, ChatEventType.DONE);
        assertGaplessSequence(events);
        assertThat(events).allMatch(e -> "session-1".equals(e.getCorrelationId()));

        ChatEvent done = events.get(2);
        assertThat(done.getMetadata()).containsEntry("turns", 1).containsKey("conversation_id");
        String conversationId = (String) done.getMetadata().get("conversation_id");
        assertThat(conversationStore.history(CTX, conversationId))
                .extracting(Message::getRole)
                .containsExactly(Message.Role.user, Message.Role.assistant);
        verify(memoryService).extractAndStore(eq("Hello there"), eq(conversationId), anyString(), eq(CTX));
    }

    @Test
    void chat_readToolThenAnswer_feedsResultBackToLlm() {
        llmReplies(toolCallTurn("call-1", "list_devices", "{\"limit\":5}"),
                Flux.just(LlmStreamEvent.text("You have 2 devices."), LlmStreamEvent.done()));
        when(toolRegistry.executeToolCall(any(ToolCall.class), eq(CTX)))
                .thenReturn(ToolResults.data(List.of("d1", "d2")));

        List<ChatEvent> events = chat("how many devices?", "conv-1");

        assertThat(types(events)).containsExactly(
                ChatEventType.TOOL_CALL_START, ChatEventType.TOOL_CALL_END, ChatEventType.TOOL_RESULT,
                ChatEventType.TEXT_DELTA, ChatEventType.DONE);
        assertGaplessSequence(events);
        assertThat(events.get(1).getToolArguments()).containsEntry("limit", 5);
        assertThat(events.get(4).getMetadata()).containsEntry("turns", 2);

        assertThat(conversationStore.history(CTX, "conv-1"))
                .extracting(Message::getRole)
                .containsExactly(Message.Role.user, Message.Role.assistant, Message.Role.tool, Message.Role.assistant);
        verify(patternService).learnToolSuccess(eq("tenant-a"), eq("how many devices?"), eq("list_devices"),
                anyMap(), eq(List.of("d1", "d2")));
    }

    @Test
    void chat_toolError_teachesErrorRecovery() {
        llmReplies(toolCallTurn("call-1", "list_devices", "{}"),
                Flux.just(LlmStreamEvent.text("Sorry."), LlmStreamEvent.done()));
        when(toolRegistry.executeToolCall(any(ToolCall.class), eq(CTX)))
                .thenReturn(ToolResults.error("upstream 503", true));

        chat("list devices", "conv-1");

        verify(patternService).learnErrorRecovery("tenant-a", "list_devices", "upstream 503");
        verify(patternService, never()).learnToolSuccess(anyString(), anyString(), anyString(), anyMap(), any());
    }

    @Test
    void chat_confirmationRequired_suspendsWithoutDone() {
        suspendOnArchive();

        List<PendingConfirmation> pending = confirmationStore.list(CTX, "conv-1");
        assertThat(pending).hasSize(1);
        assertThat(pending.get(0).getOperationId()).isEqualTo("op-1");
        assertThat(pending.get(0).getToolCall().getName()).isEqualTo("archive_devices");
        verify(llmProvider, times(1)).chat(anyList(), anyList(), anyString(), anyDouble(), anyInt());
        verifyNoInteractions(writeEngine);
    }

    @Test
    void chat_confirmationEvent_carriesOperationAndRisk() {
        llmReplies(toolCallTurn("call-1", "archive_devices", "{\"device_ids\":[\"d1\"]}"));
        when(toolRegistry.executeToolCall(any(ToolCall.class), eq(CTX)))
                .thenReturn(ToolResults.confirmationRequired("op-7", "Archive 1 device(s)?", "high"));

        ChatEvent confirmation = chat("archive d1", "conv-1").get(2);

        assertThat(confirmation.getContent()).isEqualTo("Archive 1 device(s)?");
        assertThat(confirmation.getMetadata())
                .containsEntry("operation_id", "op-7")
                .containsEntry("risk_level", "high");
        assertThat(confirmation.getSequence()).isEqualTo(3);
    }

    @Test
    void confirmOperation_approved_executesAndRestartsSequence() {
        String conversationId = suspendOnArchive();
        when(writeEngine.confirm(eq("op-1"), any(ToolCall.class), eq(CTX))).thenReturn(WriteOperation.builder()
                .id("op-1").executed(true).confirmed(true).result(Map.of("archived", 2)).build());

        List<ChatEvent> events = orchestrator.confirmOperation(conversationId, true, CTX, null)
                .collectList().block(WAIT);

        assertThat(types(events)).containsExactly(
                ChatEventType.CONFIRMATION_RESPONSE, ChatEventType.TOOL_RESULT,
                ChatEventType.TEXT_DELTA, ChatEventType.DONE);
        assertGaplessSequence(events);
        assertThat(events.get(0).getMetadata()).containsEntry("confirmed", true).containsEntry("operation_id", "op-1");
        assertThat(events.get(1).getContent()).startsWith("Operation completed successfully:");
        assertThat(events.get(2).getContent()).isEqualTo("Done! The operation completed successfully.");
        assertThat(confirmationStore.hasPending(CTX, conversationId)).isFalse();
        verify(patternService).learnToolSuccess(eq("tenant-a"), anyString(), eq("archive_devices"), anyMap(), any());
    }

    @Test
    void confirmOperation_secondApproval_findsNothingPending() {
        String conversationId = suspendOnArchive();
        when(writeEngine.confirm(eq("op-1"), any(ToolCall.class), eq(CTX))).thenReturn(WriteOperation.builder()
                .id("op-1").executed(true).result("ok").build());

        orchestrator.confirmOperation(conversationId, true, CTX, "op-1").collectList().block(WAIT);
        List<ChatEvent> again = orchestrator.confirmOperation(conversationId, true, CTX, "op-1")
                .collectList().block(WAIT);

        assertThat(again).hasSize(1);
        assertThat(again.get(0).getType()).isEqualTo(ChatEventType.ERROR);
        assertThat(again.get(0).getContent()).isEqualTo("No pending operation to confirm");
        assertThat(again.get(0).getErrorKind()).isEqualTo(ErrorKind.RECOVERABLE);
        verify(writeEngine, times(1)).confirm(anyString(), any(ToolCall.class), any());
    }

    @Test
    void confirmOperation_declined_cancelsWithoutUpstreamCall() {
        String conversationId = suspendOnArchive();

        List<ChatEvent> events = orchestrator.confirmOperation(conversationId, false, CTX, null)
                .collectList().block(WAIT);

        assertThat(types(events)).containsExactly(
                ChatEventType.CONFIRMATION_RESPONSE, ChatEventType.TEXT_DELTA, ChatEventType.DONE);
        assertThat(events.get(1).getContent()).isEqualTo("Operation cancelled.");
        verify(writeEngine).cancel("op-1");
        verify(writeEngine, never()).confirm(anyString(), any(ToolCall.class), any());
    }

    @Test
    void confirmOperation_upstreamFailure_reportsRecoverableError() {
        String conversationId = suspendOnArchive();
        when(writeEngine.confirm(eq("op-1"), any(ToolCall.class), eq(CTX))).thenReturn(WriteOperation.builder()
                .id("op-1").executed(true).error("device d2 not found").build());

        List<ChatEvent> events = orchestrator.confirmOperation(conversationId, true, CTX, null)
                .collectList().block(WAIT);

        assertThat(types(events)).containsExactly(
                ChatEventType.CONFIRMATION_RESPONSE, ChatEventType.ERROR, ChatEventType.DONE);
        assertThat(events.get(1).getContent()).isEqualTo("Operation failed: device d2 not found");
        verify(patternService).learnErrorRecovery("tenant-a", "archive_devices", "device d2 not found");
    }

    @Test
    void confirmOperation_engineThrows_reportsFailureThenDone() {
        String conversationId = suspendOnArchive();
        when(writeEngine.confirm(eq("op-1"), any(ToolCall.class), eq(CTX)))
                .thenThrow(new IllegalStateException("quota store down"));

        List<ChatEvent> events = orchestrator.confirmOperation(conversationId, true, CTX, null)
                .collectList().block(WAIT);

        assertThat(types(events)).containsExactly(
                ChatEventType.CONFIRMATION_RESPONSE, ChatEventType.ERROR, ChatEventType.DONE);
        assertThat(events.get(1).getContent()).isEqualTo("Failed to execute operation: quota store down");
    }

    @Test
    void cancelChat_dropsPendingConfirmations() {
        String conversationId = suspendOnArchive();

        assertThat(orchestrator.cancelChat(conversationId, CTX)).isEqualTo(1);
        verify(writeEngine).cancel("op-1");

        List<ChatEvent> events = orchestrator.confirmOperation(conversationId, true, CTX, null)
                .collectList().block(WAIT);
        assertThat(events).extracting(ChatEvent::getType).containsExactly(ChatEventType.ERROR);
    }

    @Test
    void chat_thinkingIsRedactedBeforeStreamingAndStorage() {
        llmReplies(Flux.just(
                LlmStreamEvent.thinking("Use api_key=sk-live-123 against 10.0.0.12"),
                LlmStreamEvent.text("Done."),
                LlmStreamEvent.done()));

        List<ChatEvent> events = chat("check", "conv-1");

        ChatEvent thinking = events.get(0);
        assertThat(thinking.getType()).isEqualTo(ChatEventType.THINKING_DELTA);
        assertThat(thinking.getContent()).doesNotContain("sk-live-123").doesNotContain("10.0.0.12");

        Message assistant = conversationStore.history(CTX, "conv-1").get(1);
        assertThat(assistant.getThinkingSummary())
                .contains("api_key=[REDACTED]")
                .contains("[IP_ADDRESS]")
                .doesNotContain("sk-live-123");
    }

    @Test
    void chat_thinkingSummary_isCappedAfterRedaction() {
        llmReplies(Flux.just(LlmStreamEvent.thinking("x ".repeat(1000)), LlmStreamEvent.done()));

        chat("think hard", "conv-1");

        Message assistant = conversationStore.history(CTX, "conv-1").get(1);
        assertThat(assistant.getThinkingSummary()).hasSize(500);
    }

    @Test
    void chat_redactionFailure_neverExposesRawThinking() {
        CotRedactor failingRedactor = mock(CotRedactor.class);
        when(failingRedactor.redactFragment(anyString())).thenThrow(new IllegalStateException("regex blew up"));
        when(failingRedactor.redact(anyString(), anyInt())).thenThrow(new IllegalStateException("regex blew up"));
        AgentProperties properties = new AgentProperties();
        ConversationOrchestrator guarded = new ConversationOrchestrator(llmProvider, toolRegistry, writeEngine,
                confirmationStore, conversationStore, memoryService, patternService,
                new SystemPromptBuilder(properties), failingRedactor, new ObjectMapper(), properties);
        llmReplies(Flux.just(
                LlmStreamEvent.thinking("Use api_key=sk-live-123 against 10.0.0.12"),
                LlmStreamEvent.text("Done."),
                LlmStreamEvent.done()));

        List<ChatEvent> events = guarded.chat("check", CTX, "conv-1").collectList().block(WAIT);

        ChatEvent thinking = events.get(0);
        assertThat(thinking.getType()).isEqualTo(ChatEventType.THINKING_DELTA);
        assertThat(thinking.getContent()).isEmpty();
        assertThat(types(events)).endsWith(ChatEventType.DONE);

        Message assistant = conversationStore.history(CTX, "conv-1").get(1);
        assertThat(assistant.getThinkingSummary())
                .isEqualTo(ConversationOrchestrator.REDACTION_FAILED_PLACEHOLDER)
                .doesNotContain("sk-live-123");
    }

    @Test
    void chat_streamTimeout_emitsTimeoutErrorWithoutDone() {
        llmReplies(Flux.error(new TimeoutException("read timed out")));

        List<ChatEvent> events = chat("hi", "conv-1");

        assertThat(events).hasSize(1);
        assertThat(events.get(0).getType()).isEqualTo(ChatEventType.ERROR);
        assertThat(events.get(0).getErrorKind()).isEqualTo(ErrorKind.TIMEOUT);
        verify(memoryService, never()).extractAndStore(any(), any(), any(), any());
    }

    @Test
    void chat_providerRateLimit_keepsItsKind() {
        llmReplies(Flux.concat(
                Flux.just(LlmStreamEvent.text("par")),
                Flux.<LlmStreamEvent>error(new LlmProviderException("429", ErrorKind.RATE_LIMIT))));

        List<ChatEvent> events = chat("hi", "conv-1");

        assertThat(types(events)).containsExactly(ChatEventType.TEXT_DELTA, ChatEventType.ERROR);
        assertThat(events.get(1).getErrorKind()).isEqualTo(ErrorKind.RATE_LIMIT);
        assertGaplessSequence(events);
    }

    @Test
    void chat_inBandErrorEvent_isForwarded() {
        llmReplies(Flux.just(LlmStreamEvent.error("context too long", ErrorKind.FATAL)));

        List<ChatEvent> events = chat("hi", "conv-1");

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.getType()).isEqualTo(ChatEventType.ERROR);
            assertThat(e.getContent()).isEqualTo("context too long");
            assertThat(e.getErrorKind()).isEqualTo(ErrorKind.FATAL);
        });
    }

    @Test
    void chat_unexpectedFailure_isFatalErrorEvent() {
        when(toolRegistry.getAllTools()).thenThrow(new IllegalStateException("catalog exploded"));

        List<ChatEvent> events = chat("hi", "conv-1");

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.getErrorKind()).isEqualTo(ErrorKind.FATAL);
            assertThat(e.getContent()).isEqualTo("An error occurred: catalog exploded");
        });
    }

    @Test
    void chat_executesAtMostFiveToolCallsPerTurn() {
        Flux<LlmStreamEvent> sevenCalls = Flux.range(1, 7)
                .flatMapSequential(i -> Flux.just(
                        LlmStreamEvent.toolCallStart("call-" + i, "list_devices"),
                        LlmStreamEvent.toolCallEnd("call-" + i, Map.of())))
                .concatWith(Flux.just(LlmStreamEvent.done()));
        llmReplies(sevenCalls, Flux.just(LlmStreamEvent.text("ok"), LlmStreamEvent.done()));
        when(toolRegistry.executeToolCall(any(ToolCall.class), eq(CTX))).thenReturn(ToolResults.data("x"));

        chat("list everything", "conv-1");

        verify(toolRegistry, times(5)).executeToolCall(any(ToolCall.class), eq(CTX));
    }

    @Test
    void chat_stopsAfterMaxTurns() {
        when(llmProvider.chat(anyList(), anyList(), anyString(), anyDouble(), anyInt()))
                .thenAnswer(inv -> toolCallTurn("call-1", "list_devices", "{}"));
        when(toolRegistry.executeToolCall(any(ToolCall.class), eq(CTX))).thenReturn(ToolResults.data("x"));

        List<ChatEvent> events = chat("loop forever", "conv-1");

        ChatEvent last = events.get(events.size() - 1);
        assertThat(last.getType()).isEqualTo(ChatEventType.DONE);
        assertThat(last.getMetadata()).containsEntry("turns", 10);
        verify(llmProvider, times(10)).chat(anyList(), anyList(), anyString(), anyDouble(), anyInt());
        assertGaplessSequence(events);
    }

    @Test
    void chat_toolResultPreview_isTruncated() {
        llmReplies(toolCallTurn("call-1", "list_devices", "{}"),
                Flux.just(LlmStreamEvent.text("ok"), LlmStreamEvent.done()));
        when(toolRegistry.executeToolCall(any(ToolCall.class), eq(CTX)))
                .thenReturn(ToolResults.data("y".repeat(5000)));

        List<ChatEvent> events = chat("big", "conv-1");

        assertThat(events.get(2).getType()).isEqualTo(ChatEventType.TOOL_RESULT);
        assertThat(events.get(2).getContent()).hasSize(1000);
    }

    @Test
    void classify_mapsErrorsToKinds() {
        assertThat(ConversationOrchestrator.classify(new TimeoutException())).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(ConversationOrchestrator.classify(new LlmProviderException("x", ErrorKind.RATE_LIMIT)))
                .isEqualTo(ErrorKind.RATE_LIMIT);
        assertThat(ConversationOrchestrator.classify(new IllegalStateException())).isEqualTo(ErrorKind.FATAL);
    }
}
