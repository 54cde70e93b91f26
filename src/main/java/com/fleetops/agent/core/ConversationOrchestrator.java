package com.fleetops.agent.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetops.agent.config.AgentProperties;
import com.fleetops.agent.confirmation.ConfirmationStore;
import com.fleetops.agent.confirmation.PendingConfirmation;
import com.fleetops.agent.llm.LlmProvider;
import com.fleetops.agent.llm.LlmProviderException;
import com.fleetops.agent.llm.LlmStreamEvent;
import com.fleetops.agent.memory.Conversation;
import com.fleetops.agent.memory.ConversationStore;
import com.fleetops.agent.memory.MemoryService;
import com.fleetops.agent.model.ChatEvent;
import com.fleetops.agent.model.ErrorKind;
import com.fleetops.agent.model.Message;
import com.fleetops.agent.model.ToolCall;
import com.fleetops.agent.model.ToolResults;
import com.fleetops.agent.model.UserContext;
import com.fleetops.agent.pattern.PatternService;
import com.fleetops.agent.security.CotRedactor;
import com.fleetops.agent.security.RedactionResult;
import com.fleetops.agent.tool.ToolDefinition;
import com.fleetops.agent.tool.ToolRegistry;
import com.fleetops.agent.write.WriteOperation;
import com.fleetops.agent.write.WriteOperationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * The per-conversation turn loop.
 *
 * Per chat() run:
 * 1. Get or create the conversation, append the user message
 * 2. Recall memories and similar patterns into the system prompt
 * 3. Turn loop: stream the LLM, assemble tool calls, execute them in order
 * 4. A tool result asking for confirmation stores a pending confirmation and ends the run
 * 5. Async: extract facts from the final answer, learn from tool outcomes
 *
 * Each call returns a Flux that runs the loop on a bounded-elastic worker. Events of
 * one call are numbered 1, 2, 3, ... in emission order. Nothing escapes the stream:
 * every failure ends in an error event.
 */
@Service
@Slf4j
public class ConversationOrchestrator {

    static final String REDACTION_FAILED_PLACEHOLDER = "[CoT redacted due to processing error]";
    static final String NO_PENDING_OPERATION = "No pending operation to confirm";

    private final LlmProvider llmProvider;
    private final ToolRegistry toolRegistry;
    private final WriteOperationEngine writeEngine;
    private final ConfirmationStore confirmationStore;
    private final ConversationStore conversationStore;
    private final MemoryService memoryService;
    private final PatternService patternService;
    private final SystemPromptBuilder promptBuilder;
    private final CotRedactor redactor;
    private final ObjectMapper objectMapper;
    private final AgentProperties.Orchestrator settings;

    public ConversationOrchestrator(LlmProvider llmProvider,
                                    ToolRegistry toolRegistry,
                                    WriteOperationEngine writeEngine,
                                    ConfirmationStore confirmationStore,
                                    ConversationStore conversationStore,
                                    MemoryService memoryService,
                                    PatternService patternService,
                                    SystemPromptBuilder promptBuilder,
                                    CotRedactor redactor,
                                    ObjectMapper objectMapper,
                                    AgentProperties properties) {
        this.llmProvider = llmProvider;
        this.toolRegistry = toolRegistry;
        this.writeEngine = writeEngine;
        this.confirmationStore = confirmationStore;
        this.conversationStore = conversationStore;
        this.memoryService = memoryService;
        this.patternService = patternService;
        this.promptBuilder = promptBuilder;
        this.redactor = redactor;
        this.objectMapper = objectMapper;
        this.settings = properties.getOrchestrator();
    }

    /**
     * @param conversationId existing conversation, or null to start a new one
     */
    public Flux<ChatEvent> chat(String userMessage, UserContext context, String conversationId) {
        return Flux.<ChatEvent>create(sink -> {
                    ChatEventEmitter emitter = new ChatEventEmitter(sink, correlationId(context));
                    try {
                        runChat(userMessage, context, conversationId, emitter);
                    } finally {
                        emitter.complete();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Resumes a conversation suspended on a confirmation.
     *
     * @param operationId the operation to answer; null answers the earliest pending one
     */
    public Flux<ChatEvent> confirmOperation(String conversationId, boolean confirmed,
                                            UserContext context, String operationId) {
        return Flux.<ChatEvent>create(sink -> {
                    ChatEventEmitter emitter = new ChatEventEmitter(sink, correlationId(context));
                    try {
                        runConfirmation(conversationId, confirmed, context, operationId, emitter);
                    } finally {
                        emitter.complete();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Drops every pending confirmation of the conversation so a stale approval
     * can never run a mutation afterwards.
     *
     * @return number of pending confirmations removed
     */
    public int cancelChat(String conversationId, UserContext context) {
        confirmationStore.list(context, conversationId)
                .forEach(pending -> writeEngine.cancel(pending.getOperationId()));
        int removed = confirmationStore.cleanupConversation(context, conversationId);
        log.info("Cancelled chat [conversation={}, tenant={}, pendingRemoved={}]",
                conversationId, context.tenantId(), removed);
        return removed;
    }

    private void runChat(String userMessage, UserContext context, String conversationId, ChatEventEmitter emitter) {
        TurnContext turn = null;
        try {
            Conversation conversation = conversationStore.getOrCreate(context, conversationId);
            log.info("Chat started [conversation={}, tenant={}, user={}]",
                    conversation.getId(), context.tenantId(), context.userId());

            List<Message> messages = new ArrayList<>(conversationStore.history(context, conversation.getId()));
            Message userMsg = Message.builder()
                    .conversationId(conversation.getId())
                    .role(Message.Role.user)
                    .content(userMessage)
                    .build();
            conversationStore.append(context, conversation.getId(), List.of(userMsg));
            messages.add(userMsg);

            turn = TurnContext.builder()
                    .conversationId(conversation.getId())
                    .userContext(context)
                    .userMessage(userMessage)
                    .messages(messages)
                    .systemPrompt(promptBuilder.build(
                            memoryService.recall(userMessage, context),
                            patternService.findSimilar(userMessage, context)))
                    .build();

            List<ToolDefinition> tools = toolRegistry.getAllTools();
            boolean answered = false;

            while (turn.getTurn() < settings.getMaxTurns()) {
                turn.setTurn(turn.getTurn() + 1);
                turn.transition(TurnState.AWAITING_LLM);

                StreamedTurn streamed = streamTurn(turn, tools, emitter);
                if (streamed == null) {
                    turn.transition(TurnState.ERROR);
                    return;
                }
                if (emitter.isCancelled()) {
                    log.info("Subscriber cancelled [conversation={}]", turn.getConversationId());
                    return;
                }

                Message assistant = Message.builder()
                        .conversationId(turn.getConversationId())
                        .role(Message.Role.assistant)
                        .content(streamed.text())
                        .thinkingSummary(streamed.thinkingSummary())
                        .toolCalls(streamed.toolCalls().isEmpty() ? null : streamed.toolCalls())
                        .build();
                conversationStore.append(context, turn.getConversationId(), List.of(assistant));
                turn.getMessages().add(assistant);
                turn.setLastResponseText(streamed.text());
                turn.setLastAssistantMessageId(assistant.getId());

                if (streamed.toolCalls().isEmpty()) {
                    answered = true;
                    break;
                }

                turn.transition(TurnState.EXECUTING_TOOLS);
                if (executeToolCalls(turn, streamed.toolCalls(), emitter)) {
                    turn.transition(TurnState.AWAITING_CONFIRMATION);
                    return;
                }
                turn.transition(TurnState.AWAITING_LLM);
            }

            if (!answered) {
                log.warn("Hit max turns ({}) [conversation={}]", settings.getMaxTurns(), turn.getConversationId());
            }
            turn.transition(TurnState.DONE);

            String finalText = turn.getLastResponseText();
            if (finalText != null && !finalText.isBlank()) {
                memoryService.extractAndStore(finalText, turn.getConversationId(),
                        turn.getLastAssistantMessageId(), context);
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("conversation_id", turn.getConversationId());
            metadata.put("turns", turn.getTurn());
            emitter.done(metadata);

            log.info("Chat complete [conversation={}, turns={}, events={}]",
                    turn.getConversationId(), turn.getTurn(), emitter.lastSequence());

        } catch (Exception e) {
            log.error("Chat failed [conversation={}]",
                    turn != null ? turn.getConversationId() : conversationId, e);
            if (turn != null) {
                turn.transition(TurnState.ERROR);
            }
            emitter.error("An error occurred: " + e.getMessage(), ErrorKind.FATAL);
        }
    }

    private record StreamedTurn(String text, String thinkingSummary, List<ToolCall> toolCalls) {
    }

    /**
     * Consumes one LLM response. Returns null when the stream failed; the error
     * event has been emitted by then.
     */
    private StreamedTurn streamTurn(TurnContext turn, List<ToolDefinition> tools, ChatEventEmitter emitter) {
        StringBuilder text = new StringBuilder();
        StringBuilder thinking = new StringBuilder();
        ToolCallAssembler assembler = new ToolCallAssembler(objectMapper);

        Flux<LlmStreamEvent> events = llmProvider.chat(turn.getMessages(), tools, turn.getSystemPrompt(),
                settings.getTemperature(), settings.getMaxTokens());
        turn.transition(TurnState.STREAMING);

        try (Stream<LlmStreamEvent> stream = events.toStream()) {
            Iterator<LlmStreamEvent> it = stream.iterator();
            while (it.hasNext() && !emitter.isCancelled()) {
                LlmStreamEvent event = it.next();
                if (event == null || event.getType() == null) {
                    continue;
                }
                switch (event.getType()) {
                    case TEXT_DELTA -> {
                        String content = event.getContent() != null ? event.getContent() : "";
                        text.append(content);
                        emitter.text(content);
                    }
                    case THINKING_DELTA -> {
                        String raw = event.getContent() != null ? event.getContent() : "";
                        thinking.append(raw);
                        emitter.thinking(redactFragment(raw));
                    }
                    case TOOL_CALL_START -> {
                        String id = assembler.start(event.getToolCallId(), event.getToolName());
                        emitter.toolCallStart(id, event.getToolName());
                    }
                    case TOOL_CALL_DELTA -> assembler.appendArguments(event.getToolCallId(), event.getArgumentsDelta());
                    case TOOL_CALL_END -> {
                        ToolCall call = assembler.end(event.getToolCallId(), event.getArguments());
                        if (call != null) {
                            emitter.toolCallEnd(call);
                        }
                    }
                    case ERROR -> {
                        ErrorKind kind = event.getErrorKind() != null ? event.getErrorKind() : ErrorKind.FATAL;
                        log.warn("LLM stream error [conversation={}, kind={}]: {}",
                                turn.getConversationId(), kind, event.getContent());
                        emitter.error(event.getContent(), kind);
                        return null;
                    }
                    case DONE -> {
                        return finishTurn(turn, text, thinking, assembler);
                    }
                }
            }
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            ErrorKind kind = classify(cause);
            log.warn("LLM stream failed [conversation={}, kind={}]: {}",
                    turn.getConversationId(), kind, cause.getMessage());
            emitter.error(describe(cause, kind), kind);
            return null;
        }

        return finishTurn(turn, text, thinking, assembler);
    }

    private StreamedTurn finishTurn(TurnContext turn, StringBuilder text, StringBuilder thinking,
                                    ToolCallAssembler assembler) {
        if (assembler.hasOpenCalls()) {
            log.warn("Dropping {} unfinished tool call(s) [conversation={}]",
                    assembler.openCount(), turn.getConversationId());
        }
        return new StreamedTurn(text.toString(), summarizeThinking(thinking.toString()),
                new ArrayList<>(assembler.completed()));
    }

    /**
     * Runs the turn's tool calls in order, up to the per-turn cap.
     *
     * @return true when a call needs confirmation and the run must suspend
     */
    private boolean executeToolCalls(TurnContext turn, List<ToolCall> toolCalls, ChatEventEmitter emitter) {
        UserContext context = turn.getUserContext();
        int cap = settings.getMaxToolCallsPerTurn();
        if (toolCalls.size() > cap) {
            log.warn("LLM requested {} tool calls, executing the first {} [conversation={}]",
                    toolCalls.size(), cap, turn.getConversationId());
        }

        for (ToolCall call : toolCalls.subList(0, Math.min(cap, toolCalls.size()))) {
            Map<String, Object> result = toolRegistry.executeToolCall(call, context);

            if (ToolResults.isConfirmationRequired(result)) {
                String operationId = String.valueOf(result.get(ToolResults.OPERATION_ID));
                confirmationStore.store(context, PendingConfirmation.builder()
                        .operationId(operationId)
                        .conversationId(turn.getConversationId())
                        .toolCall(ToolCall.builder()
                                .id(call.getId())
                                .name(call.getName())
                                .arguments(call.getArguments())
                                .build())
                        .metadata(Map.of(ToolResults.RISK_LEVEL, result.get(ToolResults.RISK_LEVEL)))
                        .build());
                emitter.confirmationRequired(call, (String) result.get(ToolResults.MESSAGE),
                        operationId, (String) result.get(ToolResults.RISK_LEVEL));
                log.info("Awaiting confirmation [conversation={}, operation={}]",
                        turn.getConversationId(), operationId);
                return true;
            }

            emitter.toolResult(call.getId(), call.getName(), preview(result));

            if (ToolResults.isError(result)) {
                patternService.learnErrorRecovery(context.tenantId(), call.getName(),
                        String.valueOf(result.get(ToolResults.ERROR)));
            } else {
                patternService.learnToolSuccess(context.tenantId(), turn.getUserMessage(), call.getName(),
                        call.getArguments(), result.get(ToolResults.RESULT));
            }

            Message toolMessage = Message.builder()
                    .conversationId(turn.getConversationId())
                    .role(Message.Role.tool)
                    .toolCallId(call.getId())
                    .name(call.getName())
                    .content(toJson(result))
                    .build();
            conversationStore.append(context, turn.getConversationId(), List.of(toolMessage));
            turn.getMessages().add(toolMessage);
        }
        return false;
    }

    private void runConfirmation(String conversationId, boolean confirmed, UserContext context,
                                 String operationId, ChatEventEmitter emitter) {
        try {
            PendingConfirmation pending = confirmationStore
                    .getAndDelete(context, conversationId, operationId)
                    .orElse(null);
            if (pending == null) {
                log.info("No pending confirmation [conversation={}, operation={}]", conversationId, operationId);
                emitter.error(NO_PENDING_OPERATION, ErrorKind.RECOVERABLE);
                return;
            }

            String resolvedId = pending.getOperationId();
            emitter.confirmationResponse(confirmed, resolvedId);

            Map<String, Object> doneMetadata = new LinkedHashMap<>();
            doneMetadata.put("conversation_id", conversationId);
            doneMetadata.put("operation_id", resolvedId);

            if (!confirmed) {
                writeEngine.cancel(resolvedId);
                emitter.text("Operation cancelled.");
                emitter.done(doneMetadata);
                return;
            }

            ToolCall toolCall = pending.getToolCall();
            try {
                WriteOperation operation = writeEngine.confirm(resolvedId, toolCall, context);
                if (operation.getError() != null) {
                    emitter.error("Operation failed: " + operation.getError(), ErrorKind.RECOVERABLE);
                    patternService.learnErrorRecovery(context.tenantId(), toolCall.getName(), operation.getError());
                } else {
                    emitter.toolResult(toolCall.getId(), toolCall.getName(),
                            "Operation completed successfully: " + operation.getResult());
                    emitter.text("Done! The operation completed successfully.");
                    patternService.learnToolSuccess(context.tenantId(),
                            "User requested: " + toolCall.getName() + " with " + toolCall.getArguments(),
                            toolCall.getName(), toolCall.getArguments(), operation.getResult());
                }
                recordConfirmedResult(context, conversationId, toolCall, operation);
            } catch (Exception e) {
                log.error("Confirmed operation failed [conversation={}, operation={}]",
                        conversationId, resolvedId, e);
                emitter.error("Failed to execute operation: " + e.getMessage(), ErrorKind.RECOVERABLE);
            }

            emitter.done(doneMetadata);

        } catch (Exception e) {
            log.error("Confirmation handling failed [conversation={}]", conversationId, e);
            emitter.error("An error occurred: " + e.getMessage(), ErrorKind.FATAL);
        }
    }

    /** Appends the outcome as a tool message so the next turn's LLM call sees it. */
    private void recordConfirmedResult(UserContext context, String conversationId,
                                       ToolCall toolCall, WriteOperation operation) {
        Map<String, Object> result = operation.getError() != null
                ? ToolResults.error(operation.getError(), true, "upstream")
                : ToolResults.success(operation.getId(), operation.getResult());
        try {
            conversationStore.append(context, conversationId, List.of(Message.builder()
                    .conversationId(conversationId)
                    .role(Message.Role.tool)
                    .toolCallId(toolCall.getId())
                    .name(toolCall.getName())
                    .content(toJson(result))
                    .build()));
        } catch (Exception e) {
            log.warn("Failed to record confirmed result in history [conversation={}]: {}",
                    conversationId, e.getMessage());
        }
    }

    private String redactFragment(String raw) {
        try {
            return redactor.redactFragment(raw);
        } catch (Exception e) {
            log.warn("Thinking fragment redaction failed, withholding fragment: {}", e.getMessage());
            return "";
        }
    }

    /** Redact first, then truncate, so a cut can never expose half a secret. */
    private String summarizeThinking(String raw) {
        if (raw.isEmpty()) {
            return null;
        }
        try {
            RedactionResult result = redactor.redact(raw, Integer.MAX_VALUE);
            if (result.wasRedacted()) {
                log.info("Redacted {} sensitive item(s) from thinking before storage", result.redactionCount());
            }
            String summary = result.summary();
            int max = settings.getThinkingSummaryMaxLength();
            return summary.length() > max ? summary.substring(0, max) : summary;
        } catch (Exception e) {
            log.warn("Thinking redaction failed, storing placeholder: {}", e.getMessage());
            return REDACTION_FAILED_PLACEHOLDER;
        }
    }

    static ErrorKind classify(Throwable error) {
        if (error instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (error instanceof LlmProviderException providerError && providerError.getKind() != null) {
            return providerError.getKind();
        }
        return ErrorKind.FATAL;
    }

    private static String describe(Throwable error, ErrorKind kind) {
        return switch (kind) {
            case TIMEOUT -> "The model did not respond in time. Please try again.";
            case RATE_LIMIT -> "The model is rate limited right now. Please try again shortly.";
            default -> "LLM request failed: " + error.getMessage();
        };
    }

    private String preview(Map<String, Object> result) {
        String text = String.valueOf(result);
        int max = settings.getToolResultPreviewLength();
        return text.length() > max ? text.substring(0, max) : text;
    }

    private String toJson(Map<String, Object> result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return String.valueOf(result);
        }
    }

    private static String correlationId(UserContext context) {
        return context.sessionId() != null ? context.sessionId() : UUID.randomUUID().toString();
    }
}
