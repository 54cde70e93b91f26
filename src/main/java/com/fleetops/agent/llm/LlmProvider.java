package com.fleetops.agent.llm;

import com.fleetops.agent.model.Message;
import com.fleetops.agent.tool.ToolDefinition;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Contract every LLM vendor adapter implements.
 * Vendor wire formats stay inside the adapter; the agent only sees {@link LlmStreamEvent}s.
 */
public interface LlmProvider {

    /**
     * Stream a response for the full conversation so far.
     *
     * @param messages     conversation history (user, assistant and tool messages)
     * @param tools        tool definitions the model may invoke
     * @param systemPrompt system instructions for this turn
     * @return a stream ending in DONE or ERROR; a provider may also signal failure
     *         by erroring the Flux, preferably with {@link LlmProviderException}
     */
    Flux<LlmStreamEvent> chat(List<Message> messages,
                              List<ToolDefinition> tools,
                              String systemPrompt,
                              double temperature,
                              int maxTokens);

    Embedding embed(String text);
}
