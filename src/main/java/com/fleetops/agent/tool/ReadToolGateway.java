package com.fleetops.agent.tool;

import com.fleetops.agent.model.ToolResults;
import com.fleetops.agent.model.UserContext;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Resilient access to the read tool executor.
 *
 * Reads are safe to repeat, so calls get retry plus circuit breaker (instance "readTools").
 * When retries are exhausted or the circuit is open the caller receives a recoverable
 * error result instead of an exception.
 */
@Component
@Slf4j
public class ReadToolGateway {

    static final String NOT_AVAILABLE = "Read operations not available";

    private final ObjectProvider<ReadToolExecutor> executorProvider;

    public ReadToolGateway(ObjectProvider<ReadToolExecutor> executorProvider) {
        this.executorProvider = executorProvider;
    }

    public boolean isAvailable() {
        return executorProvider.getIfAvailable() != null;
    }

    public List<ToolDefinition> listTools() {
        ReadToolExecutor executor = executorProvider.getIfAvailable();
        if (executor == null) {
            return List.of();
        }
        try {
            return executor.listTools();
        } catch (Exception e) {
            log.error("Failed to load read tools: {}", e.getMessage());
            return List.of();
        }
    }

    @Retry(name = "readTools", fallbackMethod = "callFallback")
    @CircuitBreaker(name = "readTools")
    public Map<String, Object> call(String toolName, Map<String, Object> arguments, UserContext context) {
        ReadToolExecutor executor = executorProvider.getIfAvailable();
        if (executor == null) {
            return ToolResults.error(NOT_AVAILABLE, false);
        }
        return ToolResults.data(executor.call(toolName, arguments, context));
    }

    public Map<String, Object> callFallback(String toolName, Map<String, Object> arguments,
                                            UserContext context, Exception ex) {
        log.error("Read tool [{}] failed after retries: {}", toolName, ex.getMessage());
        return ToolResults.error("Tool '" + toolName + "' failed: " + ex.getMessage(), true, "upstream");
    }
}
