package com.fleetops.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Pool for post-response side effects: fact extraction and pattern learning.
 *
 * Kept apart from the request threads and the streaming workers so a burst of
 * extraction calls never delays a chat. When the queue is full the task is
 * dropped with a warning; side effects are best-effort.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "sideEffectExecutor")
    public Executor sideEffectExecutor(AgentProperties properties) {
        AgentProperties.SideEffects settings = properties.getSideEffects();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("side-effect-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Side-effect queue full ({} queued), dropping task", pool.getQueue().size()));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
