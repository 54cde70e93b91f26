package com.fleetops.agent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetops.agent.audit.AuditEntryRepository;
import com.fleetops.agent.audit.AuditLog;
import com.fleetops.agent.audit.LoggingAuditLog;
import com.fleetops.agent.audit.MongoAuditLog;
import com.fleetops.agent.confirmation.ConfirmationBackend;
import com.fleetops.agent.confirmation.ConfirmationStore;
import com.fleetops.agent.confirmation.InMemoryConfirmationBackend;
import com.fleetops.agent.confirmation.RedisConfirmationBackend;
import com.fleetops.agent.memory.ConversationStore;
import com.fleetops.agent.memory.InMemoryConversationStore;
import com.fleetops.agent.memory.RedisConversationStore;
import com.fleetops.agent.quota.InMemoryTenantQuotaTracker;
import com.fleetops.agent.quota.RedisTenantQuotaTracker;
import com.fleetops.agent.quota.TenantQuotaTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the storage strategy for each shared-state concern.
 *
 * agent.quota.store, agent.confirmation.store and agent.conversation.store take
 * "memory" (default) or "redis"; agent.audit.store takes "log" (default) or "mongo".
 */
@Configuration
@Slf4j
public class StoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Quota

    @Bean
    @ConditionalOnProperty(name = "agent.quota.store", havingValue = "redis")
    public TenantQuotaTracker redisTenantQuotaTracker(StringRedisTemplate redisTemplate,
                                                      AgentProperties properties, Clock clock) {
        log.info("Tenant quotas kept in Redis [dailyLimit={}]", properties.getQuota().getDailyOperationLimit());
        return new RedisTenantQuotaTracker(redisTemplate, properties.getQuota().getDailyOperationLimit(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "agent.quota.store", havingValue = "memory", matchIfMissing = true)
    public TenantQuotaTracker inMemoryTenantQuotaTracker(AgentProperties properties, Clock clock) {
        log.info("Tenant quotas kept in process memory [dailyLimit={}]",
                properties.getQuota().getDailyOperationLimit());
        return new InMemoryTenantQuotaTracker(properties.getQuota().getDailyOperationLimit(), clock);
    }

    // Confirmations

    /**
     * With Redis selected, the in-process backend stays behind it as a fallback for
     * when Redis is unreachable.
     */
    @Bean
    public ConfirmationStore confirmationStore(AgentProperties properties,
                                               ObjectProvider<StringRedisTemplate> redisTemplate,
                                               ObjectMapper objectMapper,
                                               Clock clock) {
        AgentProperties.Confirmation settings = properties.getConfirmation();
        List<ConfirmationBackend> backends = new ArrayList<>();
        if ("redis".equalsIgnoreCase(settings.getStore())) {
            backends.add(new RedisConfirmationBackend(redisTemplate.getObject(), objectMapper));
        }
        backends.add(new InMemoryConfirmationBackend(clock));
        log.info("Pending confirmations kept in {} [ttl={}s]",
                backends.stream().map(ConfirmationBackend::name).toList(), settings.getTtlSeconds());
        return new ConfirmationStore(backends, Duration.ofSeconds(settings.getTtlSeconds()), clock);
    }

    // Conversations

    @Bean
    @ConditionalOnProperty(name = "agent.conversation.store", havingValue = "redis")
    public ConversationStore redisConversationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                                    AgentProperties properties, Clock clock) {
        AgentProperties.Conversation settings = properties.getConversation();
        return new RedisConversationStore(redisTemplate, objectMapper,
                Duration.ofMinutes(settings.getTtlMinutes()), settings.getMaxMessages(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "agent.conversation.store", havingValue = "memory", matchIfMissing = true)
    public ConversationStore inMemoryConversationStore(AgentProperties properties, Clock clock) {
        return new InMemoryConversationStore(properties.getConversation().getMaxMessages(), clock);
    }

    // Audit

    @Bean
    @ConditionalOnProperty(name = "agent.audit.store", havingValue = "mongo")
    public AuditLog mongoAuditLog(AuditEntryRepository repository) {
        return new MongoAuditLog(repository);
    }

    @Bean
    @ConditionalOnProperty(name = "agent.audit.store", havingValue = "log", matchIfMissing = true)
    public AuditLog loggingAuditLog() {
        return new LoggingAuditLog();
    }
}
