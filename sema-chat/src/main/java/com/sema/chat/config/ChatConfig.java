package com.sema.chat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sema.chat.backend.BackendRegistry;
import com.sema.chat.metrics.ChatMetrics;
import com.sema.chat.service.BackendSelection;
import com.sema.chat.service.ChatManager;
import com.sema.chat.service.ModelManager;
import com.sema.chat.session.InMemorySessionStore;
import com.sema.chat.session.RedisSessionStore;
import com.sema.chat.session.SessionExpirySweeper;
import com.sema.chat.session.SessionStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the orchestration core as explicit singletons.
 */
@Slf4j
@Configuration
public class ChatConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService backendStreamExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("backend-stream-"));
    }

    @Bean
    public ChatMetrics chatMetrics(MeterRegistry meterRegistry) {
        return new ChatMetrics(meterRegistry);
    }

    @Bean
    public BackendRegistry backendRegistry(ChatProperties properties, ObjectMapper objectMapper,
                                           @Qualifier("backendStreamExecutor") ExecutorService backendStreamExecutor) {
        return BackendCatalog.standard(properties, objectMapper, backendStreamExecutor);
    }

    @Bean
    public ModelManager modelManager(BackendRegistry backendRegistry, ChatProperties properties, ChatMetrics metrics) {
        ChatProperties.BackendConfig backend = properties.getBackend();
        return new ModelManager(backendRegistry, new BackendSelection(backend.getType(), backend.getModelName()),
                metrics);
    }

    // In-process session storage (default)
    @Bean
    @ConditionalOnProperty(name = "sema.chat.session.storage", havingValue = "memory", matchIfMissing = true)
    public SessionStore inMemorySessionStore(ChatProperties properties) {
        ChatProperties.SessionConfig session = properties.getSession();
        log.info("Using in-memory session storage (timeout={}, maxMessages={})",
                session.getTimeout(), session.getMaxMessagesPerSession());
        return new InMemorySessionStore(session.getTimeout(), session.getMaxMessagesPerSession());
    }

    // Redis session storage with native key expiry
    @Bean
    @ConditionalOnProperty(name = "sema.chat.session.storage", havingValue = "redis")
    public SessionStore redisSessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                          ChatProperties properties) {
        ChatProperties.SessionConfig session = properties.getSession();
        log.info("Using Redis session storage (timeout={}, keyPrefix={})", session.getTimeout(), session.getKeyPrefix());
        return new RedisSessionStore(redisTemplate, objectMapper, session.getTimeout(),
                session.getMaxMessagesPerSession(), session.getKeyPrefix());
    }

    @Bean
    public SessionExpirySweeper sessionExpirySweeper(SessionStore sessionStore) {
        return new SessionExpirySweeper(sessionStore);
    }

    @Bean
    public ChatManager chatManager(ModelManager modelManager, SessionStore sessionStore, ChatProperties properties,
                                   ChatMetrics metrics) {
        return new ChatManager(modelManager, sessionStore, properties, metrics);
    }

    @Bean
    public ChatLifecycle chatLifecycle(ModelManager modelManager) {
        return new ChatLifecycle(modelManager);
    }
}
