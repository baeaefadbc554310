package ru.tigran.freigenthub.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.freigenthub.hub.MessagingHub;
import ru.tigran.freigenthub.service.RecommendationGatewayService;

/**
 * Конфигурация health checks
 */
@Slf4j
@Configuration
public class HealthCheckConfig {

    /**
     * Состояние in-memory хаба: число агентов, почтовых ящиков и ожидающих сообщений
     */
    @Bean
    public HealthIndicator hubHealthIndicator(MessagingHub hub) {
        return () -> Health.up()
                .withDetail("agents", hub.agentCount())
                .withDetail("mailboxes", hub.mailboxCount())
                .withDetail("pendingMessages", hub.pendingMessageCount())
                .build();
    }

    /**
     * Health check для LLM провайдера по состоянию circuit breaker.
     * Всегда UP: при открытом breaker поиск возвращает fallback, а не ошибку.
     */
    @Bean
    public HealthIndicator recommendationProviderHealthIndicator(
            CircuitBreaker recommendationProviderCircuitBreaker,
            RecommendationGatewayService gatewayService
    ) {
        return () -> {
            CircuitBreaker.State state = recommendationProviderCircuitBreaker.getState();
            if (state == CircuitBreaker.State.OPEN) {
                log.warn("Recommendation provider health: circuit breaker is OPEN");
            }
            return Health.up()
                    .withDetail("provider", gatewayService.getProvider())
                    .withDetail("model", gatewayService.getConfiguredModel())
                    .withDetail("circuitBreaker", state.name())
                    .build();
        };
    }
}
