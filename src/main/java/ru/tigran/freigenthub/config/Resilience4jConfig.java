package ru.tigran.freigenthub.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.freigenthub.exception.RecommendationGenerationException;
import ru.tigran.freigenthub.exception.RetriableHttpException;

import java.time.Duration;

/**
 * Конфигурация Resilience4j для защиты от отказов LLM провайдера
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    /**
     * Открывается при 50% ошибок среди последних 10 вызовов (минимум 5),
     * остается открытым 20 секунд, затем переходит в HALF_OPEN
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(
            CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f)
                .slowCallRateThreshold(50.0f)
                .slowCallDurationThreshold(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .minimumNumberOfCalls(5)
                .slidingWindowSize(10)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .waitDurationInOpenState(Duration.ofSeconds(20))
                .recordExceptions(RecommendationGenerationException.class, RetriableHttpException.class, Exception.class)
                .ignoreExceptions(IllegalArgumentException.class)
                .build()
        );

        registry.getEventPublisher()
                .onEntryAdded(event -> log.info("CircuitBreaker created: {}", event.getAddedEntry().getName()))
                .onEntryRemoved(event -> log.info("CircuitBreaker removed: {}", event.getRemovedEntry().getName()))
                .onEntryReplaced(event -> log.info("CircuitBreaker replaced: {}", event.getNewEntry().getName()));

        return registry;
    }

    @Bean
    public CircuitBreaker recommendationProviderCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker("recommendationProvider");

        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("CircuitBreaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
                .onError(event -> log.error("CircuitBreaker recorded error: {}", event.getThrowable().getMessage()))
                .onSuccess(event -> log.debug("CircuitBreaker recorded success"));

        return circuitBreaker;
    }
}
