package ru.tigran.freigenthub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.util.Optional;

/**
 * Конфигурация для поддержки аудита сущностей
 * Автоматически заполняет createdBy, updatedBy, createdAt, updatedAt
 */
@Configuration
@EnableJpaAuditing
public class AuditingConfig {

    /**
     * API без аутентификации, поэтому все изменения пишутся от имени 'system'
     */
    @Bean
    public AuditorAware<String> auditorAware() {
        return () -> Optional.of("system");
    }
}
