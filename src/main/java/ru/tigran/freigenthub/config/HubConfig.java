package ru.tigran.freigenthub.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.freigenthub.hub.AgentDirectory;
import ru.tigran.freigenthub.hub.MailboxStore;
import ru.tigran.freigenthub.hub.MessagingHub;

/**
 * Конфигурация in-memory хаба агентов.
 * Один экземпляр на контекст приложения, состояние живет до перезапуска процесса.
 */
@Configuration
public class HubConfig {

    @Bean
    public AgentDirectory agentDirectory() {
        return new AgentDirectory();
    }

    @Bean
    public MailboxStore mailboxStore() {
        return new MailboxStore();
    }

    @Bean
    public MessagingHub messagingHub(AgentDirectory agentDirectory, MailboxStore mailboxStore, MeterRegistry meterRegistry) {
        return new MessagingHub(agentDirectory, mailboxStore, meterRegistry);
    }
}
