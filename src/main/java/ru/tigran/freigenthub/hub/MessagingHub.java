package ru.tigran.freigenthub.hub;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for agent registration and agent-to-agent messaging.
 *
 * Composes an {@link AgentDirectory} and a {@link MailboxStore} sharing agentId as key.
 * Never fails for unknown agents: sends create the recipient mailbox and receives on
 * unknown ids return an empty list. Built once per application context (see HubConfig)
 * and passed by reference to workers, the orchestrator and controllers.
 */
@Slf4j
public class MessagingHub {

    private final AgentDirectory directory;
    private final MailboxStore mailboxStore;
    private final Counter messagesSentCounter;
    private final Counter messagesDrainedCounter;

    public MessagingHub(AgentDirectory directory, MailboxStore mailboxStore, MeterRegistry meterRegistry) {
        this.directory = directory;
        this.mailboxStore = mailboxStore;
        this.messagesSentCounter = Counter.builder("hub.messages.sent")
                .description("Messages appended to agent mailboxes")
                .register(meterRegistry);
        this.messagesDrainedCounter = Counter.builder("hub.mailbox.drained")
                .description("Messages removed from mailboxes by draining reads")
                .register(meterRegistry);
    }

    /**
     * Registers (or overwrites) an agent and makes sure it has a mailbox.
     */
    public AgentRecord registerAgent(String agentId, String agentType, String displayName, String personalitySummary) {
        AgentRecord record = directory.register(new AgentRecord(agentId, agentType, displayName, personalitySummary));
        mailboxStore.ensureMailbox(agentId);
        log.info("Registered agent {} (type={}, name={})", agentId, agentType, displayName);
        return record;
    }

    public Optional<AgentRecord> getAgent(String agentId) {
        return directory.get(agentId);
    }

    public List<AgentRecord> listAgents() {
        return directory.list();
    }

    public AgentMessage sendMessage(String fromAgentId, String toAgentId, Map<String, Object> payload) {
        AgentMessage message = mailboxStore.send(fromAgentId, toAgentId, payload);
        messagesSentCounter.increment();
        log.info("A2A message {} sent {} -> {} (type={})",
                message.messageId(), fromAgentId, toAgentId, message.payloadString(AgentMessage.TYPE_KEY));
        return message;
    }

    /**
     * Reads an agent's inbox.
     *
     * @param clear when true, returned messages are removed atomically
     */
    public List<AgentMessage> getInbox(String agentId, boolean clear) {
        List<AgentMessage> messages = mailboxStore.receive(agentId, clear);
        if (clear && !messages.isEmpty()) {
            messagesDrainedCounter.increment(messages.size());
            log.debug("Drained {} message(s) from inbox of {}", messages.size(), agentId);
        }
        return messages;
    }

    public int agentCount() {
        return directory.size();
    }

    public int mailboxCount() {
        return mailboxStore.mailboxCount();
    }

    public long pendingMessageCount() {
        return mailboxStore.pendingCount();
    }
}
