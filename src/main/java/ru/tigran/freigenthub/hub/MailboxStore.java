package ru.tigran.freigenthub.hub;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-agent FIFO mailboxes.
 *
 * Each mailbox is held as an immutable list snapshot. Appends and drains replace the
 * snapshot inside {@link ConcurrentHashMap#compute}, so a send can never be lost to a
 * concurrent lazy creation and concurrent drains of one mailbox partition its content.
 * A missing mailbox and an empty one read the same.
 */
@Slf4j
public class MailboxStore {

    private final Map<String, List<AgentMessage>> mailboxes = new ConcurrentHashMap<>();
    private final Clock clock;

    public MailboxStore() {
        this(Clock.systemUTC());
    }

    public MailboxStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates an empty mailbox for the agent unless one already exists.
     */
    public void ensureMailbox(String agentId) {
        mailboxes.putIfAbsent(agentId, List.of());
    }

    /**
     * Appends a new message to the recipient's mailbox, creating the mailbox if needed.
     *
     * @return the stored message with its freshly generated id
     */
    public AgentMessage send(String fromAgentId, String toAgentId, Map<String, Object> payload) {
        AgentMessage message = new AgentMessage(
                UUID.randomUUID().toString(),
                fromAgentId,
                toAgentId,
                payload,
                Instant.now(clock)
        );
        mailboxes.compute(toAgentId, (id, current) -> append(current, message));
        log.debug("Message {} queued: {} -> {}", message.messageId(), fromAgentId, toAgentId);
        return message;
    }

    /**
     * Returns the agent's messages in arrival order.
     *
     * @param clear when true the mailbox is emptied in the same atomic step
     */
    public List<AgentMessage> receive(String agentId, boolean clear) {
        if (agentId == null) {
            return List.of();
        }
        if (!clear) {
            return mailboxes.getOrDefault(agentId, List.of());
        }
        AtomicReference<List<AgentMessage>> drained = new AtomicReference<>(List.of());
        mailboxes.computeIfPresent(agentId, (id, current) -> {
            drained.set(current);
            return List.of();
        });
        return drained.get();
    }

    public int mailboxCount() {
        return mailboxes.size();
    }

    public long pendingCount() {
        return mailboxes.values().stream().mapToLong(List::size).sum();
    }

    private static List<AgentMessage> append(List<AgentMessage> current, AgentMessage message) {
        if (current == null || current.isEmpty()) {
            return List.of(message);
        }
        List<AgentMessage> next = new ArrayList<>(current.size() + 1);
        next.addAll(current);
        next.add(message);
        return Collections.unmodifiableList(next);
    }
}
