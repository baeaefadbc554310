package ru.tigran.freigenthub.hub;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory directory of agents known to the hub.
 *
 * Entries are never removed during the process lifetime.
 * {@link #list()} returns agents in first-registration order.
 */
@Slf4j
public class AgentDirectory {

    private final Map<String, AgentRecord> agents = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();

    /**
     * Registers an agent or overwrites the existing entry with the same id.
     * Position in {@link #list()} is fixed by the first registration.
     */
    public AgentRecord register(AgentRecord record) {
        Objects.requireNonNull(record.agentId(), "agentId");
        agents.compute(record.agentId(), (id, previous) -> {
            if (previous == null) {
                registrationOrder.add(id);
                log.debug("Agent {} added to directory (type={})", id, record.agentType());
            } else {
                log.debug("Agent {} re-registered, fields replaced", id);
            }
            return record;
        });
        return record;
    }

    public Optional<AgentRecord> get(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(agentId));
    }

    public List<AgentRecord> list() {
        return registrationOrder.stream()
                .map(agents::get)
                .filter(Objects::nonNull)
                .toList();
    }

    public int size() {
        return agents.size();
    }
}
