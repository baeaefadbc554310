package ru.tigran.freigenthub.hub;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agent-to-agent message stored in a mailbox.
 *
 * The payload is opaque to the hub. Apart from the "type" key used for logging,
 * its structure is defined by the layer that sends the message.
 */
public record AgentMessage(
        String messageId,
        String fromAgentId,
        String toAgentId,
        Map<String, Object> payload,
        Instant sentAt
) {

    /** Payload key that discriminates message semantics. */
    public static final String TYPE_KEY = "type";

    public AgentMessage {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Returns payload value as string, or null if absent.
     */
    public String payloadString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}
