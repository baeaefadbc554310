package ru.tigran.freigenthub.dto;

import jakarta.validation.constraints.NotNull;
import ru.tigran.freigenthub.validation.AgentId;

import java.util.Map;

/**
 * Request DTO for sending an agent-to-agent message.
 * The recipient does not need to be registered: its mailbox is created on demand.
 */
public record MessageSendRequest(
        @AgentId
        String fromAgentId,

        @AgentId
        String toAgentId,

        @NotNull(message = "Payload cannot be null")
        Map<String, Object> payload
) {
}
