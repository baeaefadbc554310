package ru.tigran.freigenthub.dto;

import ru.tigran.freigenthub.hub.AgentMessage;

import java.time.Instant;
import java.util.Map;

public record MessageResponse(
        String messageId,
        String fromAgentId,
        String toAgentId,
        Map<String, Object> payload,
        Instant sentAt
) {
    public static MessageResponse from(AgentMessage message) {
        return new MessageResponse(
                message.messageId(),
                message.fromAgentId(),
                message.toAgentId(),
                message.payload(),
                message.sentAt()
        );
    }
}
