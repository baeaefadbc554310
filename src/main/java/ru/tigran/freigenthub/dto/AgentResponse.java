package ru.tigran.freigenthub.dto;

import ru.tigran.freigenthub.hub.AgentRecord;

public record AgentResponse(
        String agentId,
        String agentType,
        String displayName,
        String personalitySummary
) {
    public static AgentResponse from(AgentRecord record) {
        return new AgentResponse(
                record.agentId(),
                record.agentType(),
                record.displayName(),
                record.personalitySummary()
        );
    }
}
