package ru.tigran.freigenthub.dto;

public record ProfileSaveResponse(
        String status,   // always "ok"
        String userId,
        AgentResponse agent
) {
}
