package ru.tigran.freigenthub.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import ru.tigran.freigenthub.validation.AgentId;

/**
 * Request DTO for registering an agent in the hub directory.
 * agentType defaults to "freigent", personalitySummary to an empty string.
 */
public record AgentRegisterRequest(
        @AgentId
        String agentId,

        @Size(max = 64, message = "Agent type must be at most 64 characters")
        String agentType,

        @NotBlank(message = "Display name cannot be blank")
        String displayName,

        String personalitySummary
) {
    public static final String DEFAULT_AGENT_TYPE = "freigent";

    public AgentRegisterRequest {
        if (agentType == null || agentType.isBlank()) {
            agentType = DEFAULT_AGENT_TYPE;
        }
        if (personalitySummary == null) {
            personalitySummary = "";
        }
    }
}
