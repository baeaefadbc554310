package ru.tigran.freigenthub.hub;

/**
 * Directory entry of an agent registered in the hub.
 * Re-registration of the same agentId replaces all fields.
 */
public record AgentRecord(
        String agentId,
        String agentType,          // e.g. "freigent"
        String displayName,
        String personalitySummary
) {
    public AgentRecord {
        if (personalitySummary == null) {
            personalitySummary = "";
        }
    }
}
