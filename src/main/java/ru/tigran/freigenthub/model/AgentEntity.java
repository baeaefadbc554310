package ru.tigran.freigenthub.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Persisted agent registration.
 * Survives restarts, unlike the in-memory hub directory, and drives peer discovery.
 */
@Entity
@Table(name = "agents", indexes = {
    @Index(name = "idx_agent_type", columnList = "agent_type")
})
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "agentId", callSuper = false)
@ToString
public class AgentEntity extends AuditableEntity {

    @Id
    @Column(name = "agent_id", length = 128)
    private String agentId;

    @Column(name = "agent_type", nullable = false, length = 64)
    private String agentType;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Column(name = "personality_summary", columnDefinition = "TEXT")
    private String personalitySummary = "";

    public AgentEntity(String agentId) {
        this.agentId = agentId;
    }
}
