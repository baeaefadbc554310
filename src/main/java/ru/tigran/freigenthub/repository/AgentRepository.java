package ru.tigran.freigenthub.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tigran.freigenthub.model.AgentEntity;

import java.util.List;

@Repository
public interface AgentRepository extends JpaRepository<AgentEntity, String> {

    /**
     * Ids of agents of the given type, other than the base agent, that have a stored profile.
     * Ordered by registration time, then id.
     */
    @Query("""
            select a.agentId from AgentEntity a
            where a.agentType = :agentType
              and a.agentId <> :baseAgentId
              and exists (select p.userId from UserProfile p where p.userId = a.agentId)
            order by a.createdAt asc, a.agentId asc
            """)
    List<String> findPeerAgentIds(@Param("baseAgentId") String baseAgentId, @Param("agentType") String agentType);
}
