package ru.tigran.freigenthub.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.freigenthub.dto.ExperienceData;
import ru.tigran.freigenthub.dto.UserProfileData;
import ru.tigran.freigenthub.model.AgentEntity;
import ru.tigran.freigenthub.model.ProductExperience;
import ru.tigran.freigenthub.model.UserProfile;
import ru.tigran.freigenthub.repository.AgentRepository;
import ru.tigran.freigenthub.repository.UserProfileRepository;

import java.util.List;
import java.util.Optional;

/**
 * Profile store backed by JPA.
 * Holds user profiles with their product experiences and the persisted agent registrations
 * used for peer discovery.
 */
@Slf4j
@Service
public class ProfileService {

    private final UserProfileRepository userProfileRepository;
    private final AgentRepository agentRepository;

    public ProfileService(UserProfileRepository userProfileRepository, AgentRepository agentRepository) {
        this.userProfileRepository = userProfileRepository;
        this.agentRepository = agentRepository;
    }

    /**
     * Loads a profile with its experiences.
     *
     * @param userId user (and agent) id
     * @return profile data, empty if nothing is stored for this id
     */
    @Transactional(readOnly = true)
    public Optional<UserProfileData> loadProfile(String userId) {
        log.debug("Loading profile {}", userId);
        return userProfileRepository.findWithExperiencesByUserId(userId)
                .map(this::mapToData);
    }

    /**
     * Stores or updates a profile. Existing experiences are replaced as a whole.
     */
    @Transactional
    public UserProfileData upsertProfile(String userId, UserProfileData data) {
        UserProfile profile = userProfileRepository.findWithExperiencesByUserId(userId)
                .orElseGet(() -> new UserProfile(userId));
        boolean created = profile.getVersion() == null;

        profile.setName(data.name());
        profile.setPersonality(nullToEmpty(data.personality()));
        profile.setValuesText(nullToEmpty(data.values()));
        profile.replaceExperiences(data.experiences().stream()
                .map(e -> new ProductExperience(e.name(), nullToEmpty(e.notes()), e.rating() != null ? e.rating() : 0))
                .toList());

        UserProfile saved = userProfileRepository.save(profile);
        log.info("Profile {} {} with {} experience(s)", userId, created ? "created" : "updated",
                saved.getExperiences().size());
        return mapToData(saved);
    }

    /**
     * Stores or updates the persisted registration of an agent.
     */
    @Transactional
    public void upsertAgent(String agentId, String agentType, String displayName, String personalitySummary) {
        AgentEntity agent = agentRepository.findById(agentId).orElseGet(() -> new AgentEntity(agentId));
        agent.setAgentType(agentType);
        agent.setDisplayName(displayName);
        agent.setPersonalitySummary(nullToEmpty(personalitySummary));
        agentRepository.save(agent);
        log.debug("Agent {} persisted (type={})", agentId, agentType);
    }

    /**
     * Ids of other agents of the given type that have a stored profile.
     *
     * @param baseUserId agent excluded from the result
     * @param agentType  agent type to match
     * @return peer ids in registration order
     */
    @Transactional(readOnly = true)
    public List<String> listPeerAgentIds(String baseUserId, String agentType) {
        List<String> peerIds = agentRepository.findPeerAgentIds(baseUserId, agentType);
        log.debug("Found {} peer agent(s) of type {} for {}", peerIds.size(), agentType, baseUserId);
        return peerIds;
    }

    private UserProfileData mapToData(UserProfile profile) {
        return new UserProfileData(
                profile.getUserId(),
                profile.getName(),
                profile.getPersonality(),
                profile.getValuesText(),
                profile.getExperiences().stream()
                        .map(e -> new ExperienceData(e.getName(), e.getNotes(), e.getRating()))
                        .toList()
        );
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
