package ru.tigran.freigenthub.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.tigran.freigenthub.dto.AgentResponse;
import ru.tigran.freigenthub.dto.ProfileSaveResponse;
import ru.tigran.freigenthub.dto.RecommendationResult;
import ru.tigran.freigenthub.dto.UserProfileData;
import ru.tigran.freigenthub.dto.UserProfileRequest;
import ru.tigran.freigenthub.exception.ProfileNotFoundException;
import ru.tigran.freigenthub.hub.AgentRecord;
import ru.tigran.freigenthub.hub.MessagingHub;

/**
 * Сервис для управления профилями Freigent-агентов и одиночного поиска.
 * Сохранение профиля одновременно регистрирует агента в хабе и в базе.
 */
@Slf4j
@Service
public class FreigentService {

    private final ProfileService profileService;
    private final RecommendationGatewayService gatewayService;
    private final MessagingHub hub;
    private final String agentType;

    public FreigentService(
            ProfileService profileService,
            RecommendationGatewayService gatewayService,
            MessagingHub hub,
            @Value("${app.hub.agent-type:freigent}") String agentType
    ) {
        this.profileService = profileService;
        this.gatewayService = gatewayService;
        this.hub = hub;
        this.agentType = agentType;
    }

    /**
     * Сохраняет профиль и регистрирует агента пользователя.
     *
     * @param userId  ID пользователя (он же ID агента)
     * @param request данные профиля
     * @return статус и зарегистрированный агент
     */
    public ProfileSaveResponse saveProfile(String userId, UserProfileRequest request) {
        UserProfileData saved = profileService.upsertProfile(userId, UserProfileData.fromRequest(userId, request));
        profileService.upsertAgent(userId, agentType, saved.name(), saved.personality());
        AgentRecord agent = hub.registerAgent(userId, agentType, saved.name(), saved.personality());
        log.info("Profile saved and agent registered for {}", userId);
        return new ProfileSaveResponse("ok", userId, AgentResponse.from(agent));
    }

    public UserProfileData getProfile(String userId) {
        return profileService.loadProfile(userId)
                .orElseThrow(() -> new ProfileNotFoundException(userId));
    }

    /**
     * Одиночный поиск: рекомендации только для профиля самого пользователя.
     */
    public RecommendationResult search(String userId, String query) {
        UserProfileData profile = getProfile(userId);
        log.info("Single-agent search for {}", userId);
        return gatewayService.generateRecommendations(profile, query);
    }
}
