package ru.tigran.freigenthub.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.freigenthub.dto.AutoSearchResponse;
import ru.tigran.freigenthub.dto.ExperienceRequest;
import ru.tigran.freigenthub.dto.ProductRecommendation;
import ru.tigran.freigenthub.dto.RecommendationResult;
import ru.tigran.freigenthub.dto.SourcedProduct;
import ru.tigran.freigenthub.dto.UserProfileData;
import ru.tigran.freigenthub.dto.UserProfileRequest;
import ru.tigran.freigenthub.exception.ProfileNotFoundException;
import ru.tigran.freigenthub.hub.MessagingHub;
import ru.tigran.freigenthub.repository.AgentRepository;
import ru.tigran.freigenthub.service.FreigentService;
import ru.tigran.freigenthub.service.MultiAgentSearchService;
import ru.tigran.freigenthub.service.ProfileService;
import ru.tigran.freigenthub.service.RecommendationGatewayService;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
public class MultiAgentSearchIntegrationTest {

    @Autowired
    private FreigentService freigentService;

    @Autowired
    private MultiAgentSearchService multiAgentSearchService;

    @Autowired
    private ProfileService profileService;

    @Autowired
    private AgentRepository agentRepository;

    @Autowired
    private MessagingHub hub;

    @MockBean
    private RecommendationGatewayService gatewayService;

    private static final ProductRecommendation BASE_PRODUCT =
            new ProductRecommendation("Grinder", "Burr grinder", "Fresh beans", "$80-$120");
    private static final ProductRecommendation HELPER_PRODUCT =
            new ProductRecommendation("Scale", "Coffee scale", "Precision", "$20-$40");

    @BeforeEach
    public void setUp() {
        freigentService.saveProfile("it-alice", new UserProfileRequest("Alice", "curious", "quality",
                List.of(new ExperienceRequest("Moka pot", "Great coffee", 5))));
        freigentService.saveProfile("it-bob", new UserProfileRequest("Bob", "practical", "price", null));

        when(gatewayService.generateRecommendations(any(UserProfileData.class), anyString())).thenReturn(
                new RecommendationResult(List.of(BASE_PRODUCT), "base"),
                new RecommendationResult(List.of(HELPER_PRODUCT), "helper"));
    }

    @Test
    public void testProfileRoundTripReplacesExperiences() {
        freigentService.saveProfile("it-alice", new UserProfileRequest("Alice", "calm", "durability",
                List.of(new ExperienceRequest("Kettle", "Loud", 2), new ExperienceRequest("Mug", "Nice", 4))));

        UserProfileData profile = freigentService.getProfile("it-alice");
        assertEquals("calm", profile.personality());
        assertEquals("durability", profile.values());
        assertEquals(List.of("Kettle", "Mug"), profile.experiences().stream().map(e -> e.name()).toList());
        assertEquals("calm", agentRepository.findById("it-alice").orElseThrow().getPersonalitySummary());
    }

    @Test
    public void testPeerDiscoveryExcludesBaseAndAgentsWithoutProfile() {
        profileService.upsertAgent("it-ghost", "freigent", "Ghost", "");
        profileService.upsertAgent("it-bot", "shopbot", "Bot", "");

        assertEquals(List.of("it-bob"), profileService.listPeerAgentIds("it-alice", "freigent"));
        assertEquals(List.of("it-alice"), profileService.listPeerAgentIds("it-bob", "freigent"));
    }

    @Test
    public void testAutoSearchMergesBaseAndHelperProducts() {
        AutoSearchResponse response = multiAgentSearchService.autoSearch("it-alice", "coffee gear");

        assertEquals("it-alice", response.baseAgentId());
        assertEquals(List.of("it-bob"), response.helperAgentIds());
        assertEquals(1, response.helperResults().size());
        assertEquals("it-bob", response.helperResults().get(0).agentId());
        assertEquals(List.of(BASE_PRODUCT, HELPER_PRODUCT), response.mergedProducts());
        assertEquals(List.of("it-alice", "it-bob"),
                response.sourcedProducts().stream().map(SourcedProduct::sourceAgentId).toList());
        assertEquals("This response combines the base Freigent 'it-alice' recommendations with 1 helper Freigent(s): it-bob.",
                response.mergedSummaryForUser());

        assertTrue(hub.getInbox("it-alice", false).isEmpty());
        assertTrue(hub.getInbox("it-bob", false).isEmpty());
        verify(gatewayService, times(2)).generateRecommendations(any(UserProfileData.class), eq("coffee gear"));
    }

    @Test
    public void testAutoSearchForUnknownUserFails() {
        assertThrows(ProfileNotFoundException.class,
                () -> multiAgentSearchService.autoSearch("it-nobody", "coffee gear"));
    }
}
