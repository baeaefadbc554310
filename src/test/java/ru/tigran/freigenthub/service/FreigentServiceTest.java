package ru.tigran.freigenthub.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.freigenthub.dto.ExperienceRequest;
import ru.tigran.freigenthub.dto.ProfileSaveResponse;
import ru.tigran.freigenthub.dto.RecommendationResult;
import ru.tigran.freigenthub.dto.UserProfileData;
import ru.tigran.freigenthub.dto.UserProfileRequest;
import ru.tigran.freigenthub.exception.ProfileNotFoundException;
import ru.tigran.freigenthub.hub.AgentDirectory;
import ru.tigran.freigenthub.hub.MailboxStore;
import ru.tigran.freigenthub.hub.MessagingHub;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FreigentService unit тесты")
class FreigentServiceTest {

    @Mock
    private ProfileService profileService;

    @Mock
    private RecommendationGatewayService gatewayService;

    private MessagingHub hub;
    private FreigentService freigentService;

    @BeforeEach
    void setUp() {
        hub = new MessagingHub(new AgentDirectory(), new MailboxStore(), new SimpleMeterRegistry());
        freigentService = new FreigentService(profileService, gatewayService, hub, "freigent");
    }

    @Test
    @DisplayName("saveProfile - профиль сохраняется, агент записывается в БД и регистрируется в хабе")
    void saveProfileRegistersAgent() {
        UserProfileRequest request = new UserProfileRequest("Alice", "curious", "quality",
                List.of(new ExperienceRequest("Moka pot", "Great coffee", 5)));
        when(profileService.upsertProfile(eq("u1"), any(UserProfileData.class)))
                .thenAnswer(invocation -> invocation.getArgument(1));

        ProfileSaveResponse response = freigentService.saveProfile("u1", request);

        assertEquals("ok", response.status());
        assertEquals("u1", response.userId());
        assertEquals("Alice", response.agent().displayName());
        assertEquals("freigent", response.agent().agentType());
        assertEquals("curious", response.agent().personalitySummary());

        ArgumentCaptor<UserProfileData> captor = ArgumentCaptor.forClass(UserProfileData.class);
        verify(profileService).upsertProfile(eq("u1"), captor.capture());
        assertEquals(1, captor.getValue().experiences().size());
        assertEquals(5, captor.getValue().experiences().get(0).rating());

        verify(profileService).upsertAgent("u1", "freigent", "Alice", "curious");
        assertTrue(hub.getAgent("u1").isPresent());
    }

    @Test
    @DisplayName("getProfile - нет профиля: ProfileNotFoundException")
    void getProfileMissing() {
        when(profileService.loadProfile("u1")).thenReturn(Optional.empty());

        ProfileNotFoundException e = assertThrows(ProfileNotFoundException.class,
                () -> freigentService.getProfile("u1"));
        assertTrue(e.getMessage().contains("u1"));
    }

    @Test
    @DisplayName("search - рекомендации по профилю пользователя")
    void searchUsesOwnProfile() {
        UserProfileData profile = new UserProfileData("u1", "Alice", "curious", "quality", List.of());
        RecommendationResult result = new RecommendationResult(List.of(), "nothing yet");
        when(profileService.loadProfile("u1")).thenReturn(Optional.of(profile));
        when(gatewayService.generateRecommendations(profile, "lamp")).thenReturn(result);

        assertSame(result, freigentService.search("u1", "lamp"));
    }

    @Test
    @DisplayName("search - нет профиля: LLM не вызывается")
    void searchWithoutProfile() {
        when(profileService.loadProfile("u1")).thenReturn(Optional.empty());

        assertThrows(ProfileNotFoundException.class, () -> freigentService.search("u1", "lamp"));
        verifyNoInteractions(gatewayService);
    }
}
