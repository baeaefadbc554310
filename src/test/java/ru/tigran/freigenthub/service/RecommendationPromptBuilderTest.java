package ru.tigran.freigenthub.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.freigenthub.dto.ExperienceData;
import ru.tigran.freigenthub.dto.UserProfileData;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecommendationPromptBuilder тесты")
class RecommendationPromptBuilderTest {

    @Test
    @DisplayName("profileToText - профиль с опытом")
    void profileWithExperiences() {
        UserProfileData profile = new UserProfileData("u1", "Alice", "curious", "quality", List.of(
                new ExperienceData("Moka pot", "Great coffee", 5),
                new ExperienceData("Drip machine", "Too slow", null)));

        assertEquals("""
                User name: Alice
                Personality: curious
                Values in products: quality
                Past product experience:
                - Moka pot (rating 5/5): Great coffee
                - Drip machine: Too slow
                """, RecommendationPromptBuilder.profileToText(profile));
    }

    @Test
    @DisplayName("profileToText - без опыта")
    void profileWithoutExperiences() {
        UserProfileData profile = new UserProfileData("u1", "Alice", "curious", "quality", null);

        assertTrue(RecommendationPromptBuilder.profileToText(profile)
                .endsWith("Past product experience:\nNo concrete past product experience.\n"));
    }

    @Test
    @DisplayName("buildUserPrompt - содержит профиль и запрос")
    void userPromptContainsProfileAndQuery() {
        UserProfileData profile = new UserProfileData("u1", "Alice", "curious", "quality", List.of());

        String prompt = RecommendationPromptBuilder.buildUserPrompt(profile, "noise-cancelling headphones");

        assertTrue(prompt.startsWith("Here is the user profile:"));
        assertTrue(prompt.contains("User name: Alice"));
        assertTrue(prompt.contains("Here is the user's product search query:\nnoise-cancelling headphones"));
        assertTrue(prompt.endsWith("Remember: JSON only."));
    }

    @Test
    @DisplayName("buildSystemPrompt - описывает формат JSON ответа")
    void systemPromptDescribesFormat() {
        String prompt = RecommendationPromptBuilder.buildSystemPrompt();

        assertTrue(prompt.contains("3-5 concrete product ideas"));
        assertTrue(prompt.contains("\"summary_for_user\""));
        assertTrue(prompt.contains("\"estimated_price_range\""));
    }
}
