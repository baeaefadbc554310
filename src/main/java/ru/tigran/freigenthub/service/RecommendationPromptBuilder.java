package ru.tigran.freigenthub.service;

import ru.tigran.freigenthub.dto.ExperienceData;
import ru.tigran.freigenthub.dto.UserProfileData;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builder for recommendation prompts.
 *
 * Usage:
 * String systemPrompt = RecommendationPromptBuilder.buildSystemPrompt();
 * String userPrompt = RecommendationPromptBuilder.buildUserPrompt(profile, query);
 */
public class RecommendationPromptBuilder {

    static final String NO_EXPERIENCE = "No concrete past product experience.";

    /**
     * Системный промпт: формат ответа и количество товаров.
     */
    public static String buildSystemPrompt() {
        return """
                You are a product recommendation engine for an AI shopping friend (Freigent). You receive:
                1) A detailed user profile (personality, values, previous products).
                2) A free-text product search query.

                Your job is to suggest 3-5 concrete product ideas that match the user.
                IMPORTANT:
                - You MUST respond with ONLY valid JSON.
                - Do NOT include any markdown, backticks, or plain text outside JSON.
                - The JSON must have this exact structure:
                {
                  "products": [
                    {
                      "name": "string",
                      "short_description": "string",
                      "why_match": "string",
                      "estimated_price_range": "string"
                    },
                    ... 3 to 5 items ...
                  ],
                  "summary_for_user": "short, friendly paragraph explaining the recommendations"
                }
                - The JSON must be parseable by a strict JSON parser.
                """;
    }

    /**
     * Builds user prompt with the rendered profile and the search query.
     *
     * @param profile profile of the agent the recommendations are generated for
     * @param query   free-text product search query
     * @return User prompt string
     */
    public static String buildUserPrompt(UserProfileData profile, String query) {
        return String.format("""
                Here is the user profile:
                ----------------------------------------
                %s
                ----------------------------------------

                Here is the user's product search query:
                %s

                Now generate the JSON response as specified. Remember: JSON only.""",
                profileToText(profile),
                query != null ? query : "");
    }

    /**
     * Renders a profile as a readable text block.
     */
    public static String profileToText(UserProfileData profile) {
        String name = profile.name() != null ? profile.name() : "Unknown user";
        return "User name: " + name + "\n"
                + "Personality: " + nullToEmpty(profile.personality()) + "\n"
                + "Values in products: " + nullToEmpty(profile.values()) + "\n"
                + "Past product experience:\n" + experienceText(profile.experiences()) + "\n";
    }

    private static String experienceText(List<ExperienceData> experiences) {
        if (experiences == null || experiences.isEmpty()) {
            return NO_EXPERIENCE;
        }
        return experiences.stream()
                .map(RecommendationPromptBuilder::experienceLine)
                .collect(Collectors.joining("\n"));
    }

    private static String experienceLine(ExperienceData experience) {
        String name = experience.name() != null ? experience.name() : "Unknown product";
        if (experience.rating() == null) {
            return "- " + name + ": " + nullToEmpty(experience.notes());
        }
        return "- " + name + " (rating " + experience.rating() + "/5): " + nullToEmpty(experience.notes());
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
