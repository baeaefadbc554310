package ru.tigran.freigenthub.dto;

import java.util.List;

/**
 * Profile as loaded from the profile store.
 * Input of the recommendation gateway and body of GET /profile.
 */
public record UserProfileData(
        String userId,
        String name,
        String personality,
        String values,
        List<ExperienceData> experiences
) {
    public UserProfileData {
        experiences = experiences == null ? List.of() : List.copyOf(experiences);
    }

    public static UserProfileData fromRequest(String userId, UserProfileRequest request) {
        return new UserProfileData(
                userId,
                request.name(),
                request.personality(),
                request.values(),
                request.experiences().stream()
                        .map(e -> new ExperienceData(e.name(), e.notes(), e.rating()))
                        .toList()
        );
    }
}
