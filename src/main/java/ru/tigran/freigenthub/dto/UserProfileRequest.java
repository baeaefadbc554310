package ru.tigran.freigenthub.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for saving a Freigent profile.
 *
 * Constraints:
 * - name: required, used as the agent display name
 * - personality: required, used as the agent personality summary
 * - values: required, what the user values in products
 * - experiences: 0-50 past product experiences, replaces the stored list
 */
public record UserProfileRequest(
        @NotBlank(message = "Name cannot be blank")
        @Size(max = 255, message = "Name must be at most 255 characters")
        String name,

        @NotNull(message = "Personality cannot be null")
        String personality,

        @NotNull(message = "Values cannot be null")
        String values,

        @Size(max = 50, message = "At most 50 experiences per profile")
        List<@Valid ExperienceRequest> experiences
) {
    public UserProfileRequest {
        if (experiences == null) {
            experiences = List.of();
        }
    }
}
