package ru.tigran.freigenthub.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ExperienceRequest(
        @NotBlank(message = "Experience name cannot be blank")
        String name,

        @NotNull(message = "Experience notes cannot be null")
        String notes,

        @NotNull(message = "Rating cannot be null")
        @Min(value = 0, message = "Rating must be between 0 and 5")
        @Max(value = 5, message = "Rating must be between 0 and 5")
        Integer rating
) {
}
