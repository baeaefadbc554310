package ru.tigran.freigenthub.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SearchRequest(
        @NotBlank(message = "Query cannot be blank")
        @Size(max = 2000, message = "Query must be at most 2000 characters")
        String query
) {
}
