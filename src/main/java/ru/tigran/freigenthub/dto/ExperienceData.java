package ru.tigran.freigenthub.dto;

public record ExperienceData(
        String name,
        String notes,
        Integer rating   // 0-5, null if unknown
) {
}
