package ru.tigran.freigenthub.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One recommended product as produced by the LLM.
 * Serialized in snake_case, the format the model is instructed to return.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProductRecommendation(
        String name,
        String shortDescription,
        String whyMatch,
        String estimatedPriceRange   // free text, e.g. "$50-$80"
) {
}
