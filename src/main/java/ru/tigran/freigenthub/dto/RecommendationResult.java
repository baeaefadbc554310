package ru.tigran.freigenthub.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Result of one recommendation call.
 *
 * Structure:
 * {
 *   "products": [{"name": ..., "short_description": ..., "why_match": ..., "estimated_price_range": ...}],
 *   "summary_for_user": "short friendly paragraph"
 * }
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecommendationResult(
        List<ProductRecommendation> products,
        String summaryForUser
) {
    public static final String MISSING_SUMMARY = "No summary_for_user provided by the model.";

    public RecommendationResult {
        products = products == null ? List.of() : List.copyOf(products);
        if (summaryForUser == null) {
            summaryForUser = MISSING_SUMMARY;
        }
    }

    /**
     * Safe result returned instead of propagating a provider failure.
     */
    public static RecommendationResult fallback(String errorMessage) {
        return new RecommendationResult(
                List.of(),
                "The agent tried to return a result, but there was an error parsing the JSON output.\n\nError: "
                        + errorMessage
        );
    }
}
