package ru.tigran.freigenthub.dto;

/**
 * Recommendation returned by one peer agent during multi-agent search.
 */
public record HelperResult(
        String agentId,
        RecommendationResult result
) {
}
