package ru.tigran.freigenthub.dto;

import java.util.List;

/**
 * Output of a multi-agent search run.
 *
 * helperAgentIds lists every discovered peer in discovery order, including peers that
 * did not answer. mergedProducts is the base products followed by each helper's
 * products in helperResults order. sourcedProducts holds the same products in the same
 * order, each tagged with the agent it came from.
 */
public record AutoSearchResponse(
        String baseAgentId,
        List<String> helperAgentIds,
        RecommendationResult baseResult,
        List<HelperResult> helperResults,
        List<ProductRecommendation> mergedProducts,
        List<SourcedProduct> sourcedProducts,
        String mergedSummaryForUser
) {
}
