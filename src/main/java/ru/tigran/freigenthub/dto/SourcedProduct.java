package ru.tigran.freigenthub.dto;

/**
 * Merged product tagged with the agent whose recommendation it came from.
 */
public record SourcedProduct(
        String sourceAgentId,
        SourceKind sourceKind,
        ProductRecommendation product
) {

    public enum SourceKind {
        BASE,
        HELPER
    }

    public static SourcedProduct base(String agentId, ProductRecommendation product) {
        return new SourcedProduct(agentId, SourceKind.BASE, product);
    }

    public static SourcedProduct helper(String agentId, ProductRecommendation product) {
        return new SourcedProduct(agentId, SourceKind.HELPER, product);
    }
}
