package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.mcp.ToolResponse;
import de.mirkosertic.mcp.ruleengine.retrieval.EmbeddingCacheStats;
import de.mirkosertic.mcp.ruleengine.retrieval.RetrievalRuntimeStats;
import org.jspecify.annotations.Nullable;

/**
 * Response DTO for the getRetrievalStats tool.
 */
public record RetrievalStatsResponse(
        boolean success,
        Integer indexedRules,
        Long retrievals,
        Long emptyResults,
        Long rerankedRetrievals,
        Double averageMicros,
        Long maxMicros,
        Long p50Micros,
        Long p90Micros,
        Long p99Micros,
        Double averageLexicalHits,
        Double averageDenseHits,
        Double averageReturned,
        Double embeddingCacheHitRate,
        Long embeddingCacheSize,
        String error
) implements ToolResponse {

    public static RetrievalStatsResponse success(final int indexedRules, final RetrievalRuntimeStats stats,
                                                 final @Nullable EmbeddingCacheStats cacheStats) {
        final RetrievalRuntimeStats.Percentiles percentiles = stats.getPercentiles();
        return new RetrievalStatsResponse(
                true,
                indexedRules,
                stats.getRetrievals(),
                stats.getEmptyResults(),
                stats.getRerankedRetrievals(),
                stats.getAverageMicros(),
                stats.getMaxMicros(),
                percentiles != null ? percentiles.p50() : null,
                percentiles != null ? percentiles.p90() : null,
                percentiles != null ? percentiles.p99() : null,
                stats.getAverageLexicalHits(),
                stats.getAverageDenseHits(),
                stats.getAverageReturned(),
                cacheStats != null ? cacheStats.getHitRate() : null,
                cacheStats != null ? cacheStats.getCurrentSize() : null,
                null);
    }

    public static RetrievalStatsResponse error(final String errorMessage) {
        return new RetrievalStatsResponse(false, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null, errorMessage);
    }
}
