package de.mirkosertic.mcp.ruleengine.retrieval;

/**
 * Pairwise (query, rule) relevance used to rerank the top fused candidates.
 * Higher is more relevant; scores only need to be comparable for the same query.
 * Implementations must be thread-safe.
 */
@FunctionalInterface
public interface RelevanceScorer {

    double score(String query, Rule rule);
}
