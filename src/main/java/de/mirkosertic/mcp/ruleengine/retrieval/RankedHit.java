package de.mirkosertic.mcp.ruleengine.retrieval;

/**
 * A rule in one ranked candidate list.
 *
 * @param ruleId rule id
 * @param score  score in that list (BM25 or cosine)
 * @param rank   1-based position
 */
public record RankedHit(String ruleId, double score, int rank) {
}
