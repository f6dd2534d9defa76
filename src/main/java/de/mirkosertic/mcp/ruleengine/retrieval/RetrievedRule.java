package de.mirkosertic.mcp.ruleengine.retrieval;

import org.jspecify.annotations.Nullable;

import java.util.Comparator;

/**
 * One fused retrieval result. Ranks start at 1; a rank of 0 means the rule was not in that list.
 *
 * @param ruleId       rule id
 * @param title        rule title
 * @param discipline   discipline code of the rule, or null
 * @param lexicalScore BM25 score, 0 when absent from the lexical list
 * @param lexicalRank  rank in the lexical list
 * @param denseScore   cosine similarity, 0 when absent from the dense list
 * @param denseRank    rank in the dense list
 * @param fusedScore   Reciprocal Rank Fusion score
 * @param rerankScore  pairwise relevance score when reranking ran, else null
 */
public record RetrievedRule(
        String ruleId,
        String title,
        @Nullable String discipline,
        double lexicalScore,
        int lexicalRank,
        double denseScore,
        int denseRank,
        double fusedScore,
        @Nullable Double rerankScore
) {

    /**
     * Result order: rerank score (when present) or fused score descending, then lexical score
     * descending, then rule id ascending.
     */
    public static final Comparator<RetrievedRule> RESULT_ORDER = Comparator
            .comparingDouble(RetrievedRule::primaryScore).reversed()
            .thenComparing(Comparator.comparingDouble(RetrievedRule::lexicalScore).reversed())
            .thenComparing(RetrievedRule::ruleId);

    public double primaryScore() {
        return rerankScore != null ? rerankScore : fusedScore;
    }

    public boolean inLexicalList() {
        return lexicalRank > 0;
    }

    public boolean inDenseList() {
        return denseRank > 0;
    }

    public RetrievedRule withRerankScore(final double score) {
        return new RetrievedRule(ruleId, title, discipline, lexicalScore, lexicalRank, denseScore, denseRank,
                fusedScore, score);
    }
}
