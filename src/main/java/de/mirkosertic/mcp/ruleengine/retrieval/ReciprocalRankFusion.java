package de.mirkosertic.mcp.ruleengine.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted Reciprocal Rank Fusion of the lexical and the dense candidate list.
 * <p>
 * A rule at rank {@code r} (1-based) of a list contributes {@code weight / (k + r)}; the fused
 * score is the sum over both lists. Rules found by both lists therefore always outrank rules with
 * the same rank in only one list. Only ranks matter, so BM25 and cosine scores need no
 * normalization against each other.
 */
public final class ReciprocalRankFusion {

    private final int k;
    private final double lexicalWeight;
    private final double denseWeight;

    public ReciprocalRankFusion(final int k, final double lexicalWeight, final double denseWeight) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
        if (lexicalWeight <= 0 || denseWeight <= 0) {
            throw new IllegalArgumentException("List weights must be positive");
        }
        this.k = k;
        this.lexicalWeight = lexicalWeight;
        this.denseWeight = denseWeight;
    }

    public double contribution(final double weight, final int rank) {
        return weight / (k + rank);
    }

    /**
     * Fuse two ranked lists into results sorted by {@link RetrievedRule#RESULT_ORDER}.
     * Rules missing from the catalog are dropped.
     */
    public List<RetrievedRule> fuse(final List<RankedHit> lexical, final List<RankedHit> dense, final RuleCatalog catalog) {
        final Map<String, Accumulator> fused = new LinkedHashMap<>();
        for (final RankedHit hit : lexical) {
            final Accumulator acc = fused.computeIfAbsent(hit.ruleId(), id -> new Accumulator());
            acc.lexicalScore = hit.score();
            acc.lexicalRank = hit.rank();
            acc.fused += contribution(lexicalWeight, hit.rank());
        }
        for (final RankedHit hit : dense) {
            final Accumulator acc = fused.computeIfAbsent(hit.ruleId(), id -> new Accumulator());
            acc.denseScore = hit.score();
            acc.denseRank = hit.rank();
            acc.fused += contribution(denseWeight, hit.rank());
        }

        final List<RetrievedRule> results = new ArrayList<>(fused.size());
        for (final Map.Entry<String, Accumulator> entry : fused.entrySet()) {
            final Accumulator acc = entry.getValue();
            catalog.get(entry.getKey()).ifPresent(rule -> results.add(new RetrievedRule(
                    rule.id(), rule.title(), rule.discipline(),
                    acc.lexicalScore, acc.lexicalRank,
                    acc.denseScore, acc.denseRank,
                    acc.fused, null)));
        }
        results.sort(RetrievedRule.RESULT_ORDER);
        return results;
    }

    public int getK() {
        return k;
    }

    private static final class Accumulator {
        double lexicalScore;
        int lexicalRank;
        double denseScore;
        int denseRank;
        double fused;
    }
}
