package de.mirkosertic.mcp.ruleengine.retrieval;

import de.mirkosertic.mcp.ruleengine.config.ApplicationConfig;
import org.apache.lucene.search.Query;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lexical + dense rule retrieval with Reciprocal Rank Fusion and optional reranking.
 * <p>
 * The index lives in a {@link RuleIndexArena} behind one atomic reference. {@link #rebuildIndexes}
 * builds a complete new arena off to the side and swaps the reference; searches running against
 * the old arena finish undisturbed and the old index is freed once they release it.
 * <p>
 * Discipline and document-type filters are applied inside both index searches, so fusion ranks
 * are computed over eligible rules only.
 */
public class HybridRetriever implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HybridRetriever.class);

    private final EmbeddingProvider embeddings;
    private final ReciprocalRankFusion fusion;
    private final RelevanceScorer relevanceScorer;
    private final RetrievalRuntimeStats stats = new RetrievalRuntimeStats();
    private final AtomicReference<RuleIndexArena> arena = new AtomicReference<>();

    private final int candidateDepth;
    private final int defaultTopK;
    private final double denseMinSimilarity;
    private final int rerankDepth;
    private volatile boolean rerankEnabled;

    public HybridRetriever(final ApplicationConfig config,
                           final EmbeddingProvider embeddings,
                           final RelevanceScorer relevanceScorer) {
        this.embeddings = embeddings;
        this.relevanceScorer = relevanceScorer;
        this.fusion = new ReciprocalRankFusion(config.getRrfK(), config.getLexicalWeight(), config.getDenseWeight());
        this.candidateDepth = config.getCandidateDepth();
        this.defaultTopK = config.getDefaultTopK();
        this.denseMinSimilarity = config.getDenseMinSimilarity();
        this.rerankDepth = config.getRerankDepth();
        this.rerankEnabled = config.isRerankEnabled();
    }

    /**
     * Build indexes for a catalog and make them the active ones.
     *
     * @throws IndexUnavailableException if the catalog is empty or indexing fails; the previous
     *                                   index, if any, stays active
     */
    public void rebuildIndexes(final RuleCatalog catalog) {
        final RuleIndexArena next = RuleIndexArena.build(catalog, embeddings);
        final RuleIndexArena previous = arena.getAndSet(next);
        if (previous != null) {
            final int previousCount = previous.getDocumentCount();
            previous.close();
            logger.info("Replaced rule index: {} -> {} rules", previousCount, next.getDocumentCount());
        }
    }

    public List<RetrievedRule> retrieve(final String query) {
        return retrieve(query, null, null, defaultTopK);
    }

    public List<RetrievedRule> retrieve(final String query, final @Nullable String discipline,
                                        final @Nullable String documentType, final int topK) {
        return retrieve(query, query, discipline, documentType, topK);
    }

    /**
     * Retrieve rules for an expanded query.
     *
     * @param expandedQuery query searched in both indexes
     * @param rerankQuery   query the reranker scores against, usually the unexpanded query
     * @param discipline    discipline code filter, optional
     * @param documentType  document type filter, optional
     * @param topK          maximum number of results
     * @return ranked rules, empty when nothing matches
     * @throws IndexUnavailableException if no index has been built
     */
    public List<RetrievedRule> retrieve(final String expandedQuery,
                                        final @Nullable String rerankQuery,
                                        final @Nullable String discipline,
                                        final @Nullable String documentType,
                                        final int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, was " + topK);
        }
        if (expandedQuery == null || expandedQuery.isBlank()) {
            return List.of();
        }

        final long start = System.nanoTime();
        final RuleIndexArena current = acquireArena();
        try {
            final Query filter = RuleIndexArena.buildFilter(discipline, documentType);
            final List<RankedHit> lexical = current.searchLexical(expandedQuery, filter, candidateDepth);
            final List<RankedHit> dense = current.searchDense(embeddings.embed(expandedQuery), filter,
                    candidateDepth, denseMinSimilarity);

            List<RetrievedRule> fused = fusion.fuse(lexical, dense, current.getCatalog());
            final boolean rerank = rerankEnabled && !fused.isEmpty();
            if (rerank) {
                fused = rerank(rerankQuery != null && !rerankQuery.isBlank() ? rerankQuery : expandedQuery,
                        fused, current.getCatalog());
            }
            final List<RetrievedRule> results = fused.size() > topK ? List.copyOf(fused.subList(0, topK)) : fused;

            final long micros = (System.nanoTime() - start) / 1_000;
            stats.record(micros, lexical.size(), dense.size(), results.size(), rerank);
            logger.debug("Retrieved {} rules (lexical={}, dense={}, reranked={}) in {}us",
                    results.size(), lexical.size(), dense.size(), rerank, micros);
            return results;
        } catch (final IOException e) {
            throw new UncheckedIOException("Rule index search failed", e);
        } finally {
            current.release();
        }
    }

    private RuleIndexArena acquireArena() {
        while (true) {
            final RuleIndexArena current = arena.get();
            if (current == null) {
                throw new IndexUnavailableException("Rule index has not been built");
            }
            if (current.tryAcquire()) {
                return current;
            }
            // lost a race with rebuildIndexes; the reference now points to the new arena
        }
    }

    private List<RetrievedRule> rerank(final String query, final List<RetrievedRule> fused, final RuleCatalog catalog) {
        final int depth = Math.min(rerankDepth, fused.size());
        final List<RetrievedRule> reranked = new ArrayList<>(depth);
        for (final RetrievedRule candidate : fused.subList(0, depth)) {
            final Rule rule = catalog.get(candidate.ruleId()).orElseThrow();
            reranked.add(candidate.withRerankScore(relevanceScorer.score(query, rule)));
        }
        reranked.sort(RetrievedRule.RESULT_ORDER);
        return reranked;
    }

    public boolean isReady() {
        return arena.get() != null;
    }

    public int getIndexedRuleCount() {
        final RuleIndexArena current = arena.get();
        return current == null ? 0 : current.getDocumentCount();
    }

    public @Nullable RuleIndexArena getArena() {
        return arena.get();
    }

    public boolean isRerankEnabled() {
        return rerankEnabled;
    }

    public void setRerankEnabled(final boolean rerankEnabled) {
        this.rerankEnabled = rerankEnabled;
    }

    public RetrievalRuntimeStats getStats() {
        return stats;
    }

    public EmbeddingProvider getEmbeddings() {
        return embeddings;
    }

    @Override
    public void close() {
        final RuleIndexArena current = arena.getAndSet(null);
        if (current != null) {
            current.close();
        }
    }
}
