package de.mirkosertic.mcp.ruleengine.retrieval;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import de.mirkosertic.mcp.ruleengine.analysis.StemmedRuleTextAnalyzer;
import de.mirkosertic.mcp.ruleengine.analysis.Tokens;
import org.apache.lucene.analysis.Analyzer;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Local embedding by signed feature hashing of stemmed unigrams and bigrams.
 * <p>
 * Each feature is hashed with murmur3 into one of {@code dimension} buckets; bit 31 of the hash
 * picks the sign so that collisions cancel out on average. Bigrams carry half the weight of
 * unigrams. The result is L2-normalized, so dot product equals cosine similarity.
 * <p>
 * Captures morphological overlap only, no semantics. Plug in a model-backed
 * {@link EmbeddingProvider} for real semantic retrieval.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final float BIGRAM_WEIGHT = 0.5f;

    private final int dimension;
    private final HashFunction hashFunction = Hashing.murmur3_32_fixed();
    private final Analyzer analyzer = new StemmedRuleTextAnalyzer();

    public HashingEmbeddingProvider(final int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive, was " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(final String text) {
        final float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        final List<String> stems = Tokens.analyze(analyzer, "content", text);
        for (int i = 0; i < stems.size(); i++) {
            addFeature(vector, stems.get(i), 1.0f);
            if (i > 0) {
                addFeature(vector, stems.get(i - 1) + '_' + stems.get(i), BIGRAM_WEIGHT);
            }
        }
        return VectorMath.normalize(vector);
    }

    private void addFeature(final float[] vector, final String feature, final float weight) {
        final int hash = hashFunction.hashString(feature, StandardCharsets.UTF_8).asInt();
        final int bucket = Math.floorMod(hash, dimension);
        vector[bucket] += hash < 0 ? -weight : weight;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
