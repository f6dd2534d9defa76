package de.mirkosertic.mcp.ruleengine.retrieval;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic embeddings for tests: one dimension per keyword group, 1 when the text mentions any
 * keyword of the group. Texts without a keyword get the zero vector.
 */
class KeywordEmbeddingProvider implements EmbeddingProvider {

    private final List<List<String>> groups;

    KeywordEmbeddingProvider(final List<List<String>> groups) {
        this.groups = List.copyOf(groups);
    }

    static KeywordEmbeddingProvider none() {
        return new KeywordEmbeddingProvider(List.of(List.of()));
    }

    @Override
    public float[] embed(final String text) {
        final float[] vector = new float[groups.size()];
        final String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (int i = 0; i < groups.size(); i++) {
            for (final String keyword : groups.get(i)) {
                if (lower.contains(keyword)) {
                    vector[i] = 1.0f;
                    break;
                }
            }
        }
        return vector;
    }

    @Override
    public int dimension() {
        return groups.size();
    }
}
