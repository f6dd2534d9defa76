package de.mirkosertic.mcp.ruleengine.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

/**
 * Bounded Caffeine cache in front of another {@link EmbeddingProvider}.
 * <p>
 * Used for query embeddings: analysis queries repeat a lot (same rule family, same document
 * type), rule texts are embedded once per index build and bypass the cache.
 * Returned arrays are copies, callers may modify them.
 */
public class CachingEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingProvider delegate;
    private final Cache<String, float[]> cache;
    private final EmbeddingCacheStats stats;

    public CachingEmbeddingProvider(final EmbeddingProvider delegate, final long maximumSize) {
        this.delegate = delegate;
        this.stats = new EmbeddingCacheStats();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .evictionListener((String key, float[] value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        stats.recordEviction();
                    }
                })
                .build();
    }

    @Override
    public float[] embed(final String text) {
        final float[] cached = cache.getIfPresent(text);
        if (cached != null) {
            stats.recordHit();
            return cached.clone();
        }
        stats.recordMiss();
        final float[] computed = delegate.embed(text);
        cache.put(text, computed.clone());
        stats.setCurrentSize(cache.estimatedSize());
        return computed;
    }

    @Override
    public int dimension() {
        return delegate.dimension();
    }

    public EmbeddingProvider getDelegate() {
        return delegate;
    }

    public EmbeddingCacheStats getStats() {
        stats.setCurrentSize(cache.estimatedSize());
        return stats;
    }
}
