package de.mirkosertic.mcp.ruleengine.retrieval;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for the query embedding cache.
 */
public class EmbeddingCacheStats {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong currentSize = new AtomicLong();

    public void recordHit() {
        hits.incrementAndGet();
    }

    public void recordMiss() {
        misses.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public void setCurrentSize(final long size) {
        currentSize.set(size);
    }

    public long getRequests() {
        return hits.get() + misses.get();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getCurrentSize() {
        return currentSize.get();
    }

    /**
     * Hit rate as a percentage (0-100), 0 when nothing was requested yet.
     */
    public double getHitRate() {
        final long requests = getRequests();
        return requests == 0 ? 0.0 : hits.get() * 100.0 / requests;
    }

    @Override
    public String toString() {
        return String.format("EmbeddingCacheStats[requests=%d, hits=%d, misses=%d, hitRate=%.1f%%, size=%d, evictions=%d]",
                getRequests(), getHits(), getMisses(), getHitRate(), getCurrentSize(), getEvictions());
    }
}
