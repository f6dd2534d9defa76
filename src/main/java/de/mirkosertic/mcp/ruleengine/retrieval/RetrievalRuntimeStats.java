package de.mirkosertic.mcp.ruleengine.retrieval;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe aggregate statistics over retrieval calls.
 *
 * <p>Counters are lock-free; the last {@value #WINDOW} call durations are kept in a circular
 * buffer guarded by a lock for percentile computation.</p>
 */
public class RetrievalRuntimeStats {

    private static final int WINDOW = 1000;

    private final AtomicLong retrievals = new AtomicLong();
    private final AtomicLong emptyResults = new AtomicLong();
    private final AtomicLong rerankedRetrievals = new AtomicLong();
    private final AtomicLong totalMicros = new AtomicLong();
    private final AtomicLong maxMicros = new AtomicLong();
    private final AtomicLong lexicalHits = new AtomicLong();
    private final AtomicLong denseHits = new AtomicLong();
    private final AtomicLong returnedRules = new AtomicLong();

    private final long[] window = new long[WINDOW];
    private int windowIndex = 0;
    private int windowCount = 0;
    private final Object lock = new Object();

    /**
     * Latency percentiles in microseconds over the recent window.
     */
    public record Percentiles(long p50, long p90, long p99) {
    }

    public void record(final long durationMicros, final int lexicalCount, final int denseCount,
                       final int returned, final boolean reranked) {
        retrievals.incrementAndGet();
        totalMicros.addAndGet(durationMicros);
        lexicalHits.addAndGet(lexicalCount);
        denseHits.addAndGet(denseCount);
        returnedRules.addAndGet(returned);
        if (returned == 0) {
            emptyResults.incrementAndGet();
        }
        if (reranked) {
            rerankedRetrievals.incrementAndGet();
        }
        long current;
        do {
            current = maxMicros.get();
            if (durationMicros <= current) {
                break;
            }
        } while (!maxMicros.compareAndSet(current, durationMicros));

        synchronized (lock) {
            window[windowIndex] = durationMicros;
            windowIndex = (windowIndex + 1) % WINDOW;
            windowCount = Math.min(windowCount + 1, WINDOW);
        }
    }

    /**
     * @return percentiles, or null before the first retrieval
     */
    public @Nullable Percentiles getPercentiles() {
        final long[] sorted;
        synchronized (lock) {
            if (windowCount == 0) {
                return null;
            }
            sorted = Arrays.copyOf(window, windowCount);
        }
        Arrays.sort(sorted);
        return new Percentiles(percentile(sorted, 50), percentile(sorted, 90), percentile(sorted, 99));
    }

    private static long percentile(final long[] sorted, final int percentile) {
        final int index = (int) Math.ceil(percentile / 100.0 * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }

    public long getRetrievals() {
        return retrievals.get();
    }

    public long getEmptyResults() {
        return emptyResults.get();
    }

    public long getRerankedRetrievals() {
        return rerankedRetrievals.get();
    }

    public long getMaxMicros() {
        return maxMicros.get();
    }

    public double getAverageMicros() {
        final long count = retrievals.get();
        return count == 0 ? 0.0 : (double) totalMicros.get() / count;
    }

    public double getAverageLexicalHits() {
        final long count = retrievals.get();
        return count == 0 ? 0.0 : (double) lexicalHits.get() / count;
    }

    public double getAverageDenseHits() {
        final long count = retrievals.get();
        return count == 0 ? 0.0 : (double) denseHits.get() / count;
    }

    public double getAverageReturned() {
        final long count = retrievals.get();
        return count == 0 ? 0.0 : (double) returnedRules.get() / count;
    }

    public void reset() {
        retrievals.set(0);
        emptyResults.set(0);
        rerankedRetrievals.set(0);
        totalMicros.set(0);
        maxMicros.set(0);
        lexicalHits.set(0);
        denseHits.set(0);
        returnedRules.set(0);
        synchronized (lock) {
            windowIndex = 0;
            windowCount = 0;
            Arrays.fill(window, 0L);
        }
    }
}
