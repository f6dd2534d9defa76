package de.mirkosertic.mcp.ruleengine.retrieval;

/**
 * Turns text into a fixed-length vector for the dense index.
 * <p>
 * Implementations must be thread-safe and return vectors of {@link #dimension()} entries.
 * The index stores L2-normalized vectors; a zero vector means "no embedding" and never matches.
 */
public interface EmbeddingProvider {

    float[] embed(String text);

    int dimension();
}
