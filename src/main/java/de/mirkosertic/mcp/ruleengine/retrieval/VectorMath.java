package de.mirkosertic.mcp.ruleengine.retrieval;

/**
 * Small helpers for embedding vectors.
 */
final class VectorMath {

    private VectorMath() {
    }

    /**
     * Scales the vector to unit length in place. Zero vectors are returned unchanged.
     */
    static float[] normalize(final float[] vector) {
        double sumOfSquares = 0.0;
        for (final float value : vector) {
            sumOfSquares += value * value;
        }
        if (sumOfSquares == 0.0) {
            return vector;
        }
        final float norm = (float) Math.sqrt(sumOfSquares);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return vector;
    }

    static boolean isZero(final float[] vector) {
        for (final float value : vector) {
            if (value != 0.0f) {
                return false;
            }
        }
        return true;
    }
}
