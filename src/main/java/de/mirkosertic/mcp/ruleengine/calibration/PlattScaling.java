package de.mirkosertic.mcp.ruleengine.calibration;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Platt scaling: {@code sigmoid(a * score + b)}.
 * <p>
 * Logistic regression of the label on the raw score, fitted by Newton iterations with step
 * halving. Labels are replaced by Platt's smoothed targets {@code (N+ + 1) / (N+ + 2)} and
 * {@code 1 / (N- + 2)} so that separable data does not drive the slope to infinity; a small
 * ridge term keeps the Hessian invertible. Parameters: {@code [a, b]}.
 */
final class PlattScaling implements CalibrationFunction {

    private static final int MAX_ITERATIONS = 100;
    private static final double RIDGE = 1e-6;
    private static final double MIN_STEP = 1e-10;
    private static final double CONVERGENCE = 1e-9;

    @Override
    public List<Double> fit(final double[] scores, final boolean[] labels) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("No samples");
        }
        int positives = 0;
        for (final boolean label : labels) {
            if (label) {
                positives++;
            }
        }
        final int negatives = labels.length - positives;
        final double highTarget = (positives + 1.0) / (positives + 2.0);
        final double lowTarget = 1.0 / (negatives + 2.0);
        final double[] targets = new double[labels.length];
        for (int i = 0; i < labels.length; i++) {
            targets[i] = labels[i] ? highTarget : lowTarget;
        }

        double a = 0.0;
        double b = Math.log((positives + 1.0) / (negatives + 1.0));
        double loss = loss(scores, targets, a, b);

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double gradA = RIDGE * a;
            double gradB = RIDGE * b;
            double hAA = RIDGE;
            double hAB = 0.0;
            double hBB = RIDGE;
            for (int i = 0; i < scores.length; i++) {
                final double p = Probabilities.sigmoid(a * scores[i] + b);
                final double residual = p - targets[i];
                final double w = p * (1.0 - p);
                gradA += residual * scores[i];
                gradB += residual;
                hAA += w * scores[i] * scores[i];
                hAB += w * scores[i];
                hBB += w;
            }
            final double determinant = hAA * hBB - hAB * hAB;
            if (!(Math.abs(determinant) > 0.0)) {
                throw new IllegalArgumentException("Singular Hessian in Platt scaling");
            }
            final double stepA = (hBB * gradA - hAB * gradB) / determinant;
            final double stepB = (hAA * gradB - hAB * gradA) / determinant;

            double scale = 1.0;
            double nextA = a - stepA;
            double nextB = b - stepB;
            double nextLoss = loss(scores, targets, nextA, nextB);
            while (nextLoss > loss && scale > MIN_STEP) {
                scale /= 2.0;
                nextA = a - scale * stepA;
                nextB = b - scale * stepB;
                nextLoss = loss(scores, targets, nextA, nextB);
            }
            if (scale <= MIN_STEP) {
                break;
            }
            final boolean converged = Math.abs(nextA - a) < CONVERGENCE && Math.abs(nextB - b) < CONVERGENCE;
            a = nextA;
            b = nextB;
            loss = nextLoss;
            if (converged) {
                break;
            }
        }
        if (!Double.isFinite(a) || !Double.isFinite(b)) {
            throw new IllegalArgumentException("Platt scaling diverged");
        }
        return List.of(a, b);
    }

    private static double loss(final double[] scores, final double[] targets, final double a, final double b) {
        double sum = 0.5 * RIDGE * (a * a + b * b);
        for (int i = 0; i < scores.length; i++) {
            sum -= Probabilities.logLikelihood(Probabilities.sigmoid(a * scores[i] + b), targets[i]);
        }
        return sum;
    }

    @Override
    public double apply(final List<Double> parameters, final double score, final @Nullable Double logit) {
        return Probabilities.sigmoid(parameters.get(0) * score + parameters.get(1));
    }
}
