package de.mirkosertic.mcp.ruleengine.calibration;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Monotone non-decreasing step fit by pool-adjacent-violators.
 * <p>
 * Samples with equal scores are pooled first. Every final block contributes a knot at its lowest
 * and highest score (one knot when both are equal); calibration interpolates linearly between
 * knots and clips to the first/last knot value outside the fitted range.
 * Parameters: flattened knots {@code [x0, y0, x1, y1, ...]} with ascending x.
 */
final class IsotonicRegression implements CalibrationFunction {

    private static final class Block {
        double sum;
        double weight;
        final double minScore;
        double maxScore;

        Block(final double score, final double sum, final double weight) {
            this.minScore = score;
            this.maxScore = score;
            this.sum = sum;
            this.weight = weight;
        }

        double mean() {
            return sum / weight;
        }

        void absorb(final Block next) {
            sum += next.sum;
            weight += next.weight;
            maxScore = next.maxScore;
        }
    }

    @Override
    public List<Double> fit(final double[] scores, final boolean[] labels) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("No samples");
        }
        final Integer[] order = new Integer[scores.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));

        final List<Block> blocks = new ArrayList<>();
        for (final int index : order) {
            final double y = labels[index] ? 1.0 : 0.0;
            final Block last = blocks.isEmpty() ? null : blocks.get(blocks.size() - 1);
            if (last != null && last.maxScore == scores[index]) {
                // ties share one block
                last.sum += y;
                last.weight += 1.0;
            } else {
                blocks.add(new Block(scores[index], y, 1.0));
            }
            poolViolators(blocks);
        }

        final List<Double> knots = new ArrayList<>();
        for (final Block block : blocks) {
            final double y = block.mean();
            knots.add(block.minScore);
            knots.add(y);
            if (block.maxScore > block.minScore) {
                knots.add(block.maxScore);
                knots.add(y);
            }
        }
        return knots;
    }

    private static void poolViolators(final List<Block> blocks) {
        while (blocks.size() > 1) {
            final Block last = blocks.get(blocks.size() - 1);
            final Block previous = blocks.get(blocks.size() - 2);
            if (previous.mean() <= last.mean()) {
                return;
            }
            previous.absorb(last);
            blocks.remove(blocks.size() - 1);
        }
    }

    @Override
    public double apply(final List<Double> parameters, final double score, final @Nullable Double logit) {
        final int knotCount = parameters.size() / 2;
        if (knotCount == 0) {
            return score;
        }
        if (score <= parameters.get(0)) {
            return parameters.get(1);
        }
        final int lastX = 2 * (knotCount - 1);
        if (score >= parameters.get(lastX)) {
            return parameters.get(lastX + 1);
        }
        // binary search for the segment [x_k, x_k+1] containing score
        int low = 0;
        int high = knotCount - 1;
        while (high - low > 1) {
            final int mid = (low + high) >>> 1;
            if (parameters.get(2 * mid) <= score) {
                low = mid;
            } else {
                high = mid;
            }
        }
        final double x0 = parameters.get(2 * low);
        final double y0 = parameters.get(2 * low + 1);
        final double x1 = parameters.get(2 * high);
        final double y1 = parameters.get(2 * high + 1);
        if (x1 == x0) {
            return y1;
        }
        return y0 + (score - x0) / (x1 - x0) * (y1 - y0);
    }
}
