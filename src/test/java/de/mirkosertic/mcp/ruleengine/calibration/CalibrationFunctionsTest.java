package de.mirkosertic.mcp.ruleengine.calibration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Calibration function Tests")
class CalibrationFunctionsTest {

    private static double[] scores(final List<CalibrationPair> pairs) {
        return pairs.stream().mapToDouble(CalibrationPair::rawConfidence).toArray();
    }

    private static boolean[] labels(final List<CalibrationPair> pairs) {
        final boolean[] labels = new boolean[pairs.size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = pairs.get(i).correct();
        }
        return labels;
    }

    @Nested
    @DisplayName("Temperature scaling")
    class Temperature {

        private final TemperatureScaling function = new TemperatureScaling();

        @Test
        @DisplayName("Should soften overconfident scores with a temperature above one")
        void shouldFitTemperature() {
            // 0.9 confidence, 60% correct: sigmoid(logit(0.9) / T) = 0.6
            final List<CalibrationPair> pairs = CalibrationTestData.levels(new double[]{0.9}, new int[]{60}, 100);

            final List<Double> parameters = function.fit(scores(pairs), labels(pairs));

            final double expected = Probabilities.logit(0.9) / Probabilities.logit(0.6);
            assertThat(parameters).hasSize(1);
            assertThat(parameters.get(0)).isCloseTo(expected, within(1e-3));
            assertThat(function.apply(parameters, 0.9, null)).isCloseTo(0.6, within(1e-3));
        }

        @Test
        @DisplayName("Should prefer the supplied logit over the score")
        void shouldUseLogitWhenPresent() {
            final List<Double> parameters = List.of(2.0);

            assertThat(function.apply(parameters, 0.5, 4.0)).isCloseTo(Probabilities.sigmoid(2.0), within(1e-12));
            assertThat(function.apply(parameters, 0.5, Double.NaN)).isCloseTo(0.5, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Platt scaling")
    class Platt {

        private final PlattScaling function = new PlattScaling();

        @Test
        @DisplayName("Should fit an increasing sigmoid that lowers overconfident scores")
        void shouldFitIncreasingSigmoid() {
            final List<CalibrationPair> pairs = CalibrationTestData.overconfident();

            final List<Double> parameters = function.fit(scores(pairs), labels(pairs));

            assertThat(parameters).hasSize(2);
            assertThat(parameters.get(0)).isPositive();
            assertThat(function.apply(parameters, 0.9, null)).isLessThan(0.9);
            assertThat(function.apply(parameters, 0.4, null)).isLessThan(function.apply(parameters, 0.9, null));
        }

        @Test
        @DisplayName("Separable data should still give finite parameters")
        void shouldStayFiniteOnSeparableData() {
            final double[] scores = {0.1, 0.2, 0.8, 0.9};
            final boolean[] labels = {false, false, true, true};

            final List<Double> parameters = function.fit(scores, labels);

            assertThat(parameters).allSatisfy(value -> assertThat(value).isFinite());
        }

        @Test
        @DisplayName("Should reject empty input")
        void shouldRejectEmptyInput() {
            assertThatThrownBy(() -> function.fit(new double[0], new boolean[0]))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Isotonic regression")
    class Isotonic {

        private final IsotonicRegression function = new IsotonicRegression();

        @Test
        @DisplayName("Should pool adjacent violators into one block")
        void shouldPoolViolators() {
            final double[] scores = {0.1, 0.2, 0.3, 0.4};
            final boolean[] labels = {false, true, false, true};

            final List<Double> knots = function.fit(scores, labels);

            assertThat(knots).containsExactly(0.1, 0.0, 0.2, 0.5, 0.3, 0.5, 0.4, 1.0);
        }

        @Test
        @DisplayName("Should interpolate between knots and clip outside the fitted range")
        void shouldInterpolateAndClip() {
            final List<Double> knots = List.of(0.1, 0.0, 0.2, 0.5, 0.3, 0.5, 0.4, 1.0);

            assertThat(function.apply(knots, 0.05, null)).isEqualTo(0.0);
            assertThat(function.apply(knots, 0.25, null)).isEqualTo(0.5);
            assertThat(function.apply(knots, 0.35, null)).isCloseTo(0.75, within(1e-12));
            assertThat(function.apply(knots, 0.95, null)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Output should be non-decreasing in the score")
        void shouldBeMonotone() {
            final List<CalibrationPair> pairs = CalibrationTestData.overconfident();
            final List<Double> knots = function.fit(scores(pairs), labels(pairs));

            double previous = -1.0;
            for (int i = 0; i <= 100; i++) {
                final double calibrated = function.apply(knots, i / 100.0, null);
                assertThat(calibrated).isGreaterThanOrEqualTo(previous);
                previous = calibrated;
            }
        }
    }
}
