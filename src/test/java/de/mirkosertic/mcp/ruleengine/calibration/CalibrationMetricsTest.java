package de.mirkosertic.mcp.ruleengine.calibration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("CalibrationMetrics Tests")
class CalibrationMetricsTest {

    @Test
    @DisplayName("ECE should be the weighted gap between confidence and accuracy per bin")
    void shouldComputeExpectedCalibrationError() {
        final double[] probabilities = {0.9, 0.9, 0.1, 0.1};
        final boolean[] labels = {true, false, false, false};

        // bin 9: |0.9 - 0.5| * 2/4, bin 1: |0.1 - 0.0| * 2/4
        assertThat(CalibrationMetrics.expectedCalibrationError(probabilities, labels, 10))
                .isCloseTo(0.25, within(1e-12));
    }

    @Test
    @DisplayName("A probability of exactly 1 should fall into the last bin")
    void shouldPutOneIntoLastBin() {
        assertThat(CalibrationMetrics.expectedCalibrationError(new double[]{1.0, 0.95}, new boolean[]{true, true}, 10))
                .isCloseTo(0.025, within(1e-12));
    }

    @Test
    @DisplayName("Brier score should be the mean squared error")
    void shouldComputeBrierScore() {
        final double[] probabilities = {0.9, 0.9, 0.1, 0.1};
        final boolean[] labels = {true, false, false, false};

        assertThat(CalibrationMetrics.brierScore(probabilities, labels)).isCloseTo(0.21, within(1e-12));
    }

    @Test
    @DisplayName("Empty input should score zero, mismatched input should be rejected")
    void shouldHandleDegenerateInput() {
        assertThat(CalibrationMetrics.expectedCalibrationError(new double[0], new boolean[0], 10)).isZero();
        assertThat(CalibrationMetrics.brierScore(new double[0], new boolean[0])).isZero();
        assertThatThrownBy(() -> CalibrationMetrics.brierScore(new double[1], new boolean[2]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
