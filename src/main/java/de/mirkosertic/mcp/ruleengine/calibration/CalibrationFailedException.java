package de.mirkosertic.mcp.ruleengine.calibration;

import java.util.Map;

/**
 * Every candidate calibration method failed to fit.
 */
public class CalibrationFailedException extends Exception {

    private final Map<CalibrationMethod, String> failures;

    public CalibrationFailedException(final Map<CalibrationMethod, String> failures) {
        super("All calibration methods failed: " + failures);
        this.failures = Map.copyOf(failures);
    }

    public Map<CalibrationMethod, String> getFailures() {
        return failures;
    }
}
