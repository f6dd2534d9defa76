package de.mirkosertic.mcp.ruleengine.calibration;

/**
 * Calibration methods. Declaration order is the tie-break order of automatic selection.
 */
public enum CalibrationMethod {
    /** Pass-through, active until the first model is deployed. Never selected by fitting. */
    IDENTITY,
    TEMPERATURE_SCALING,
    PLATT_SCALING,
    ISOTONIC_REGRESSION
}
