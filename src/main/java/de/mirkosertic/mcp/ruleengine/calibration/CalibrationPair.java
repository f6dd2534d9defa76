package de.mirkosertic.mcp.ruleengine.calibration;

/**
 * A raw confidence with the correctness the user asserted for it.
 */
public record CalibrationPair(double rawConfidence, boolean correct) {
}
