package de.mirkosertic.mcp.ruleengine.calibration;

/**
 * Calibration quality of one model on a set of labelled samples.
 */
public record CalibrationEvaluation(double ece, double brier, int sampleCount) {
}
