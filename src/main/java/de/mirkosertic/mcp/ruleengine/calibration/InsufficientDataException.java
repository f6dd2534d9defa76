package de.mirkosertic.mcp.ruleengine.calibration;

/**
 * Too few labelled samples to fit a calibration model.
 */
public class InsufficientDataException extends Exception {

    private final int available;
    private final int required;

    public InsufficientDataException(final int available, final int required) {
        super("Need at least " + required + " feedback samples to fit a calibration model, have " + available);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
