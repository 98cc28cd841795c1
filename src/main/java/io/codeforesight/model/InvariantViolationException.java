package io.codeforesight.model;

/**
 * Signals a bug: a value that must never occur was produced (for example a
 * confidence outside [0,1]). The run aborts instead of emitting a corrupted report.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }

    /**
     * Throws if the value lies outside [0,1] or is NaN.
     */
    public static double requireUnitInterval(double value, String what) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvariantViolationException(what + " must be in [0,1] but was " + value);
        }
        return value;
    }
}
