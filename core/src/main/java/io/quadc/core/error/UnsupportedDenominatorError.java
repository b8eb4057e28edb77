package io.quadc.core.error;

/**
 * Thrown when the denominator of a division still carries free indices.
 */
public final class UnsupportedDenominatorError extends FormCompileException {

    private static final long serialVersionUID = 1L;

    public UnsupportedDenominatorError(String message) {
        super(message, null, Kind.INPUT);
    }

    public UnsupportedDenominatorError(String message, String context) {
        super(message, context, Kind.INPUT);
    }
}
