package io.quadc.core.error;

/**
 * Thrown when an algebraic reduction would divide by a structurally zero denominator.
 */
public final class DivisionError extends FormCompileException {

    private static final long serialVersionUID = 1L;

    public DivisionError(String message) {
        super(message, null, Kind.INPUT);
    }

    public DivisionError(String message, String context) {
        super(message, context, Kind.INPUT);
    }
}
