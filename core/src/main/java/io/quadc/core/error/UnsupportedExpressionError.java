package io.quadc.core.error;

/**
 * Thrown when the form tree contains a node the transformer cannot lower (wrong operand count, unbound
 * index, non-scalar operand where a scalar is required).
 */
public final class UnsupportedExpressionError extends FormCompileException {

    private static final long serialVersionUID = 1L;

    public UnsupportedExpressionError(String message) {
        super(message, null, Kind.INPUT);
    }

    public UnsupportedExpressionError(String message, String context) {
        super(message, context, Kind.INPUT);
    }
}
