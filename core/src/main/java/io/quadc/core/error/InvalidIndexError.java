package io.quadc.core.error;

/**
 * Thrown when free-index bookkeeping is inconsistent: an argument slot outside the reserved test/trial
 * numbers, keys of different arity in one code map, or two index combinations that collapse to the
 * same canonical key.
 */
public final class InvalidIndexError extends FormCompileException {

    private static final long serialVersionUID = 1L;

    public InvalidIndexError(String message) {
        super(message, null, Kind.INTERNAL);
    }

    public InvalidIndexError(String message, String context) {
        super(message, context, Kind.INTERNAL);
    }
}
