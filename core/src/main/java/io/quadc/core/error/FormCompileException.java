package io.quadc.core.error;

/**
 * Abstract base for all errors raised while compiling one form. Never thrown directly, use the
 * concrete subclasses.
 *
 * <p>Every failure is a deterministic function of the input tree and the compiler options: a form
 * either compiles completely or is rejected as a whole, and re-running it unchanged fails the same
 * way.
 */
public abstract class FormCompileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** What the failure says about its origin. */
    public enum Kind {
        /** The input form uses something the compiler does not handle. */
        INPUT,
        /** An internal bookkeeping invariant was violated. */
        INTERNAL
    }

    private final String context;
    private final Kind kind;

    protected FormCompileException(String message, String context, Kind kind) {
        super(message);
        this.context = context;
        this.kind = kind;
    }

    /**
     * Textual rendering of the sub-expression that failed, or {@code null} if the failure is not
     * tied to one.
     */
    public String context() {
        return context;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    public Kind kind() {
        return kind;
    }
}
