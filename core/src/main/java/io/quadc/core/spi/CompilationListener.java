package io.quadc.core.spi;

/**
 * SPI for observability hooks around form compilation.
 *
 * <p>All methods receive immutable event objects. Implementations must be thread-safe when forms
 * are compiled in parallel. Exceptions thrown by listeners are caught by the compiler and logged;
 * they do not affect compilation.
 */
public interface CompilationListener {

    /**
     * Called when compilation of a form begins.
     *
     * @param event contains the form name and number of integrals
     */
    void onFormStarted(FormStartedEvent event);

    /**
     * Called when a form compiled completely.
     *
     * @param event contains the form name, number of integral codes and non-zero entries,
     *              operation count and duration
     */
    void onFormCompiled(FormCompiledEvent event);

    /**
     * Called when a form is rejected.
     *
     * @param event contains the form name, error type, detail and failing sub-expression
     */
    void onFormRejected(FormRejectedEvent event);

    // --- Event records ---

    /** Event emitted when a form compilation starts. */
    record FormStartedEvent(String formName, int integrals) {}

    /** Event emitted when a form compiled successfully. */
    record FormCompiledEvent(String formName, int integralCodes, int entries, int ops, long durationMs) {}

    /** Event emitted when a form is rejected. */
    record FormRejectedEvent(String formName, String errorType, String detail, String context, long durationMs) {}
}
