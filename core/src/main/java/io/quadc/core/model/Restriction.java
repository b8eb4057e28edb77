package io.quadc.core.model;

/** Side of an interior facet a function is evaluated on. */
public enum Restriction {
    NONE,
    /** The {@code +} side, evaluated on the first facet of the pair. */
    PLUS,
    /** The {@code -} side, evaluated on the second facet of the pair. */
    MINUS;

    public boolean isRestricted() {
        return this != NONE;
    }
}
