package io.quadc.core.symbolic;

/**
 * Loop-nesting class of an expression: which loop variables its value depends on. Declared from
 * the most constant to the least constant, so {@link #compareTo} orders domains by width.
 *
 * <ul>
 *   <li>{@link #CONST}: global constant.
 *   <li>{@link #GEO}: varies per cell, constant across quadrature points.
 *   <li>{@link #IP}: varies per quadrature point only.
 *   <li>{@link #BASIS}: varies per local basis-function index and quadrature point.
 * </ul>
 */
public enum Domain {
    CONST,
    GEO,
    IP,
    BASIS;

    /** Returns the wider (less constant) of two domains. */
    public static Domain widest(Domain a, Domain b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public boolean isNarrowerThan(Domain other) {
        return compareTo(other) < 0;
    }
}
