package io.quadc.core.model;

/** Integration domain of an integral. */
public enum IntegralType {
    CELL,
    EXTERIOR_FACET,
    INTERIOR_FACET;

    public boolean isFacet() {
        return this != CELL;
    }
}
