package io.quadc.core.model;

/**
 * How values of a reference basis function are mapped to the physical cell. Only the first three
 * are supported by the quadrature compiler; the others are recognised so that forms using them
 * are rejected with a clear error.
 */
public enum MappingKind {
    AFFINE,
    COVARIANT_PIOLA,
    CONTRAVARIANT_PIOLA,
    DOUBLE_COVARIANT_PIOLA,
    DOUBLE_CONTRAVARIANT_PIOLA,
    L2_PIOLA;

    public boolean isSupported() {
        return this == AFFINE || this == COVARIANT_PIOLA || this == CONTRAVARIANT_PIOLA;
    }
}
