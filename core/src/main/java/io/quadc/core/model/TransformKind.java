package io.quadc.core.model;

/** Geometric transform entries: the Jacobian {@code J} and its inverse {@code JINV}. */
public enum TransformKind {
    J,
    JINV
}
