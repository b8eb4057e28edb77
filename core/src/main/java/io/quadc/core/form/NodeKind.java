package io.quadc.core.form;

/** Closed set of form tree node kinds; the transformer switches over it exhaustively. */
public enum NodeKind {
    SUM,
    PRODUCT,
    DIVISION,
    POWER,
    ABS,
    MATH_FUNCTION,
    INDEX_SUM,
    SCALAR,
    FACET_NORMAL,
    ARGUMENT,
    COEFFICIENT
}
