package io.quadc.core.model;

import java.util.Objects;

/** Known function given by its degrees of freedom {@code w[number][*]}. */
public record Coefficient(int number, FiniteElement element) {

    public Coefficient {
        if (number < 0) {
            throw new IllegalArgumentException("Coefficient number must not be negative, got: " + number);
        }
        Objects.requireNonNull(element, "element must not be null");
    }
}
