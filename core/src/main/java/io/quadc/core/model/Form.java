package io.quadc.core.model;

import java.util.List;
import java.util.Objects;

/** Named variational form: a list of integrals over one cell shape. */
public record Form(String name, CellShape cell, List<Integral> integrals) {

    public Form {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(cell, "cell must not be null");
        integrals = List.copyOf(integrals);
    }
}
