package io.quadc.core.model;

import io.quadc.core.form.FormNode;
import java.util.Objects;

/** One integrand over one integration domain with the quadrature rule to evaluate it with. */
public record Integral(IntegralType type, QuadratureRule rule, FormNode integrand) {

    public Integral {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(integrand, "integrand must not be null");
    }
}
