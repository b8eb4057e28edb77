package io.quadc.core.engine;

import io.quadc.core.symbolic.Expr;
import java.util.Set;

/**
 * Final contribution of one index combination at one quadrature point.
 *
 * @param value      optimised expression, weight and scale factor included
 * @param zero       the contribution is structurally zero and can be omitted
 * @param usedTables unique basis tables the value reads, directly or through hoisted
 *                   temporaries and coefficient values
 */
public record Entry(Expr value, boolean zero, Set<String> usedTables) {

    public Entry {
        usedTables = Set.copyOf(usedTables);
    }
}
