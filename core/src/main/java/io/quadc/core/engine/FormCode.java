package io.quadc.core.engine;

import io.quadc.core.symbolic.Expr;
import io.quadc.core.symbolic.Symbol;
import io.quadc.core.tables.NonzeroColumns;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything generated for one form, ready for a code emitter.
 *
 * @param formName       name of the compiled form
 * @param integrals      one code per integral and facet combination, in input order
 * @param coefficients   named coefficient values, evaluated per quadrature point
 * @param tables         unique basis tables per number of quadrature points
 * @param nonzeroColumns non-zero column arrays referenced by index maps
 */
public record FormCode(
        String formName,
        List<IntegralCode> integrals,
        Map<Symbol, Expr> coefficients,
        Map<Integer, Map<String, double[][]>> tables,
        List<NonzeroColumns> nonzeroColumns) {

    public FormCode {
        integrals = List.copyOf(integrals);
        coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
        tables = Collections.unmodifiableMap(new TreeMap<>(tables));
        nonzeroColumns = List.copyOf(nonzeroColumns);
    }

    /** Number of non-zero entries over all integral codes. */
    public int entryCount() {
        return integrals.stream().mapToInt(c -> c.entries().size()).sum();
    }

    public int ops() {
        return integrals.stream().mapToInt(IntegralCode::ops).sum();
    }
}
