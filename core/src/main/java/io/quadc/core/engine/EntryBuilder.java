package io.quadc.core.engine;

import io.quadc.core.config.CompilerOptions;
import io.quadc.core.symbolic.CseCaches;
import io.quadc.core.symbolic.Expr;
import io.quadc.core.symbolic.Optimizer;
import io.quadc.core.symbolic.Symbol;
import io.quadc.core.symbolic.Symbolics;
import io.quadc.core.tables.BasisTableRegistry;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Multiplies a reduced per-index expression by the quadrature weight and the scale factor,
 * optimises the product and reports which basis tables the result reads.
 */
public final class EntryBuilder {

    private final Symbolics sym;
    private final Optimizer optimizer;
    private final BasisTableRegistry tables;
    private final CoefficientRegistry coefficients;
    private final CompilerOptions options;

    public EntryBuilder(
            Symbolics sym, BasisTableRegistry tables, CoefficientRegistry coefficients, CompilerOptions options) {
        this.sym = sym;
        this.optimizer = new Optimizer(sym);
        this.tables = tables;
        this.coefficients = coefficients;
        this.options = options;
    }

    public Entry buildEntry(Expr reduced, Expr weight, Expr scaleFactor, CseCaches caches) {
        Expr value = sym.product(reduced, weight, scaleFactor);
        if (options.eliminateCommonSubexpressions()) {
            value = optimizer.optimize(value, caches);
        }
        if (value.isZero()) {
            return new Entry(value, true, Set.of());
        }
        Set<String> used = new TreeSet<>();
        collectTables(value, caches, used, new HashSet<>());
        return new Entry(value, false, used);
    }

    private void collectTables(Expr expr, CseCaches caches, Set<String> used, Set<Symbol> seen) {
        for (Symbol symbol : expr.symbols()) {
            if (!seen.add(symbol)) {
                continue;
            }
            String table = tables.tableOf(symbol.name());
            if (table != null) {
                used.add(table);
                continue;
            }
            Expr definition = caches.definitionOf(symbol);
            if (definition == null) {
                definition = coefficients.definitionOf(symbol);
            }
            if (definition != null) {
                collectTables(definition, caches, used, seen);
            }
        }
    }
}
