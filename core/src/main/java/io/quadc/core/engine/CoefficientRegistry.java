package io.quadc.core.engine;

import io.quadc.core.spi.SymbolFormat;
import io.quadc.core.symbolic.Expr;
import io.quadc.core.symbolic.Symbol;
import io.quadc.core.symbolic.Symbolics;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Names the distinct coefficient evaluations of one form. A coefficient value at a quadrature
 * point is a sum over degrees of freedom; each distinct sum is registered once under
 * {@code F0}, {@code F1}, ...
 *
 * <p>Not thread-safe: one registry is created per form.
 */
public final class CoefficientRegistry {

    private final Symbolics sym;
    private final SymbolFormat format;
    private final Map<String, Symbol> byKey = new HashMap<>();
    private final Map<Symbol, Expr> definitions = new LinkedHashMap<>();

    public CoefficientRegistry(Symbolics sym, SymbolFormat format) {
        this.sym = sym;
        this.format = format;
    }

    /** Returns the symbol standing for {@code definition}, in the definition's domain. */
    public Symbol register(Expr definition) {
        Symbol existing = byKey.get(definition.key());
        if (existing != null) {
            return existing;
        }
        Symbol symbol = sym.symbol(format.coefficientValue(definitions.size()), definition.domain());
        byKey.put(definition.key(), symbol);
        definitions.put(symbol, definition);
        return symbol;
    }

    /** The definition behind a coefficient symbol, or {@code null}. */
    public Expr definitionOf(Symbol symbol) {
        return definitions.get(symbol);
    }

    public Map<Symbol, Expr> definitions() {
        return Collections.unmodifiableMap(definitions);
    }

    public int size() {
        return definitions.size();
    }
}
