package io.quadc.core.symbolic;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Common-subexpression cache for one {@link Domain}. Interning an expression returns a stable
 * generated symbol ({@code G0}, {@code G1}, ...); interning a structurally equal expression
 * again returns the same symbol.
 *
 * <p>Not thread-safe. One cache set is created per compiled integral.
 */
public final class CseCache {

    private final Domain domain;
    private final String prefix;
    private final Map<String, Symbol> byKey = new HashMap<>();
    private final Map<Symbol, Expr> definitions = new LinkedHashMap<>();

    public CseCache(Domain domain, String prefix) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
    }

    public Domain domain() {
        return domain;
    }

    /**
     * Returns the symbol standing for {@code expr}, minting a new one on first sight.
     *
     * @throws IllegalArgumentException if {@code expr} varies faster than this cache's domain
     */
    public Symbol intern(Expr expr) {
        if (domain.isNarrowerThan(expr.domain())) {
            throw new IllegalArgumentException(
                    "Cannot cache " + expr.domain() + " expression in " + domain + " cache: " + expr.key());
        }
        Symbol existing = byKey.get(expr.key());
        if (existing != null) {
            return existing;
        }
        Symbol symbol = new Symbol(prefix + definitions.size(), domain);
        byKey.put(expr.key(), symbol);
        definitions.put(symbol, expr);
        return symbol;
    }

    public Optional<Symbol> lookup(Expr expr) {
        return Optional.ofNullable(byKey.get(expr.key()));
    }

    /** Hoisted definitions in creation order; a definition only refers to earlier symbols. */
    public Map<Symbol, Expr> definitions() {
        return Collections.unmodifiableMap(definitions);
    }

    public int size() {
        return definitions.size();
    }
}
