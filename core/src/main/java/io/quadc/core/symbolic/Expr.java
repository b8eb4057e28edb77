package io.quadc.core.symbolic;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable node of the symbolic algebra. Every node carries its {@link Domain}, a canonical
 * textual rendering that doubles as the structural-equality key, and an operation-count estimate
 * used to compare rewrites.
 *
 * <p>Nodes are only created through {@link Symbolics}, which performs local simplification, and
 * through {@link CseCache}, which mints hoisted symbols. Sharing nodes is always safe.
 */
public abstract sealed class Expr implements Comparable<Expr> permits FloatValue, Symbol, Product, Sum, Fraction {

    /** Closed set of node kinds. */
    public enum Kind {
        FLOAT,
        SYMBOL,
        PRODUCT,
        SUM,
        FRACTION
    }

    private final Domain domain;
    private final String key;
    private final int ops;

    Expr(Domain domain, String key, int ops) {
        this.domain = domain;
        this.key = key;
        this.ops = ops;
    }

    public abstract Kind kind();

    /** Direct operands; empty for leaves. */
    public List<Expr> operands() {
        return List.of();
    }

    public Domain domain() {
        return domain;
    }

    /** Canonical rendering; two nodes are structurally equal iff their keys are equal. */
    public String key() {
        return key;
    }

    /** Estimated number of floating-point operations needed to evaluate this node. */
    public int ops() {
        return ops;
    }

    public boolean isZero() {
        return false;
    }

    public boolean isOne() {
        return false;
    }

    /**
     * Returns {@code true} for nodes worth a named temporary: products, sums, fractions and
     * wrapped calls. Plain symbols and literals are never hoisted.
     */
    public boolean isComposite() {
        return true;
    }

    /** All plain symbols this node reads, descending into the arguments of wrapped calls. */
    public Set<Symbol> symbols() {
        Set<Symbol> result = new LinkedHashSet<>();
        collectSymbols(result);
        return result;
    }

    /** The plain symbols of the given domain this node reads. */
    public Set<Symbol> symbols(Domain of) {
        Set<Symbol> result = new LinkedHashSet<>();
        for (Symbol symbol : symbols()) {
            if (symbol.domain() == of) {
                result.add(symbol);
            }
        }
        return result;
    }

    void collectSymbols(Set<Symbol> into) {
        for (Expr operand : operands()) {
            operand.collectSymbols(into);
        }
    }

    /** Rendering used when this node appears as a factor of a product. */
    String asFactor() {
        return key;
    }

    @Override
    public int compareTo(Expr other) {
        return key.compareTo(other.key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expr)) return false;
        Expr other = (Expr) o;
        return kind() == other.kind() && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
