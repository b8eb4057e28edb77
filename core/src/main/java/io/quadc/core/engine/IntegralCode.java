package io.quadc.core.engine;

import io.quadc.core.index.IndexKey;
import io.quadc.core.model.IntegralType;
import io.quadc.core.symbolic.Expr;
import io.quadc.core.symbolic.Symbol;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Generated code of one integral for one point rule and one facet combination: the non-zero
 * entries per index key, the hoisted temporaries they read and the basis tables they use.
 */
public final class IntegralCode {

    private final IntegralType type;
    private final int points;
    private final int facet0;
    private final int facet1;
    private final Map<IndexKey, Entry> entries;
    private final Map<Symbol, Expr> definitions;
    private final Set<String> usedTables;
    private final int ops;

    IntegralCode(
            IntegralType type,
            int points,
            int facet0,
            int facet1,
            Map<IndexKey, Entry> entries,
            Map<Symbol, Expr> definitions,
            Set<String> usedTables,
            int ops) {
        this.type = type;
        this.points = points;
        this.facet0 = facet0;
        this.facet1 = facet1;
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        this.usedTables = Set.copyOf(usedTables);
        this.ops = ops;
    }

    public IntegralType type() {
        return type;
    }

    public int points() {
        return points;
    }

    /** Local facet (first facet for interior facets), or -1 for cell integrals. */
    public int facet0() {
        return facet0;
    }

    /** Second local facet of an interior facet, or -1. */
    public int facet1() {
        return facet1;
    }

    /** Non-zero entries in key order. */
    public Map<IndexKey, Entry> entries() {
        return entries;
    }

    /** Hoisted temporaries in definition order. */
    public Map<Symbol, Expr> definitions() {
        return definitions;
    }

    public Set<String> usedTables() {
        return usedTables;
    }

    /** Operations of all entries plus all hoisted definitions. */
    public int ops() {
        return ops;
    }

    @Override
    public String toString() {
        String where = switch (type) {
            case CELL -> "cell";
            case EXTERIOR_FACET -> "facet " + facet0;
            case INTERIOR_FACET -> "facets " + facet0 + "/" + facet1;
        };
        return "IntegralCode[" + where + ", points=" + points + ", entries=" + entries.size() + ", ops=" + ops + "]";
    }
}
