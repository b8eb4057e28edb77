package io.quadc.core.symbolic;

import java.util.List;

/** Sum of two or more terms in canonical order. */
public final class Sum extends Expr {

    private final List<Expr> terms;

    Sum(List<Expr> terms, Domain domain, String key, int ops) {
        super(domain, key, ops);
        this.terms = List.copyOf(terms);
    }

    @Override
    public Kind kind() {
        return Kind.SUM;
    }

    @Override
    public List<Expr> operands() {
        return terms;
    }

    @Override
    String asFactor() {
        return "(" + key() + ")";
    }
}
