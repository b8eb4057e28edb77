package io.quadc.core.symbolic;

import java.util.List;

/** Product of two or more factors; at most one literal coefficient, which always comes first. */
public final class Product extends Expr {

    private final List<Expr> factors;

    Product(List<Expr> factors, Domain domain, String key, int ops) {
        super(domain, key, ops);
        this.factors = List.copyOf(factors);
    }

    @Override
    public Kind kind() {
        return Kind.PRODUCT;
    }

    @Override
    public List<Expr> operands() {
        return factors;
    }
}
