package io.quadc.core.symbolic;

import java.util.List;

/** Quotient of a numerator and a scalar denominator. */
public final class Fraction extends Expr {

    private final Expr numerator;
    private final Expr denominator;

    Fraction(Expr numerator, Expr denominator, String key) {
        super(
                Domain.widest(numerator.domain(), denominator.domain()),
                key,
                1 + numerator.ops() + denominator.ops());
        this.numerator = numerator;
        this.denominator = denominator;
    }

    @Override
    public Kind kind() {
        return Kind.FRACTION;
    }

    public Expr numerator() {
        return numerator;
    }

    public Expr denominator() {
        return denominator;
    }

    @Override
    public List<Expr> operands() {
        return List.of(numerator, denominator);
    }

    @Override
    String asFactor() {
        return "(" + key() + ")";
    }
}
