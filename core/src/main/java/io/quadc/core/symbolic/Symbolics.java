package io.quadc.core.symbolic;

import io.quadc.core.error.DivisionError;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.DoubleFunction;

/**
 * Factory for {@link Expr} nodes. Every constructor performs local simplification: nested
 * products and sums are flattened, literals are folded, neutral elements are dropped, and a literal
 * zero factor collapses a whole product before any other factor is looked at.
 *
 * <p>Operands are kept in canonical order (sorted by key) so that structurally equal expressions
 * always render identically, which is what common-subexpression elimination keys on.
 *
 * <p>Stateless apart from the float formatter; safe to share between threads.
 */
public final class Symbolics {

    /** Default tolerance below which a folded literal is treated as exactly zero. */
    public static final double DEFAULT_EPSILON = 3.0e-16;

    private final DoubleFunction<String> floatFormat;
    private final double epsilon;
    private final FloatValue zero;
    private final FloatValue one;

    /**
     * @param floatFormat renders literal values; the rendering is part of the canonical key
     * @param epsilon     literals with a smaller magnitude fold to zero
     */
    public Symbolics(DoubleFunction<String> floatFormat, double epsilon) {
        this.floatFormat = Objects.requireNonNull(floatFormat, "floatFormat must not be null");
        this.epsilon = epsilon;
        this.zero = new FloatValue(0.0, floatFormat.apply(0.0));
        this.one = new FloatValue(1.0, floatFormat.apply(1.0));
    }

    /** Symbolics rendering literals in C scientific notation with 15 digits. */
    public static Symbolics withDefaults() {
        return new Symbolics(v -> String.format(Locale.ROOT, "%.15e", v), DEFAULT_EPSILON);
    }

    public FloatValue zero() {
        return zero;
    }

    public FloatValue one() {
        return one;
    }

    public FloatValue floatValue(double value) {
        if (Math.abs(value) < epsilon) {
            return zero;
        }
        if (Math.abs(value - 1.0) < epsilon) {
            return one;
        }
        return new FloatValue(value, floatFormat.apply(value));
    }

    public Symbol symbol(String name, Domain domain) {
        return new Symbol(name, Objects.requireNonNull(domain, "domain must not be null"));
    }

    /**
     * Wraps already rendered call text (power, absolute value, math function) as a symbol that
     * remembers its arguments and the operations the call adds.
     */
    public Symbol call(String rendered, Domain domain, List<Expr> arguments, int callOps) {
        return new Symbol(rendered, domain, arguments, callOps);
    }

    public Expr product(Expr... factors) {
        return product(Arrays.asList(factors));
    }

    public Expr product(List<Expr> factors) {
        for (Expr factor : factors) {
            if (factor.isZero()) {
                return zero;
            }
        }
        double coefficient = 1.0;
        List<Expr> rest = new ArrayList<>();
        for (Expr factor : factors) {
            List<Expr> parts = factor.kind() == Expr.Kind.PRODUCT ? factor.operands() : List.of(factor);
            for (Expr part : parts) {
                if (part.kind() == Expr.Kind.FLOAT) {
                    coefficient *= ((FloatValue) part).value();
                } else {
                    rest.add(part);
                }
            }
        }
        FloatValue literal = floatValue(coefficient);
        if (literal.isZero()) {
            return zero;
        }
        if (rest.isEmpty()) {
            return literal;
        }
        if (literal.isOne() && rest.size() == 1) {
            return rest.get(0);
        }
        Collections.sort(rest);
        List<Expr> all = new ArrayList<>(rest.size() + 1);
        if (!literal.isOne()) {
            all.add(literal);
        }
        all.addAll(rest);
        return newProduct(all);
    }

    public Expr sum(Expr... terms) {
        return sum(Arrays.asList(terms));
    }

    public Expr sum(List<Expr> terms) {
        double constant = 0.0;
        List<Expr> rest = new ArrayList<>();
        for (Expr term : terms) {
            List<Expr> parts = term.kind() == Expr.Kind.SUM ? term.operands() : List.of(term);
            for (Expr part : parts) {
                if (part.kind() == Expr.Kind.FLOAT) {
                    constant += ((FloatValue) part).value();
                } else {
                    rest.add(part);
                }
            }
        }
        Collections.sort(rest);
        FloatValue literal = floatValue(constant);
        if (!literal.isZero()) {
            rest.add(literal);
        }
        if (rest.isEmpty()) {
            return zero;
        }
        if (rest.size() == 1) {
            return rest.get(0);
        }
        return newSum(rest);
    }

    /**
     * Builds {@code numerator / denominator}. Nested fractions are multiplied through so the
     * result has one scalar denominator.
     *
     * @throws DivisionError if the denominator is literal zero
     */
    public Expr fraction(Expr numerator, Expr denominator) {
        if (denominator.isZero()) {
            throw new DivisionError("Division by zero", numerator.key() + "/" + denominator.key());
        }
        if (numerator.isZero()) {
            return zero;
        }
        if (denominator.isOne()) {
            return numerator;
        }
        if (denominator.kind() == Expr.Kind.FLOAT) {
            double d = ((FloatValue) denominator).value();
            if (numerator.kind() == Expr.Kind.FLOAT) {
                return floatValue(((FloatValue) numerator).value() / d);
            }
            return product(floatValue(1.0 / d), numerator);
        }
        if (denominator.kind() == Expr.Kind.FRACTION) {
            Fraction inner = (Fraction) denominator;
            return fraction(product(numerator, inner.denominator()), inner.numerator());
        }
        if (numerator.kind() == Expr.Kind.FRACTION) {
            Fraction inner = (Fraction) numerator;
            return fraction(inner.numerator(), product(inner.denominator(), denominator));
        }
        String num = numerator.kind() == Expr.Kind.SUM ? "(" + numerator.key() + ")" : numerator.key();
        String den = denominator.kind() == Expr.Kind.SYMBOL ? denominator.key() : "(" + denominator.key() + ")";
        return new Fraction(numerator, denominator, num + "/" + den);
    }

    private Product newProduct(List<Expr> factors) {
        Domain domain = Domain.CONST;
        int ops = factors.size() - 1;
        StringJoiner key = new StringJoiner("*");
        for (Expr factor : factors) {
            domain = Domain.widest(domain, factor.domain());
            ops += factor.ops();
            key.add(factor.asFactor());
        }
        return new Product(factors, domain, key.toString(), ops);
    }

    private Sum newSum(List<Expr> terms) {
        Domain domain = Domain.CONST;
        int ops = terms.size() - 1;
        StringJoiner key = new StringJoiner(" + ");
        for (Expr term : terms) {
            domain = Domain.widest(domain, term.domain());
            ops += term.ops();
            key.add(term.key());
        }
        return new Sum(terms, domain, key.toString(), ops);
    }
}
