package io.quadc.core.symbolic;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Term-rewriting optimizer with domain-partitioned common-subexpression elimination.
 *
 * <p>One pass expands products over sums, regroups every sum by the factors that vary at the
 * sum's own domain, and then hoists the narrower parts of each product, sum and fraction into
 * the cache of their domain. Passes repeat until the expression no longer changes, so the result
 * is a fixed point: optimizing it again yields the same expression.
 */
public final class Optimizer {

    /** Beyond this many terms a product is left factored instead of being distributed. */
    static final int MAX_EXPANDED_TERMS = 256;

    private static final int MAX_PASSES = 8;

    private static final Domain[] HOISTABLE = {Domain.CONST, Domain.GEO, Domain.IP};

    private final Symbolics sym;

    public Optimizer(Symbolics sym) {
        this.sym = Objects.requireNonNull(sym, "sym must not be null");
    }

    /**
     * Rewrites {@code expr}, hoisting loop-invariant sub-expressions into {@code caches}. The
     * expression itself is never replaced by a cached symbol; plain symbols and literals are
     * never hoisted.
     */
    public Expr optimize(Expr expr, CseCaches caches) {
        Expr current = expr;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            Expr next = lift(factor(expand(current)), caches);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    // --- expansion ---

    Expr expand(Expr expr) {
        switch (expr.kind()) {
            case SUM: {
                List<Expr> terms = new ArrayList<>();
                for (Expr term : expr.operands()) {
                    terms.add(expand(term));
                }
                return sym.sum(terms);
            }
            case PRODUCT:
                return expandProduct(expr.operands());
            case FRACTION:
                return expandFraction((Fraction) expr);
            default:
                return expr;
        }
    }

    private Expr expandProduct(List<Expr> factors) {
        List<Expr> expanded = new ArrayList<>(factors.size());
        int width = 1;
        for (Expr factor : factors) {
            Expr e = expand(factor);
            expanded.add(e);
            if (e.kind() == Expr.Kind.SUM) {
                width *= e.operands().size();
            }
        }
        if (width == 1 || width > MAX_EXPANDED_TERMS) {
            return sym.product(expanded);
        }
        List<Expr> terms = new ArrayList<>();
        terms.add(sym.one());
        for (Expr factor : expanded) {
            List<Expr> parts = factor.kind() == Expr.Kind.SUM ? factor.operands() : List.of(factor);
            List<Expr> next = new ArrayList<>(terms.size() * parts.size());
            for (Expr term : terms) {
                for (Expr part : parts) {
                    next.add(sym.product(term, part));
                }
            }
            terms = next;
        }
        return sym.sum(terms);
    }

    private Expr expandFraction(Fraction fraction) {
        Expr num = expand(fraction.numerator());
        Expr den = expand(fraction.denominator());
        if (num.isOne()) {
            return sym.fraction(num, den);
        }
        List<Expr> terms = num.kind() == Expr.Kind.SUM ? num.operands() : List.of(num);
        List<Expr> out = new ArrayList<>(terms.size());
        if (den.domain() == Domain.BASIS) {
            for (Expr term : terms) {
                out.add(sym.fraction(term, den));
            }
        } else {
            Expr reciprocal = sym.fraction(sym.one(), den);
            for (Expr term : terms) {
                out.add(sym.product(term, reciprocal));
            }
        }
        return sym.sum(out);
    }

    // --- grouping ---

    Expr factor(Expr expr) {
        switch (expr.kind()) {
            case SUM:
                return factorSum(expr);
            case PRODUCT: {
                List<Expr> factors = new ArrayList<>();
                for (Expr f : expr.operands()) {
                    factors.add(factor(f));
                }
                return sym.product(factors);
            }
            case FRACTION: {
                Fraction f = (Fraction) expr;
                return sym.fraction(factor(f.numerator()), factor(f.denominator()));
            }
            default:
                return expr;
        }
    }

    /** Groups the terms of a sum by their factors at the sum's domain: a*x + b*x becomes (a + b)*x. */
    private Expr factorSum(Expr sum) {
        Domain domain = sum.domain();
        Map<String, Expr> heads = new LinkedHashMap<>();
        Map<String, List<Expr>> tails = new LinkedHashMap<>();
        for (Expr term : sum.operands()) {
            List<Expr> head = new ArrayList<>();
            List<Expr> tail = new ArrayList<>();
            List<Expr> parts = term.kind() == Expr.Kind.PRODUCT ? term.operands() : List.of(term);
            for (Expr part : parts) {
                if (part.domain() == domain && part.kind() != Expr.Kind.FLOAT) {
                    head.add(part);
                } else {
                    tail.add(part);
                }
            }
            Expr h = sym.product(head);
            heads.putIfAbsent(h.key(), h);
            tails.computeIfAbsent(h.key(), k -> new ArrayList<>()).add(sym.product(tail));
        }
        List<Expr> grouped = new ArrayList<>(heads.size());
        for (Map.Entry<String, Expr> e : heads.entrySet()) {
            Expr rest = sym.sum(tails.get(e.getKey()));
            if (rest.kind() == Expr.Kind.SUM && rest.domain().isNarrowerThan(domain)) {
                rest = factorSum(rest);
            }
            grouped.add(sym.product(e.getValue(), rest));
        }
        return sym.sum(grouped);
    }

    // --- hoisting ---

    private Expr lift(Expr expr, CseCaches caches) {
        switch (expr.kind()) {
            case PRODUCT:
                return liftProduct(expr, caches);
            case SUM:
                return liftSum(expr, caches);
            case FRACTION:
                return liftFraction((Fraction) expr, caches);
            default:
                return expr;
        }
    }

    private Expr liftProduct(Expr product, CseCaches caches) {
        Domain domain = product.domain();
        List<Expr> own = new ArrayList<>();
        Map<Domain, List<Expr>> narrower = new EnumMap<>(Domain.class);
        for (Expr factor : product.operands()) {
            Expr lifted = lift(factor, caches);
            if (lifted.domain() == domain && lifted.kind() != Expr.Kind.FLOAT) {
                own.add(lifted);
            } else {
                narrower.computeIfAbsent(lifted.domain(), d -> new ArrayList<>()).add(lifted);
            }
        }
        Expr carried = hoistLevels(narrower, domain, caches, true);
        if (carried != null) {
            own.add(carried);
        }
        return sym.product(own);
    }

    private Expr liftSum(Expr sum, CseCaches caches) {
        Domain domain = sum.domain();
        List<Expr> own = new ArrayList<>();
        Map<Domain, List<Expr>> narrower = new EnumMap<>(Domain.class);
        for (Expr term : sum.operands()) {
            Expr lifted = lift(term, caches);
            if (lifted.domain() == domain && lifted.kind() != Expr.Kind.FLOAT) {
                own.add(lifted);
            } else {
                narrower.computeIfAbsent(lifted.domain(), d -> new ArrayList<>()).add(lifted);
            }
        }
        Expr carried = hoistLevels(narrower, domain, caches, false);
        if (carried != null) {
            own.add(carried);
        }
        return sym.sum(own);
    }

    /**
     * Combines the narrower parts level by level, from constants outwards, caching each level's
     * combination (which includes the previous level's symbol) when it is composite.
     */
    private Expr hoistLevels(Map<Domain, List<Expr>> narrower, Domain enclosing, CseCaches caches, boolean multiply) {
        if (narrower.isEmpty()) {
            return null;
        }
        Expr carried = null;
        for (Domain level : HOISTABLE) {
            List<Expr> parts = new ArrayList<>();
            if (carried != null) {
                parts.add(carried);
            }
            parts.addAll(narrower.getOrDefault(level, List.of()));
            if (parts.isEmpty()) {
                continue;
            }
            Expr combined = multiply ? sym.product(parts) : sym.sum(parts);
            if (level.isNarrowerThan(enclosing) && combined.domain() == level && combined.isComposite()) {
                combined = caches.cache(level).intern(combined);
            }
            carried = combined;
            if (!level.isNarrowerThan(enclosing)) {
                break;
            }
        }
        return carried;
    }

    private Expr liftFraction(Fraction fraction, CseCaches caches) {
        Expr num = lift(fraction.numerator(), caches);
        Expr den = lift(fraction.denominator(), caches);
        if (den.domain().isNarrowerThan(num.domain())) {
            Expr reciprocal = sym.fraction(sym.one(), den);
            if (reciprocal.isComposite()) {
                reciprocal = caches.cache(reciprocal.domain()).intern(reciprocal);
            }
            return lift(sym.product(num, reciprocal), caches);
        }
        if (num.domain().isNarrowerThan(den.domain()) && num.isComposite()) {
            num = caches.cache(num.domain()).intern(num);
        }
        return sym.fraction(num, den);
    }
}
