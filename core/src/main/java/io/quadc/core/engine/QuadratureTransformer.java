package io.quadc.core.engine;

import io.quadc.core.error.DivisionError;
import io.quadc.core.error.UnsupportedDenominatorError;
import io.quadc.core.error.UnsupportedExpressionError;
import io.quadc.core.form.AbsNode;
import io.quadc.core.form.ArgumentNode;
import io.quadc.core.form.CoefficientNode;
import io.quadc.core.form.FacetNormalNode;
import io.quadc.core.form.FormNode;
import io.quadc.core.form.IndexSumNode;
import io.quadc.core.form.IndexValue;
import io.quadc.core.form.MathFunctionNode;
import io.quadc.core.form.PowerNode;
import io.quadc.core.form.ScalarNode;
import io.quadc.core.index.CodeMap;
import io.quadc.core.index.Permutations;
import io.quadc.core.model.IntegralType;
import io.quadc.core.model.MathFunction;
import io.quadc.core.model.Restriction;
import io.quadc.core.spi.SymbolFormat;
import io.quadc.core.symbolic.Domain;
import io.quadc.core.symbolic.Expr;
import io.quadc.core.symbolic.FloatValue;
import io.quadc.core.symbolic.Symbolics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers a form tree to a code map: for every combination of free indices, the scalar
 * expression contributed at one quadrature point.
 *
 * <p>The tree is visited depth-first. Leaves are resolved through {@link BasisResolver}; inner
 * nodes combine their children's maps with {@link Permutations}. Anything the compiler cannot
 * express fails with a {@link io.quadc.core.error.FormCompileException} naming the offending
 * sub-expression.
 *
 * <p>Not thread-safe: one transformer evaluates one integrand in one integration context.
 */
public final class QuadratureTransformer {

    /** Integer exponents beyond this magnitude are emitted as power calls instead of products. */
    static final int MAX_EXPANDED_POWER = 64;

    private final Symbolics sym;
    private final Permutations permutations;
    private final BasisResolver resolver;
    private final SymbolFormat format;
    private final IntegrationContext ctx;
    private final Map<String, Integer> bindings = new HashMap<>();

    public QuadratureTransformer(
            Symbolics sym, BasisResolver resolver, SymbolFormat format, IntegrationContext ctx) {
        this.sym = sym;
        this.permutations = new Permutations(sym);
        this.resolver = resolver;
        this.format = format;
        this.ctx = ctx;
    }

    public CodeMap transform(FormNode node) {
        return switch (node.kind()) {
            case SUM -> permutations.sum(visitAll(node.operands()));
            case PRODUCT -> permutations.product(visitAll(node.operands()));
            case DIVISION -> division(node);
            case POWER -> power((PowerNode) node);
            case ABS -> abs((AbsNode) node);
            case MATH_FUNCTION -> mathFunction((MathFunctionNode) node);
            case INDEX_SUM -> indexSum((IndexSumNode) node);
            case SCALAR -> CodeMap.scalar(sym.floatValue(((ScalarNode) node).value()));
            case FACET_NORMAL -> facetNormal((FacetNormalNode) node);
            case ARGUMENT -> argument((ArgumentNode) node);
            case COEFFICIENT -> coefficient((CoefficientNode) node);
        };
    }

    private List<CodeMap> visitAll(List<FormNode> operands) {
        List<CodeMap> maps = new ArrayList<>(operands.size());
        for (FormNode operand : operands) {
            maps.add(transform(operand));
        }
        return maps;
    }

    private CodeMap division(FormNode node) {
        if (node.operands().size() != 2) {
            throw new UnsupportedExpressionError(
                    "Expected exactly two operands (numerator and denominator), got " + node.operands().size(),
                    node.toString());
        }
        CodeMap numerator = transform(node.operands().get(0));
        CodeMap denominatorCode = transform(node.operands().get(1));
        if (!denominatorCode.isEmpty() && !denominatorCode.isScalar()) {
            throw new UnsupportedDenominatorError(
                    "Denominator must reduce to a scalar, got " + denominatorCode.size() + " indexed entries",
                    node.operands().get(1).toString());
        }
        Expr denominator = denominatorCode.isEmpty() ? sym.zero() : denominatorCode.scalar();
        if (denominator.isZero()) {
            throw new DivisionError("Division by zero", node.toString());
        }
        return numerator.mapValues(v -> sym.fraction(v, denominator));
    }

    private CodeMap power(PowerNode node) {
        Expr base = scalarOperand(transform(node.base()), "Power base", node);
        FormNode exponentNode = node.exponent();
        if (exponentNode instanceof ScalarNode && ((ScalarNode) exponentNode).integer()
                && Math.abs(((ScalarNode) exponentNode).value()) <= MAX_EXPANDED_POWER) {
            return CodeMap.scalar(integerPower(base, (int) ((ScalarNode) exponentNode).value(), node));
        }
        Expr exponent = scalarOperand(transform(exponentNode), "Power exponent", node);
        if (base.kind() == Expr.Kind.FLOAT && exponent.kind() == Expr.Kind.FLOAT) {
            double b = ((FloatValue) base).value();
            double e = ((FloatValue) exponent).value();
            if (base.isZero() && e < 0.0) {
                throw new DivisionError("Negative power of zero", node.toString());
            }
            double folded = Math.pow(b, e);
            if (Double.isFinite(folded)) {
                return CodeMap.scalar(sym.floatValue(folded));
            }
        }
        String rendered = exponent.kind() == Expr.Kind.FLOAT
                ? format.power(base.key(), format.floatValue(((FloatValue) exponent).value()))
                : format.power(base.key(), exponent.key());
        List<Expr> arguments = exponent.kind() == Expr.Kind.FLOAT ? List.of(base) : List.of(base, exponent);
        return CodeMap.scalar(sym.call(rendered, Domain.widest(base.domain(), exponent.domain()), arguments, 1));
    }

    private Expr integerPower(Expr base, int exponent, FormNode node) {
        if (exponent == 0) {
            return sym.one();
        }
        Expr repeated = sym.product(Collections.nCopies(Math.abs(exponent), base));
        if (exponent > 0) {
            return repeated;
        }
        if (repeated.isZero()) {
            throw new DivisionError("Negative power of zero", node.toString());
        }
        return sym.fraction(sym.one(), repeated);
    }

    private CodeMap abs(AbsNode node) {
        Expr value = singleScalarOperand(node, "Abs");
        if (value.kind() == Expr.Kind.FLOAT) {
            return CodeMap.scalar(sym.floatValue(Math.abs(((FloatValue) value).value())));
        }
        return CodeMap.scalar(sym.call(format.absoluteValue(value.key()), value.domain(), List.of(value), 1));
    }

    private CodeMap mathFunction(MathFunctionNode node) {
        MathFunction function = node.function();
        Expr value = singleScalarOperand(node, function.cName());
        if (value.kind() == Expr.Kind.FLOAT && function.canFold()) {
            double folded = function.apply(((FloatValue) value).value());
            // outside the domain (sqrt(-1), log(0)) the call is emitted as written
            if (Double.isFinite(folded)) {
                return CodeMap.scalar(sym.floatValue(folded));
            }
        }
        return CodeMap.scalar(sym.call(format.mathFunction(function, value.key()), value.domain(), List.of(value), 1));
    }

    private CodeMap indexSum(IndexSumNode node) {
        if (bindings.containsKey(node.index())) {
            throw new UnsupportedExpressionError("Index '" + node.index() + "' shadows an enclosing index sum", node.toString());
        }
        List<CodeMap> terms = new ArrayList<>(node.range());
        try {
            for (int value = 0; value < node.range(); value++) {
                bindings.put(node.index(), value);
                terms.add(transform(node.summand()));
            }
        } finally {
            bindings.remove(node.index());
        }
        return permutations.sum(terms);
    }

    private CodeMap facetNormal(FacetNormalNode node) {
        if (ctx.type() == IntegralType.CELL) {
            throw new UnsupportedExpressionError("Facet normal used in a cell integral", node.toString());
        }
        if (node.component().size() != 1) {
            throw new UnsupportedExpressionError(
                    "Facet normal expects 1 component index, got " + node.component().size(), node.toString());
        }
        checkRestriction(node.restriction(), node);
        int component = node.component().get(0).resolve(bindings);
        if (component >= ctx.geometricDimension()) {
            throw new UnsupportedExpressionError(
                    "Facet normal component " + component + " out of range", node.toString());
        }
        return CodeMap.scalar(sym.symbol(format.normalComponent(node.restriction(), component), Domain.GEO));
    }

    private CodeMap argument(ArgumentNode node) {
        checkRestriction(node.restriction(), node);
        int component = flatComponent(node.component(), node);
        return resolver.resolveArgument(
                node.argument(), component, directions(node.derivatives(), node), node.restriction(), ctx);
    }

    private CodeMap coefficient(CoefficientNode node) {
        checkRestriction(node.restriction(), node);
        int component = flatComponent(node.component(), node);
        return CodeMap.scalar(resolver.resolveCoefficient(
                node.coefficient(), component, directions(node.derivatives(), node), node.restriction(), ctx));
    }

    private void checkRestriction(Restriction restriction, FormNode node) {
        if (restriction.isRestricted() && ctx.type() != IntegralType.INTERIOR_FACET) {
            throw new UnsupportedExpressionError(
                    "Restricted function outside an interior facet integral", node.toString());
        }
    }

    /** Flattens a component multi-index: none is 0, one is itself, two are row-major. */
    private int flatComponent(List<IndexValue> component, FormNode node) {
        switch (component.size()) {
            case 0:
                return 0;
            case 1:
                return component.get(0).resolve(bindings);
            case 2:
                return component.get(0).resolve(bindings) * ctx.geometricDimension() + component.get(1).resolve(bindings);
            default:
                throw new UnsupportedExpressionError(
                        "Components of rank " + component.size() + " are not supported", node.toString());
        }
    }

    private List<Integer> directions(List<IndexValue> derivatives, FormNode node) {
        List<Integer> directions = new ArrayList<>(derivatives.size());
        for (IndexValue derivative : derivatives) {
            int direction = derivative.resolve(bindings);
            if (direction >= ctx.geometricDimension()) {
                throw new UnsupportedExpressionError(
                        "Derivative direction " + direction + " out of range for dimension " + ctx.geometricDimension(),
                        node.toString());
            }
            directions.add(direction);
        }
        return directions;
    }

    private Expr singleScalarOperand(FormNode node, String what) {
        if (node.operands().size() != 1) {
            throw new UnsupportedExpressionError(
                    what + " expects one operand, got " + node.operands().size(), node.toString());
        }
        return scalarOperand(transform(node.operands().get(0)), what + " operand", node);
    }

    private Expr scalarOperand(CodeMap code, String what, FormNode node) {
        if (code.isEmpty()) {
            return sym.zero();
        }
        if (!code.isScalar()) {
            throw new UnsupportedExpressionError(what + " must reduce to a scalar", node.toString());
        }
        return code.scalar();
    }
}
