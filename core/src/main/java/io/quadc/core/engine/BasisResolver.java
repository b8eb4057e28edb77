package io.quadc.core.engine;

import io.quadc.core.config.CompilerOptions;
import io.quadc.core.error.UnsupportedExpressionError;
import io.quadc.core.error.UnsupportedMappingError;
import io.quadc.core.index.BasisIndex;
import io.quadc.core.index.CodeMap;
import io.quadc.core.index.IndexExpr;
import io.quadc.core.index.IndexKey;
import io.quadc.core.model.Argument;
import io.quadc.core.model.Coefficient;
import io.quadc.core.model.FiniteElement;
import io.quadc.core.model.FiniteElement.ComponentInfo;
import io.quadc.core.model.MappingKind;
import io.quadc.core.model.Restriction;
import io.quadc.core.model.TransformKind;
import io.quadc.core.spi.SymbolFormat;
import io.quadc.core.symbolic.Domain;
import io.quadc.core.symbolic.Expr;
import io.quadc.core.symbolic.Symbolics;
import io.quadc.core.tables.BasisTable;
import io.quadc.core.tables.BasisTableRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates test/trial functions and coefficients at a quadrature point: looks up the basis
 * tables, applies the value mapping of the element and the chain rule for derivatives, and
 * short-circuits all-zero and all-ones tables.
 */
public final class BasisResolver {

    private final Symbolics sym;
    private final SymbolFormat format;
    private final BasisTableRegistry tables;
    private final CoefficientRegistry coefficients;
    private final CompilerOptions options;

    public BasisResolver(
            Symbolics sym,
            SymbolFormat format,
            BasisTableRegistry tables,
            CoefficientRegistry coefficients,
            CompilerOptions options) {
        this.sym = sym;
        this.format = format;
        this.tables = tables;
        this.coefficients = coefficients;
        this.options = options;
    }

    /**
     * Resolves a (derivative of a) test or trial function component to a code map keyed by the
     * placement of the function's basis index.
     *
     * @param component  flattened value component
     * @param directions physical derivative directions, in order
     * @throws UnsupportedMappingError if the element's mapping is not supported
     */
    public CodeMap resolveArgument(
            Argument argument, int component, List<Integer> directions, Restriction restriction, IntegrationContext ctx) {
        FiniteElement element = argument.element();
        ComponentInfo info = element.componentInfo(component);
        MappingKind mapping = requireSupported(info.element());

        Map<IndexKey, List<Expr>> code = new LinkedHashMap<>();
        for (int[] multi : multiIndices(directions.size(), ctx.geometricDimension())) {
            int[] counts = derivativeCounts(multi, ctx.geometricDimension());
            if (mapping == MappingKind.AFFINE) {
                MappedBasis basis = mapBasis(argument, component, counts, restriction, ctx);
                add(code, basis.key(), applyTransform(basis.value(), directions, multi, restriction));
            } else {
                for (int c = 0; c < ctx.geometricDimension(); c++) {
                    MappedBasis basis = mapBasis(argument, c + info.offset(), counts, restriction, ctx);
                    Expr mapped = piola(mapping, c, info.localComponent(), restriction, basis.value());
                    add(code, basis.key(), applyTransform(mapped, directions, multi, restriction));
                }
            }
        }
        Map<IndexKey, Expr> result = new LinkedHashMap<>();
        for (Map.Entry<IndexKey, List<Expr>> e : code.entrySet()) {
            result.put(e.getKey(), sym.sum(e.getValue()));
        }
        return CodeMap.of(result);
    }

    /**
     * Resolves a (derivative of a) coefficient component to a scalar. Each distinct dof sum is
     * registered as a named coefficient value; the result is literal zero if every table
     * involved is zero.
     */
    public Expr resolveCoefficient(
            Coefficient coefficient,
            int component,
            List<Integer> directions,
            Restriction restriction,
            IntegrationContext ctx) {
        FiniteElement element = coefficient.element();
        if (element.isQuadrature()) {
            if (!directions.isEmpty()) {
                throw new UnsupportedExpressionError(
                        "Derivatives of quadrature element coefficients are not supported", element.toString());
            }
            return sym.symbol(format.coefficientDof(coefficient.number(), pointIndex(ctx)), Domain.IP);
        }
        ComponentInfo info = element.componentInfo(component);
        MappingKind mapping = requireSupported(info.element());

        List<Expr> terms = new ArrayList<>();
        for (int[] multi : multiIndices(directions.size(), ctx.geometricDimension())) {
            int[] counts = derivativeCounts(multi, ctx.geometricDimension());
            if (mapping == MappingKind.AFFINE) {
                Expr value = functionValue(coefficient, component, counts, restriction, ctx);
                if (value != null) {
                    terms.add(applyTransform(value, directions, multi, restriction));
                }
            } else {
                for (int c = 0; c < ctx.geometricDimension(); c++) {
                    Expr value = functionValue(coefficient, c + info.offset(), counts, restriction, ctx);
                    if (value != null) {
                        Expr mapped = piola(mapping, c, info.localComponent(), restriction, value);
                        terms.add(applyTransform(mapped, directions, multi, restriction));
                    }
                }
            }
        }
        return sym.sum(terms);
    }

    /** Point index in table accesses: literal {@code 0} for one-point rules. */
    String pointIndex(IntegrationContext ctx) {
        return ctx.points() == 1 ? "0" : format.integrationPoint();
    }

    private MappingKind requireSupported(FiniteElement leaf) {
        MappingKind mapping = leaf.mapping();
        if (mapping == null || !mapping.isSupported()) {
            throw new UnsupportedMappingError("Mapping is not supported: " + mapping, leaf.toString());
        }
        return mapping;
    }

    /** Looks up one basis table and places the basis function in the element tensor. */
    private MappedBasis mapBasis(
            Argument argument, int component, int[] counts, Restriction restriction, IntegrationContext ctx) {
        BasisTable table = tables.resolve(
                argument.element(), component, counts, ctx.type(), ctx.facetOf(restriction), ctx.points());
        String loopIndex = format.freeIndex(argument.freeIndexPosition());
        IndexExpr map = IndexExpr.variable(loopIndex);
        int loopRange = table.loopRange();

        Expr basis;
        if (table.zeros() && options.dropsZeroTables()) {
            basis = sym.zero();
        } else if (options.ignoreOnes() && loopRange == 1 && table.ones()) {
            basis = sym.one();
            map = IndexExpr.constant(0);
        } else {
            String access = format.psiAccess(table.name(), pointIndex(ctx), loopIndex);
            basis = sym.symbol(access, Domain.BASIS);
            tables.recordAccess(access, table.name());
        }

        if (table.isCompressed()) {
            map = map.isConstant()
                    ? IndexExpr.constant(table.nonzeroColumns().columns().get(map.offset()))
                    : map.through(format.nonzeroColumns(table.nonzeroColumns().number()));
        }
        int spaceDimension = table.spaceDimension();
        if (restriction.isRestricted()) {
            map = map.plus(table.restrictionOffset(restriction));
            spaceDimension *= 2;
        }
        BasisIndex index = new BasisIndex(argument.number(), map, loopRange, spaceDimension);
        return new MappedBasis(IndexKey.of(index), basis);
    }

    /**
     * Value of a coefficient component at the current point: the sum of its dofs weighted by
     * the table columns, or {@code null} if the table is dropped as zero.
     */
    private Expr functionValue(
            Coefficient coefficient, int component, int[] counts, Restriction restriction, IntegrationContext ctx) {
        BasisTable table = tables.resolve(
                coefficient.element(), component, counts, ctx.type(), ctx.facetOf(restriction), ctx.points());
        if (table.zeros() && options.dropsZeroTables()) {
            return null;
        }
        boolean unitTable = options.ignoreOnes() && table.loopRange() == 1 && table.ones();
        int offset = table.restrictionOffset(restriction);
        List<Expr> terms = new ArrayList<>(table.loopRange());
        for (int r = 0; r < table.loopRange(); r++) {
            int column = table.isCompressed() ? table.nonzeroColumns().columns().get(r) : r;
            Expr dof = sym.symbol(
                    format.coefficientDof(coefficient.number(), Integer.toString(column + offset)), Domain.GEO);
            if (unitTable) {
                terms.add(dof);
            } else {
                String access = format.psiAccess(table.name(), pointIndex(ctx), Integer.toString(r));
                tables.recordAccess(access, table.name());
                terms.add(sym.product(dof, sym.symbol(access, Domain.IP)));
            }
        }
        Expr value = sym.sum(terms);
        return value.isComposite() ? coefficients.register(value) : value;
    }

    private Expr piola(MappingKind mapping, int c, int localComponent, Restriction restriction, Expr basis) {
        return switch (mapping) {
            case COVARIANT_PIOLA -> sym.product(
                    sym.symbol(format.transform(TransformKind.JINV, c, localComponent, restriction), Domain.GEO), basis);
            case CONTRAVARIANT_PIOLA -> sym.product(
                    sym.fraction(sym.one(), sym.symbol(format.determinant(restriction), Domain.GEO)),
                    sym.symbol(format.transform(TransformKind.J, c, localComponent, restriction), Domain.GEO),
                    basis);
            default -> throw new UnsupportedMappingError("Mapping is not supported: " + mapping);
        };
    }

    /** Chain rule: one inverse-Jacobian factor per derivative direction. */
    private Expr applyTransform(Expr value, List<Integer> directions, int[] multi, Restriction restriction) {
        if (directions.isEmpty()) {
            return value;
        }
        List<Expr> factors = new ArrayList<>(directions.size() + 1);
        for (int i = 0; i < directions.size(); i++) {
            factors.add(sym.symbol(
                    format.transform(TransformKind.JINV, multi[i], directions.get(i), restriction), Domain.GEO));
        }
        factors.add(value);
        return sym.product(factors);
    }

    private static void add(Map<IndexKey, List<Expr>> code, IndexKey key, Expr value) {
        code.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    /** All reference-direction tuples of the given length. */
    static List<int[]> multiIndices(int length, int dimension) {
        List<int[]> result = new ArrayList<>();
        result.add(new int[0]);
        for (int i = 0; i < length; i++) {
            List<int[]> next = new ArrayList<>(result.size() * dimension);
            for (int[] prefix : result) {
                for (int d = 0; d < dimension; d++) {
                    int[] extended = Arrays.copyOf(prefix, prefix.length + 1);
                    extended[prefix.length] = d;
                    next.add(extended);
                }
            }
            result = next;
        }
        return result;
    }

    private static int[] derivativeCounts(int[] multi, int dimension) {
        int[] counts = new int[dimension];
        for (int d : multi) {
            counts[d]++;
        }
        return counts;
    }

    private record MappedBasis(IndexKey key, Expr value) {}
}
