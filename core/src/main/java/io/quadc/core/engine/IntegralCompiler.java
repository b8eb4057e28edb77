package io.quadc.core.engine;

import io.quadc.core.index.CodeMap;
import io.quadc.core.index.IndexKey;
import io.quadc.core.model.CellShape;
import io.quadc.core.model.Integral;
import io.quadc.core.model.IntegralType;
import io.quadc.core.model.QuadratureRule;
import io.quadc.core.spi.SymbolFormat;
import io.quadc.core.symbolic.CseCaches;
import io.quadc.core.symbolic.Domain;
import io.quadc.core.symbolic.Expr;
import io.quadc.core.symbolic.Symbolics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles one integral: cell integrals once, exterior facet integrals once per local facet and
 * interior facet integrals once per pair of local facets. Every combination gets fresh
 * common-subexpression caches.
 */
public final class IntegralCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(IntegralCompiler.class);

    private final Symbolics sym;
    private final SymbolFormat format;
    private final BasisResolver resolver;
    private final EntryBuilder entryBuilder;

    public IntegralCompiler(Symbolics sym, SymbolFormat format, BasisResolver resolver, EntryBuilder entryBuilder) {
        this.sym = sym;
        this.format = format;
        this.resolver = resolver;
        this.entryBuilder = entryBuilder;
    }

    /**
     * @throws io.quadc.core.error.FormCompileException if the integrand cannot be compiled
     */
    public List<IntegralCode> compile(Integral integral, CellShape cell) {
        List<IntegralCode> codes = new ArrayList<>();
        QuadratureRule rule = integral.rule();
        int dim = cell.geometricDimension();
        switch (integral.type()) {
            case CELL -> codes.add(compile(integral, IntegrationContext.cell(rule.points(), dim)));
            case EXTERIOR_FACET -> {
                for (int facet = 0; facet < cell.numFacets(); facet++) {
                    codes.add(compile(
                            integral, new IntegrationContext(IntegralType.EXTERIOR_FACET, rule.points(), facet, -1, dim)));
                }
            }
            case INTERIOR_FACET -> {
                for (int facet0 = 0; facet0 < cell.numFacets(); facet0++) {
                    for (int facet1 = 0; facet1 < cell.numFacets(); facet1++) {
                        codes.add(compile(
                                integral,
                                new IntegrationContext(IntegralType.INTERIOR_FACET, rule.points(), facet0, facet1, dim)));
                    }
                }
            }
        }
        return codes;
    }

    IntegralCode compile(Integral integral, IntegrationContext ctx) {
        LOG.debug(
                "Compiling {} integral: points={}, facet0={}, facet1={}",
                ctx.type(),
                ctx.points(),
                ctx.facet0(),
                ctx.facet1());
        QuadratureTransformer transformer = new QuadratureTransformer(sym, resolver, format, ctx);
        CodeMap code = transformer.transform(integral.integrand());

        CseCaches caches = new CseCaches();
        Expr weight = weight(integral.rule());
        Expr scale = sym.symbol(format.scaleFactor(ctx.type()), Domain.GEO);

        Map<IndexKey, Entry> entries = new LinkedHashMap<>();
        Set<String> usedTables = new TreeSet<>();
        int ops = 0;
        for (Map.Entry<IndexKey, Expr> e : code.entries().entrySet()) {
            Entry entry = entryBuilder.buildEntry(e.getValue(), weight, scale, caches);
            if (entry.zero()) {
                continue;
            }
            entries.put(e.getKey(), entry);
            usedTables.addAll(entry.usedTables());
            ops += entry.value().ops();
        }
        ops += caches.totalOps();
        LOG.debug(
                "Compiled {} integral: entries={}, omitted={}, temporaries={}, ops={}",
                ctx.type(),
                entries.size(),
                code.size() - entries.size(),
                caches.definitions().size(),
                ops);
        return new IntegralCode(
                ctx.type(), ctx.points(), ctx.facet0(), ctx.facet1(), entries, caches.definitions(), usedTables, ops);
    }

    /** Literal weight for one-point rules, otherwise the weight table at the current point. */
    private Expr weight(QuadratureRule rule) {
        if (rule.isSinglePoint()) {
            return sym.floatValue(rule.weights().get(0));
        }
        return sym.symbol(format.weight(rule.points(), format.integrationPoint()), Domain.IP);
    }
}
