package io.quadc.core.engine;

import io.quadc.core.config.CompilerOptions;
import io.quadc.core.format.FormatRegistry;
import io.quadc.core.spi.SymbolFormat;
import io.quadc.core.spi.Tabulator;
import io.quadc.core.symbolic.Domain;
import io.quadc.core.symbolic.Symbol;
import io.quadc.core.symbolic.Symbolics;
import io.quadc.core.tables.BasisTableRegistry;

/** Per-form compiler collaborators wired the way {@link FormCompiler} wires them. */
final class EngineFixture {

    final CompilerOptions options;
    final SymbolFormat format;
    final Symbolics sym;
    final BasisTableRegistry tables;
    final CoefficientRegistry coefficients;
    final BasisResolver resolver;
    final EntryBuilder entryBuilder;

    EngineFixture(Tabulator tabulator) {
        this(tabulator, CompilerOptions.DEFAULT);
    }

    EngineFixture(Tabulator tabulator, CompilerOptions options) {
        this.options = options;
        this.format = FormatRegistry.withDefaults(options).requireFormat(options.format());
        this.sym = new Symbolics(format::floatValue, options.epsilon());
        this.tables = new BasisTableRegistry(tabulator, options.epsilon());
        this.coefficients = new CoefficientRegistry(sym, format);
        this.resolver = new BasisResolver(sym, format, tables, coefficients, options);
        this.entryBuilder = new EntryBuilder(sym, tables, coefficients, options);
    }

    QuadratureTransformer transformer(IntegrationContext ctx) {
        return new QuadratureTransformer(sym, resolver, format, ctx);
    }

    IntegralCompiler integralCompiler() {
        return new IntegralCompiler(sym, format, resolver, entryBuilder);
    }

    Symbol geo(String name) {
        return sym.symbol(name, Domain.GEO);
    }

    Symbol basis(String name) {
        return sym.symbol(name, Domain.BASIS);
    }
}
