package io.quadc.core.engine;

import io.quadc.core.config.CompilerOptions;
import io.quadc.core.error.FormCompileException;
import io.quadc.core.format.FormatRegistry;
import io.quadc.core.model.Form;
import io.quadc.core.model.Integral;
import io.quadc.core.spi.CompilationListener;
import io.quadc.core.spi.SymbolFormat;
import io.quadc.core.spi.Tabulator;
import io.quadc.core.symbolic.Symbolics;
import io.quadc.core.tables.BasisTableRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point: compiles forms to {@link FormCode}.
 *
 * <p>A form either compiles completely or is rejected as a whole. When several forms are
 * compiled, a rejected form is reported and the remaining forms are still compiled. Every
 * mutable cache (basis tables, coefficient values, hoisted temporaries) belongs to one form, so
 * independent forms may be compiled in parallel with one compiler instance.
 *
 * <p>While a form is compiled its name is available in the SLF4J MDC under {@value #MDC_FORM}.
 */
public final class FormCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(FormCompiler.class);

    /** MDC key holding the name of the form being compiled. */
    public static final String MDC_FORM = "form";

    private final Tabulator tabulator;
    private final CompilerOptions options;
    private final SymbolFormat format;
    private final Symbolics sym;
    private final CompilationListener listener;

    /** Creates a compiler using the format named in {@code options} (no listener). */
    public FormCompiler(Tabulator tabulator, CompilerOptions options) {
        this(tabulator, options, FormatRegistry.withDefaults(options).requireFormat(options.format()), null);
    }

    /**
     * @param listener optional listener for compilation lifecycle events, may be {@code null}
     */
    public FormCompiler(Tabulator tabulator, CompilerOptions options, SymbolFormat format, CompilationListener listener) {
        this.tabulator = Objects.requireNonNull(tabulator, "tabulator must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.sym = new Symbolics(format::floatValue, options.epsilon());
        this.listener = listener;
    }

    /**
     * Compiles one form.
     *
     * @throws FormCompileException if the form cannot be compiled
     */
    public FormCode compile(Form form) {
        Objects.requireNonNull(form, "form must not be null");
        MDC.put(MDC_FORM, form.name());
        try {
            return compileInternal(form);
        } finally {
            MDC.remove(MDC_FORM);
        }
    }

    /** Compiles forms in order, isolating failures per form. One result per form, in input order. */
    public List<CompilationResult> compileAll(List<Form> forms) {
        List<CompilationResult> results = new ArrayList<>(forms.size());
        for (Form form : forms) {
            results.add(compileSafely(form));
        }
        return results;
    }

    /** Like {@link #compileAll(List)} but compiles the forms concurrently. */
    public List<CompilationResult> compileAllParallel(List<Form> forms) {
        return forms.parallelStream().map(this::compileSafely).collect(Collectors.toList());
    }

    private CompilationResult compileSafely(Form form) {
        try {
            return CompilationResult.success(compile(form));
        } catch (FormCompileException e) {
            return CompilationResult.rejected(form.name(), e);
        }
    }

    private FormCode compileInternal(Form form) {
        long start = System.nanoTime();
        notifyStarted(form);

        BasisTableRegistry tables = new BasisTableRegistry(tabulator, options.epsilon());
        CoefficientRegistry coefficients = new CoefficientRegistry(sym, format);
        BasisResolver resolver = new BasisResolver(sym, format, tables, coefficients, options);
        EntryBuilder entryBuilder = new EntryBuilder(sym, tables, coefficients, options);
        IntegralCompiler integralCompiler = new IntegralCompiler(sym, format, resolver, entryBuilder);

        List<IntegralCode> codes = new ArrayList<>();
        try {
            for (Integral integral : form.integrals()) {
                codes.addAll(integralCompiler.compile(integral, form.cell()));
            }
        } catch (FormCompileException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.warn(
                    "form.rejected form={} error={} detail={} context={}",
                    form.name(),
                    e.getClass().getSimpleName(),
                    e.detail(),
                    e.context());
            notifyRejected(form, e, durationMs);
            throw e;
        }

        FormCode code = new FormCode(
                form.name(), codes, coefficients.definitions(), tables.allUniqueTables(), tables.nonzeroColumns());
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        LOG.info(
                "form.compiled form={} integrals={} entries={} ops={} duration_ms={}",
                form.name(),
                codes.size(),
                code.entryCount(),
                code.ops(),
                durationMs);
        notifyCompiled(code, durationMs);
        return code;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they must not affect compilation.

    private void notifyStarted(Form form) {
        if (listener == null) return;
        try {
            listener.onFormStarted(
                    new CompilationListener.FormStartedEvent(form.name(), form.integrals().size()));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onFormStarted failed", e);
        }
    }

    private void notifyCompiled(FormCode code, long durationMs) {
        if (listener == null) return;
        try {
            listener.onFormCompiled(new CompilationListener.FormCompiledEvent(
                    code.formName(), code.integrals().size(), code.entryCount(), code.ops(), durationMs));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onFormCompiled failed", e);
        }
    }

    private void notifyRejected(Form form, FormCompileException error, long durationMs) {
        if (listener == null) return;
        try {
            listener.onFormRejected(new CompilationListener.FormRejectedEvent(
                    form.name(), error.getClass().getSimpleName(), error.detail(), error.context(), durationMs));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onFormRejected failed", e);
        }
    }
}
