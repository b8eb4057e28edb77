package io.quadc.core.engine;

import static io.quadc.core.form.Forms.divide;
import static io.quadc.core.form.Forms.fixed;
import static io.quadc.core.form.Forms.i;
import static io.quadc.core.form.Forms.indexSum;
import static io.quadc.core.form.Forms.power;
import static io.quadc.core.form.Forms.product;
import static io.quadc.core.form.Forms.sum;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.quadc.core.config.CompilerOptions;
import io.quadc.core.error.UnsupportedDenominatorError;
import io.quadc.core.form.ArgumentNode;
import io.quadc.core.form.CoefficientNode;
import io.quadc.core.format.FormatRegistry;
import io.quadc.core.model.Argument;
import io.quadc.core.model.CellShape;
import io.quadc.core.model.Coefficient;
import io.quadc.core.model.FiniteElement;
import io.quadc.core.model.Form;
import io.quadc.core.model.Integral;
import io.quadc.core.model.IntegralType;
import io.quadc.core.model.QuadratureRule;
import io.quadc.core.spi.CompilationListener;
import io.quadc.core.spi.CompilationListener.FormCompiledEvent;
import io.quadc.core.spi.CompilationListener.FormRejectedEvent;
import io.quadc.core.spi.CompilationListener.FormStartedEvent;
import io.quadc.core.symbolic.Expr;
import io.quadc.core.testkit.P1Tabulator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Tests for {@link FormCompiler}: whole forms, failure isolation, logging and listeners. */
@DisplayName("FormCompilerTest")
class FormCompilerTest {

    private static final FiniteElement P1 = FiniteElement.lagrange(CellShape.TRIANGLE, 1);
    private static final QuadratureRule ONE_POINT = QuadratureRule.of(0.5);

    private static final ArgumentNode V = ArgumentNode.of(new Argument(0, P1));
    private static final ArgumentNode U = ArgumentNode.of(new Argument(1, P1));

    static Form laplace(String name) {
        return new Form(
                name,
                CellShape.TRIANGLE,
                List.of(new Integral(
                        IntegralType.CELL, ONE_POINT, indexSum("i", 2, product(V.dx(i("i")), U.dx(i("i")))))));
    }

    static Form indexedDenominator(String name) {
        return new Form(
                name,
                CellShape.TRIANGLE,
                List.of(new Integral(IntegralType.CELL, ONE_POINT, divide(U, sum(V, V.dx(fixed(0)))))));
    }

    @Nested
    @DisplayName("Compilation")
    class Compilation {

        private final FormCompiler compiler = new FormCompiler(new P1Tabulator(), CompilerOptions.DEFAULT);

        @Test
        @DisplayName("Laplace on P1 triangles")
        void laplaceForm() {
            FormCode code = compiler.compile(laplace("laplace"));

            assertThat(code.formName()).isEqualTo("laplace");
            assertThat(code.integrals()).hasSize(1);
            assertThat(code.entryCount()).isEqualTo(4);
            assertThat(code.coefficients()).isEmpty();
            assertThat(code.tables()).containsOnlyKeys(1);
            assertThat(code.tables().get(1)).containsOnlyKeys("FE0_D10");
            assertThat(code.tables().get(1).get("FE0_D10")).isDeepEqualTo(new double[][] {{-1.0, 1.0}});
            assertThat(code.nonzeroColumns()).hasSize(2);
            assertThat(code.ops()).isEqualTo(code.integrals().get(0).ops());
        }

        @Test
        @DisplayName("Caches are per form: compiling twice gives equal code")
        void repeatable() {
            FormCode first = compiler.compile(laplace("laplace"));
            FormCode second = compiler.compile(laplace("laplace"));

            assertThat(second.integrals().get(0).entries()).isEqualTo(first.integrals().get(0).entries());
            assertThat(second.integrals().get(0).definitions()).isEqualTo(first.integrals().get(0).definitions());
        }

        @Test
        @DisplayName("A failing form throws its error")
        void rejectedForm() {
            assertThatThrownBy(() -> compiler.compile(indexedDenominator("bad")))
                    .isInstanceOf(UnsupportedDenominatorError.class);
        }

        @Test
        @DisplayName("compileAll isolates failures and keeps input order")
        void compileAll() {
            List<CompilationResult> results =
                    compiler.compileAll(List.of(indexedDenominator("bad"), laplace("good")));

            assertThat(results).extracting(CompilationResult::type)
                    .containsExactly(CompilationResult.Type.REJECTED, CompilationResult.Type.SUCCESS);
            assertThat(results.get(0).error()).isInstanceOf(UnsupportedDenominatorError.class);
            assertThat(results.get(0).code()).isNull();
            assertThat(results.get(1).code().entryCount()).isEqualTo(4);
            assertThat(results.get(0).toString())
                    .isEqualTo("CompilationResult[REJECTED, form=bad, error=UnsupportedDenominatorError]");
            assertThat(results.get(1).toString()).isEqualTo("CompilationResult[SUCCESS, form=good, entries=4]");
        }

        @Test
        @DisplayName("Extreme integer exponents compile to a power call and do not stop later forms")
        void extremeExponent() {
            var f = CoefficientNode.of(new Coefficient(0, P1));
            var extreme = new Form(
                    "extreme",
                    CellShape.TRIANGLE,
                    List.of(new Integral(IntegralType.CELL, ONE_POINT, product(power(f, Integer.MIN_VALUE), V))));

            List<CompilationResult> results = compiler.compileAll(List.of(extreme, laplace("good")));

            assertThat(results).extracting(CompilationResult::type)
                    .containsExactly(CompilationResult.Type.SUCCESS, CompilationResult.Type.SUCCESS);
            IntegralCode code = results.get(0).code().integrals().get(0);
            String rendered = Stream.concat(
                            code.definitions().values().stream(),
                            code.entries().values().stream().map(Entry::value))
                    .map(Expr::key)
                    .collect(Collectors.joining(" "));
            assertThat(rendered).contains("std::pow(F0, ");
            assertThat(results.get(1).code().entryCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("compileAllParallel returns results in input order")
        void compileAllParallel() {
            List<Form> forms = IntStream.range(0, 16)
                    .mapToObj(n -> n % 4 == 0 ? indexedDenominator("form" + n) : laplace("form" + n))
                    .collect(Collectors.toList());

            List<CompilationResult> results = compiler.compileAllParallel(forms);

            assertThat(results).extracting(CompilationResult::formName)
                    .containsExactlyElementsOf(forms.stream().map(Form::name).collect(Collectors.toList()));
            assertThat(results).filteredOn(CompilationResult::isRejected).hasSize(4);
            assertThat(results).filteredOn(CompilationResult::isSuccess)
                    .allSatisfy(r -> assertThat(r.code().entryCount()).isEqualTo(4));
        }

        @Test
        @DisplayName("The configured format names the scale factor")
        void dolfinFormat() {
            var options = CompilerOptions.builder().format("dolfin").build();
            FormCode code = new FormCompiler(new P1Tabulator(), options).compile(laplace("laplace"));

            assertThat(code.integrals().get(0).definitions().values())
                    .allSatisfy(definition -> assertThat(definition.key()).contains("map.scale"));
        }

        @Test
        @DisplayName("Unknown format → IllegalArgumentException")
        void unknownFormat() {
            var options = CompilerOptions.builder().format("fortran").build();

            assertThatThrownBy(() -> new FormCompiler(new P1Tabulator(), options))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("fortran");
        }
    }

    @Nested
    @DisplayName("Structured logging")
    class StructuredLogging {

        private final FormCompiler compiler = new FormCompiler(new P1Tabulator(), CompilerOptions.DEFAULT);
        private ListAppender<ILoggingEvent> logAppender;
        private Logger compilerLogger;

        @BeforeEach
        void attachAppender() {
            compilerLogger = (Logger) LoggerFactory.getLogger(FormCompiler.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            compilerLogger.addAppender(logAppender);
        }

        @AfterEach
        void detachAppender() {
            compilerLogger.detachAppender(logAppender);
            logAppender.stop();
        }

        private List<ILoggingEvent> events(String marker) {
            return logAppender.list.stream()
                    .filter(e -> e.getMessage() != null && e.getMessage().startsWith(marker))
                    .collect(Collectors.toList());
        }

        @Test
        @DisplayName("Compiled form → one INFO form.compiled entry with the form in the MDC")
        void compiledEntry() {
            compiler.compile(laplace("laplace"));

            List<ILoggingEvent> compiled = events("form.compiled");
            assertThat(compiled).hasSize(1);
            ILoggingEvent event = compiled.get(0);
            assertThat(event.getLevel()).isEqualTo(Level.INFO);
            assertThat(event.getFormattedMessage()).contains("form=laplace", "integrals=1", "entries=4");
            assertThat(event.getMDCPropertyMap()).containsEntry(FormCompiler.MDC_FORM, "laplace");
            assertThat(MDC.get(FormCompiler.MDC_FORM)).isNull();
        }

        @Test
        @DisplayName("Rejected form → one WARN form.rejected entry naming the error")
        void rejectedEntry() {
            compiler.compileAll(List.of(indexedDenominator("bad")));

            List<ILoggingEvent> rejected = events("form.rejected");
            assertThat(rejected).hasSize(1);
            assertThat(rejected.get(0).getLevel()).isEqualTo(Level.WARN);
            assertThat(rejected.get(0).getFormattedMessage())
                    .contains("form=bad", "error=UnsupportedDenominatorError");
            assertThat(events("form.compiled")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Listeners")
    @ExtendWith(MockitoExtension.class)
    class Listeners {

        @Mock
        CompilationListener listener;

        private FormCompiler compilerWith(CompilationListener l) {
            var options = CompilerOptions.DEFAULT;
            return new FormCompiler(
                    new P1Tabulator(), options, FormatRegistry.withDefaults(options).requireFormat("ufc"), l);
        }

        @Test
        @DisplayName("Started and compiled events describe the form")
        void compiledEvents() {
            compilerWith(listener).compile(laplace("laplace"));

            verify(listener).onFormStarted(new FormStartedEvent("laplace", 1));
            ArgumentCaptor<FormCompiledEvent> captor = ArgumentCaptor.forClass(FormCompiledEvent.class);
            verify(listener).onFormCompiled(captor.capture());
            assertThat(captor.getValue().formName()).isEqualTo("laplace");
            assertThat(captor.getValue().entries()).isEqualTo(4);
            assertThat(captor.getValue().integralCodes()).isEqualTo(1);
            verify(listener, never()).onFormRejected(any());
        }

        @Test
        @DisplayName("Rejected event carries the error and the failing sub-expression")
        void rejectedEvent() {
            compilerWith(listener).compileAll(List.of(indexedDenominator("bad")));

            ArgumentCaptor<FormRejectedEvent> captor = ArgumentCaptor.forClass(FormRejectedEvent.class);
            verify(listener).onFormRejected(captor.capture());
            assertThat(captor.getValue().errorType()).isEqualTo("UnsupportedDenominatorError");
            assertThat(captor.getValue().context()).isEqualTo("(v_0 + v_0.dx(0))");
            verify(listener, never()).onFormCompiled(any());
        }

        @Test
        @DisplayName("A throwing listener does not affect compilation")
        void throwingListener() {
            doThrow(new IllegalStateException("boom")).when(listener).onFormStarted(any());
            Logger compilerLogger = (Logger) LoggerFactory.getLogger(FormCompiler.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            compilerLogger.addAppender(appender);
            try {
                FormCode code = compilerWith(listener).compile(laplace("laplace"));

                assertThat(code.entryCount()).isEqualTo(4);
                assertThat(appender.list)
                        .anySatisfy(e -> assertThat(e.getMessage()).isEqualTo("CompilationListener.onFormStarted failed"));
                verify(listener).onFormCompiled(any());
            } finally {
                compilerLogger.detachAppender(appender);
            }
        }

        @Test
        @DisplayName("The form name is in the MDC while listeners run")
        void mdcVisibleToListeners() {
            AtomicReference<String> seen = new AtomicReference<>();
            doAnswer(invocation -> {
                        seen.set(MDC.get(FormCompiler.MDC_FORM));
                        return null;
                    })
                    .when(listener)
                    .onFormStarted(any());

            compilerWith(listener).compile(laplace("laplace"));

            assertThat(seen.get()).isEqualTo("laplace");
            assertThat(MDC.get(FormCompiler.MDC_FORM)).isNull();
        }

        @Test
        @DisplayName("No listener is fine")
        void noListener() {
            assertThat(compilerWith(null).compile(laplace("laplace")).entryCount()).isEqualTo(4);
        }
    }
}
