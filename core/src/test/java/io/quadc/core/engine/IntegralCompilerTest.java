package io.quadc.core.engine;

import static io.quadc.core.form.Forms.fixed;
import static io.quadc.core.form.Forms.i;
import static io.quadc.core.form.Forms.indexSum;
import static io.quadc.core.form.Forms.product;
import static org.assertj.core.api.Assertions.assertThat;

import io.quadc.core.form.ArgumentNode;
import io.quadc.core.model.Argument;
import io.quadc.core.model.CellShape;
import io.quadc.core.model.FiniteElement;
import io.quadc.core.model.Integral;
import io.quadc.core.model.IntegralType;
import io.quadc.core.model.QuadratureRule;
import io.quadc.core.model.Restriction;
import io.quadc.core.symbolic.Domain;
import io.quadc.core.symbolic.Expr;
import io.quadc.core.tables.NonzeroColumns;
import io.quadc.core.testkit.P1Tabulator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link IntegralCompiler}: facet loops, weights, omitted entries and operation counts. */
class IntegralCompilerTest {

    private static final FiniteElement P0 = FiniteElement.lagrange(CellShape.TRIANGLE, 0);
    private static final FiniteElement P1 = FiniteElement.lagrange(CellShape.TRIANGLE, 1);
    private static final QuadratureRule ONE_POINT = QuadratureRule.of(0.5);
    private static final QuadratureRule THREE_POINT = QuadratureRule.of(1.0 / 6.0, 1.0 / 6.0, 1.0 / 6.0);

    private final ArgumentNode v = ArgumentNode.of(new Argument(0, P1));
    private final ArgumentNode u = ArgumentNode.of(new Argument(1, P1));

    private EngineFixture fixture;
    private IntegralCompiler compiler;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(new P1Tabulator());
        compiler = fixture.integralCompiler();
    }

    @Nested
    @DisplayName("Cell integrals")
    class CellIntegrals {

        @Test
        @DisplayName("One-point rules fold the weight into the geometry temporary")
        void literalWeight() {
            var mass = new Integral(IntegralType.CELL, ONE_POINT, product(v, u));

            List<IntegralCode> codes = compiler.compile(mass, CellShape.TRIANGLE);

            assertThat(codes).hasSize(1);
            IntegralCode code = codes.get(0);
            assertThat(code.facet0()).isEqualTo(-1);
            assertThat(code.entries()).hasSize(1);
            assertThat(code.definitions())
                    .containsExactly(Map.entry(
                            fixture.geo("G0"), fixture.sym.product(fixture.sym.floatValue(0.5), fixture.geo("det"))));
            Expr value = code.entries().values().iterator().next().value();
            assertThat(value)
                    .isEqualTo(fixture.sym.product(
                            fixture.basis("FE0[0][j]"), fixture.basis("FE0[0][k]"), fixture.geo("G0")));
            assertThat(code.usedTables()).containsExactly("FE0");
        }

        @Test
        @DisplayName("Multi-point rules read the weight table at the current point")
        void weightTable() {
            var mass = new Integral(IntegralType.CELL, THREE_POINT, product(v, u));

            IntegralCode code = compiler.compile(mass, CellShape.TRIANGLE).get(0);

            assertThat(code.points()).isEqualTo(3);
            assertThat(code.definitions().values())
                    .containsExactly(fixture.sym.product(fixture.sym.symbol("W3[ip]", Domain.IP), fixture.geo("det")));
            assertThat(code.entries().values().iterator().next().value().key()).contains("FE0[ip][j]");
        }

        @Test
        @DisplayName("Laplace: four entries over three geometry temporaries")
        void laplace() {
            var laplace = new Integral(
                    IntegralType.CELL, ONE_POINT, indexSum("i", 2, product(v.dx(i("i")), u.dx(i("i")))));

            IntegralCode code = compiler.compile(laplace, CellShape.TRIANGLE).get(0);

            assertThat(code.entries()).hasSize(4);
            assertThat(code.definitions()).hasSize(3);
            assertThat(code.definitions().keySet())
                    .allSatisfy(symbol -> assertThat(symbol.domain()).isEqualTo(Domain.GEO));
            assertThat(code.entries().values()).allSatisfy(entry -> assertThat(entry.value().ops()).isEqualTo(2));
            int definitionOps =
                    code.definitions().values().stream().mapToInt(Expr::ops).sum();
            assertThat(code.ops()).isEqualTo(8 + definitionOps);
            assertThat(code.usedTables()).containsExactly("FE0_D10");
        }

        @Test
        @DisplayName("Structurally zero entries are omitted")
        void zeroEntriesOmitted() {
            var dg0 = ArgumentNode.of(new Argument(0, P0));
            var integral = new Integral(IntegralType.CELL, ONE_POINT, product(dg0.dx(fixed(0)), u));

            IntegralCode code = compiler.compile(integral, CellShape.TRIANGLE).get(0);

            assertThat(code.entries()).isEmpty();
            assertThat(code.definitions()).isEmpty();
            assertThat(code.ops()).isZero();
        }
    }

    @Nested
    @DisplayName("Facet integrals")
    class FacetIntegrals {

        @Test
        @DisplayName("Exterior facets compile once per local facet")
        void exteriorFacets() {
            var boundary = new Integral(IntegralType.EXTERIOR_FACET, ONE_POINT, v);

            List<IntegralCode> codes = compiler.compile(boundary, CellShape.TRIANGLE);

            assertThat(codes).extracting(IntegralCode::facet0).containsExactly(0, 1, 2);
            assertThat(codes).allSatisfy(code -> {
                assertThat(code.entries()).hasSize(1);
                assertThat(code.usedTables()).containsExactly("FE0_f0");
            });
            assertThat(fixture.tables.nonzeroColumns())
                    .extracting(NonzeroColumns::columns)
                    .containsExactly(List.of(1, 2), List.of(0, 2), List.of(0, 1));
        }

        @Test
        @DisplayName("Exterior facets scale by the facet determinant")
        void facetScale() {
            var boundary = new Integral(IntegralType.EXTERIOR_FACET, ONE_POINT, v);

            IntegralCode code = compiler.compile(boundary, CellShape.TRIANGLE).get(0);

            assertThat(code.definitions().values())
                    .containsExactly(fixture.sym.product(fixture.sym.floatValue(0.5), fixture.geo("det_f")));
        }

        @Test
        @DisplayName("Interior facets compile once per pair of local facets")
        void interiorFacets() {
            var jump = new Integral(
                    IntegralType.INTERIOR_FACET,
                    ONE_POINT,
                    product(v.restricted(Restriction.PLUS), u.restricted(Restriction.MINUS)));

            List<IntegralCode> codes = compiler.compile(jump, CellShape.TRIANGLE);

            assertThat(codes).hasSize(9);
            assertThat(codes.get(5).facet0()).isEqualTo(1);
            assertThat(codes.get(5).facet1()).isEqualTo(2);
            assertThat(codes).allSatisfy(code -> assertThat(code.entries()).hasSize(1));
        }
    }
}
