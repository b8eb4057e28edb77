package io.quadc.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.quadc.core.error.InvalidIndexError;
import io.quadc.core.error.UnsupportedExpressionError;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FiniteElementTest {

    @Test
    @DisplayName("Lagrange dimensions follow the cell")
    void lagrangeDimensions() {
        assertThat(FiniteElement.lagrange(CellShape.TRIANGLE, 1).spaceDimension()).isEqualTo(3);
        assertThat(FiniteElement.lagrange(CellShape.TRIANGLE, 2).spaceDimension()).isEqualTo(6);
        assertThat(FiniteElement.lagrange(CellShape.TETRAHEDRON, 1).spaceDimension()).isEqualTo(4);
        assertThat(FiniteElement.lagrange(CellShape.QUADRILATERAL, 2).spaceDimension()).isEqualTo(9);
        assertThat(FiniteElement.lagrange(CellShape.TRIANGLE, 0).spaceDimension()).isEqualTo(1);
    }

    @Test
    @DisplayName("Vector Lagrange is a mixed element of scalar copies")
    void vectorLagrange() {
        FiniteElement vector = FiniteElement.vectorLagrange(CellShape.TRIANGLE, 1);

        assertThat(vector.isMixed()).isTrue();
        assertThat(vector.mapping()).isNull();
        assertThat(vector.spaceDimension()).isEqualTo(6);
        assertThat(vector.valueDimension()).isEqualTo(2);
    }

    @Test
    @DisplayName("Components of a mixed element resolve to their leaf element and offset")
    void componentInfoOfMixedElement() {
        FiniteElement p2 = FiniteElement.lagrange(CellShape.TRIANGLE, 2);
        FiniteElement rt = FiniteElement.vector(
                "Raviart-Thomas", CellShape.TRIANGLE, 1, MappingKind.CONTRAVARIANT_PIOLA, 3);
        FiniteElement mixed = FiniteElement.mixed(List.of(rt, p2));

        FiniteElement.ComponentInfo second = mixed.componentInfo(1);
        FiniteElement.ComponentInfo third = mixed.componentInfo(2);

        assertThat(second.element()).isEqualTo(rt);
        assertThat(second.localComponent()).isEqualTo(1);
        assertThat(second.offset()).isZero();
        assertThat(third.element()).isEqualTo(p2);
        assertThat(third.localComponent()).isZero();
        assertThat(third.offset()).isEqualTo(2);
    }

    @Test
    @DisplayName("Out-of-range component → UnsupportedExpressionError")
    void componentOutOfRange() {
        FiniteElement p1 = FiniteElement.lagrange(CellShape.TRIANGLE, 1);

        assertThatThrownBy(() -> p1.componentInfo(1)).isInstanceOf(UnsupportedExpressionError.class);
    }

    @Test
    @DisplayName("Mixed sub-elements must share one cell")
    void mixedCellsMustAgree() {
        assertThatThrownBy(() -> FiniteElement.mixed(List.of(
                        FiniteElement.lagrange(CellShape.TRIANGLE, 1),
                        FiniteElement.lagrange(CellShape.TETRAHEDRON, 1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Argument numbers outside -2..1 are rejected")
    void argumentNumbers() {
        FiniteElement p1 = FiniteElement.lagrange(CellShape.TRIANGLE, 1);

        assertThat(new Argument(-2, p1).freeIndexPosition()).isZero();
        assertThat(new Argument(1, p1).freeIndexPosition()).isEqualTo(1);
        assertThatThrownBy(() -> new Argument(2, p1)).isInstanceOf(InvalidIndexError.class);
    }

    @Test
    @DisplayName("Quadrature rule weights must match the point count")
    void quadratureRule() {
        assertThat(QuadratureRule.of(0.5).isSinglePoint()).isTrue();
        assertThatThrownBy(() -> new QuadratureRule(2, List.of(0.5)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
