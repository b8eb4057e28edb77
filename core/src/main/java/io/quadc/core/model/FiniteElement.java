package io.quadc.core.model;

import io.quadc.core.error.UnsupportedExpressionError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Finite element metadata the compiler needs: family, cell, degree, value mapping and
 * dimensions. A mixed element lists its sub-elements; its value components are the
 * concatenation of theirs and its mapping is {@code null}.
 *
 * <p>Immutable; equality is structural, so equal elements share basis tables.
 *
 * @param family         element family name, e.g. {@code "Lagrange"}
 * @param cell           reference cell
 * @param degree         polynomial degree
 * @param mapping        reference-to-physical value mapping, {@code null} for mixed elements
 * @param spaceDimension number of basis functions
 * @param valueDimension number of flattened value components
 * @param subElements    sub-elements of a mixed element, empty otherwise
 */
public record FiniteElement(
        String family,
        CellShape cell,
        int degree,
        MappingKind mapping,
        int spaceDimension,
        int valueDimension,
        List<FiniteElement> subElements) {

    public static final String MIXED = "Mixed";
    public static final String QUADRATURE = "Quadrature";

    public FiniteElement {
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(cell, "cell must not be null");
        subElements = subElements == null ? List.of() : List.copyOf(subElements);
        if (subElements.isEmpty()) {
            Objects.requireNonNull(mapping, "mapping must not be null for " + family);
        }
        if (spaceDimension < 1) {
            throw new IllegalArgumentException("spaceDimension must be positive, got: " + spaceDimension);
        }
        if (valueDimension < 1) {
            throw new IllegalArgumentException("valueDimension must be positive, got: " + valueDimension);
        }
    }

    /** Scalar continuous Lagrange element. */
    public static FiniteElement lagrange(CellShape cell, int degree) {
        return new FiniteElement("Lagrange", cell, degree, MappingKind.AFFINE, lagrangeDimension(cell, degree), 1, null);
    }

    /** Vector Lagrange element with one scalar sub-element per geometric dimension. */
    public static FiniteElement vectorLagrange(CellShape cell, int degree) {
        return mixed(Collections.nCopies(cell.geometricDimension(), lagrange(cell, degree)));
    }

    /** Element with one degree of freedom per quadrature point, read directly without tables. */
    public static FiniteElement quadrature(CellShape cell, int points) {
        return new FiniteElement(QUADRATURE, cell, 0, MappingKind.AFFINE, points, 1, null);
    }

    /** Vector-valued element with an explicit mapping and dimension, e.g. Raviart-Thomas or Nedelec. */
    public static FiniteElement vector(String family, CellShape cell, int degree, MappingKind mapping, int spaceDimension) {
        return new FiniteElement(family, cell, degree, mapping, spaceDimension, cell.geometricDimension(), null);
    }

    public static FiniteElement mixed(List<FiniteElement> subElements) {
        if (subElements.isEmpty()) {
            throw new IllegalArgumentException("Mixed element needs at least one sub-element");
        }
        CellShape cell = subElements.get(0).cell();
        int space = 0;
        int value = 0;
        int degree = 0;
        for (FiniteElement sub : subElements) {
            if (sub.cell() != cell) {
                throw new IllegalArgumentException("Mixed element sub-elements must share one cell: " + subElements);
            }
            space += sub.spaceDimension();
            value += sub.valueDimension();
            degree = Math.max(degree, sub.degree());
        }
        return new FiniteElement(MIXED, cell, degree, null, space, value, new ArrayList<>(subElements));
    }

    public boolean isMixed() {
        return !subElements.isEmpty();
    }

    public boolean isQuadrature() {
        return QUADRATURE.equals(family);
    }

    /**
     * Locates a flattened value component: the leaf element that owns it, the component local to
     * that element and the offset of that element's first component.
     *
     * @throws UnsupportedExpressionError if the component is out of range
     */
    public ComponentInfo componentInfo(int component) {
        if (component < 0 || component >= valueDimension) {
            throw new UnsupportedExpressionError(
                    "Component " + component + " out of range for element with " + valueDimension + " components",
                    toString());
        }
        if (!isMixed()) {
            return new ComponentInfo(this, component, 0);
        }
        int offset = 0;
        for (FiniteElement sub : subElements) {
            if (component < offset + sub.valueDimension()) {
                ComponentInfo inner = sub.componentInfo(component - offset);
                return new ComponentInfo(inner.element(), inner.localComponent(), offset + inner.offset());
            }
            offset += sub.valueDimension();
        }
        throw new IllegalStateException("Unreachable: component " + component + " of " + this);
    }

    @Override
    public String toString() {
        if (isMixed()) {
            return MIXED + subElements;
        }
        return family + "(" + cell + ", " + degree + ")";
    }

    private static int lagrangeDimension(CellShape cell, int degree) {
        int n = degree + 1;
        return switch (cell) {
            case INTERVAL -> n;
            case TRIANGLE -> n * (n + 1) / 2;
            case TETRAHEDRON -> n * (n + 1) * (n + 2) / 6;
            case QUADRILATERAL -> n * n;
            case HEXAHEDRON -> n * n * n;
        };
    }

    /**
     * @param element        leaf element owning the component
     * @param localComponent component within {@code element}
     * @param offset         index of {@code element}'s first component in the enclosing element
     */
    public record ComponentInfo(FiniteElement element, int localComponent, int offset) {}
}
