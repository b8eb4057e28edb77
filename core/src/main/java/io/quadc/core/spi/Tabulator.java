package io.quadc.core.spi;

import io.quadc.core.model.FiniteElement;
import io.quadc.core.model.IntegralType;

/**
 * SPI for the numerical kernel that evaluates reference basis functions at quadrature points.
 * The compiler calls it at most once per distinct request while compiling one form.
 *
 * <p>Implementations must be deterministic. They are called from the compiling thread only, but
 * one instance may serve several forms compiled in parallel.
 */
public interface Tabulator {

    /**
     * Tabulates one value component (or derivative of it) of every basis function of an element.
     *
     * @param element          the element whose basis is tabulated; for a mixed element the
     *                         component is a flattened component of the whole element
     * @param component        flattened reference value component
     * @param derivativeCounts number of derivatives in each reference direction, one entry per
     *                         geometric dimension
     * @param type             integration domain; facet integrals tabulate on a facet's points
     * @param facet            local facet number, ignored for cell integrals
     * @param points           number of quadrature points
     * @return values indexed {@code [point][basisFunction]}, each row of length
     *     {@code element.spaceDimension()}
     */
    double[][] tabulate(
            FiniteElement element, int component, int[] derivativeCounts, IntegralType type, int facet, int points);
}
