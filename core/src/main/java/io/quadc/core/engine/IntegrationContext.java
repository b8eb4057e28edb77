package io.quadc.core.engine;

import io.quadc.core.model.IntegralType;
import io.quadc.core.model.Restriction;

/**
 * Where an integrand is being evaluated: integration domain, point rule and the local facets of
 * the current facet loop iteration.
 *
 * @param type               integration domain
 * @param points             number of quadrature points
 * @param facet0             facet of the {@code +} side (the only facet for exterior facets), -1
 *                           for cells
 * @param facet1             facet of the {@code -} side of an interior facet, -1 otherwise
 * @param geometricDimension geometric dimension of the cell
 */
public record IntegrationContext(IntegralType type, int points, int facet0, int facet1, int geometricDimension) {

    public static IntegrationContext cell(int points, int geometricDimension) {
        return new IntegrationContext(IntegralType.CELL, points, -1, -1, geometricDimension);
    }

    /** Facet a function restricted to {@code restriction} is evaluated on. */
    public int facetOf(Restriction restriction) {
        return restriction == Restriction.MINUS ? facet1 : facet0;
    }
}
