package io.quadc.core.tables;

import io.quadc.core.model.FiniteElement;
import java.util.List;
import java.util.Objects;

/**
 * Identity of one basis table request.
 *
 * @param element          the (possibly mixed) element tabulated
 * @param facet            local facet, or -1 for cell integrals
 * @param component        flattened reference component
 * @param derivativeCounts derivatives per reference direction
 * @param points           number of quadrature points
 */
public record TableKey(FiniteElement element, int facet, int component, List<Integer> derivativeCounts, int points) {

    public TableKey {
        Objects.requireNonNull(element, "element must not be null");
        derivativeCounts = List.copyOf(derivativeCounts);
    }

    public boolean hasDerivatives() {
        return derivativeCounts.stream().anyMatch(c -> c > 0);
    }
}
