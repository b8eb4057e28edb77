package io.quadc.core.testkit;

import io.quadc.core.model.CellShape;
import io.quadc.core.model.FiniteElement;
import io.quadc.core.model.IntegralType;
import io.quadc.core.spi.Tabulator;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exact tabulator for degree 0 and degree 1 Lagrange elements on the reference triangle, and
 * for mixed elements built from them.
 *
 * <p>Cell integrals are tabulated at the barycentre, facet integrals at the facet midpoint. Every
 * point of a multi-point rule uses the same location, which keeps expected values easy to write
 * down while still exercising the point loop.
 */
public final class P1Tabulator implements Tabulator {

    /** P1 values at the facet midpoints, facet {@code f} lies opposite vertex {@code f}. */
    private static final double[][] FACET_MIDPOINT = {
        {0.0, 0.5, 0.5},
        {0.5, 0.0, 0.5},
        {0.5, 0.5, 0.0}
    };

    private static final double[] BARYCENTRE = {1.0 / 3.0, 1.0 / 3.0, 1.0 / 3.0};

    private static final double[] DX = {-1.0, 1.0, 0.0};
    private static final double[] DY = {-1.0, 0.0, 1.0};

    private final AtomicInteger calls = new AtomicInteger();

    /** Number of tabulation requests served so far. */
    public int calls() {
        return calls.get();
    }

    @Override
    public double[][] tabulate(
            FiniteElement element, int component, int[] derivativeCounts, IntegralType type, int facet, int points) {
        calls.incrementAndGet();
        if (element.cell() != CellShape.TRIANGLE) {
            throw new IllegalArgumentException("Only triangles are tabulated: " + element);
        }
        double[] row = new double[element.spaceDimension()];
        if (element.isMixed()) {
            int componentOffset = 0;
            int dofOffset = 0;
            for (FiniteElement sub : element.subElements()) {
                if (component < componentOffset + sub.valueDimension()) {
                    double[] block = scalarRow(sub, derivativeCounts, type, facet);
                    System.arraycopy(block, 0, row, dofOffset, block.length);
                    break;
                }
                componentOffset += sub.valueDimension();
                dofOffset += sub.spaceDimension();
            }
        } else {
            row = scalarRow(element, derivativeCounts, type, facet);
        }
        double[][] table = new double[points][];
        for (int p = 0; p < points; p++) {
            table[p] = row.clone();
        }
        return table;
    }

    private static double[] scalarRow(FiniteElement element, int[] counts, IntegralType type, int facet) {
        int order = Arrays.stream(counts).sum();
        if (element.degree() == 0) {
            return new double[] {order == 0 ? 1.0 : 0.0};
        }
        if (element.degree() != 1) {
            throw new IllegalArgumentException("Only degree 0 and 1 are tabulated: " + element);
        }
        if (order == 0) {
            return (type.isFacet() ? FACET_MIDPOINT[facet] : BARYCENTRE).clone();
        }
        if (order > 1) {
            return new double[3];
        }
        return (counts[0] == 1 ? DX : DY).clone();
    }
}
