package io.quadc.core.index;

import io.quadc.core.error.InvalidIndexError;
import java.util.Comparator;
import java.util.Objects;

/**
 * Placement of one test/trial function slot in the element tensor.
 *
 * <p>For a cell integral over a P1 triangle this reads {@code (0, j, 3, 3)}; for an interior
 * facet integral restricted to the negative side {@code (0, (j + 3), 3, 6)}; with non-zero
 * column compression {@code (0, (nzc2[j] + 3), 2, 6)}.
 *
 * @param slot           argument number, one of -2, -1, 0 or 1
 * @param map            index into the element tensor dimension of this slot
 * @param loopRange      number of values the loop variable runs over
 * @param spaceDimension size of the element tensor dimension, doubled for restricted functions
 */
public record BasisIndex(int slot, IndexExpr map, int loopRange, int spaceDimension)
        implements Comparable<BasisIndex> {

    private static final Comparator<BasisIndex> ORDER = Comparator.comparingInt(BasisIndex::slot)
            .thenComparing(BasisIndex::map)
            .thenComparingInt(BasisIndex::loopRange)
            .thenComparingInt(BasisIndex::spaceDimension);

    public BasisIndex {
        if (slot < -2 || slot > 1) {
            throw new InvalidIndexError("Basis function slot must be -2, -1, 0 or 1, got: " + slot);
        }
        Objects.requireNonNull(map, "map must not be null");
        if (loopRange < 1 || spaceDimension < loopRange) {
            throw new InvalidIndexError(
                    "Invalid loop range " + loopRange + " for space dimension " + spaceDimension,
                    map.render());
        }
    }

    @Override
    public int compareTo(BasisIndex other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + slot + ", " + map.render() + ", " + loopRange + ", " + spaceDimension + ")";
    }
}
