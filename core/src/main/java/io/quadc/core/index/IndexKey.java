package io.quadc.core.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical tuple of free-index assignments. The indices are sorted on construction, so two keys
 * built from permutations of the same indices are equal.
 */
public final class IndexKey implements Comparable<IndexKey> {

    /** Key of a fully reduced scalar. */
    public static final IndexKey EMPTY = new IndexKey(List.of());

    private final List<BasisIndex> indices;

    private IndexKey(List<BasisIndex> sorted) {
        this.indices = sorted;
    }

    public static IndexKey of(BasisIndex... indices) {
        return of(List.of(indices));
    }

    public static IndexKey of(List<BasisIndex> indices) {
        if (indices.isEmpty()) {
            return EMPTY;
        }
        List<BasisIndex> sorted = new ArrayList<>(indices);
        Collections.sort(sorted);
        return new IndexKey(List.copyOf(sorted));
    }

    public IndexKey concat(IndexKey other) {
        if (other.indices.isEmpty()) {
            return this;
        }
        if (indices.isEmpty()) {
            return other;
        }
        List<BasisIndex> merged = new ArrayList<>(indices.size() + other.indices.size());
        merged.addAll(indices);
        merged.addAll(other.indices);
        return of(merged);
    }

    public List<BasisIndex> indices() {
        return indices;
    }

    public int arity() {
        return indices.size();
    }

    @Override
    public int compareTo(IndexKey other) {
        int n = Math.min(indices.size(), other.indices.size());
        for (int i = 0; i < n; i++) {
            int c = indices.get(i).compareTo(other.indices.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(indices.size(), other.indices.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexKey)) return false;
        return indices.equals(((IndexKey) o).indices);
    }

    @Override
    public int hashCode() {
        return indices.hashCode();
    }

    @Override
    public String toString() {
        return indices.stream().map(BasisIndex::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
