package io.quadc.core.index;

import io.quadc.core.error.InvalidIndexError;
import io.quadc.core.symbolic.Expr;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Sparse map from canonical free-index keys to the scalar expression at that combination of
 * indices, iterated in key order. All keys of one map have the same arity; an empty map
 * contributes nothing.
 */
public final class CodeMap {

    private static final CodeMap EMPTY = new CodeMap(new TreeMap<>());

    private final NavigableMap<IndexKey, Expr> entries;

    private CodeMap(NavigableMap<IndexKey, Expr> entries) {
        this.entries = entries;
    }

    public static CodeMap empty() {
        return EMPTY;
    }

    /** Map holding one fully reduced value under {@link IndexKey#EMPTY}. */
    public static CodeMap scalar(Expr value) {
        TreeMap<IndexKey, Expr> map = new TreeMap<>();
        map.put(IndexKey.EMPTY, Objects.requireNonNull(value, "value must not be null"));
        return new CodeMap(map);
    }

    /**
     * @throws InvalidIndexError if the keys do not all have the same arity
     */
    public static CodeMap of(Map<IndexKey, Expr> entries) {
        TreeMap<IndexKey, Expr> map = new TreeMap<>(entries);
        if (!map.isEmpty()) {
            int arity = map.firstKey().arity();
            for (IndexKey key : map.keySet()) {
                if (key.arity() != arity) {
                    throw new InvalidIndexError(
                            "Mixed key arity " + arity + " and " + key.arity() + " in one code map", key.toString());
                }
            }
        }
        return new CodeMap(map);
    }

    public Map<IndexKey, Expr> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public Expr get(IndexKey key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Arity of the keys, or -1 for an empty map. */
    public int arity() {
        return entries.isEmpty() ? -1 : entries.firstKey().arity();
    }

    /** {@code true} if this map holds exactly one value under the empty key. */
    public boolean isScalar() {
        return entries.size() == 1 && entries.firstKey().arity() == 0;
    }

    /**
     * @throws IllegalStateException if this map is not {@linkplain #isScalar() scalar}
     */
    public Expr scalar() {
        if (!isScalar()) {
            throw new IllegalStateException("Not a scalar code map: " + this);
        }
        return entries.firstEntry().getValue();
    }

    public CodeMap mapValues(UnaryOperator<Expr> f) {
        TreeMap<IndexKey, Expr> map = new TreeMap<>();
        for (Map.Entry<IndexKey, Expr> e : entries.entrySet()) {
            map.put(e.getKey(), f.apply(e.getValue()));
        }
        return new CodeMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeMap)) return false;
        return entries.equals(((CodeMap) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
