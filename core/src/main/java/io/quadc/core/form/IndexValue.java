package io.quadc.core.form;

import io.quadc.core.error.UnsupportedExpressionError;
import java.util.Map;

/**
 * Component or derivative index in a leaf: either fixed or a named index bound by an enclosing
 * {@link IndexSumNode}.
 *
 * @param name  index name, {@code null} for a fixed index
 * @param value the fixed value; ignored for named indices
 */
public record IndexValue(String name, int value) {

    public static IndexValue fixed(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Fixed index must not be negative, got: " + value);
        }
        return new IndexValue(null, value);
    }

    public static IndexValue free(String name) {
        return new IndexValue(name, -1);
    }

    private boolean isFixed() {
        return name == null;
    }

    /**
     * @throws UnsupportedExpressionError if the index is named and not bound
     */
    public int resolve(Map<String, Integer> bindings) {
        if (isFixed()) {
            return value;
        }
        Integer bound = bindings.get(name);
        if (bound == null) {
            throw new UnsupportedExpressionError("Free index '" + name + "' is not bound by an index sum", name);
        }
        return bound;
    }

    @Override
    public String toString() {
        return isFixed() ? Integer.toString(value) : name;
    }
}
