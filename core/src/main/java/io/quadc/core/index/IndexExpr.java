package io.quadc.core.index;

import java.util.Objects;

/**
 * Typed integer index expression used to place a basis-function value into the element tensor:
 * an optional loop variable, optionally read through a non-zero-column array, plus a constant
 * offset. Constant parts fold eagerly, so {@code 3 + 2} is always held as {@code 5}.
 *
 * <p>Examples: {@code j}, {@code nzc0[j]}, {@code (nzc1[k] + 3)}, {@code 4}.
 *
 * @param array    non-zero-column array the variable is read through, or {@code null}
 * @param variable loop variable, or {@code null} for a constant index
 * @param offset   constant added to the (possibly mapped) variable
 */
public record IndexExpr(String array, String variable, int offset) implements Comparable<IndexExpr> {

    public IndexExpr {
        if (array != null && variable == null) {
            throw new IllegalArgumentException("Array access requires a loop variable: " + array);
        }
    }

    public static IndexExpr constant(int value) {
        return new IndexExpr(null, null, value);
    }

    public static IndexExpr variable(String name) {
        return new IndexExpr(null, Objects.requireNonNull(name, "name must not be null"), 0);
    }

    /** Reads this variable through {@code arrayName}; only valid before any offset is added. */
    public IndexExpr through(String arrayName) {
        if (variable == null || array != null || offset != 0) {
            throw new IllegalStateException("Cannot map index " + render() + " through " + arrayName);
        }
        return new IndexExpr(arrayName, variable, 0);
    }

    public IndexExpr plus(int amount) {
        return new IndexExpr(array, variable, offset + amount);
    }

    public boolean isConstant() {
        return variable == null;
    }

    public String render() {
        if (variable == null) {
            return Integer.toString(offset);
        }
        String base = array == null ? variable : array + "[" + variable + "]";
        return offset == 0 ? base : "(" + base + " + " + offset + ")";
    }

    @Override
    public int compareTo(IndexExpr other) {
        return render().compareTo(other.render());
    }

    @Override
    public String toString() {
        return render();
    }
}
