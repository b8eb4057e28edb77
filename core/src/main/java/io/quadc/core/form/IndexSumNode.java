package io.quadc.core.form;

import java.util.List;
import java.util.Objects;

/** Implicit summation of {@code summand} over {@code index = 0 .. range-1}. */
public record IndexSumNode(String index, int range, FormNode summand) implements FormNode {

    public IndexSumNode {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(summand, "summand must not be null");
        if (range < 1) {
            throw new IllegalArgumentException("range must be positive, got: " + range);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INDEX_SUM;
    }

    @Override
    public List<FormNode> operands() {
        return List.of(summand);
    }

    @Override
    public String toString() {
        return "sum_" + index + "<" + range + "> " + summand;
    }
}
