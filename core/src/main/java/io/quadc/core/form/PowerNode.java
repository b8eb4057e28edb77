package io.quadc.core.form;

import java.util.List;
import java.util.Objects;

public record PowerNode(FormNode base, FormNode exponent) implements FormNode {

    public PowerNode {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(exponent, "exponent must not be null");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.POWER;
    }

    @Override
    public List<FormNode> operands() {
        return List.of(base, exponent);
    }

    @Override
    public String toString() {
        return "(" + base + ")**(" + exponent + ")";
    }
}
