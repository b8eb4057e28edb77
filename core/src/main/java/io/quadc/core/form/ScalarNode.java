package io.quadc.core.form;

import java.util.List;

/**
 * Numeric constant. Integer constants are kept apart from floating-point ones because an integer
 * exponent expands to a repeated product while a float exponent becomes a power call.
 */
public record ScalarNode(double value, boolean integer) implements FormNode {

    public ScalarNode {
        if (integer && value != Math.rint(value)) {
            throw new IllegalArgumentException("Integer scalar with fractional value: " + value);
        }
    }

    public static ScalarNode of(int value) {
        return new ScalarNode(value, true);
    }

    public static ScalarNode of(double value) {
        return new ScalarNode(value, false);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SCALAR;
    }

    @Override
    public List<FormNode> operands() {
        return List.of();
    }

    @Override
    public String toString() {
        return integer ? Long.toString((long) value) : Double.toString(value);
    }
}
