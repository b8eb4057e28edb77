package io.quadc.core.form;

import io.quadc.core.model.MathFunction;
import java.util.List;
import java.util.Objects;

/** Elementary function application; well formed with exactly one operand. */
public record MathFunctionNode(MathFunction function, List<FormNode> operands) implements FormNode {

    public MathFunctionNode {
        Objects.requireNonNull(function, "function must not be null");
        operands = List.copyOf(operands);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MATH_FUNCTION;
    }

    @Override
    public String toString() {
        return function.cName() + operands;
    }
}
