package io.quadc.core.form;

import java.util.List;

/** Absolute value; well formed with exactly one operand. */
public record AbsNode(List<FormNode> operands) implements FormNode {

    public AbsNode {
        operands = List.copyOf(operands);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ABS;
    }

    @Override
    public String toString() {
        return "abs" + operands;
    }
}
