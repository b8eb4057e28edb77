package io.quadc.core.form;

import java.util.List;
import java.util.stream.Collectors;

public record SumNode(List<FormNode> operands) implements FormNode {

    public SumNode {
        operands = List.copyOf(operands);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUM;
    }

    @Override
    public String toString() {
        return operands.stream().map(FormNode::toString).collect(Collectors.joining(" + ", "(", ")"));
    }
}
