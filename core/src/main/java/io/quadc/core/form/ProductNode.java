package io.quadc.core.form;

import java.util.List;
import java.util.stream.Collectors;

public record ProductNode(List<FormNode> operands) implements FormNode {

    public ProductNode {
        operands = List.copyOf(operands);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PRODUCT;
    }

    @Override
    public String toString() {
        return operands.stream().map(FormNode::toString).collect(Collectors.joining("*"));
    }
}
