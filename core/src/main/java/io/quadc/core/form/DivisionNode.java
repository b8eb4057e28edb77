package io.quadc.core.form;

import java.util.List;

/**
 * Quotient. Well formed with exactly two operands, numerator first; the operand list is kept as
 * given so that malformed trees reach the transformer and are reported there.
 */
public record DivisionNode(List<FormNode> operands) implements FormNode {

    public DivisionNode {
        operands = List.copyOf(operands);
    }

    public static DivisionNode of(FormNode numerator, FormNode denominator) {
        return new DivisionNode(List.of(numerator, denominator));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DIVISION;
    }

    @Override
    public String toString() {
        return operands.size() == 2 ? operands.get(0) + "/(" + operands.get(1) + ")" : "Division" + operands;
    }
}
