package io.quadc.core.form;

import io.quadc.core.model.MathFunction;
import java.util.List;

/** Short static constructors for building form trees by hand. */
public final class Forms {

    private Forms() {}

    public static SumNode sum(FormNode... operands) {
        return new SumNode(List.of(operands));
    }

    public static ProductNode product(FormNode... operands) {
        return new ProductNode(List.of(operands));
    }

    public static DivisionNode divide(FormNode numerator, FormNode denominator) {
        return DivisionNode.of(numerator, denominator);
    }

    public static PowerNode power(FormNode base, FormNode exponent) {
        return new PowerNode(base, exponent);
    }

    public static PowerNode power(FormNode base, int exponent) {
        return new PowerNode(base, ScalarNode.of(exponent));
    }

    public static AbsNode abs(FormNode operand) {
        return new AbsNode(List.of(operand));
    }

    public static MathFunctionNode apply(MathFunction function, FormNode operand) {
        return new MathFunctionNode(function, List.of(operand));
    }

    public static IndexSumNode indexSum(String index, int range, FormNode summand) {
        return new IndexSumNode(index, range, summand);
    }

    public static ScalarNode scalar(double value) {
        return ScalarNode.of(value);
    }

    public static ScalarNode integer(int value) {
        return ScalarNode.of(value);
    }

    public static IndexValue i(String name) {
        return IndexValue.free(name);
    }

    public static IndexValue fixed(int value) {
        return IndexValue.fixed(value);
    }
}
