package io.quadc.core.model;

import java.util.function.DoubleUnaryOperator;

/**
 * Elementary functions a form may apply to a scalar operand. The evaluator, when present, folds
 * literal operands at compile time.
 */
public enum MathFunction {
    SQRT("sqrt", Math::sqrt),
    EXP("exp", Math::exp),
    LN("log", Math::log),
    SIN("sin", Math::sin),
    COS("cos", Math::cos),
    TAN("tan", Math::tan),
    ACOS("acos", Math::acos),
    ASIN("asin", Math::asin),
    ATAN("atan", Math::atan),
    SINH("sinh", Math::sinh),
    COSH("cosh", Math::cosh),
    TANH("tanh", Math::tanh),
    // no JDK implementation; never folded
    ERF("erf", null);

    private final String cName;
    private final DoubleUnaryOperator evaluator;

    MathFunction(String cName, DoubleUnaryOperator evaluator) {
        this.cName = cName;
        this.evaluator = evaluator;
    }

    /** Name of the C math library function. */
    public String cName() {
        return cName;
    }

    public boolean canFold() {
        return evaluator != null;
    }

    public double apply(double x) {
        if (evaluator == null) {
            throw new UnsupportedOperationException(name() + " cannot be evaluated at compile time");
        }
        return evaluator.applyAsDouble(x);
    }
}
