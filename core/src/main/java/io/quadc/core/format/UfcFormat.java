package io.quadc.core.format;

import io.quadc.core.model.IntegralType;
import io.quadc.core.model.MathFunction;
import io.quadc.core.model.Restriction;
import io.quadc.core.model.TransformKind;

/**
 * UFC naming: {@code K_01} / {@code J0_10} transforms, {@code detJ}, {@code det} scale factors,
 * {@code w[0][3]} coefficient dofs and {@code std::} calls.
 */
public final class UfcFormat extends AbstractSymbolFormat {

    public static final String ID = "ufc";

    public UfcFormat(double epsilon, int floatPrecision) {
        super(epsilon, floatPrecision);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String transform(TransformKind kind, int i, int j, Restriction restriction) {
        String name = kind == TransformKind.J ? "J" : "K";
        return name + side(restriction) + "_" + i + j;
    }

    @Override
    public String determinant(Restriction restriction) {
        return "detJ" + side(restriction);
    }

    @Override
    public String scaleFactor(IntegralType type) {
        return type == IntegralType.CELL ? "det" : "det_f";
    }

    @Override
    public String normalComponent(Restriction restriction, int component) {
        return "n" + side(restriction) + "_" + component;
    }

    @Override
    public String coefficientDof(int coefficient, String dofIndex) {
        return "w[" + coefficient + "][" + dofIndex + "]";
    }

    @Override
    public String power(String base, String exponent) {
        return "std::pow(" + base + ", " + exponent + ")";
    }

    @Override
    public String absoluteValue(String operand) {
        return "std::abs(" + operand + ")";
    }

    @Override
    public String mathFunction(MathFunction function, String operand) {
        return "std::" + function.cName() + "(" + operand + ")";
    }
}
