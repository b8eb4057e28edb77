package io.quadc.core.format;

import io.quadc.core.model.IntegralType;
import io.quadc.core.model.MathFunction;
import io.quadc.core.model.Restriction;
import io.quadc.core.model.TransformKind;

/**
 * Legacy DOLFIN naming: geometry read from an affine map object ({@code map.g01},
 * {@code map.det}), coefficient dofs as {@code c[0][3]} and C library calls.
 */
public final class DolfinFormat extends AbstractSymbolFormat {

    public static final String ID = "dolfin";

    public DolfinFormat(double epsilon, int floatPrecision) {
        super(epsilon, floatPrecision);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String transform(TransformKind kind, int i, int j, Restriction restriction) {
        String entry = kind == TransformKind.J ? "J" : "g";
        return map(restriction) + "." + entry + i + j;
    }

    @Override
    public String determinant(Restriction restriction) {
        return map(restriction) + ".det";
    }

    @Override
    public String scaleFactor(IntegralType type) {
        return type == IntegralType.CELL ? "map.scale" : "map.fscale";
    }

    @Override
    public String normalComponent(Restriction restriction, int component) {
        return map(restriction) + ".n" + component;
    }

    @Override
    public String coefficientDof(int coefficient, String dofIndex) {
        return "c[" + coefficient + "][" + dofIndex + "]";
    }

    @Override
    public String power(String base, String exponent) {
        return "pow(" + base + ", " + exponent + ")";
    }

    @Override
    public String absoluteValue(String operand) {
        return "fabs(" + operand + ")";
    }

    @Override
    public String mathFunction(MathFunction function, String operand) {
        return function.cName() + "(" + operand + ")";
    }

    private static String map(Restriction restriction) {
        return "map" + side(restriction);
    }
}
