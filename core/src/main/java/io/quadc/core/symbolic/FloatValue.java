package io.quadc.core.symbolic;

/** Numeric literal. Always in the {@link Domain#CONST} domain. */
public final class FloatValue extends Expr {

    private final double value;

    FloatValue(double value, String rendered) {
        super(Domain.CONST, rendered, 0);
        this.value = value;
    }

    @Override
    public Kind kind() {
        return Kind.FLOAT;
    }

    public double value() {
        return value;
    }

    @Override
    public boolean isZero() {
        return value == 0.0;
    }

    @Override
    public boolean isOne() {
        return value == 1.0;
    }

    @Override
    public boolean isComposite() {
        return false;
    }
}
