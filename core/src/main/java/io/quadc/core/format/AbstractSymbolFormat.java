package io.quadc.core.format;

import io.quadc.core.model.Restriction;
import io.quadc.core.spi.SymbolFormat;
import java.util.Locale;

/**
 * Naming shared by the C-family output conventions: table accesses, quadrature weights, loop
 * variables and float literals. Subclasses name the geometry and the calls.
 */
abstract class AbstractSymbolFormat implements SymbolFormat {

    private final double epsilon;
    private final String floatPattern;

    AbstractSymbolFormat(double epsilon, int floatPrecision) {
        this.epsilon = epsilon;
        this.floatPattern = "%." + floatPrecision + "e";
    }

    @Override
    public String psiAccess(String table, String pointIndex, String columnIndex) {
        return table + "[" + pointIndex + "][" + columnIndex + "]";
    }

    @Override
    public String weight(int points, String pointIndex) {
        return "W" + points + "[" + pointIndex + "]";
    }

    @Override
    public String coefficientValue(int k) {
        return "F" + k;
    }

    @Override
    public String nonzeroColumns(int n) {
        return "nzc" + n;
    }

    @Override
    public String floatValue(double value) {
        if (Math.abs(value) < epsilon) {
            return "0.0";
        }
        return String.format(Locale.ROOT, floatPattern, value);
    }

    @Override
    public String integrationPoint() {
        return "ip";
    }

    @Override
    public String freeIndex(int position) {
        return switch (position) {
            case 0 -> "j";
            case 1 -> "k";
            default -> throw new IllegalArgumentException("Free index position must be 0 or 1, got: " + position);
        };
    }

    /** Side marker appended to restricted geometry names: none, {@code 0} or {@code 1}. */
    static String side(Restriction restriction) {
        return switch (restriction) {
            case NONE -> "";
            case PLUS -> "0";
            case MINUS -> "1";
        };
    }
}
