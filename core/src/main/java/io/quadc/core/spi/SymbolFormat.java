package io.quadc.core.spi;

import io.quadc.core.model.IntegralType;
import io.quadc.core.model.MathFunction;
import io.quadc.core.model.Restriction;
import io.quadc.core.model.TransformKind;

/**
 * Naming strategy of one output convention: how geometric quantities, table accesses, calls and
 * literals are spelled in generated code. Names are part of the canonical form of expressions,
 * so one compilation uses one format throughout.
 *
 * <p>Implementations must be stateless and thread-safe.
 */
public interface SymbolFormat {

    /** Unique identifier used for selection in configuration (e.g. {@code "ufc"}). */
    String id();

    /** Entry {@code (i, j)} of the Jacobian or its inverse, on the given side. */
    String transform(TransformKind kind, int i, int j, Restriction restriction);

    /** Jacobian determinant on the given side. */
    String determinant(Restriction restriction);

    /** Factor converting reference measure to physical measure for an integration domain. */
    String scaleFactor(IntegralType type);

    /** Component of the facet normal on the given side. */
    String normalComponent(Restriction restriction, int component);

    /** Access to a basis table at one quadrature point and one (loop) column. */
    String psiAccess(String table, String pointIndex, String columnIndex);

    /** Weight of a quadrature rule at a point. */
    String weight(int points, String pointIndex);

    /** Degree of freedom of a coefficient. */
    String coefficientDof(int coefficient, String dofIndex);

    /** Temporary holding the value of the {@code k}-th distinct coefficient expression. */
    String coefficientValue(int k);

    /** Name of the {@code n}-th non-zero-column array. */
    String nonzeroColumns(int n);

    String power(String base, String exponent);

    String absoluteValue(String operand);

    String mathFunction(MathFunction function, String operand);

    /** Literal rendering; values below the configured tolerance render as zero. */
    String floatValue(double value);

    /** Loop variable over quadrature points. */
    String integrationPoint();

    /** Loop variable of a free index: position 0 is the test slot, 1 the trial slot. */
    String freeIndex(int position);
}
