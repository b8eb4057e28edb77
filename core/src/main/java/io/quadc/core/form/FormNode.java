package io.quadc.core.form;

import java.util.List;

/**
 * Node of an already built form expression tree. Every implementation is an immutable record;
 * {@link #kind()} identifies it without reflection.
 */
public sealed interface FormNode
        permits SumNode,
                ProductNode,
                DivisionNode,
                PowerNode,
                AbsNode,
                MathFunctionNode,
                IndexSumNode,
                ScalarNode,
                FacetNormalNode,
                ArgumentNode,
                CoefficientNode {

    NodeKind kind();

    /** Child nodes; empty for leaves. */
    List<FormNode> operands();
}
