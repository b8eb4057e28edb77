package io.quadc.core.form;

import io.quadc.core.model.Coefficient;
import io.quadc.core.model.Restriction;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** Coefficient function leaf; same indexing rules as {@link ArgumentNode}. */
public record CoefficientNode(
        Coefficient coefficient, List<IndexValue> component, List<IndexValue> derivatives, Restriction restriction)
        implements FormNode {

    public CoefficientNode {
        Objects.requireNonNull(coefficient, "coefficient must not be null");
        component = List.copyOf(component);
        derivatives = List.copyOf(derivatives);
        Objects.requireNonNull(restriction, "restriction must not be null");
    }

    public static CoefficientNode of(Coefficient coefficient) {
        return new CoefficientNode(coefficient, List.of(), List.of(), Restriction.NONE);
    }

    public CoefficientNode dx(IndexValue... directions) {
        List<IndexValue> all = new ArrayList<>(derivatives);
        all.addAll(Arrays.asList(directions));
        return new CoefficientNode(coefficient, component, all, restriction);
    }

    public CoefficientNode component(IndexValue... indices) {
        return new CoefficientNode(coefficient, List.of(indices), derivatives, restriction);
    }

    public CoefficientNode restricted(Restriction side) {
        return new CoefficientNode(coefficient, component, derivatives, side);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COEFFICIENT;
    }

    @Override
    public List<FormNode> operands() {
        return List.of();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("w_").append(coefficient.number());
        if (!component.isEmpty()) {
            sb.append(component);
        }
        for (IndexValue d : derivatives) {
            sb.append(".dx(").append(d).append(')');
        }
        return sb.append(FacetNormalNode.suffix(restriction)).toString();
    }
}
