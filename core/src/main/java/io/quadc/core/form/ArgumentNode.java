package io.quadc.core.form;

import io.quadc.core.model.Argument;
import io.quadc.core.model.Restriction;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Test or trial function leaf, optionally indexed into a value component, differentiated in the
 * given physical directions and restricted to one side of an interior facet.
 */
public record ArgumentNode(
        Argument argument, List<IndexValue> component, List<IndexValue> derivatives, Restriction restriction)
        implements FormNode {

    public ArgumentNode {
        Objects.requireNonNull(argument, "argument must not be null");
        component = List.copyOf(component);
        derivatives = List.copyOf(derivatives);
        Objects.requireNonNull(restriction, "restriction must not be null");
    }

    public static ArgumentNode of(Argument argument) {
        return new ArgumentNode(argument, List.of(), List.of(), Restriction.NONE);
    }

    /** Adds derivatives in the given directions. */
    public ArgumentNode dx(IndexValue... directions) {
        List<IndexValue> all = new ArrayList<>(derivatives);
        all.addAll(Arrays.asList(directions));
        return new ArgumentNode(argument, component, all, restriction);
    }

    public ArgumentNode component(IndexValue... indices) {
        return new ArgumentNode(argument, List.of(indices), derivatives, restriction);
    }

    public ArgumentNode restricted(Restriction side) {
        return new ArgumentNode(argument, component, derivatives, side);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARGUMENT;
    }

    @Override
    public List<FormNode> operands() {
        return List.of();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("v_").append(argument.number());
        if (!component.isEmpty()) {
            sb.append(component);
        }
        for (IndexValue d : derivatives) {
            sb.append(".dx(").append(d).append(')');
        }
        return sb.append(FacetNormalNode.suffix(restriction)).toString();
    }
}
