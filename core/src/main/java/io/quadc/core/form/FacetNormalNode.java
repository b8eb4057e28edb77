package io.quadc.core.form;

import io.quadc.core.model.Restriction;
import java.util.List;
import java.util.Objects;

/** Component of the outward facet normal. Well formed with exactly one component index. */
public record FacetNormalNode(List<IndexValue> component, Restriction restriction) implements FormNode {

    public FacetNormalNode {
        component = List.copyOf(component);
        Objects.requireNonNull(restriction, "restriction must not be null");
    }

    public static FacetNormalNode of(IndexValue component) {
        return new FacetNormalNode(List.of(component), Restriction.NONE);
    }

    public FacetNormalNode restricted(Restriction side) {
        return new FacetNormalNode(component, side);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FACET_NORMAL;
    }

    @Override
    public List<FormNode> operands() {
        return List.of();
    }

    @Override
    public String toString() {
        return "n" + component + suffix(restriction);
    }

    static String suffix(Restriction restriction) {
        return switch (restriction) {
            case NONE -> "";
            case PLUS -> "('+')";
            case MINUS -> "('-')";
        };
    }
}
