package io.quadc.core.model;

import java.util.List;

/**
 * Quadrature rule descriptor: the number of points and the weights. Point coordinates are the
 * tabulator's concern.
 */
public record QuadratureRule(int points, List<Double> weights) {

    public QuadratureRule {
        if (points < 1) {
            throw new IllegalArgumentException("points must be positive, got: " + points);
        }
        weights = List.copyOf(weights);
        if (weights.size() != points) {
            throw new IllegalArgumentException(
                    "Expected " + points + " weights, got: " + weights.size());
        }
    }

    public static QuadratureRule of(double... weights) {
        Double[] boxed = new Double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            boxed[i] = weights[i];
        }
        return new QuadratureRule(weights.length, List.of(boxed));
    }

    public boolean isSinglePoint() {
        return points == 1;
    }
}
