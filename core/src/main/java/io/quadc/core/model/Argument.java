package io.quadc.core.model;

import io.quadc.core.error.InvalidIndexError;
import java.util.Objects;

/**
 * Test or trial function. Numbers 0 and 1 are the test and trial slots of a bilinear form; -2
 * and -1 are the same slots as renumbered for auxiliary forms.
 */
public record Argument(int number, FiniteElement element) {

    public Argument {
        if (number < -2 || number > 1) {
            throw new InvalidIndexError("Argument number must be -2, -1, 0 or 1, got: " + number);
        }
        Objects.requireNonNull(element, "element must not be null");
    }

    /** Position of the free index this argument binds: 0 for {@code j}, 1 for {@code k}. */
    public int freeIndexPosition() {
        return (number + 2) % 2;
    }
}
