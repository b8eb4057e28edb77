package io.quadc.core.tables;

import java.util.List;

/**
 * Columns of a basis table that are not identically zero. Tables with the same column set share
 * one number.
 */
public record NonzeroColumns(int number, List<Integer> columns) {

    public NonzeroColumns {
        columns = List.copyOf(columns);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Non-zero column set must not be empty");
        }
    }

    public int size() {
        return columns.size();
    }
}
