package io.quadc.core.tables;

import io.quadc.core.model.Restriction;

/**
 * Resolution record of one basis table: the unique name its values are stored under and what
 * the values look like. Immutable; memoised for one form's compilation.
 *
 * @param name           name of the unique table holding the (compressed) values
 * @param nonzeroColumns the non-zero columns if some columns were dropped, otherwise {@code null}
 * @param zeros          every value is zero
 * @param ones           every (compressed) value is one
 * @param loopRange      number of columns the basis loop runs over
 * @param spaceDimension space dimension of the tabulated element
 */
public record BasisTable(
        String name, NonzeroColumns nonzeroColumns, boolean zeros, boolean ones, int loopRange, int spaceDimension) {

    public boolean isCompressed() {
        return nonzeroColumns != null;
    }

    /** Offset into the doubled element tensor dimension of a function restricted to one side. */
    public int restrictionOffset(Restriction restriction) {
        return restriction == Restriction.MINUS ? spaceDimension : 0;
    }
}
