package io.quadc.core.error;

/**
 * Thrown when a finite element uses a reference-to-physical mapping other than affine, covariant Piola
 * or contravariant Piola.
 */
public final class UnsupportedMappingError extends FormCompileException {

    private static final long serialVersionUID = 1L;

    public UnsupportedMappingError(String message) {
        super(message, null, Kind.INPUT);
    }

    public UnsupportedMappingError(String message, String context) {
        super(message, context, Kind.INPUT);
    }
}
