package io.quadc.core.config;

/**
 * Compiler options controlling optimisation and numeric output.
 *
 * <p>Use {@link #builder()} to construct instances; {@link #DEFAULT} enables every optimisation.
 *
 * @param ignoreZeroTables              substitute literal zero for all-zero basis tables
 * @param removeZeroTerms               also substitute literal zero for all-zero tables, so that
 *                                      terms using them vanish
 * @param ignoreOnes                    substitute literal one for all-ones single-column tables
 * @param eliminateCommonSubexpressions hoist loop-invariant sub-expressions into named
 *                                      temporaries when building entries
 * @param epsilon                       tolerance for zero and one detection in tables and
 *                                      literals
 * @param format                        id of the symbol format used for naming
 * @param floatPrecision                digits after the decimal point in float literals
 */
public record CompilerOptions(
        boolean ignoreZeroTables,
        boolean removeZeroTerms,
        boolean ignoreOnes,
        boolean eliminateCommonSubexpressions,
        double epsilon,
        String format,
        int floatPrecision) {

    /** All optimisations on, UFC naming, 15 digits. */
    public static final CompilerOptions DEFAULT = builder().build();

    public CompilerOptions {
        if (!(epsilon > 0.0)) {
            throw new IllegalArgumentException("epsilon must be positive, got: " + epsilon);
        }
        if (format == null || format.isBlank()) {
            throw new IllegalArgumentException("format must not be null or blank");
        }
        if (floatPrecision < 1 || floatPrecision > 17) {
            throw new IllegalArgumentException("floatPrecision must be between 1 and 17, got: " + floatPrecision);
        }
    }

    /** Returns {@code true} if all-zero tables are replaced by literal zero. */
    public boolean dropsZeroTables() {
        return ignoreZeroTables || removeZeroTerms;
    }

    /** Creates a new builder with the default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CompilerOptions}. Every field has a default. */
    public static final class Builder {
        private boolean ignoreZeroTables = true;
        private boolean removeZeroTerms = true;
        private boolean ignoreOnes = true;
        private boolean eliminateCommonSubexpressions = true;
        private double epsilon = 3.0e-16;
        private String format = "ufc";
        private int floatPrecision = 15;

        Builder() {}

        public Builder ignoreZeroTables(boolean ignoreZeroTables) {
            this.ignoreZeroTables = ignoreZeroTables;
            return this;
        }

        public Builder removeZeroTerms(boolean removeZeroTerms) {
            this.removeZeroTerms = removeZeroTerms;
            return this;
        }

        public Builder ignoreOnes(boolean ignoreOnes) {
            this.ignoreOnes = ignoreOnes;
            return this;
        }

        public Builder eliminateCommonSubexpressions(boolean eliminateCommonSubexpressions) {
            this.eliminateCommonSubexpressions = eliminateCommonSubexpressions;
            return this;
        }

        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder floatPrecision(int floatPrecision) {
            this.floatPrecision = floatPrecision;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(
                    ignoreZeroTables,
                    removeZeroTerms,
                    ignoreOnes,
                    eliminateCommonSubexpressions,
                    epsilon,
                    format,
                    floatPrecision);
        }
    }
}
