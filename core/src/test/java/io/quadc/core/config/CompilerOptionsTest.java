package io.quadc.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CompilerOptionsTest {

    @Test
    void defaultsEnableEveryOptimisation() {
        CompilerOptions options = CompilerOptions.DEFAULT;

        assertThat(options.ignoreZeroTables()).isTrue();
        assertThat(options.removeZeroTerms()).isTrue();
        assertThat(options.ignoreOnes()).isTrue();
        assertThat(options.eliminateCommonSubexpressions()).isTrue();
        assertThat(options.epsilon()).isEqualTo(3.0e-16);
        assertThat(options.format()).isEqualTo("ufc");
        assertThat(options.floatPrecision()).isEqualTo(15);
    }

    @Test
    void eitherZeroOptionDropsZeroTables() {
        assertThat(CompilerOptions.builder().ignoreZeroTables(false).build().dropsZeroTables()).isTrue();
        assertThat(CompilerOptions.builder().removeZeroTerms(false).build().dropsZeroTables()).isTrue();
        assertThat(CompilerOptions.builder()
                        .ignoreZeroTables(false)
                        .removeZeroTerms(false)
                        .build()
                        .dropsZeroTables())
                .isFalse();
    }

    @Test
    void invalidValuesAreRejected() {
        assertThatThrownBy(() -> CompilerOptions.builder().epsilon(0.0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("epsilon");
        assertThatThrownBy(() -> CompilerOptions.builder().format(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompilerOptions.builder().floatPrecision(18).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("floatPrecision");
    }
}
