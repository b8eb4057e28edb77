package io.quadc.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for the environment variable overlay of {@link OptionsLoader}. Env vars take precedence
 * over YAML values; empty or whitespace-only values count as unset.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullOptionsPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullOptionsPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-options.yaml")
                .toURI());
        envVars.clear();
    }

    @Test
    @DisplayName("Booleans override YAML values")
    void booleanOverrides() {
        envVars.put("QUADC_CSE", "true");
        envVars.put("QUADC_IGNORE_ONES", "TRUE");

        CompilerOptions options = OptionsLoader.load(fullOptionsPath, envLookup());

        assertThat(options.eliminateCommonSubexpressions()).isTrue();
        assertThat(options.ignoreOnes()).isTrue();
        assertThat(options.ignoreZeroTables()).isFalse();
    }

    @Test
    @DisplayName("Numbers and strings override YAML values")
    void numericAndStringOverrides() {
        envVars.put("QUADC_EPSILON", "1e-10");
        envVars.put("QUADC_FLOAT_PRECISION", " 6 ");
        envVars.put("QUADC_FORMAT", "ufc");

        CompilerOptions options = OptionsLoader.load(fullOptionsPath, envLookup());

        assertThat(options.epsilon()).isEqualTo(1e-10);
        assertThat(options.floatPrecision()).isEqualTo(6);
        assertThat(options.format()).isEqualTo("ufc");
    }

    @Test
    @DisplayName("Blank values are treated as unset")
    void blankIsUnset() {
        envVars.put("QUADC_FORMAT", "   ");
        envVars.put("QUADC_FLOAT_PRECISION", "");

        CompilerOptions options = OptionsLoader.load(fullOptionsPath, envLookup());

        assertThat(options.format()).isEqualTo("dolfin");
        assertThat(options.floatPrecision()).isEqualTo(8);
    }

    @Test
    @DisplayName("Unparseable numbers → OptionsLoadException")
    void unparseableNumber() {
        envVars.put("QUADC_FLOAT_PRECISION", "many");

        assertThatThrownBy(() -> OptionsLoader.load(fullOptionsPath, envLookup()))
                .isInstanceOf(OptionsLoadException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("Overrides apply to the bundled defaults too")
    void overridesBundledDefaults() {
        envVars.put("QUADC_REMOVE_ZERO_TERMS", "false");

        assertThat(OptionsLoader.loadDefault(envLookup()).removeZeroTerms()).isFalse();
    }
}
