package io.quadc.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CompilerOptions} from a YAML file with an optional environment variable overlay.
 *
 * <p>Recognised keys:
 * <pre>
 * optimise:
 *   ignore-zero-tables: true
 *   remove-zero-terms: true
 *   ignore-ones: true
 *   cse: true
 * numerics:
 *   epsilon: 3.0e-16
 *   float-precision: 15
 * output:
 *   format: ufc
 * </pre>
 * Missing keys receive the defaults of {@link CompilerOptions.Builder}.
 *
 * <p>Every key can be overridden by an environment variable ({@code QUADC_IGNORE_ZERO_TABLES},
 * {@code QUADC_REMOVE_ZERO_TERMS}, {@code QUADC_IGNORE_ONES}, {@code QUADC_CSE},
 * {@code QUADC_EPSILON}, {@code QUADC_FLOAT_PRECISION}, {@code QUADC_FORMAT}). An env var is
 * considered "set" if and only if it is defined and its trimmed value is non-empty.
 */
public final class OptionsLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_RESOURCE = "quadc-defaults.yaml";

    private OptionsLoader() {
        // utility class
    }

    /**
     * Loads options from the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws OptionsLoadException if the file is missing, not valid YAML or holds invalid values
     */
    public static CompilerOptions load(Path path) {
        return load(path, System::getenv);
    }

    /**
     * Loads options from the given YAML file, applying overrides from the supplied lookup
     * function. Returning {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @throws OptionsLoadException if the file is missing, not valid YAML or holds invalid values
     */
    public static CompilerOptions load(Path path, Function<String, String> envLookup) {
        if (!Files.exists(path)) {
            throw new OptionsLoadException("Options file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString(), envLookup);
        } catch (IOException e) {
            throw new OptionsLoadException("Failed to read options file: " + path, e);
        }
    }

    /** Loads the bundled {@code quadc-defaults.yaml}, applying {@link System#getenv} overrides. */
    public static CompilerOptions loadDefault() {
        return loadDefault(System::getenv);
    }

    public static CompilerOptions loadDefault(Function<String, String> envLookup) {
        InputStream in = OptionsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new OptionsLoadException("Classpath resource not found: " + DEFAULT_RESOURCE);
        }
        try (in) {
            return read(in, DEFAULT_RESOURCE, envLookup);
        } catch (IOException e) {
            throw new OptionsLoadException("Failed to read classpath resource: " + DEFAULT_RESOURCE, e);
        }
    }

    private static CompilerOptions read(InputStream in, String source, Function<String, String> envLookup) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new OptionsLoadException("Failed to parse YAML options: " + source, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new OptionsLoadException("Options root must be a mapping: " + source);
        }
        try {
            return mapToOptions(root, envLookup);
        } catch (NumberFormatException e) {
            throw new OptionsLoadException("Invalid numeric value in options from " + source + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new OptionsLoadException("Invalid options in " + source + ": " + e.getMessage(), e);
        }
    }

    private static CompilerOptions mapToOptions(JsonNode root, Function<String, String> envLookup) {
        CompilerOptions.Builder builder = CompilerOptions.builder();

        // --- YAML mapping ---

        JsonNode optimise = root.path("optimise");
        if (optimise.has("ignore-zero-tables"))
            builder.ignoreZeroTables(requireBoolean(optimise, "ignore-zero-tables"));
        if (optimise.has("remove-zero-terms"))
            builder.removeZeroTerms(requireBoolean(optimise, "remove-zero-terms"));
        if (optimise.has("ignore-ones")) builder.ignoreOnes(requireBoolean(optimise, "ignore-ones"));
        if (optimise.has("cse")) builder.eliminateCommonSubexpressions(requireBoolean(optimise, "cse"));

        JsonNode numerics = root.path("numerics");
        if (numerics.has("epsilon")) builder.epsilon(requireNumber(numerics, "epsilon").asDouble());
        if (numerics.has("float-precision"))
            builder.floatPrecision(requireNumber(numerics, "float-precision").asInt());

        JsonNode output = root.path("output");
        if (output.has("format")) builder.format(output.get("format").asText());

        // --- Environment variable overlay ---

        envBool(envLookup, "QUADC_IGNORE_ZERO_TABLES", builder::ignoreZeroTables);
        envBool(envLookup, "QUADC_REMOVE_ZERO_TERMS", builder::removeZeroTerms);
        envBool(envLookup, "QUADC_IGNORE_ONES", builder::ignoreOnes);
        envBool(envLookup, "QUADC_CSE", builder::eliminateCommonSubexpressions);
        envString(envLookup, "QUADC_EPSILON", v -> builder.epsilon(Double.parseDouble(v)));
        envInt(envLookup, "QUADC_FLOAT_PRECISION", builder::floatPrecision);
        envString(envLookup, "QUADC_FORMAT", builder::format);

        return builder.build();
    }

    // --- YAML helpers ---

    private static boolean requireBoolean(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw new OptionsLoadException("Expected a boolean for '" + field + "', got: " + value);
        }
        return value.asBoolean();
    }

    private static JsonNode requireNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.isNumber()) {
            throw new OptionsLoadException("Expected a number for '" + field + "', got: " + value);
        }
        return value;
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Integer.parseInt(envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
