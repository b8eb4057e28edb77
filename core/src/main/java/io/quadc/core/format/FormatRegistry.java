package io.quadc.core.format;

import io.quadc.core.config.CompilerOptions;
import io.quadc.core.spi.SymbolFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for symbol formats. Manages format registration and lookup by id. Thread-safe:
 * registration and lookup can happen concurrently.
 */
public final class FormatRegistry {

    private final Map<String, SymbolFormat> formats = new ConcurrentHashMap<>();

    /** Registry holding the UFC and DOLFIN formats configured from {@code options}. */
    public static FormatRegistry withDefaults(CompilerOptions options) {
        FormatRegistry registry = new FormatRegistry();
        registry.register(new UfcFormat(options.epsilon(), options.floatPrecision()));
        registry.register(new DolfinFormat(options.epsilon(), options.floatPrecision()));
        return registry;
    }

    /**
     * Registers a format. A format with the same id is replaced (last-write-wins semantics).
     *
     * @throws NullPointerException     if format is null
     * @throws IllegalArgumentException if format.id() is null or empty
     */
    public void register(SymbolFormat format) {
        if (format == null) {
            throw new NullPointerException("format must not be null");
        }
        String id = format.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("format id must not be null or empty");
        }
        formats.put(id, format);
    }

    public Optional<SymbolFormat> getFormat(String formatId) {
        return Optional.ofNullable(formats.get(formatId));
    }

    /**
     * @throws IllegalArgumentException if no format is registered with the given id
     */
    public SymbolFormat requireFormat(String formatId) {
        return getFormat(formatId)
                .orElseThrow(() -> new IllegalArgumentException("No symbol format registered for id: '" + formatId + "'"));
    }

    public int size() {
        return formats.size();
    }

    public boolean hasFormat(String formatId) {
        return formats.containsKey(formatId);
    }
}
