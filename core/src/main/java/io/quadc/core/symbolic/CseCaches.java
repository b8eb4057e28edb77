package io.quadc.core.symbolic;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One {@link CseCache} per hoistable domain: {@code C} for constants, {@code G} for geometry,
 * {@code I} for integration-point values. Basis-varying expressions are never hoisted.
 */
public final class CseCaches {

    private final Map<Domain, CseCache> caches = new EnumMap<>(Domain.class);

    public CseCaches() {
        caches.put(Domain.CONST, new CseCache(Domain.CONST, "C"));
        caches.put(Domain.GEO, new CseCache(Domain.GEO, "G"));
        caches.put(Domain.IP, new CseCache(Domain.IP, "I"));
    }

    /**
     * @throws IllegalArgumentException for {@link Domain#BASIS}
     */
    public CseCache cache(Domain domain) {
        CseCache cache = caches.get(domain);
        if (cache == null) {
            throw new IllegalArgumentException("No common-subexpression cache for domain " + domain);
        }
        return cache;
    }

    /** The definition behind a hoisted symbol, or {@code null} if the symbol was not hoisted here. */
    public Expr definitionOf(Symbol symbol) {
        CseCache cache = caches.get(symbol.domain());
        return cache == null ? null : cache.definitions().get(symbol);
    }

    /** All definitions, constants first, then geometry, then integration-point values. */
    public Map<Symbol, Expr> definitions() {
        Map<Symbol, Expr> all = new LinkedHashMap<>();
        for (CseCache cache : caches.values()) {
            all.putAll(cache.definitions());
        }
        return Collections.unmodifiableMap(all);
    }

    public int totalOps() {
        int ops = 0;
        for (CseCache cache : caches.values()) {
            for (Expr definition : cache.definitions().values()) {
                ops += definition.ops();
            }
        }
        return ops;
    }

    public boolean isEmpty() {
        return caches.values().stream().allMatch(c -> c.size() == 0);
    }
}
