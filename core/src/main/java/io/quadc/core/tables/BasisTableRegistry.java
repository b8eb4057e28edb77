package io.quadc.core.tables;

import io.quadc.core.error.UnsupportedExpressionError;
import io.quadc.core.model.FiniteElement;
import io.quadc.core.model.IntegralType;
import io.quadc.core.spi.Tabulator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tabulates, analyses and names the basis tables of one form.
 *
 * <p>Each distinct {@link TableKey} is tabulated once. The analysis detects all-zero tables,
 * drops zero columns (recording the remaining column numbers as a shared non-zero-column array),
 * detects all-ones tables and merges numerically identical compressed tables under one unique
 * name per point rule.
 *
 * <p>Not thread-safe: one registry is created per form.
 */
public final class BasisTableRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(BasisTableRegistry.class);

    private final Tabulator tabulator;
    private final double epsilon;

    private final Map<FiniteElement, Integer> elementCounters = new LinkedHashMap<>();
    private final Map<TableKey, BasisTable> records = new HashMap<>();
    private final Map<List<Integer>, NonzeroColumns> columnSets = new LinkedHashMap<>();
    private final Map<Integer, Map<String, double[][]>> uniqueTables = new TreeMap<>();
    private final Map<String, String> symbolTables = new HashMap<>();

    public BasisTableRegistry(Tabulator tabulator, double epsilon) {
        this.tabulator = Objects.requireNonNull(tabulator, "tabulator must not be null");
        this.epsilon = epsilon;
    }

    /** Number identifying {@code element} in table names, assigned in order of first use. */
    public int elementCounter(FiniteElement element) {
        return elementCounters.computeIfAbsent(element, e -> elementCounters.size());
    }

    /**
     * Returns the memoised resolution record of a table, tabulating and analysing it on first
     * request.
     *
     * @param facet local facet for facet integrals, ignored for cell integrals
     */
    public BasisTable resolve(
            FiniteElement element, int component, int[] derivativeCounts, IntegralType type, int facet, int points) {
        int effectiveFacet = type.isFacet() ? facet : -1;
        List<Integer> derivatives = new ArrayList<>(derivativeCounts.length);
        for (int d : derivativeCounts) {
            derivatives.add(d);
        }
        TableKey key = new TableKey(element, effectiveFacet, component, derivatives, points);
        BasisTable table = records.get(key);
        if (table == null) {
            table = analyse(key, tabulate(key, derivativeCounts, type));
            records.put(key, table);
        }
        return table;
    }

    /**
     * Records that a basis symbol reads from a unique table, so that referenced tables can be
     * collected from expressions later.
     */
    public void recordAccess(String symbolName, String tableName) {
        symbolTables.put(symbolName, tableName);
    }

    /** The unique table a basis symbol reads from, or {@code null}. */
    public String tableOf(String symbolName) {
        return symbolTables.get(symbolName);
    }

    /** Copies of the unique (compressed) tables of one point rule, in creation order. */
    public Map<String, double[][]> uniqueTables(int points) {
        return copyOf(uniqueTables.getOrDefault(points, Map.of()));
    }

    /** Copies of the unique tables of every point rule seen so far, keyed by number of points. */
    public Map<Integer, Map<String, double[][]>> allUniqueTables() {
        Map<Integer, Map<String, double[][]>> all = new TreeMap<>();
        uniqueTables.forEach((points, tables) -> all.put(points, copyOf(tables)));
        return Collections.unmodifiableMap(all);
    }

    private static Map<String, double[][]> copyOf(Map<String, double[][]> tables) {
        Map<String, double[][]> copy = new LinkedHashMap<>();
        tables.forEach((name, values) -> copy.put(name, copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    private static double[][] copyOf(double[][] values) {
        double[][] copy = new double[values.length][];
        for (int p = 0; p < values.length; p++) {
            copy[p] = values[p].clone();
        }
        return copy;
    }

    /** All non-zero-column arrays, in numbering order. */
    public List<NonzeroColumns> nonzeroColumns() {
        return List.copyOf(columnSets.values());
    }

    /** Number of distinct tables tabulated so far. */
    public int size() {
        return records.size();
    }

    private double[][] tabulate(TableKey key, int[] derivativeCounts, IntegralType type) {
        FiniteElement element = key.element();
        if (element.isQuadrature()) {
            if (key.hasDerivatives()) {
                throw new UnsupportedExpressionError(
                        "Derivatives of quadrature element functions are not supported", element.toString());
            }
            if (element.spaceDimension() != key.points()) {
                throw new UnsupportedExpressionError(
                        "Quadrature element with " + element.spaceDimension() + " points used with a "
                                + key.points() + "-point rule",
                        element.toString());
            }
            return identity(key.points());
        }
        double[][] values = tabulator.tabulate(element, key.component(), derivativeCounts, type, key.facet(), key.points());
        if (values == null || values.length != key.points()) {
            throw new IllegalStateException("Tabulator returned " + (values == null ? "null" : values.length + " rows")
                    + " for " + key.points() + " points: " + key);
        }
        for (double[] row : values) {
            if (row.length != element.spaceDimension()) {
                throw new IllegalStateException("Tabulator returned a row of length " + row.length
                        + ", expected " + element.spaceDimension() + ": " + key);
            }
        }
        LOG.debug("Tabulated {}x{} table for {}", values.length, element.spaceDimension(), key);
        return copyOf(values);
    }

    private BasisTable analyse(TableKey key, double[][] values) {
        String name = psiName(key);
        int dofs = key.element().spaceDimension();
        List<Integer> columns = new ArrayList<>();
        for (int c = 0; c < dofs; c++) {
            if (!isZeroColumn(values, c)) {
                columns.add(c);
            }
        }
        if (columns.isEmpty()) {
            return new BasisTable(unique(name, values, key.points()), null, true, false, dofs, dofs);
        }
        NonzeroColumns nonzero = null;
        double[][] compressed = values;
        if (columns.size() < dofs) {
            nonzero = columnSets.computeIfAbsent(columns, c -> new NonzeroColumns(columnSets.size(), c));
            compressed = compress(values, columns);
        }
        boolean ones = allOnes(compressed);
        String unique = unique(name, compressed, key.points());
        return new BasisTable(unique, nonzero, false, ones, columns.size(), dofs);
    }

    /** {@code FE<e>[_f<facet>][_C<component>][_D<derivatives>]}. */
    private String psiName(TableKey key) {
        StringBuilder name = new StringBuilder("FE").append(elementCounter(key.element()));
        if (key.facet() >= 0) {
            name.append("_f").append(key.facet());
        }
        if (key.element().valueDimension() > 1) {
            name.append("_C").append(key.component());
        }
        if (key.hasDerivatives()) {
            name.append("_D");
            key.derivativeCounts().forEach(name::append);
        }
        return name.toString();
    }

    private String unique(String name, double[][] values, int points) {
        Map<String, double[][]> tables = uniqueTables.computeIfAbsent(points, p -> new LinkedHashMap<>());
        for (Map.Entry<String, double[][]> e : tables.entrySet()) {
            if (sameValues(e.getValue(), values)) {
                return e.getKey();
            }
        }
        tables.put(name, values);
        return name;
    }

    private boolean isZeroColumn(double[][] values, int column) {
        for (double[] row : values) {
            if (Math.abs(row[column]) >= epsilon) {
                return false;
            }
        }
        return true;
    }

    private boolean allOnes(double[][] values) {
        for (double[] row : values) {
            for (double v : row) {
                if (Math.abs(v - 1.0) >= epsilon) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean sameValues(double[][] a, double[][] b) {
        if (a.length != b.length || a[0].length != b[0].length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < a[i].length; j++) {
                if (Math.abs(a[i][j] - b[i][j]) >= epsilon) {
                    return false;
                }
            }
        }
        return true;
    }

    private static double[][] compress(double[][] values, List<Integer> columns) {
        double[][] out = new double[values.length][columns.size()];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < columns.size(); j++) {
                out[i][j] = values[i][columns.get(j)];
            }
        }
        return out;
    }

    private static double[][] identity(int n) {
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            out[i][i] = 1.0;
        }
        return out;
    }
}
