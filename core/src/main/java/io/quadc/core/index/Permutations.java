package io.quadc.core.index;

import io.quadc.core.error.InvalidIndexError;
import io.quadc.core.symbolic.Expr;
import io.quadc.core.symbolic.Symbolics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Combines the code maps of the operands of a product or a sum.
 *
 * <p>A product is expanded over the Cartesian product of the operands' keys, with scalar operands
 * multiplied into every entry. A sum merges entries key-wise.
 */
public final class Permutations {

    private final Symbolics sym;

    public Permutations(Symbolics sym) {
        this.sym = Objects.requireNonNull(sym, "sym must not be null");
    }

    /**
     * Pointwise product. An empty operand makes the whole product empty; with no indexed operand
     * the result is a single scalar entry.
     *
     * @throws InvalidIndexError if two distinct index combinations canonicalise to the same key
     */
    public CodeMap product(List<CodeMap> operands) {
        List<Expr> scalars = new ArrayList<>();
        List<CodeMap> indexed = new ArrayList<>();
        for (CodeMap operand : operands) {
            if (operand.isEmpty()) {
                return CodeMap.empty();
            }
            if (operand.arity() == 0) {
                scalars.add(operand.scalar());
            } else {
                indexed.add(operand);
            }
        }
        if (indexed.isEmpty()) {
            return CodeMap.scalar(sym.product(scalars));
        }
        Map<IndexKey, List<Expr>> combinations = new LinkedHashMap<>();
        combinations.put(IndexKey.EMPTY, List.of());
        for (CodeMap operand : indexed) {
            Map<IndexKey, List<Expr>> next = new LinkedHashMap<>();
            for (Map.Entry<IndexKey, List<Expr>> left : combinations.entrySet()) {
                for (Map.Entry<IndexKey, Expr> right : operand.entries().entrySet()) {
                    IndexKey key = left.getKey().concat(right.getKey());
                    List<Expr> factors = new ArrayList<>(left.getValue());
                    factors.add(right.getValue());
                    if (next.put(key, factors) != null) {
                        throw new InvalidIndexError("Index key collision in product expansion", key.toString());
                    }
                }
            }
            combinations = next;
        }
        TreeMap<IndexKey, Expr> result = new TreeMap<>();
        for (Map.Entry<IndexKey, List<Expr>> e : combinations.entrySet()) {
            List<Expr> factors = new ArrayList<>(e.getValue());
            factors.addAll(scalars);
            result.put(e.getKey(), sym.product(factors));
        }
        return CodeMap.of(result);
    }

    /**
     * Key-wise sum. Absent keys contribute nothing; a scalar operand whose value is literal zero
     * is dropped so it can be added to indexed operands.
     *
     * @throws InvalidIndexError if the non-zero operands have different key arities
     */
    public CodeMap sum(List<CodeMap> operands) {
        Map<IndexKey, List<Expr>> terms = new TreeMap<>();
        int arity = -1;
        for (CodeMap operand : operands) {
            if (operand.isEmpty() || (operand.isScalar() && operand.scalar().isZero())) {
                continue;
            }
            if (arity >= 0 && operand.arity() != arity) {
                throw new InvalidIndexError(
                        "Cannot add code maps of arity " + arity + " and " + operand.arity(), operand.toString());
            }
            arity = operand.arity();
            for (Map.Entry<IndexKey, Expr> e : operand.entries().entrySet()) {
                terms.computeIfAbsent(e.getKey(), k -> new ArrayList<>()).add(e.getValue());
            }
        }
        if (terms.isEmpty()) {
            boolean anyScalarZero = operands.stream().anyMatch(CodeMap::isScalar);
            return anyScalarZero ? CodeMap.scalar(sym.zero()) : CodeMap.empty();
        }
        TreeMap<IndexKey, Expr> result = new TreeMap<>();
        for (Map.Entry<IndexKey, List<Expr>> e : terms.entrySet()) {
            List<Expr> values = e.getValue();
            result.put(e.getKey(), values.size() == 1 ? values.get(0) : sym.sum(values));
        }
        return CodeMap.of(result);
    }
}
