package io.quadc.core.symbolic;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Named value: a table access, a geometric quantity, a hoisted temporary, or a call such as
 * {@code std::pow(x, 2.5)} that wraps simpler expressions.
 *
 * <p>The operations of a wrapped call are its own plus those of its arguments. The arguments only
 * feed operation counting and symbol collection; the name is what gets emitted.
 */
public final class Symbol extends Expr {

    private final String name;
    private final List<Expr> arguments;

    Symbol(String name, Domain domain) {
        this(name, domain, List.of(), 0);
    }

    Symbol(String name, Domain domain, List<Expr> arguments, int callOps) {
        super(domain, Objects.requireNonNull(name, "name must not be null"), callOps + sumOps(arguments));
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    private static int sumOps(List<Expr> arguments) {
        int ops = 0;
        for (Expr argument : arguments) {
            ops += argument.ops();
        }
        return ops;
    }

    @Override
    public Kind kind() {
        return Kind.SYMBOL;
    }

    public String name() {
        return name;
    }

    public boolean isCall() {
        return !arguments.isEmpty();
    }

    @Override
    public boolean isComposite() {
        return isCall();
    }

    @Override
    void collectSymbols(Set<Symbol> into) {
        if (isCall()) {
            for (Expr argument : arguments) {
                argument.collectSymbols(into);
            }
        } else {
            into.add(this);
        }
    }
}
