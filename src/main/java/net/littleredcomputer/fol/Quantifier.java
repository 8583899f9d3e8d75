package net.littleredcomputer.fol;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Common state of {@link ForAll} and {@link ThereExists}: a nonempty list of distinct variable
 * names bound over a child formula.
 */
public abstract class Quantifier extends Clause {
    private static final Joiner commaJoiner = Joiner.on(", ");
    private final ImmutableList<String> variables;
    private final Clause child;

    Quantifier(Iterable<String> variables, Clause child) {
        this.variables = ImmutableList.copyOf(checkNotNull(variables, "variables"));
        this.child = checkNotNull(child, "child");
        checkArgument(!this.variables.isEmpty(), "a quantifier must bind at least one variable");
        Set<String> seen = new HashSet<>();
        for (String v : this.variables) {
            checkArgument(!v.isEmpty(), "empty variable name");
            if (!seen.add(v)) throw new IllegalArgumentException("variable bound twice: " + v);
        }
    }

    public ImmutableList<String> variables() { return variables; }

    public Clause child() { return child; }

    abstract String keyword();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        Quantifier q = (Quantifier) o;
        return variables.equals(q.variables) && child.equals(q.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), variables, child);
    }

    @Override
    public String toString() {
        return "(" + keyword() + " (" + commaJoiner.join(variables) + ") " + child + ")";
    }
}
