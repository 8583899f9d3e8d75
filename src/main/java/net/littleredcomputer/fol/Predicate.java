package net.littleredcomputer.fol;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An atomic formula: a predicate name applied to an ordered list of terms.
 */
public final class Predicate extends Clause {
    private static final Joiner commaJoiner = Joiner.on(", ");
    private final String name;
    private final ImmutableList<Term> args;

    public Predicate(String name, Iterable<? extends Term> args) {
        checkNotNull(name, "name");
        checkArgument(!name.isEmpty(), "predicate name must not be empty");
        this.name = name;
        this.args = ImmutableList.copyOf(checkNotNull(args, "args"));
    }

    public Predicate(String name, Term... args) {
        this(name, ImmutableList.copyOf(args));
    }

    /**
     * Shorthand for a predicate all of whose arguments are symbols.
     */
    public static Predicate of(String name, String... args) {
        ImmutableList.Builder<Term> b = ImmutableList.builder();
        for (String a : args) b.add(new Symbol(a));
        return new Predicate(name, b.build());
    }

    public String name() { return name; }

    public ImmutableList<Term> args() { return args; }

    public int arity() { return args.size(); }

    public boolean contains(Term t) {
        return args.contains(t);
    }

    /**
     * @return a predicate in which each argument equal to {@code variable} is replaced. Only
     * whole arguments are compared; Skolem terms are left alone.
     */
    public Predicate replace(Symbol variable, Term replacement) {
        ImmutableList.Builder<Term> b = ImmutableList.builderWithExpectedSize(args.size());
        for (Term t : args) b.add(t.equals(variable) ? replacement : t);
        return new Predicate(name, b.build());
    }

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitPredicate(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Predicate)) return false;
        Predicate p = (Predicate) o;
        return name.equals(p.name) && args.equals(p.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        return name + "(" + commaJoiner.join(args) + ")";
    }
}
