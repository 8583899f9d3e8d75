package net.littleredcomputer.fol;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A witness for an eliminated existential quantifier: an identity handed out by a
 * {@code SkolemAllocator} together with the universally quantified variables that were in scope
 * where the quantifier stood. Two Skolem terms with different identities are never equal.
 */
public final class SkolemTerm extends Term {
    private static final Joiner commaJoiner = Joiner.on(", ");
    private final long id;
    private final ImmutableList<Term> captured;

    public SkolemTerm(long id, Iterable<? extends Term> captured) {
        this.id = id;
        this.captured = ImmutableList.copyOf(checkNotNull(captured, "captured"));
    }

    public long id() { return id; }

    public ImmutableList<Term> captured() { return captured; }

    public String name() { return "F_" + id; }

    @Override
    public boolean isVariable() {
        return false;
    }

    @Override
    public Term replace(Symbol variable, Term replacement) {
        if (!occurs(variable)) return this;
        ImmutableList.Builder<Term> b = ImmutableList.builderWithExpectedSize(captured.size());
        for (Term t : captured) b.add(t.replace(variable, replacement));
        return new SkolemTerm(id, b.build());
    }

    @Override
    public boolean occurs(Symbol variable) {
        for (Term t : captured) if (t.occurs(variable)) return true;
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SkolemTerm)) return false;
        SkolemTerm s = (SkolemTerm) o;
        return id == s.id && captured.equals(s.captured);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, captured);
    }

    @Override
    public String toString() {
        return name() + "(" + commaJoiner.join(captured) + ")";
    }
}
