package net.littleredcomputer.fol.cnf;

import net.littleredcomputer.fol.Clause;
import net.littleredcomputer.fol.Not;
import net.littleredcomputer.fol.Predicate;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A predicate, possibly negated.
 */
public final class Literal {
    private final Predicate predicate;
    private final boolean negated;

    public Literal(Predicate predicate, boolean negated) {
        this.predicate = checkNotNull(predicate, "predicate");
        this.negated = negated;
    }

    public Predicate predicate() { return predicate; }

    public boolean isNegated() { return negated; }

    public Literal complement() { return new Literal(predicate, !negated); }

    public Clause toClause() { return negated ? new Not(predicate) : predicate; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Literal)) return false;
        Literal l = (Literal) o;
        return negated == l.negated && predicate.equals(l.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicate, negated);
    }

    @Override
    public String toString() {
        return negated ? "~" + predicate : predicate.toString();
    }
}
