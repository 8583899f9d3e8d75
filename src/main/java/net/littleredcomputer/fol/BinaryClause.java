package net.littleredcomputer.fol;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Common state of the binary connectives {@link And}, {@link Or} and {@link Implies}.
 */
public abstract class BinaryClause extends Clause {
    private final Clause left;
    private final Clause right;

    BinaryClause(Clause left, Clause right) {
        this.left = checkNotNull(left, "left");
        this.right = checkNotNull(right, "right");
    }

    public Clause left() { return left; }

    public Clause right() { return right; }

    abstract String connective();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        BinaryClause b = (BinaryClause) o;
        return left.equals(b.left) && right.equals(b.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + connective() + " " + right + ")";
    }
}
