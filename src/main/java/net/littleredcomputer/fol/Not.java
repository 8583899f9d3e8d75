package net.littleredcomputer.fol;

import static com.google.common.base.Preconditions.checkNotNull;

public final class Not extends Clause {
    private final Clause child;

    public Not(Clause child) {
        this.child = checkNotNull(child, "child");
    }

    public Clause child() { return child; }

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Not && ((Not) o).child.equals(child);
    }

    @Override
    public int hashCode() {
        return 31 * Not.class.hashCode() + child.hashCode();
    }

    @Override
    public String toString() {
        return "(not " + child + ")";
    }
}
