package net.littleredcomputer.fol;

/** Material implication. Eliminated before negations are pushed inward. */
public final class Implies extends BinaryClause {
    public Implies(Clause left, Clause right) {
        super(left, right);
    }

    @Override
    String connective() { return "->"; }

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitImplies(this);
    }
}
