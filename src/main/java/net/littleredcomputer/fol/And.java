package net.littleredcomputer.fol;

public final class And extends BinaryClause {
    public And(Clause left, Clause right) {
        super(left, right);
    }

    @Override
    String connective() { return "and"; }

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
