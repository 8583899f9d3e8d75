package net.littleredcomputer.fol;

public final class Or extends BinaryClause {
    public Or(Clause left, Clause right) {
        super(left, right);
    }

    @Override
    String connective() { return "or"; }

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
