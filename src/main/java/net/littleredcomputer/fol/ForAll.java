package net.littleredcomputer.fol;

import com.google.common.collect.ImmutableList;

public final class ForAll extends Quantifier {
    public ForAll(Iterable<String> variables, Clause child) {
        super(variables, child);
    }

    public ForAll(String variable, Clause child) {
        this(ImmutableList.of(variable), child);
    }

    @Override
    String keyword() { return "for_all"; }

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitForAll(this);
    }
}
