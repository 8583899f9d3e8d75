package net.littleredcomputer.fol;

import com.google.common.collect.ImmutableList;

/**
 * Existential quantification. These nodes do not survive Skolemization.
 */
public final class ThereExists extends Quantifier {
    public ThereExists(Iterable<String> variables, Clause child) {
        super(variables, child);
    }

    public ThereExists(String variable, Clause child) {
        this(ImmutableList.of(variable), child);
    }

    @Override
    String keyword() { return "there_exists"; }

    @Override
    public <R> R accept(ClauseVisitor<R> visitor) {
        return visitor.visitThereExists(this);
    }
}
