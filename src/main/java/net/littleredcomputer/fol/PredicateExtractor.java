package net.littleredcomputer.fol;

import com.google.common.collect.ImmutableList;

/**
 * Flattens a clause tree into the predicates at its leaves, left to right, depth first.
 * Negations and quantifiers are looked through; the And/Or structure is not recorded.
 */
public final class PredicateExtractor implements ClauseVisitor<Void> {
    private final ImmutableList.Builder<Predicate> predicates = ImmutableList.builder();

    private PredicateExtractor() {}

    public static ImmutableList<Predicate> extract(Clause clause) {
        PredicateExtractor x = new PredicateExtractor();
        clause.accept(x);
        return x.predicates.build();
    }

    @Override
    public Void visitPredicate(Predicate p) {
        predicates.add(p);
        return null;
    }

    @Override
    public Void visitNot(Not n) {
        return n.child().accept(this);
    }

    @Override
    public Void visitAnd(And a) {
        return binary(a);
    }

    @Override
    public Void visitOr(Or o) {
        return binary(o);
    }

    @Override
    public Void visitImplies(Implies i) {
        return binary(i);
    }

    @Override
    public Void visitForAll(ForAll f) {
        return f.child().accept(this);
    }

    @Override
    public Void visitThereExists(ThereExists e) {
        return e.child().accept(this);
    }

    private Void binary(BinaryClause b) {
        b.left().accept(this);
        return b.right().accept(this);
    }
}
