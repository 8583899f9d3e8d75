package net.littleredcomputer.fol;

/**
 * A pass over a clause tree, with one case for each kind of node.
 * @param <R> result of the pass
 */
public interface ClauseVisitor<R> {
    R visitPredicate(Predicate p);
    R visitNot(Not n);
    R visitAnd(And a);
    R visitOr(Or o);
    R visitImplies(Implies i);
    R visitForAll(ForAll f);
    R visitThereExists(ThereExists e);
}
