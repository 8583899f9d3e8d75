package net.littleredcomputer.fol.cnf;

import net.littleredcomputer.fol.*;

import javax.annotation.CheckReturnValue;

/**
 * Conversion to negation normal form, in two passes. The first replaces each implication
 * {@code L -> R} by {@code (not L) or R}. The second moves negations inward using De Morgan's
 * laws and quantifier duality until each one sits directly above a predicate.
 */
public final class NegationNormalizer {
    private NegationNormalizer() {}

    @CheckReturnValue
    public static Clause toNegationNormalForm(Clause c) {
        return pushNegations(eliminateImplication(c));
    }

    @CheckReturnValue
    public static Clause eliminateImplication(Clause c) {
        return c.accept(IMPLICATION_ELIMINATOR);
    }

    /**
     * The negation of a clause, with the negation carried one level (or, through And, Or and the
     * quantifiers, all the way) inward:
     * <ul>
     *     <li>{@code negate(p) = (not p)} for a predicate p</li>
     *     <li>{@code negate((not c)) = c}</li>
     *     <li>{@code negate((l and r)) = (negate(l) or negate(r))}, and dually for Or</li>
     *     <li>{@code negate((for_all (v) c)) = (there_exists (v) negate(c))}, and dually</li>
     *     <li>{@code negate((l -> r)) = (l and negate(r))}</li>
     * </ul>
     * The implication case is sound only at the node itself; implications beneath l are not
     * touched, which is why elimination is a separate, earlier pass.
     */
    @CheckReturnValue
    public static Clause negate(Clause c) {
        return c.accept(NEGATOR);
    }

    /**
     * Move every negation in an implication-free clause down to the predicates.
     * @throws UnsupportedClauseKindException if an implication is found anywhere in the clause,
     * including beneath a negation
     */
    @CheckReturnValue
    public static Clause pushNegations(Clause c) {
        return c.accept(NEGATION_PUSHER);
    }

    private static final ClauseVisitor<Clause> IMPLICATION_ELIMINATOR = new ClauseVisitor<Clause>() {
        @Override public Clause visitPredicate(Predicate p) { return p; }
        @Override public Clause visitNot(Not n) { return new Not(n.child().accept(this)); }
        @Override public Clause visitAnd(And a) { return new And(a.left().accept(this), a.right().accept(this)); }
        @Override public Clause visitOr(Or o) { return new Or(o.left().accept(this), o.right().accept(this)); }

        @Override
        public Clause visitImplies(Implies i) {
            Clause left = i.left().accept(this);
            Clause right = i.right().accept(this);
            return new Or(negate(left), right);
        }

        @Override public Clause visitForAll(ForAll f) { return new ForAll(f.variables(), f.child().accept(this)); }
        @Override public Clause visitThereExists(ThereExists e) { return new ThereExists(e.variables(), e.child().accept(this)); }
    };

    private static final ClauseVisitor<Clause> NEGATOR = new ClauseVisitor<Clause>() {
        @Override public Clause visitPredicate(Predicate p) { return new Not(p); }
        @Override public Clause visitNot(Not n) { return n.child(); }
        @Override public Clause visitAnd(And a) { return new Or(a.left().accept(this), a.right().accept(this)); }
        @Override public Clause visitOr(Or o) { return new And(o.left().accept(this), o.right().accept(this)); }
        @Override public Clause visitImplies(Implies i) { return new And(i.left(), i.right().accept(this)); }
        @Override public Clause visitForAll(ForAll f) { return new ThereExists(f.variables(), f.child().accept(this)); }
        @Override public Clause visitThereExists(ThereExists e) { return new ForAll(e.variables(), e.child().accept(this)); }
    };

    private static final ClauseVisitor<Clause> NEGATION_PUSHER = new ClauseVisitor<Clause>() {
        @Override public Clause visitPredicate(Predicate p) { return p; }

        @Override
        public Clause visitNot(Not n) {
            if (n.child() instanceof Predicate) return n;
            // negate() would quietly rewrite an implication; refuse it here as everywhere else.
            if (Clauses.containsKind(n.child(), Implies.class)) throw new UnsupportedClauseKindException("negation pushdown", n);
            // negate() may hand back a subtree that still holds unnormalized negations,
            // e.g. the child of a double negation, so keep going on its result.
            return negate(n.child()).accept(this);
        }

        @Override public Clause visitAnd(And a) { return new And(a.left().accept(this), a.right().accept(this)); }
        @Override public Clause visitOr(Or o) { return new Or(o.left().accept(this), o.right().accept(this)); }

        @Override
        public Clause visitImplies(Implies i) {
            throw new UnsupportedClauseKindException("negation pushdown", i);
        }

        @Override public Clause visitForAll(ForAll f) { return new ForAll(f.variables(), f.child().accept(this)); }
        @Override public Clause visitThereExists(ThereExists e) { return new ThereExists(e.variables(), e.child().accept(this)); }
    };
}
