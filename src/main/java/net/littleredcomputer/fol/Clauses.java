package net.littleredcomputer.fol;

/**
 * Structural queries over clause trees.
 */
public final class Clauses {
    private Clauses() {}

    /**
     * A "monolithic or" is a disjunction of literals: a predicate, a negation of such a thing,
     * or an Or of two of them.
     */
    public static boolean isMonolithicOr(Clause c) {
        if (c instanceof Or) return isMonolithicOr(((Or) c).left()) && isMonolithicOr(((Or) c).right());
        if (c instanceof Not) return isMonolithicOr(((Not) c).child());
        return c instanceof Predicate;
    }

    /**
     * @return true if no implication remains and every negation sits directly above a predicate
     */
    public static boolean isNegationNormalForm(Clause c) {
        return c.accept(new ClauseVisitor<Boolean>() {
            @Override public Boolean visitPredicate(Predicate p) { return true; }
            @Override public Boolean visitNot(Not n) { return n.child() instanceof Predicate; }
            @Override public Boolean visitAnd(And a) { return a.left().accept(this) && a.right().accept(this); }
            @Override public Boolean visitOr(Or o) { return o.left().accept(this) && o.right().accept(this); }
            @Override public Boolean visitImplies(Implies i) { return false; }
            @Override public Boolean visitForAll(ForAll f) { return f.child().accept(this); }
            @Override public Boolean visitThereExists(ThereExists e) { return e.child().accept(this); }
        });
    }

    /**
     * Quantifier-free conjunctive normal form: a tree of And nodes whose leaves are each
     * a monolithic or.
     */
    public static boolean isConjunctiveNormalForm(Clause c) {
        if (c instanceof And) return isConjunctiveNormalForm(((And) c).left()) && isConjunctiveNormalForm(((And) c).right());
        return isMonolithicOr(c) && isNegationNormalForm(c);
    }

    public static boolean containsKind(Clause c, Class<? extends Clause> kind) {
        return c.accept(new ClauseVisitor<Boolean>() {
            private boolean found(Clause d) { return kind.isInstance(d); }
            @Override public Boolean visitPredicate(Predicate p) { return found(p); }
            @Override public Boolean visitNot(Not n) { return found(n) || n.child().accept(this); }
            @Override public Boolean visitAnd(And a) { return found(a) || a.left().accept(this) || a.right().accept(this); }
            @Override public Boolean visitOr(Or o) { return found(o) || o.left().accept(this) || o.right().accept(this); }
            @Override public Boolean visitImplies(Implies i) { return found(i) || i.left().accept(this) || i.right().accept(this); }
            @Override public Boolean visitForAll(ForAll f) { return found(f) || f.child().accept(this); }
            @Override public Boolean visitThereExists(ThereExists e) { return found(e) || e.child().accept(this); }
        });
    }

    /**
     * Remove every universal quantifier, keeping its body. Once existentials have been Skolemized
     * the variables that remain are implicitly universal, so this is safe provided no two
     * quantifiers bind the same name.
     */
    public static Clause dropUniversals(Clause c) {
        return c.accept(new ClauseVisitor<Clause>() {
            @Override public Clause visitPredicate(Predicate p) { return p; }
            @Override public Clause visitNot(Not n) { return new Not(n.child().accept(this)); }
            @Override public Clause visitAnd(And a) { return new And(a.left().accept(this), a.right().accept(this)); }
            @Override public Clause visitOr(Or o) { return new Or(o.left().accept(this), o.right().accept(this)); }
            @Override public Clause visitImplies(Implies i) { return new Implies(i.left().accept(this), i.right().accept(this)); }
            @Override public Clause visitForAll(ForAll f) { return f.child().accept(this); }
            @Override public Clause visitThereExists(ThereExists e) { return new ThereExists(e.variables(), e.child().accept(this)); }
        });
    }
}
