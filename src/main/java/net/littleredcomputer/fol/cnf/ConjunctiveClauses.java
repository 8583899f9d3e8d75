package net.littleredcomputer.fol.cnf;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.fol.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the clause structure out of a formula in conjunctive normal form: the result holds one
 * list of literals per disjunction, in left to right order. Universal quantifiers are dropped
 * wherever they occur.
 */
public final class ConjunctiveClauses {
    private ConjunctiveClauses() {}

    /**
     * @throws UnsupportedClauseKindException if the formula is not in conjunctive normal form
     * once universal quantifiers are removed
     */
    public static ImmutableList<ImmutableList<Literal>> of(Clause c) {
        List<ImmutableList<Literal>> clauses = new ArrayList<>();
        conjuncts(Clauses.dropUniversals(c), clauses);
        return ImmutableList.copyOf(clauses);
    }

    private static void conjuncts(Clause c, List<ImmutableList<Literal>> out) {
        if (c instanceof And) {
            conjuncts(((And) c).left(), out);
            conjuncts(((And) c).right(), out);
            return;
        }
        ImmutableList.Builder<Literal> b = ImmutableList.builder();
        c.accept(new Disjuncts(b));
        out.add(b.build());
    }

    private static class Disjuncts implements ClauseVisitor<Void> {
        private final ImmutableList.Builder<Literal> literals;

        Disjuncts(ImmutableList.Builder<Literal> literals) { this.literals = literals; }

        @Override
        public Void visitPredicate(Predicate p) {
            literals.add(new Literal(p, false));
            return null;
        }

        @Override
        public Void visitNot(Not n) {
            if (!(n.child() instanceof Predicate)) throw new UnsupportedClauseKindException("clause extraction", n);
            literals.add(new Literal((Predicate) n.child(), true));
            return null;
        }

        @Override
        public Void visitOr(Or o) {
            o.left().accept(this);
            return o.right().accept(this);
        }

        @Override public Void visitAnd(And a) { throw new UnsupportedClauseKindException("clause extraction", a); }
        @Override public Void visitImplies(Implies i) { throw new UnsupportedClauseKindException("clause extraction", i); }
        @Override public Void visitForAll(ForAll f) { throw new UnsupportedClauseKindException("clause extraction", f); }
        @Override public Void visitThereExists(ThereExists e) { throw new UnsupportedClauseKindException("clause extraction", e); }
    }
}
