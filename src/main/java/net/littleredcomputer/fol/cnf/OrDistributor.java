package net.littleredcomputer.fol.cnf;

import net.littleredcomputer.fol.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Distributes Or over And, bottom up, so that no disjunction has a conjunction beneath it:
 * {@code ((a and b) or c)} becomes {@code ((a or c) and (b or c))}. Negations and quantifiers are
 * rebuilt around their distributed children; a conjunction under a quantifier is therefore not
 * visible to an enclosing Or (see {@link Clauses#dropUniversals}).
 */
public class OrDistributor implements ClauseVisitor<Clause> {
    private static final Logger log = LogManager.getFormatterLogger();
    private final TieBreak tieBreak;
    private long expansions = 0;

    public OrDistributor() {
        this(TieBreak.LEFT);
    }

    public OrDistributor(TieBreak tieBreak) {
        this.tieBreak = checkNotNull(tieBreak, "tieBreak");
    }

    /**
     * @return the number of distribution steps taken so far by this distributor
     */
    public long expansions() { return expansions; }

    @CheckReturnValue
    public Clause distribute(Clause c) {
        return c.accept(this);
    }

    @Override public Clause visitPredicate(Predicate p) { return p; }
    @Override public Clause visitNot(Not n) { return new Not(n.child().accept(this)); }
    @Override public Clause visitAnd(And a) { return new And(a.left().accept(this), a.right().accept(this)); }

    @Override
    public Clause visitOr(Or o) {
        return merge(o.left().accept(this), o.right().accept(this));
    }

    @Override
    public Clause visitImplies(Implies i) {
        throw new UnsupportedClauseKindException("Or distribution", i);
    }

    @Override public Clause visitForAll(ForAll f) { return new ForAll(f.variables(), f.child().accept(this)); }
    @Override public Clause visitThereExists(ThereExists e) { return new ThereExists(e.variables(), e.child().accept(this)); }

    /**
     * Form the disjunction of two clauses that have already been distributed.
     */
    private Clause merge(Clause left, Clause right) {
        And conj;
        Clause other;
        if (left instanceof And && right instanceof And) {
            boolean expandLeft = tieBreak.expandLeft((And) left, (And) right);
            log.trace("both sides of an Or are conjunctions; expanding the %s", expandLeft ? "left" : "right");
            conj = (And) (expandLeft ? left : right);
            other = expandLeft ? right : left;
        } else if (left instanceof And) {
            conj = (And) left;
            other = right;
        } else if (right instanceof And) {
            conj = (And) right;
            other = left;
        } else {
            return new Or(left, right);
        }
        ++expansions;
        // Either new disjunction may expose another conjunction (other may itself be one).
        return new And(merge(conj.left(), other), merge(conj.right(), other));
    }
}
