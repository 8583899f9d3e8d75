package net.littleredcomputer.fol;

import org.junit.Test;

import static net.littleredcomputer.fol.TestClauses.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ClausesTest {
    private final Predicate P = p("P", "a"), Q = p("Q", "b"), R = p("R", "c");

    @Test
    public void monolithicOr() {
        assertThat(Clauses.isMonolithicOr(P), is(true));
        assertThat(Clauses.isMonolithicOr(or(neg(P), or(Q, R))), is(true));
        assertThat(Clauses.isMonolithicOr(or(P, and(Q, R))), is(false));
        assertThat(Clauses.isMonolithicOr(forAll("X", P)), is(false));
        assertThat(Clauses.isMonolithicOr(implies(P, Q)), is(false));
    }

    @Test
    public void negationNormalForm() {
        assertThat(Clauses.isNegationNormalForm(and(neg(P), forAll("X", or(Q, neg(R))))), is(true));
        assertThat(Clauses.isNegationNormalForm(neg(neg(P))), is(false));
        assertThat(Clauses.isNegationNormalForm(neg(and(P, Q))), is(false));
        assertThat(Clauses.isNegationNormalForm(or(P, implies(Q, R))), is(false));
        assertThat(Clauses.isNegationNormalForm(neg(exists("X", P))), is(false));
    }

    @Test
    public void conjunctiveNormalForm() {
        assertThat(Clauses.isConjunctiveNormalForm(and(or(P, neg(Q)), and(R, or(Q, R)))), is(true));
        assertThat(Clauses.isConjunctiveNormalForm(or(P, and(Q, R))), is(false));
        assertThat(Clauses.isConjunctiveNormalForm(and(P, forAll("X", Q))), is(false));
        assertThat(Clauses.isConjunctiveNormalForm(or(P, neg(neg(Q)))), is(false));
    }

    @Test
    public void containsKind() {
        Clause c = forAll("X", or(P, neg(Q)));
        assertThat(Clauses.containsKind(c, Not.class), is(true));
        assertThat(Clauses.containsKind(c, ForAll.class), is(true));
        assertThat(Clauses.containsKind(c, And.class), is(false));
        assertThat(Clauses.containsKind(c, Implies.class), is(false));
    }

    @Test
    public void dropUniversals() {
        Clause c = and(forAll("X", p("P", "X")), or(forAll("Y", p("Q", "Y")), exists("Z", p("R", "Z"))));
        assertThat(Clauses.dropUniversals(c), is(and(p("P", "X"), or(p("Q", "Y"), exists("Z", p("R", "Z"))))));
    }
}
