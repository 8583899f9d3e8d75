package net.littleredcomputer.fol.cnf;

import net.littleredcomputer.fol.*;
import org.junit.Test;

import static net.littleredcomputer.fol.TestClauses.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class NegationNormalizerTest {
    private final Predicate PA = p("P", "A"), QB = p("Q", "B"), RC = p("R", "C");

    @Test
    public void implicationEliminated() {
        assertThat(NegationNormalizer.eliminateImplication(implies(PA, QB)), is(or(neg(PA), QB)));
        assertThat(NegationNormalizer.toNegationNormalForm(implies(PA, QB)), is(or(neg(PA), QB)));
    }

    @Test
    public void nestedImplicationsEliminatedInnermostFirst() {
        Clause c = implies(implies(PA, QB), RC);
        // ((P -> Q) -> R) == (not (not P or Q)) or R == (P and not Q) or R
        assertThat(NegationNormalizer.toNegationNormalForm(c), is(or(and(PA, neg(QB)), RC)));
        assertThat(Clauses.containsKind(NegationNormalizer.eliminateImplication(c), Implies.class), is(false));
    }

    @Test
    public void deMorgan() {
        assertThat(NegationNormalizer.toNegationNormalForm(neg(and(PA, QB))), is(or(neg(PA), neg(QB))));
        assertThat(NegationNormalizer.toNegationNormalForm(neg(or(PA, QB))), is(and(neg(PA), neg(QB))));
    }

    @Test
    public void doubleNegation() {
        assertThat(NegationNormalizer.toNegationNormalForm(neg(neg(PA))), is(PA));
        assertThat(NegationNormalizer.toNegationNormalForm(neg(neg(neg(PA)))), is(neg(PA)));
        assertThat(NegationNormalizer.toNegationNormalForm(neg(neg(neg(neg(and(PA, QB)))))), is(and(PA, QB)));
    }

    @Test
    public void quantifierDuality() {
        assertThat(NegationNormalizer.toNegationNormalForm(neg(forAll("X", p("P", "X")))),
                is(exists("X", neg(p("P", "X")))));
        assertThat(NegationNormalizer.toNegationNormalForm(neg(exists("X", and(p("P", "X"), neg(p("Q", "X")))))),
                is(forAll("X", or(neg(p("P", "X")), p("Q", "X")))));
    }

    @Test
    public void negateContract() {
        assertThat(NegationNormalizer.negate(PA), is(neg(PA)));
        assertThat(NegationNormalizer.negate(neg(and(PA, QB))), is(and(PA, QB)));
        assertThat(NegationNormalizer.negate(and(PA, QB)), is(or(neg(PA), neg(QB))));
        assertThat(NegationNormalizer.negate(or(PA, QB)), is(and(neg(PA), neg(QB))));
        assertThat(NegationNormalizer.negate(forAll("X", PA)), is(exists("X", neg(PA))));
        assertThat(NegationNormalizer.negate(exists("X", PA)), is(forAll("X", neg(PA))));
        assertThat(NegationNormalizer.negate(implies(PA, QB)), is(and(PA, neg(QB))));
    }

    @Test(expected = UnsupportedClauseKindException.class)
    public void pushdownRejectsImplication() {
        NegationNormalizer.pushNegations(or(neg(PA), and(QB, implies(QB, RC))));
    }

    @Test
    public void pushdownRejectsImplicationUnderNegation() {
        for (Clause c : new Clause[]{neg(implies(PA, QB)), neg(neg(implies(PA, QB))), neg(and(implies(PA, QB), RC))}) {
            try {
                NegationNormalizer.pushNegations(c);
                fail("accepted " + c);
            } catch (UnsupportedClauseKindException e) {
                assertThat(e.getClause(), is(c));
            }
        }
    }

    @Test
    public void randomFormulasReachNegationNormalFormAndKeepTheirMeaning() {
        TestClauses g = new TestClauses(314159, 4);
        for (int i = 0; i < 500; ++i) {
            Clause c = g.propositional(5);
            Clause n = NegationNormalizer.toNegationNormalForm(c);
            assertThat(c + " => " + n, Clauses.isNegationNormalForm(n), is(true));
            assertThat(c + " => " + n, TestClauses.equivalent(c, n), is(true));
        }
    }

    @Test
    public void inputIsNotModified() {
        Clause c = neg(implies(PA, and(QB, neg(RC))));
        String before = c.toString();
        Clause n = NegationNormalizer.toNegationNormalForm(c);
        assertThat(c.toString(), is(before));
        assertThat(n, is(and(PA, or(neg(QB), RC))));
    }
}
