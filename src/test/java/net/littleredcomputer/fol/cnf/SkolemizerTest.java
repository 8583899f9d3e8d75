package net.littleredcomputer.fol.cnf;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.fol.*;
import org.junit.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static net.littleredcomputer.fol.TestClauses.*;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class SkolemizerTest {
    private static final Symbol X = Symbol.of("X"), Z = Symbol.of("Z");

    private static SkolemTerm sk(long id, Term... captured) {
        return new SkolemTerm(id, ImmutableList.copyOf(captured));
    }

    @Test
    public void witnessOverEnclosingUniversal() {
        Clause c = forAll("X", exists("Y", p("P", "X", "Y")));
        assertThat(Skolemizer.skolemize(c, new SkolemAllocator()),
                is(forAll("X", new Predicate("P", X, sk(0, X)))));
    }

    @Test
    public void everyOccurrenceGetsTheSameWitness() {
        Clause c = forAll("X", exists("Y", and(p("P", "X", "Y"), or(p("Q", "Y"), p("R", "Y", "Y")))));
        SkolemAllocator a = new SkolemAllocator();
        Clause s = Skolemizer.skolemize(c, a);
        SkolemTerm f0 = sk(0, X);
        assertThat(s, is(forAll("X", and(new Predicate("P", X, f0), or(new Predicate("Q", f0), new Predicate("R", f0, f0))))));
        assertThat(a.peek(), is(1L));
    }

    @Test
    public void nestedScopes() {
        Clause c = forAll("X", exists("Y", forAll("Z", exists("W", p("Q", "X", "Y", "Z", "W")))));
        Clause s = Skolemizer.skolemize(c, new SkolemAllocator());
        assertThat(s, is(forAll("X", forAll("Z", new Predicate("Q", X, sk(0, X), Z, sk(1, X, Z))))));
    }

    @Test
    public void multipleUniversalsCapturedInBindingOrder() {
        Clause c = new ForAll(ImmutableList.of("B", "A"), exists("Y", p("P", "Y")));
        Clause s = Skolemizer.skolemize(c, new SkolemAllocator(5));
        assertThat(s.toString(), is("(for_all (B, A) P(F_5(B, A)))"));
    }

    @Test
    public void outermostExistentialBecomesConstant() {
        assertThat(Skolemizer.skolemize(exists("Y", p("P", "Y", "a")), new SkolemAllocator()).toString(), is("P(F_0(), a)"));
    }

    @Test
    public void oneWitnessPerBoundVariable() {
        Clause c = new ThereExists(ImmutableList.of("U", "V"), p("P", "U", "V", "U"));
        assertThat(Skolemizer.skolemize(c, new SkolemAllocator()).toString(), is("P(F_0(), F_1(), F_0())"));
    }

    @Test
    public void allocationFollowsLeftToRightOrder() {
        Clause c = forAll("X", or(exists("Y", p("P", "Y")), exists("Z", p("Q", "Z"))));
        assertThat(Skolemizer.skolemize(c, new SkolemAllocator()).toString(), is("(for_all (X) (P(F_0(X)) or Q(F_1(X))))"));
    }

    @Test
    public void namesOutsideTheScopeAreUntouched() {
        Clause c = and(exists("Y", p("P", "Y")), p("Q", "Y", "y"));
        assertThat(Skolemizer.skolemize(c, new SkolemAllocator()).toString(), is("(P(F_0()) and Q(Y, y))"));
    }

    @Test
    public void universalHidesExistentialOfTheSameName() {
        Clause c = exists("Y", and(p("P", "Y"), forAll("Y", p("Q", "Y"))));
        assertThat(Skolemizer.skolemize(c, new SkolemAllocator()).toString(), is("(P(F_0()) and (for_all (Y) Q(Y)))"));
    }

    @Test
    public void connectivesThreadedThrough() {
        Clause c = forAll("X", implies(p("P", "X"), neg(exists("Y", p("Q", "X", "Y")))));
        assertThat(Skolemizer.skolemize(c, new SkolemAllocator()).toString(),
                is("(for_all (X) (P(X) -> (not Q(X, F_0(X)))))"));
    }

    @Test
    public void reproducible() {
        TestClauses g = new TestClauses(2718, 3);
        for (int i = 0; i < 100; ++i) {
            Clause c = NegationNormalizer.toNegationNormalForm(g.quantified(6));
            assertThat(Skolemizer.skolemize(c, new SkolemAllocator()), is(Skolemizer.skolemize(c, new SkolemAllocator())));
        }
    }

    @Test
    public void randomFormulas() {
        TestClauses g = new TestClauses(1618, 3);
        for (int i = 0; i < 300; ++i) {
            Clause c = NegationNormalizer.toNegationNormalForm(g.quantified(6));
            Clause s = Skolemizer.skolemize(c, new SkolemAllocator());
            Set<Symbol> existentials = new HashSet<>();
            collectExistentials(c, existentials);
            assertThat(s.toString(), Clauses.containsKind(s, ThereExists.class), is(false));
            // A given identity always comes with the same captured variables.
            Map<Long, SkolemTerm> seen = new HashMap<>();
            for (Predicate p : PredicateExtractor.extract(s)) {
                for (Term t : p.args()) {
                    if (t instanceof SkolemTerm) {
                        SkolemTerm k = (SkolemTerm) t;
                        SkolemTerm prior = seen.putIfAbsent(k.id(), k);
                        if (prior != null) assertThat(k, is(prior));
                        for (Term u : k.captured()) assertThat(u.isVariable(), is(true));
                    }
                    assertThat(t + " in " + s, existentials.contains(t), is(false));
                }
            }
        }
    }

    private static void collectExistentials(Clause c, Set<Symbol> out) {
        if (c instanceof ThereExists) for (String v : ((ThereExists) c).variables()) out.add(Symbol.of(v));
        if (c instanceof Quantifier) collectExistentials(((Quantifier) c).child(), out);
        if (c instanceof Not) collectExistentials(((Not) c).child(), out);
        if (c instanceof BinaryClause) {
            collectExistentials(((BinaryClause) c).left(), out);
            collectExistentials(((BinaryClause) c).right(), out);
        }
    }
}
