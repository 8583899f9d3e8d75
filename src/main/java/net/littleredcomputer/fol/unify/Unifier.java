// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.fol.unify;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.fol.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Robinson-style unification driven by a disagreement set.
 * <p>
 * The disagreement set starts as the argument pairs of the literals being unified. Pairs are
 * taken out oldest first. A pair with a variable on either side becomes a binding, and the
 * variable is replaced everywhere in the pairs still waiting (and in the bindings already made).
 * Two identical terms agree trivially. Two Skolem terms of the same identity are compared
 * argument by argument. Any other pair of non-variables is a clash, and there is no unifier.
 */
public final class Unifier {
    private static final Logger log = LogManager.getFormatterLogger();

    private Unifier() {}

    /**
     * Unify two clauses on every predicate name they share. Each predicate of {@code x} is paired
     * with each predicate of {@code y} having the same name (regardless of polarity), and all of
     * their arguments must be made equal at once. Predicates whose names appear on one side only
     * impose nothing, so clauses with no name in common unify under the empty substitution.
     * <p>
     * Non-variable terms need not be identical to agree: two Skolem terms of the same identity
     * unify when their captured arguments do, so {@code F_0(X)} against {@code F_0(a)} gives
     * {@code {X -> a}}. Skolem terms of different identities, and distinct constants, always clash.
     *
     * @return bindings that make every name-matched pair of predicates identical
     * @throws NoUnifierException if two same-named predicates differ in arity or a pair of
     * arguments cannot be reconciled
     */
    public static Substitution unify(Clause x, Clause y) throws NoUnifierException {
        ImmutableList<Predicate> ps = PredicateExtractor.extract(x);
        ImmutableList<Predicate> qs = PredicateExtractor.extract(y);
        Deque<Disagreement> d = new ArrayDeque<>();
        for (Predicate p : ps) {
            for (Predicate q : qs) {
                if (p.name().equals(q.name())) disagree(p, q, d);
            }
        }
        return resolve(d);
    }

    /**
     * The most general unifier of a single pair of literals, as used by a resolution step. Terms
     * are compared as in {@link #unify(Clause, Clause)}, Skolem arguments included.
     * @throws NoUnifierException if the names or arities differ, or the arguments clash
     */
    public static Substitution unifyLiterals(Predicate p, Predicate q) throws NoUnifierException {
        if (!p.name().equals(q.name())) {
            throw new NoUnifierException(String.format("predicate names differ: %s, %s", p, q));
        }
        Deque<Disagreement> d = new ArrayDeque<>();
        disagree(p, q, d);
        return resolve(d);
    }

    public static Optional<Substitution> tryUnify(Clause x, Clause y) {
        try {
            return Optional.of(unify(x, y));
        } catch (NoUnifierException e) {
            log.trace("no unifier for %s and %s: %s", x, y, e.getMessage());
            return Optional.empty();
        }
    }

    private static void disagree(Predicate p, Predicate q, Deque<Disagreement> d) throws NoUnifierException {
        if (p.arity() != q.arity()) {
            throw new NoUnifierException(String.format("arity mismatch: %s, %s", p, q));
        }
        for (int i = 0; i < p.arity(); ++i) d.add(new Disagreement(p.args().get(i), q.args().get(i)));
    }

    private static Substitution resolve(Deque<Disagreement> d) throws NoUnifierException {
        Map<Symbol, Term> bindings = new LinkedHashMap<>();
        while (!d.isEmpty()) {
            Disagreement pair = d.removeFirst();
            Term a = pair.left, b = pair.right;
            if (a.equals(b)) continue;
            if (a.isVariable()) {
                bind((Symbol) a, b, d, bindings);
            } else if (b.isVariable()) {
                bind((Symbol) b, a, d, bindings);
            } else if (a instanceof SkolemTerm && b instanceof SkolemTerm && ((SkolemTerm) a).id() == ((SkolemTerm) b).id()) {
                ImmutableList<Term> as = ((SkolemTerm) a).captured(), bs = ((SkolemTerm) b).captured();
                if (as.size() != bs.size()) throw new NoUnifierException(String.format("%s and %s differ in length", a, b), a, b);
                // Push to the front, preserving order, so the arguments are settled next.
                for (int i = as.size() - 1; i >= 0; --i) d.addFirst(new Disagreement(as.get(i), bs.get(i)));
            } else {
                throw new NoUnifierException(String.format("cannot unify %s with %s", a, b), a, b);
            }
        }
        return Substitution.of(bindings);
    }

    private static void bind(Symbol v, Term t, Deque<Disagreement> d, Map<Symbol, Term> bindings) throws NoUnifierException {
        if (t.occurs(v)) throw new NoUnifierException(String.format("%s occurs in %s", v, t), v, t);
        log.trace("binding %s -> %s", v, t);
        for (Disagreement pair : d) {
            pair.left = pair.left.replace(v, t);
            pair.right = pair.right.replace(v, t);
        }
        for (Map.Entry<Symbol, Term> e : bindings.entrySet()) e.setValue(e.getValue().replace(v, t));
        bindings.put(v, t);
    }

    private static class Disagreement {
        Term left;
        Term right;

        Disagreement(Term left, Term right) {
            this.left = left;
            this.right = right;
        }
    }
}
