// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.fol.cnf;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.fol.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.HashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Removes existential quantifiers. Each variable bound by a {@link ThereExists} is replaced,
 * everywhere in the quantifier's scope, by one Skolem term over the universally quantified
 * variables enclosing the quantifier. Universal quantifiers are kept.
 * <p>
 * The scope analysis depends only on quantifier nesting, so any clause is accepted. Note though
 * that Skolemizing an existential under a negation (before negation normal form) does not
 * preserve satisfiability; {@link ClauseNormalizer} runs this pass after negations are pushed in.
 * Bound variable names are assumed to be distinct.
 * <p>
 * Skolem identities are drawn in the order quantifiers are met walking the tree left to right,
 * depth first, so a fixed clause and allocator state give a fixed result.
 */
public class Skolemizer {
    private static final Logger log = LogManager.getFormatterLogger();
    private final SkolemAllocator allocator;

    public Skolemizer(SkolemAllocator allocator) {
        this.allocator = checkNotNull(allocator, "allocator");
    }

    @CheckReturnValue
    public static Clause skolemize(Clause c, SkolemAllocator allocator) {
        return new Skolemizer(allocator).skolemize(c);
    }

    @CheckReturnValue
    public Clause skolemize(Clause c) {
        return c.accept(new Scope(ImmutableList.of(), ImmutableMap.of()));
    }

    /**
     * The quantifier context at one point of the walk.
     */
    private class Scope implements ClauseVisitor<Clause> {
        private final ImmutableList<String> universals;  // in binding order
        private final ImmutableMap<String, SkolemTerm> witnesses;  // existential variable -> its Skolem term

        Scope(ImmutableList<String> universals, ImmutableMap<String, SkolemTerm> witnesses) {
            this.universals = universals;
            this.witnesses = witnesses;
        }

        @Override
        public Clause visitThereExists(ThereExists e) {
            Map<String, SkolemTerm> m = new HashMap<>(witnesses);
            for (String v : e.variables()) {
                SkolemTerm s = allocator.fresh(universals);
                log.trace("%s replaces %s", s, v);
                m.put(v, s);
            }
            return e.child().accept(new Scope(universals, ImmutableMap.copyOf(m)));
        }

        @Override
        public Clause visitForAll(ForAll f) {
            Map<String, SkolemTerm> m = new HashMap<>(witnesses);
            // A universal that rebinds an existential's name hides it.
            for (String v : f.variables()) m.remove(v);
            ImmutableList<String> inner = ImmutableList.<String>builder().addAll(universals).addAll(f.variables()).build();
            return new ForAll(f.variables(), f.child().accept(new Scope(inner, ImmutableMap.copyOf(m))));
        }

        @Override
        public Clause visitPredicate(Predicate p) {
            if (witnesses.isEmpty()) return p;
            ImmutableList.Builder<Term> args = ImmutableList.builderWithExpectedSize(p.arity());
            for (Term t : p.args()) {
                SkolemTerm s = t instanceof Symbol ? witnesses.get(((Symbol) t).name()) : null;
                args.add(s != null ? s : t);
            }
            return new Predicate(p.name(), args.build());
        }

        @Override public Clause visitNot(Not n) { return new Not(n.child().accept(this)); }
        @Override public Clause visitAnd(And a) { return new And(a.left().accept(this), a.right().accept(this)); }
        @Override public Clause visitOr(Or o) { return new Or(o.left().accept(this), o.right().accept(this)); }
        @Override public Clause visitImplies(Implies i) { return new Implies(i.left().accept(this), i.right().accept(this)); }
    }
}
