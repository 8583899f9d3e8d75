package net.littleredcomputer.fol.unify;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import net.littleredcomputer.fol.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An ordered set of variable bindings. Bindings produced by {@link Unifier} are idempotent: no
 * bound variable occurs in any bound term, so applying the bindings one after another or all at
 * once gives the same answer.
 */
public final class Substitution {
    private static final Logger log = LogManager.getFormatterLogger();
    public static final Substitution EMPTY = new Substitution(ImmutableMap.of());
    private static final Joiner.MapJoiner joiner = Joiner.on(", ").withKeyValueSeparator(" -> ");

    private final ImmutableMap<Symbol, Term> bindings;

    private Substitution(ImmutableMap<Symbol, Term> bindings) {
        this.bindings = bindings;
    }

    /**
     * @param bindings variable to term, in the order the bindings were made
     */
    public static Substitution of(Map<Symbol, ? extends Term> bindings) {
        for (Symbol v : bindings.keySet()) checkArgument(v.isVariable(), "not a variable: %s", v);
        return new Substitution(ImmutableMap.copyOf(bindings));
    }

    public ImmutableMap<Symbol, Term> bindings() { return bindings; }

    @Nullable
    public Term get(Symbol variable) { return bindings.get(variable); }

    public boolean isEmpty() { return bindings.isEmpty(); }

    public int size() { return bindings.size(); }

    @CheckReturnValue
    public Term apply(Term t) {
        for (Map.Entry<Symbol, Term> e : bindings.entrySet()) t = t.replace(e.getKey(), e.getValue());
        return t;
    }

    @CheckReturnValue
    public Predicate apply(Predicate p) {
        ImmutableList.Builder<Term> args = ImmutableList.builderWithExpectedSize(p.arity());
        for (Term t : p.args()) args.add(apply(t));
        return new Predicate(p.name(), args.build());
    }

    /**
     * Apply the bindings throughout a clause. Variables bound by a quantifier within the clause
     * are left alone inside that quantifier. Where a bound term mentions a name the quantifier
     * binds, the quantifier's variable is first renamed (by appending a number) so that the term is
     * not captured: {@code {X -> Y}} takes {@code (for_all (Y) P(X, Y))} to
     * {@code (for_all (Y1) P(Y, Y1))}.
     */
    @CheckReturnValue
    public Clause apply(Clause c) {
        if (bindings.isEmpty()) return c;
        return c.accept(new ClauseVisitor<Clause>() {
            @Override public Clause visitPredicate(Predicate p) { return apply(p); }
            @Override public Clause visitNot(Not n) { return new Not(n.child().accept(this)); }
            @Override public Clause visitAnd(And a) { return new And(a.left().accept(this), a.right().accept(this)); }
            @Override public Clause visitOr(Or o) { return new Or(o.left().accept(this), o.right().accept(this)); }
            @Override public Clause visitImplies(Implies i) { return new Implies(i.left().accept(this), i.right().accept(this)); }

            @Override
            public Clause visitForAll(ForAll f) {
                ImmutableList<String> vs = freshen(f.variables(), f.child());
                return new ForAll(vs, underBinder(f.variables(), vs, f.child()));
            }

            @Override
            public Clause visitThereExists(ThereExists e) {
                ImmutableList<String> vs = freshen(e.variables(), e.child());
                return new ThereExists(vs, underBinder(e.variables(), vs, e.child()));
            }
        });
    }

    /**
     * @return the names a quantifier should bind so that no term bound here is captured; a name is
     * replaced only if some surviving binding mentions it
     */
    private ImmutableList<String> freshen(ImmutableList<String> names, Clause child) {
        Substitution inner = without(names);
        Set<String> taken = new HashSet<>(names);
        ImmutableList.Builder<String> b = ImmutableList.builderWithExpectedSize(names.size());
        for (String n : names) {
            if (!inner.mentions(n)) {
                b.add(n);
                continue;
            }
            String m;
            for (int i = 1; ; ++i) {
                m = n + i;
                if (!taken.contains(m) && !inner.mentions(m) && !inner.bindings.containsKey(new Symbol(m)) && !mentions(child, m)) break;
            }
            log.trace("renaming bound %s to %s under %s", n, m, this);
            taken.add(m);
            b.add(m);
        }
        return b.build();
    }

    private Clause underBinder(ImmutableList<String> names, ImmutableList<String> renamed, Clause child) {
        Map<Symbol, Term> r = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); ++i) {
            if (!names.get(i).equals(renamed.get(i))) r.put(new Symbol(names.get(i)), new Symbol(renamed.get(i)));
        }
        Clause c = r.isEmpty() ? child : new Substitution(ImmutableMap.copyOf(r)).apply(child);
        return without(Iterables.concat(names, renamed)).apply(c);
    }

    /**
     * @return true if some bound term mentions the symbol {@code name}
     */
    private boolean mentions(String name) {
        Symbol v = new Symbol(name);
        for (Term t : bindings.values()) if (t.occurs(v)) return true;
        return false;
    }

    /**
     * @return true if {@code name} appears in the clause as an argument or as a bound variable
     */
    private static boolean mentions(Clause c, String name) {
        Symbol v = new Symbol(name);
        return c.accept(new ClauseVisitor<Boolean>() {
            @Override
            public Boolean visitPredicate(Predicate p) {
                for (Term t : p.args()) if (t.occurs(v)) return true;
                return false;
            }

            @Override public Boolean visitNot(Not n) { return n.child().accept(this); }
            @Override public Boolean visitAnd(And a) { return a.left().accept(this) || a.right().accept(this); }
            @Override public Boolean visitOr(Or o) { return o.left().accept(this) || o.right().accept(this); }
            @Override public Boolean visitImplies(Implies i) { return i.left().accept(this) || i.right().accept(this); }
            @Override public Boolean visitForAll(ForAll f) { return f.variables().contains(name) || f.child().accept(this); }
            @Override public Boolean visitThereExists(ThereExists e) { return e.variables().contains(name) || e.child().accept(this); }
        });
    }

    private Substitution without(Iterable<String> names) {
        Map<Symbol, Term> m = new LinkedHashMap<>(bindings);
        for (String n : names) m.remove(new Symbol(n));
        return m.size() == bindings.size() ? this : new Substitution(ImmutableMap.copyOf(m));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Substitution && ((Substitution) o).bindings.equals(bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return "{" + joiner.join(bindings) + "}";
    }
}
