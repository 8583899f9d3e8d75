package net.littleredcomputer.fol;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A name token appearing as a predicate argument. By convention a name whose first character is
 * an upper-case letter denotes a logical variable; any other name is a constant (or the symbol of a
 * function of no arguments).
 */
public final class Symbol extends Term {
    private final String name;

    public Symbol(String name) {
        checkNotNull(name, "name");
        checkArgument(!name.isEmpty(), "symbol name must not be empty");
        this.name = name;
    }

    public static Symbol of(String name) { return new Symbol(name); }

    public String name() { return name; }

    @Override
    public boolean isVariable() {
        return Character.isUpperCase(name.charAt(0));
    }

    @Override
    public Term replace(Symbol variable, Term replacement) {
        return equals(variable) ? replacement : this;
    }

    @Override
    public boolean occurs(Symbol variable) {
        return equals(variable);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Symbol && ((Symbol) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
