package net.littleredcomputer.fol;

/**
 * An argument of a {@link Predicate}. There are exactly two kinds of term: a {@link Symbol},
 * which is a logical variable or a constant depending on its spelling, and a {@link SkolemTerm}
 * introduced when an existential quantifier is eliminated.
 */
public abstract class Term {
    // Only the two kinds in this package may extend Term.
    Term() {}

    /**
     * @return true if this term may be bound by a substitution
     */
    public abstract boolean isVariable();

    /**
     * Replace every occurrence of a variable, including occurrences captured by a Skolem term.
     * @param variable the variable to replace
     * @param replacement the term put in its place
     * @return a term with the replacement made (this term, if the variable does not occur)
     */
    public abstract Term replace(Symbol variable, Term replacement);

    /**
     * @param variable variable to look for
     * @return true if the variable appears anywhere within this term
     */
    public abstract boolean occurs(Symbol variable);
}
