package net.littleredcomputer.fol.unify;

import net.littleredcomputer.fol.Term;

import javax.annotation.Nullable;

/**
 * Signals that two clauses (or literals) have no unifier. This is an ordinary outcome of
 * unification, not an error in the input.
 */
public class NoUnifierException extends Exception {
    private final transient Term left;
    private final transient Term right;

    NoUnifierException(String message) {
        this(message, null, null);
    }

    NoUnifierException(String message, @Nullable Term left, @Nullable Term right) {
        super(message);
        this.left = left;
        this.right = right;
    }

    /**
     * @return the terms that could not be made equal, if the failure came from a clash of terms
     */
    @Nullable public Term left() { return left; }
    @Nullable public Term right() { return right; }
}
