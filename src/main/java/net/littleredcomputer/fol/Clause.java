// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.fol;

/**
 * A node of a first-order formula. The set of node kinds is closed: {@link Predicate},
 * {@link Not}, {@link And}, {@link Or}, {@link Implies}, {@link ForAll} and {@link ThereExists}.
 * Passes over a formula implement {@link ClauseVisitor}, which has one method per kind.
 * <p>
 * Clauses are immutable values. Every transformation builds new nodes.
 */
public abstract class Clause {
    Clause() {}

    public abstract <R> R accept(ClauseVisitor<R> visitor);
}
