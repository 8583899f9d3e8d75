package net.littleredcomputer.fol;

/**
 * Thrown when a pass meets a kind of node that its stage of the pipeline does not accept, for
 * example an implication reaching a pass that requires implications to have been eliminated.
 */
public class UnsupportedClauseKindException extends IllegalStateException {
    private final transient Clause clause;

    public UnsupportedClauseKindException(String pass, Clause clause) {
        super(String.format("%s does not accept %s: %s", pass, clause.getClass().getSimpleName(), clause));
        this.clause = clause;
    }

    public Clause getClause() { return clause; }
}
