package net.littleredcomputer.fol.cnf;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.fol.SkolemTerm;
import net.littleredcomputer.fol.Symbol;
import net.littleredcomputer.fol.Term;

import java.util.List;

/**
 * Source of fresh Skolem identities. Identities increase strictly in allocation order. Each
 * allocator counts independently, so runs that need reproducible names should each use their own
 * allocator (optionally with a fixed starting identity).
 */
public class SkolemAllocator {
    private long next;

    public SkolemAllocator() {
        this(0);
    }

    public SkolemAllocator(long firstId) {
        if (firstId < 0) throw new IllegalArgumentException("first Skolem id must be nonnegative");
        this.next = firstId;
    }

    /**
     * @return the identity the next call to {@code fresh} will use
     */
    public synchronized long peek() {
        return next;
    }

    public synchronized SkolemTerm fresh(ImmutableList<Term> captured) {
        if (next == Long.MAX_VALUE) throw new IllegalStateException("Skolem identities exhausted");
        return new SkolemTerm(next++, captured);
    }

    /**
     * @param captured names of the universally quantified variables in scope, in binding order
     * @return a new Skolem term over those variables
     */
    public SkolemTerm fresh(List<String> captured) {
        ImmutableList.Builder<Term> b = ImmutableList.builderWithExpectedSize(captured.size());
        for (String v : captured) b.add(new Symbol(v));
        return fresh(b.build());
    }
}
