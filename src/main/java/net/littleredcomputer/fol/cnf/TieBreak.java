package net.littleredcomputer.fol.cnf;

import net.littleredcomputer.fol.And;

import java.util.Random;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * When both sides of a disjunction are conjunctions, either one may be distributed over the other.
 * The choice changes the shape of the result, not its meaning. A TieBreak makes that choice.
 */
public interface TieBreak {
    /**
     * @return true to distribute {@code left} over {@code right}, false for the reverse
     */
    boolean expandLeft(And left, And right);

    TieBreak LEFT = (l, r) -> true;
    TieBreak RIGHT = (l, r) -> false;

    /**
     * A coin flip per decision, from a generator with the given seed. Two distributors built
     * with the same seed make the same choices on the same input.
     */
    static TieBreak seeded(long seed) {
        return using(new Random(seed));
    }

    static TieBreak using(Random random) {
        checkNotNull(random, "random");
        return (l, r) -> random.nextBoolean();
    }
}
