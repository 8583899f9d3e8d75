// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.fol.cnf;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.fol.Clause;
import net.littleredcomputer.fol.Clauses;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.util.EnumSet;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs an explicit, ordered list of rewriting stages over a clause. The standard list takes a
 * formula to quantifier-free conjunctive normal form:
 * <ol>
 *     <li>eliminate implications</li>
 *     <li>push negations down to the predicates</li>
 *     <li>Skolemize existential quantifiers</li>
 *     <li>drop universal quantifiers</li>
 *     <li>distribute Or over And</li>
 * </ol>
 * Each stage is a pure function of its input, apart from the Skolem identities it draws.
 */
public class ClauseNormalizer {
    private static final Logger log = LogManager.getFormatterLogger();

    public enum Stage {
        ELIMINATE_IMPLICATION,
        PUSH_NEGATION,
        SKOLEMIZE,
        DROP_UNIVERSALS,
        DISTRIBUTE_OR,
    }

    private final ImmutableList<Stage> stages;
    private final SkolemAllocator allocator;
    private final TieBreak tieBreak;
    private EnumSet<Stage> tracing = EnumSet.noneOf(Stage.class);

    private ClauseNormalizer(SkolemAllocator allocator, TieBreak tieBreak, ImmutableList<Stage> stages) {
        this.allocator = checkNotNull(allocator, "allocator");
        this.tieBreak = checkNotNull(tieBreak, "tieBreak");
        this.stages = stages;
    }

    public static ClauseNormalizer standard(SkolemAllocator allocator, TieBreak tieBreak) {
        return new ClauseNormalizer(allocator, tieBreak, ImmutableList.copyOf(Stage.values()));
    }

    public static ClauseNormalizer of(SkolemAllocator allocator, TieBreak tieBreak, Stage... stages) {
        checkArgument(stages.length > 0, "at least one stage is required");
        return new ClauseNormalizer(allocator, tieBreak, ImmutableList.copyOf(stages));
    }

    public ImmutableList<Stage> stages() { return stages; }

    /**
     * Log the result of each of the given stages at TRACE level.
     */
    public ClauseNormalizer setTracing(EnumSet<Stage> tracing) {
        this.tracing = EnumSet.copyOf(tracing);
        return this;
    }

    private UnaryOperator<Clause> operation(Stage s) {
        switch (s) {
            case ELIMINATE_IMPLICATION: return NegationNormalizer::eliminateImplication;
            case PUSH_NEGATION: return NegationNormalizer::pushNegations;
            case SKOLEMIZE: return new Skolemizer(allocator)::skolemize;
            case DROP_UNIVERSALS: return Clauses::dropUniversals;
            case DISTRIBUTE_OR: return new OrDistributor(tieBreak)::distribute;
            default: throw new IllegalStateException("Internal error: unknown stage " + s);
        }
    }

    public Clause normalize(Clause c) {
        Stopwatch sw = Stopwatch.createStarted();
        Clause result = c;
        for (Stage s : stages) {
            result = operation(s).apply(result);
            if (tracing.contains(s)) log.trace("%s: %s", s, result);
        }
        sw.stop();
        final Clause input = c, output = result;
        log.debug(() -> new FormattedMessage("normalized %s to %s in %s", input, output, sw));
        return result;
    }

    /**
     * Normalize, then read off the disjunctions. The stage list must end in conjunctive normal form.
     */
    public ImmutableList<ImmutableList<Literal>> clauses(Clause c) {
        return ConjunctiveClauses.of(normalize(c));
    }
}
