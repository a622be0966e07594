package cz.cuni.mff.d3s.ctdtlp.model.common.errors;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import lombok.Getter;

import java.util.Set;

/**
 * Coverage bookkeeping does not add up: a pair proven infeasible is covered by a
 * feasible row, or some pair is neither covered nor infeasible at the end of a run.
 */
@Getter
public class CoverageContradictionException extends GenerationException {

    private final Set<Pair> pairs;

    public CoverageContradictionException(String message, Set<Pair> pairs) {
        super(message + ": " + pairs);
        this.pairs = Set.copyOf(pairs);
    }
}
