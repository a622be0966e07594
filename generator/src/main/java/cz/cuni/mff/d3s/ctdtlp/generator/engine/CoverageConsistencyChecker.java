package cz.cuni.mff.d3s.ctdtlp.generator.engine;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.PairUniverse;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.CoverageContradictionException;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Post-condition of a run: the universe splits into pairs covered by tests and infeasible pairs.
 */
public final class CoverageConsistencyChecker {

    private CoverageConsistencyChecker() {}

    /**
     * @throws CoverageContradictionException if a pair is both covered and infeasible, or neither
     */
    public static void check(PairUniverse universe, Collection<GeneratedTest> tests, Set<Pair> infeasiblePairs) {
        Set<Pair> covered = new TreeSet<>();
        for (GeneratedTest test : tests) {
            covered.addAll(test.getRow().pairs());
        }

        Set<Pair> contradicting = new TreeSet<>(covered);
        contradicting.retainAll(infeasiblePairs);
        if (!contradicting.isEmpty()) {
            throw new CoverageContradictionException("Pairs proven infeasible but covered by a test", contradicting);
        }

        Set<Pair> unclassified = new TreeSet<>(universe.getPairs());
        unclassified.removeAll(covered);
        unclassified.removeAll(infeasiblePairs);
        if (!unclassified.isEmpty()) {
            throw new CoverageContradictionException("Pairs neither covered nor infeasible", unclassified);
        }
    }
}
