package cz.cuni.mff.d3s.ctdtlp.testutils;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.PairUniverse;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.RowKey;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Assertions over the coverage a set of generated tests achieves.
 */
public final class CoverageAssertions {

    private CoverageAssertions() {}

    public static Set<Pair> coveredPairs(Collection<GeneratedTest> tests) {
        return tests.stream()
                .map(GeneratedTest::getRow)
                .flatMap(row -> row.pairs().stream())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Every pair of the universe is either covered by a test or infeasible, never both.
     */
    public static void assertPartition(PairUniverse universe, Collection<GeneratedTest> tests, Set<Pair> infeasible) {
        Set<Pair> covered = coveredPairs(tests);

        Set<Pair> both = new TreeSet<>(covered);
        both.retainAll(infeasible);
        assertTrue(both.isEmpty(), "Pairs both covered and infeasible: " + both);

        Set<Pair> missing = new TreeSet<>(universe.getPairs());
        missing.removeAll(covered);
        missing.removeAll(infeasible);
        assertTrue(missing.isEmpty(), "Pairs neither covered nor infeasible: " + missing);

        Set<Pair> foreign = new TreeSet<>(infeasible);
        foreign.removeAll(universe.getPairs());
        assertTrue(foreign.isEmpty(), "Infeasible pairs outside the universe: " + foreign);
    }

    public static void assertNoDuplicateRows(Collection<GeneratedTest> tests) {
        Set<RowKey> keys = new HashSet<>();
        for (GeneratedTest test : tests) {
            assertTrue(keys.add(test.getRow().key()), "Duplicate row among tests: " + test.getRow());
        }
    }

    public static void assertCovers(Collection<GeneratedTest> tests, Collection<Pair> pairs) {
        Set<Pair> covered = coveredPairs(tests);
        Set<Pair> uncovered = new TreeSet<>(pairs);
        uncovered.removeAll(covered);
        assertTrue(uncovered.isEmpty(), "Pairs not covered: " + uncovered);
    }

    public static void assertNoRowSatisfies(Collection<GeneratedTest> tests, Pair pair) {
        List<Row> offending = tests.stream().map(GeneratedTest::getRow).filter(pair::isSatisfiedBy).toList();
        assertTrue(offending.isEmpty(), "Rows covering " + pair + ": " + offending);
    }
}
