package cz.cuni.mff.d3s.ctdtlp.generator.engine;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.PairUniverse;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.RowKey;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.NavigableSet;
import java.util.Set;

/**
 * Outcome of a finished discovery run: every pair of the universe is covered by one of
 * {@link #getTests()} or listed in {@link #getInfeasiblePairs()}.
 */
@Getter
@Builder
@ToString(onlyExplicitlyIncluded = true)
public class CoverageResult {

    @ToString.Include
    private final String strategyId;

    private final PairUniverse universe;

    /** Discovered tests in discovery order, no two with the same row. */
    private final List<GeneratedTest> tests;

    private final NavigableSet<Pair> feasiblePairs;

    private final NavigableSet<Pair> infeasiblePairs;

    private final Set<RowKey> infeasibleRowKeys;

    @ToString.Include
    private final int queryCount;

    @ToString.Include
    public int getTestCount() {
        return tests.size();
    }

    @ToString.Include
    public int getInfeasibleCount() {
        return infeasiblePairs.size();
    }
}
