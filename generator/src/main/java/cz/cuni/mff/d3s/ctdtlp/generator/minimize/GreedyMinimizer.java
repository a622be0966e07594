package cz.cuni.mff.d3s.ctdtlp.generator.minimize;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy set cover: keeps picking the test that covers the most still uncovered pairs.
 * Ties go to the test discovered first, so the outcome is deterministic for a given discovery order.
 */
@Slf4j
public final class GreedyMinimizer {

    private GreedyMinimizer() {}

    /**
     * @param tests          discovered tests in discovery order
     * @param requiredPairs  pairs that must stay covered, i.e. the universe minus infeasible pairs
     * @return the selected tests in selection order
     * @throws IllegalStateException if some required pair is covered by none of the tests
     */
    public static List<GeneratedTest> minimize(List<GeneratedTest> tests, Set<Pair> requiredPairs) {
        List<Set<Pair>> coverage = new ArrayList<>(tests.size());
        for (GeneratedTest test : tests) {
            Set<Pair> covered = new HashSet<>(test.getRow().pairs());
            covered.retainAll(requiredPairs);
            coverage.add(covered);
        }

        Set<Pair> remaining = new HashSet<>(requiredPairs);
        boolean[] used = new boolean[tests.size()];
        List<GeneratedTest> selected = new ArrayList<>();

        while (!remaining.isEmpty()) {
            int best = -1;
            int bestGain = 0;
            for (int i = 0; i < tests.size(); i++) {
                if (used[i]) {
                    continue;
                }
                int gain = 0;
                for (Pair pair : coverage.get(i)) {
                    if (remaining.contains(pair)) {
                        gain++;
                    }
                }
                if (gain > bestGain) {
                    best = i;
                    bestGain = gain;
                }
            }
            if (best < 0) {
                throw new IllegalStateException(remaining.size() + " feasible pairs are covered by no discovered test: "
                        + remaining);
            }
            used[best] = true;
            selected.add(tests.get(best));
            remaining.removeAll(coverage.get(best));
        }

        log.info("Minimized {} discovered tests to {}", tests.size(), selected.size());
        return selected;
    }
}
