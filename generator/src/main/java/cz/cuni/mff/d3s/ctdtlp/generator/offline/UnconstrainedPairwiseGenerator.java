package cz.cuni.mff.d3s.ctdtlp.generator.offline;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.PairUniverse;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Rows;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pairwise covering set computed without the oracle, i.e. ignoring every model constraint.
 * Useful to inspect a configuration before spending model checker time on it.
 *
 * <p>Greedy set cover over the full Cartesian product, so only practical for small factor spaces.
 */
public final class UnconstrainedPairwiseGenerator {

    private UnconstrainedPairwiseGenerator() {}

    public static List<Row> generate(FactorModel model) {
        List<Row> candidates = Rows.cartesianProduct(model);
        Set<Pair> uncovered = new HashSet<>(PairUniverse.of(model).getPairs());
        List<Row> selected = new ArrayList<>();

        if (uncovered.isEmpty()) {
            selected.add(candidates.get(0));
            return selected;
        }

        while (!uncovered.isEmpty()) {
            Row best = null;
            int bestGain = 0;
            for (Row candidate : candidates) {
                int gain = 0;
                for (Pair pair : candidate.pairs()) {
                    if (uncovered.contains(pair)) {
                        gain++;
                    }
                }
                if (gain > bestGain) {
                    best = candidate;
                    bestGain = gain;
                }
            }
            if (best == null) {
                throw new IllegalStateException("Cartesian product leaves pairs uncovered: " + uncovered);
            }
            selected.add(best);
            best.pairs().forEach(uncovered::remove);
        }
        return selected;
    }
}
