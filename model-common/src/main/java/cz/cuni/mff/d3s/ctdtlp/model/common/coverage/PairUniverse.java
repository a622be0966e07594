package cz.cuni.mff.d3s.ctdtlp.model.common.coverage;

import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;

import java.util.Collections;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * All pairs of a factor model: every unordered factor pair crossed with both domains.
 */
public final class PairUniverse {

    private final NavigableSet<Pair> pairs;

    private PairUniverse(NavigableSet<Pair> pairs) {
        this.pairs = Collections.unmodifiableNavigableSet(pairs);
    }

    public static PairUniverse of(FactorModel model) {
        NavigableSet<Pair> pairs = new TreeSet<>();
        List<Factor> factors = model.getFactors();
        for (int i = 0; i < factors.size(); i++) {
            for (int j = i + 1; j < factors.size(); j++) {
                Factor a = factors.get(i);
                Factor b = factors.get(j);
                for (FactorValue va : a.getDomain()) {
                    for (FactorValue vb : b.getDomain()) {
                        pairs.add(Pair.of(a.getName(), va, b.getName(), vb));
                    }
                }
            }
        }
        return new PairUniverse(pairs);
    }

    /**
     * Number of pairs the model must produce: sum of |domain_i| * |domain_j| over i &lt; j.
     */
    public static long expectedSize(FactorModel model) {
        long total = 0;
        List<Factor> factors = model.getFactors();
        for (int i = 0; i < factors.size(); i++) {
            for (int j = i + 1; j < factors.size(); j++) {
                total += (long) factors.get(i).getDomain().size() * factors.get(j).getDomain().size();
            }
        }
        return total;
    }

    public NavigableSet<Pair> getPairs() {
        return pairs;
    }

    public boolean contains(Pair pair) {
        return pairs.contains(pair);
    }

    public int size() {
        return pairs.size();
    }
}
