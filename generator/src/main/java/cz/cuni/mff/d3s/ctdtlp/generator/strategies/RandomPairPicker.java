package cz.cuni.mff.d3s.ctdtlp.generator.strategies;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;

import java.util.Iterator;
import java.util.NavigableSet;
import java.util.Random;

/**
 * Uniform choice from an ordered set, so that a fixed seed replays the same choices.
 */
final class RandomPairPicker {

    private RandomPairPicker() {}

    static Pair pick(NavigableSet<Pair> pairs, Random random) {
        if (pairs.isEmpty()) {
            throw new IllegalStateException("No pair to pick from");
        }
        int index = random.nextInt(pairs.size());
        Iterator<Pair> iterator = pairs.iterator();
        for (int i = 0; i < index; i++) {
            iterator.next();
        }
        return iterator.next();
    }
}
