package cz.cuni.mff.d3s.ctdtlp.generator.engine;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;

/**
 * Callbacks fired by the engine while it discovers tests.
 */
public interface DiscoveryListener {

    DiscoveryListener NONE = new DiscoveryListener() {};

    default void onTestDiscovered(GeneratedTest test) {
    }

    default void onPairInfeasible(Pair pair) {
    }

    default void onRowInfeasible(Row row) {
    }
}
