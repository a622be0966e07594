package cz.cuni.mff.d3s.ctdtlp.generator.engine;

import java.util.Optional;

/**
 * Proposes the next oracle query of a run.
 *
 * <p>Implementations must propose something that can make progress: a row that contains at least
 * one pending pair and is not a recorded infeasible row, or a pending pair.
 */
public interface RowStrategy {

    /**
     * Identifier the strategy is selected by, e.g. {@code random-default-fill}.
     */
    String getId();

    /**
     * @param state current coverage, never exhausted when called
     * @return the next probe, or empty when the strategy has nothing left to propose
     */
    Optional<Probe> next(CoverageState state);
}
