package cz.cuni.mff.d3s.ctdtlp.runner.factories;

import cz.cuni.mff.d3s.ctdtlp.generator.engine.RowStrategy;
import cz.cuni.mff.d3s.ctdtlp.generator.strategies.RowStrategyProvider;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.runner.config.GenerationRunConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.util.Random;

/**
 * Creates the row strategy of a run, seeded from the run configuration.
 */
@Slf4j
public class RowStrategyFactory {

    public static RowStrategy createStrategy(GenerationRunConfiguration configuration, FactorModel model) {
        log.info("Using strategy '{}' with seed {}", configuration.getStrategyId(), configuration.getSeed());
        return RowStrategyProvider.create(configuration.getStrategyId(), model, new Random(configuration.getSeed()));
    }
}
