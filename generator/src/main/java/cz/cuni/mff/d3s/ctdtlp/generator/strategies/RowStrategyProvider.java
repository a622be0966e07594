package cz.cuni.mff.d3s.ctdtlp.generator.strategies;

import cz.cuni.mff.d3s.ctdtlp.generator.engine.RowStrategy;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Registry of the row-proposal strategies a run can use.
 */
public class RowStrategyProvider {

    /**
     * Returns all available strategies.
     */
    public static List<RowStrategyDescriptor> getAvailableStrategies() {
        return List.of(
            new RowStrategyDescriptor(
                RandomDefaultFillStrategy.ID,
                "Random Probe, Default Fill",
                "Pins a random pending pair, fills the other factors with their first value and probes the row. " +
                "Infeasible rows are diagnosed pair by pair.",
                true
            ),
            new RowStrategyDescriptor(
                RandomDirectStrategy.ID,
                "Random Probe, Direct",
                "Probes a random pending pair on its own and reads the whole row from the witness trace.",
                false
            ),
            new RowStrategyDescriptor(
                IpoTwixStrategy.ID,
                "IPO/Twix Streaming",
                "Streams rows over the first two factors in parameter order, then completes coverage " +
                "pair by pair while avoiding known infeasible pairs. Intended for small factor counts.",
                false
            )
        );
    }

    public static RowStrategyDescriptor getDefaultStrategy() {
        return getAvailableStrategies().stream()
            .filter(RowStrategyDescriptor::isDefault)
            .findFirst()
            .orElse(getAvailableStrategies().get(0));
    }

    public static Optional<RowStrategyDescriptor> getStrategyById(String id) {
        return getAvailableStrategies().stream()
            .filter(strategy -> strategy.getId().equals(id))
            .findFirst();
    }

    public static boolean hasStrategy(String id) {
        return getStrategyById(id).isPresent();
    }

    public static String availableIds() {
        return getAvailableStrategies().stream().map(RowStrategyDescriptor::getId).collect(Collectors.joining(", "));
    }

    /**
     * Instantiates the strategy with the given id for one run.
     *
     * @throws IllegalArgumentException for an unknown id or a model the strategy cannot handle
     */
    public static RowStrategy create(String id, FactorModel model, Random random) {
        switch (id) {
            case RandomDefaultFillStrategy.ID:
                return new RandomDefaultFillStrategy(model, random);
            case RandomDirectStrategy.ID:
                return new RandomDirectStrategy(model, random);
            case IpoTwixStrategy.ID:
                return new IpoTwixStrategy(model);
            default:
                throw new IllegalArgumentException("Unknown strategy '" + id + "'. Available: " + availableIds());
        }
    }
}
