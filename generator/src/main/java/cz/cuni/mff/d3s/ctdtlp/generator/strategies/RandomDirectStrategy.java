package cz.cuni.mff.d3s.ctdtlp.generator.strategies;

import cz.cuni.mff.d3s.ctdtlp.generator.engine.CoverageState;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.Probe;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.RowStrategy;
import cz.cuni.mff.d3s.ctdtlp.generator.formula.FormulaBuilder;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;

import java.util.Optional;
import java.util.Random;

/**
 * Probes a random pending pair directly; the whole row is then read from the witness.
 */
public class RandomDirectStrategy implements RowStrategy {

    public static final String ID = "random-direct";

    private final FormulaBuilder formulas;
    private final Random random;

    public RandomDirectStrategy(FactorModel model, Random random) {
        this.formulas = new FormulaBuilder(model);
        this.random = random;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Optional<Probe> next(CoverageState state) {
        if (state.isExhausted()) {
            return Optional.empty();
        }
        Pair pair = RandomPairPicker.pick(state.getTodo(), random);
        return Optional.of(Probe.pair(pair, formulas.formulaForPair(pair)));
    }
}
