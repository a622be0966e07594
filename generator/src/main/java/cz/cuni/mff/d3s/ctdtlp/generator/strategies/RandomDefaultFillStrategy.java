package cz.cuni.mff.d3s.ctdtlp.generator.strategies;

import cz.cuni.mff.d3s.ctdtlp.generator.engine.CoverageState;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.Probe;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.RowStrategy;
import cz.cuni.mff.d3s.ctdtlp.generator.formula.FormulaBuilder;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Rows;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Random;

/**
 * Picks a pending pair at random and probes the row that pins it and sets every other factor
 * to its first domain value.
 *
 * <p>A row already recorded as infeasible, or one containing a pair already proven infeasible,
 * is never probed; the pair is probed on its own instead.
 */
@Slf4j
public class RandomDefaultFillStrategy implements RowStrategy {

    public static final String ID = "random-default-fill";

    private final FactorModel model;
    private final FormulaBuilder formulas;
    private final Random random;

    public RandomDefaultFillStrategy(FactorModel model, Random random) {
        this.model = model;
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
        Row row = Rows.defaultFilled(model, pair.bindings());

        if (state.isInfeasibleRow(row) || !state.infeasiblePairsOf(row).isEmpty()) {
            log.debug("Default-filled row {} cannot be feasible, probing pair {} alone", row, pair);
            return Optional.of(Probe.pair(pair, formulas.formulaForPartialAssignment(pair.bindings())));
        }
        return Optional.of(Probe.row(row, formulas.formulaForRow(row)));
    }
}
