package cz.cuni.mff.d3s.ctdtlp.generator.strategies;

import cz.cuni.mff.d3s.ctdtlp.generator.engine.CoverageState;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.CoverageStates;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.Probe;
import cz.cuni.mff.d3s.ctdtlp.generator.formula.FormulaBuilder;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.testutils.TestModels;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.F;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.T;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.abcRow;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.i;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.pair;
import static org.junit.jupiter.api.Assertions.*;

class IpoTwixStrategyTest {

    private final FactorModel model = TestModels.abc();
    private final FormulaBuilder formulas = new FormulaBuilder(model);

    @Test
    void givenSingleFactor_whenCreated_thenRejected() {
        FactorModel single = FactorModel.builder()
                .stepVariable("step")
                .factor(Factor.bool("A", "a", null))
                .build();

        assertThrows(IllegalArgumentException.class, () -> new IpoTwixStrategy(single));
    }

    @Test
    void givenFreshState_whenStreaming_thenSeedsExtendedTowardsUnproposedPairs() {
        // given
        IpoTwixStrategy strategy = new IpoTwixStrategy(model);
        CoverageState state = CoverageStates.fresh(model);

        // when
        List<Row> rows = new ArrayList<>();
        for (int n = 0; n < 6; n++) {
            Probe probe = strategy.next(state).orElseThrow();
            assertTrue(probe.isRowProbe());
            assertEquals(formulas.formulaForRow(probe.getRow()), probe.getFormula());
            rows.add(probe.getRow());
        }

        // then
        assertEquals(List.of(
                abcRow(F, 3, F),
                abcRow(F, 4, T),
                abcRow(F, 5, F),
                abcRow(T, 3, T),
                abcRow(T, 4, F),
                abcRow(T, 5, T)), rows);
    }

    @Test
    void givenInfeasibleSeed_whenStreaming_thenSeedSkipped() {
        // given
        IpoTwixStrategy strategy = new IpoTwixStrategy(model);
        CoverageState state = CoverageStates.fresh(model);
        CoverageStates.markInfeasible(state, pair("A", F, "B", i(3)));

        // when
        Probe probe = strategy.next(state).orElseThrow();

        // then
        assertEquals(abcRow(F, 4, F), probe.getRow());
    }

    @Test
    void givenInfeasiblePair_whenStreaming_thenExtensionAvoidsIt() {
        // given
        IpoTwixStrategy strategy = new IpoTwixStrategy(model);
        CoverageState state = CoverageStates.fresh(model);
        CoverageStates.markInfeasible(state, pair("A", F, "C", F));

        // when
        Probe probe = strategy.next(state).orElseThrow();

        // then
        assertEquals(abcRow(F, 3, T), probe.getRow());
    }

    @Test
    void givenStreamedRowWithoutPendingPairs_whenStreaming_thenSkipped() {
        // given
        IpoTwixStrategy strategy = new IpoTwixStrategy(model);
        CoverageState state = CoverageStates.fresh(model);
        CoverageStates.retire(state, abcRow(F, 3, F));

        // when
        Probe probe = strategy.next(state).orElseThrow();

        // then
        assertEquals(abcRow(F, 4, T), probe.getRow());
    }

    @Test
    void givenStreamingDone_whenPairsPending_thenFirstPendingPairExtended() {
        // given
        IpoTwixStrategy strategy = new IpoTwixStrategy(model);
        CoverageState state = CoverageStates.fresh(model);
        drainStreaming(strategy, state);

        // when
        Probe probe = strategy.next(state).orElseThrow();

        // then
        assertTrue(probe.isRowProbe());
        assertEquals(abcRow(F, 3, F), probe.getRow());
    }

    @Test
    void givenStreamingDone_whenExtensionHitsInfeasiblePair_thenOtherValueChosen() {
        // given
        IpoTwixStrategy strategy = new IpoTwixStrategy(model);
        CoverageState state = CoverageStates.fresh(model);
        drainStreaming(strategy, state);
        CoverageStates.markInfeasible(state, pair("A", F, "C", F));

        // when
        Probe probe = strategy.next(state).orElseThrow();

        // then
        assertEquals(abcRow(F, 3, T), probe.getRow());
    }

    @Test
    void givenStreamingDone_whenNoValueAvoidsInfeasiblePairs_thenPairProbedAlone() {
        // given
        IpoTwixStrategy strategy = new IpoTwixStrategy(model);
        CoverageState state = CoverageStates.fresh(model);
        drainStreaming(strategy, state);
        CoverageStates.markInfeasible(state, pair("A", F, "C", F), pair("A", F, "C", T));
        Pair target = pair("A", F, "B", i(3));

        // when
        Probe probe = strategy.next(state).orElseThrow();

        // then
        assertFalse(probe.isRowProbe());
        assertEquals(target, probe.getPair());
        assertEquals(formulas.formulaForPair(target), probe.getFormula());
    }

    @Test
    void givenStreamingDone_whenExtendedRowRecordedInfeasible_thenPairProbedAlone() {
        // given
        IpoTwixStrategy strategy = new IpoTwixStrategy(model);
        CoverageState state = CoverageStates.fresh(model);
        drainStreaming(strategy, state);
        CoverageStates.recordInfeasibleRow(state, abcRow(F, 3, F));

        // when
        Probe probe = strategy.next(state).orElseThrow();

        // then
        assertEquals(pair("A", F, "B", i(3)), probe.getPair());
    }

    @Test
    void givenExhaustedState_whenAsked_thenNothingProposed() {
        // given
        IpoTwixStrategy strategy = new IpoTwixStrategy(model);
        CoverageState state = CoverageStates.fresh(model);
        for (Row row : List.of(abcRow(F, 3, F), abcRow(F, 4, T), abcRow(F, 5, F),
                abcRow(T, 3, T), abcRow(T, 4, F), abcRow(T, 5, T))) {
            CoverageStates.retire(state, row);
        }

        // when / then
        assertTrue(state.isExhausted());
        assertTrue(strategy.next(state).isEmpty());
    }

    private static void drainStreaming(IpoTwixStrategy strategy, CoverageState state) {
        for (int n = 0; n < 6; n++) {
            strategy.next(state).orElseThrow();
        }
    }
}
