package cz.cuni.mff.d3s.ctdtlp.generator.engine;

import cz.cuni.mff.d3s.ctdtlp.generator.formula.FormulaBuilder;
import cz.cuni.mff.d3s.ctdtlp.generator.strategies.RandomDefaultFillStrategy;
import cz.cuni.mff.d3s.ctdtlp.generator.strategies.RowStrategyProvider;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.CoverageContradictionException;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.DomainViolationException;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.InconsistentWitnessException;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.MissingWitnessException;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.Oracle;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleProtocolException;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleResponse;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleTimeoutException;
import cz.cuni.mff.d3s.ctdtlp.testutils.CoverageAssertions;
import cz.cuni.mff.d3s.ctdtlp.testutils.ScriptedOracle;
import cz.cuni.mff.d3s.ctdtlp.testutils.TestModels;
import cz.cuni.mff.d3s.ctdtlp.testutils.WorldOracle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.F;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.T;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.abcRow;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.i;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.pair;
import static org.junit.jupiter.api.Assertions.*;

class CoverageEngineTest {

    private static final GenerationSettings SETTINGS = GenerationSettings.builder()
            .modelPath(Path.of("model.smv"))
            .build();

    private final FactorModel model = TestModels.abc();
    private final FormulaBuilder formulas = new FormulaBuilder(model);

    @ParameterizedTest
    @ValueSource(strings = {"random-default-fill", "random-direct", "ipo-twix"})
    void givenUnconstrainedModel_whenRun_thenEveryPairCoveredByDistinctRows(String strategyId) {
        // given
        WorldOracle oracle = WorldOracle.fromRows(model, row -> true);
        RowStrategy strategy = RowStrategyProvider.create(strategyId, model, new Random(42));

        // when
        CoverageResult result = engine(oracle, strategy, null).run();

        // then
        assertEquals(strategyId, result.getStrategyId());
        assertTrue(result.getInfeasiblePairs().isEmpty());
        assertEquals(16, result.getFeasiblePairs().size());
        CoverageAssertions.assertPartition(result.getUniverse(), result.getTests(), result.getInfeasiblePairs());
        CoverageAssertions.assertNoDuplicateRows(result.getTests());
        assertEquals(oracle.getQueries().size(), result.getQueryCount());
        for (int index = 0; index < result.getTests().size(); index++) {
            assertEquals(index, result.getTests().get(index).getIndex());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"random-default-fill", "random-direct", "ipo-twix"})
    void givenConstrainedModel_whenRun_thenConstrainedPairReportedInfeasible(String strategyId) {
        // given
        Pair forbidden = pair("A", F, "C", T);
        WorldOracle oracle = WorldOracle.fromRows(model, row -> !row.satisfies(forbidden));
        RowStrategy strategy = RowStrategyProvider.create(strategyId, model, new Random(3));

        // when
        CoverageResult result = engine(oracle, strategy, null).run();

        // then
        assertEquals(Set.of(forbidden), result.getInfeasiblePairs());
        CoverageAssertions.assertPartition(result.getUniverse(), result.getTests(), result.getInfeasiblePairs());
        CoverageAssertions.assertNoRowSatisfies(result.getTests(), forbidden);
        CoverageAssertions.assertNoDuplicateRows(result.getTests());
    }

    @Test
    void givenInfeasibleRow_whenProbed_thenEachPendingPairDiagnosed() {
        // given
        Pair forbidden = pair("A", F, "C", T);
        Row row = abcRow(F, 3, T);
        WorldOracle oracle = WorldOracle.fromRows(model, r -> !r.satisfies(forbidden));
        RecordingListener listener = new RecordingListener();

        // when
        CoverageResult result = engine(oracle, queued(Probe.row(row, formulas.formulaForRow(row))), listener).run();

        // then
        assertEquals(List.of(
                formulas.formulaForRow(row),
                formulas.formulaForPair(pair("A", F, "B", i(3))),
                formulas.formulaForPair(forbidden),
                formulas.formulaForPair(pair("B", i(3), "C", T))), oracle.getQueries().subList(0, 4));
        assertEquals(List.of(forbidden), listener.infeasiblePairs);
        assertTrue(listener.infeasibleRows.isEmpty());
        assertTrue(result.getInfeasibleRowKeys().isEmpty());
        CoverageAssertions.assertPartition(result.getUniverse(), result.getTests(), result.getInfeasiblePairs());
    }

    @Test
    void givenRowInfeasibleOnlyAsWhole_whenProbed_thenRecordedAndNeverProbedAgain() {
        // given
        Row excluded = abcRow(F, 3, T);
        WorldOracle oracle = WorldOracle.fromRows(model, r -> !r.equals(excluded));
        RecordingListener listener = new RecordingListener();
        String rowFormula = formulas.formulaForRow(excluded);

        // when
        CoverageResult result = engine(oracle, queued(Probe.row(excluded, rowFormula)), listener).run();

        // then
        assertEquals(1, Collections.frequency(oracle.getQueries(), rowFormula));
        assertEquals(Set.of(excluded.key()), result.getInfeasibleRowKeys());
        assertEquals(List.of(excluded), listener.infeasibleRows);
        assertTrue(result.getInfeasiblePairs().isEmpty());
        CoverageAssertions.assertPartition(result.getUniverse(), result.getTests(), result.getInfeasiblePairs());
        assertTrue(result.getTests().stream().noneMatch(test -> test.getRow().equals(excluded)));
    }

    @Test
    void givenRowInfeasibleOnlyAsWhole_whenRunWithAnySeed_thenRowQueriedAtMostOnce() {
        Row excluded = abcRow(F, 3, T);
        String rowFormula = formulas.formulaForRow(excluded);

        for (long seed = 0; seed < 10; seed++) {
            // given
            WorldOracle oracle = WorldOracle.fromRows(model, r -> !r.equals(excluded));

            // when
            CoverageResult result = engine(oracle, new RandomDefaultFillStrategy(model, new Random(seed)), null).run();

            // then
            int probed = Collections.frequency(oracle.getQueries(), rowFormula);
            assertTrue(probed <= 1, "seed " + seed);
            assertEquals(probed == 1, result.getInfeasibleRowKeys().contains(excluded.key()), "seed " + seed);
            CoverageAssertions.assertPartition(result.getUniverse(), result.getTests(), result.getInfeasiblePairs());
        }
    }

    @Test
    void givenOracleAlwaysTimesOut_whenRetriesExhausted_thenRunAbortsWithoutMarkingInfeasible() {
        // given
        ScriptedOracle oracle = new ScriptedOracle(formula -> {
            throw new OracleTimeoutException(formula, Duration.ofSeconds(1));
        });
        RecordingListener listener = new RecordingListener();
        GenerationSettings settings = GenerationSettings.builder()
                .modelPath(Path.of("model.smv"))
                .timeoutRetries(2)
                .build();
        CoverageEngine engine = CoverageEngine.builder()
                .model(model)
                .oracle(oracle)
                .strategy(new RandomDefaultFillStrategy(model, new Random(1)))
                .settings(settings)
                .listener(listener)
                .build();

        // when
        assertThrows(OracleTimeoutException.class, engine::run);

        // then
        assertEquals(3, oracle.getQueries().size());
        assertEquals(1, oracle.getQueries().stream().distinct().count());
        assertTrue(listener.infeasiblePairs.isEmpty());
        assertTrue(listener.infeasibleRows.isEmpty());
    }

    @Test
    void givenSingleTimeout_whenRetryAllowed_thenRunCompletes() {
        // given
        WorldOracle world = WorldOracle.fromRows(model, row -> true);
        AtomicInteger calls = new AtomicInteger();
        ScriptedOracle oracle = new ScriptedOracle(formula -> {
            if (calls.getAndIncrement() == 0) {
                throw new OracleTimeoutException(formula, Duration.ofSeconds(1));
            }
            return world.submit(null, formula, null);
        });
        GenerationSettings settings = GenerationSettings.builder()
                .modelPath(Path.of("model.smv"))
                .timeoutRetries(1)
                .build();
        CoverageEngine engine = CoverageEngine.builder()
                .model(model)
                .oracle(oracle)
                .strategy(new RandomDefaultFillStrategy(model, new Random(1)))
                .settings(settings)
                .build();

        // when
        CoverageResult result = engine.run();

        // then
        assertTrue(result.getInfeasiblePairs().isEmpty());
        assertEquals(world.getQueries().size() + 1, result.getQueryCount());
        CoverageAssertions.assertPartition(result.getUniverse(), result.getTests(), result.getInfeasiblePairs());
    }

    @Test
    void givenProtocolError_whenRun_thenPropagated() {
        // given
        ScriptedOracle oracle = new ScriptedOracle(formula -> {
            throw new OracleProtocolException("no verdict", formula, "garbage");
        });

        // when / then
        assertThrows(OracleProtocolException.class,
                () -> engine(oracle, new RandomDefaultFillStrategy(model, new Random(1)), null).run());
    }

    @Test
    void givenWitnessViolatingProbedPair_whenClassified_thenInconsistentWitness() {
        // given
        Pair probed = pair("A", F, "C", F);
        ScriptedOracle oracle = new ScriptedOracle(formula -> OracleResponse.feasible(formula, witness("TRUE", "3", "TRUE")));

        // when
        InconsistentWitnessException e = assertThrows(InconsistentWitnessException.class,
                () -> engine(oracle, queued(Probe.pair(probed, formulas.formulaForPair(probed))), null).run());

        // then
        assertEquals(probed, e.getPair());
        assertTrue(e.getRawOutput().contains("-> State: 1.1 <-"));
    }

    @Test
    void givenPairWitnessOutsideDomain_whenClassified_thenViolationKeepsFormulaAndRawOutput() {
        // given
        Pair probed = pair("A", F, "C", F);
        String formula = formulas.formulaForPair(probed);
        ScriptedOracle oracle = new ScriptedOracle(f -> OracleResponse.feasible(f, witness("FALSE", "7", "FALSE")));

        // when
        DomainViolationException e = assertThrows(DomainViolationException.class,
                () -> engine(oracle, queued(Probe.pair(probed, formula)), null).run());

        // then
        assertEquals("B", e.getFactor());
        assertEquals(formula, e.getFormula());
        assertTrue(e.getMessage().contains(formula));
        assertTrue(e.getRawOutput().contains("b = 7"));
    }

    @Test
    void givenFeasibleVerdictWithoutStates_whenClassified_thenMissingWitness() {
        // given
        ScriptedOracle oracle = new ScriptedOracle(formula ->
                OracleResponse.feasible(formula, "-- specification !( " + formula + " )  is false\n"));

        // when / then
        assertThrows(MissingWitnessException.class,
                () -> engine(oracle, new RandomDefaultFillStrategy(model, new Random(1)), null).run());
    }

    @Test
    void givenRowContainingProvenInfeasiblePair_whenFeasible_thenContradiction() {
        // given
        Pair forbidden = pair("A", F, "C", T);
        String pairFormula = formulas.formulaForPair(forbidden);
        Row row = abcRow(F, 3, T);
        ScriptedOracle oracle = new ScriptedOracle(formula -> formula.equals(pairFormula)
                ? OracleResponse.infeasible(formula, "-- specification !( " + formula + " )  is true\n")
                : OracleResponse.feasible(formula, witness("FALSE", "3", "TRUE")));

        // when
        CoverageContradictionException e = assertThrows(CoverageContradictionException.class,
                () -> engine(oracle, queued(Probe.pair(forbidden, pairFormula), Probe.row(row, formulas.formulaForRow(row))),
                        null).run());

        // then
        assertEquals(Set.of(forbidden), e.getPairs());
    }

    @Test
    void givenStrategyRepeatingCoveredRow_whenRun_thenNoProgressDetected() {
        // given
        Row row = abcRow(F, 3, F);
        Probe probe = Probe.row(row, formulas.formulaForRow(row));
        WorldOracle oracle = WorldOracle.fromRows(model, r -> true);

        // when / then
        assertThrows(IllegalStateException.class, () -> engine(oracle, queued(probe, probe), null).run());
    }

    @Test
    void givenStrategyWithNothingLeft_whenPairsPending_thenRunFails() {
        // given
        WorldOracle oracle = WorldOracle.fromRows(model, r -> true);

        // when / then
        assertThrows(IllegalStateException.class, () -> engine(oracle, queued(), null).run());
    }

    @Test
    void givenFinishedEngine_whenRunAgain_thenRejected() {
        // given
        CoverageEngine engine = engine(WorldOracle.fromRows(model, r -> true),
                new RandomDefaultFillStrategy(model, new Random(1)), null);
        engine.run();

        // when / then
        assertThrows(IllegalStateException.class, engine::run);
    }

    @Test
    void givenSameSeed_whenRunTwice_thenSameTestsInSameOrder() {
        // given
        Pair forbidden = pair("B", i(5), "C", F);

        // when
        List<Row> first = rowsOf(engine(WorldOracle.fromRows(model, r -> !r.satisfies(forbidden)),
                new RandomDefaultFillStrategy(model, new Random(7)), null).run());
        List<Row> second = rowsOf(engine(WorldOracle.fromRows(model, r -> !r.satisfies(forbidden)),
                new RandomDefaultFillStrategy(model, new Random(7)), null).run());

        // then
        assertEquals(first, second);
    }

    @Test
    void givenListener_whenTestsDiscovered_thenNotifiedInDiscoveryOrder() {
        // given
        RecordingListener listener = new RecordingListener();

        // when
        CoverageResult result = engine(WorldOracle.fromRows(model, r -> true),
                new RandomDefaultFillStrategy(model, new Random(5)), listener).run();

        // then
        assertEquals(result.getTests(), listener.tests);
    }

    private CoverageEngine engine(Oracle oracle, RowStrategy strategy, DiscoveryListener listener) {
        return CoverageEngine.builder()
                .model(model)
                .oracle(oracle)
                .strategy(strategy)
                .settings(SETTINGS)
                .listener(listener)
                .build();
    }

    /**
     * Plays the given probes first and then falls back to default fill with a fixed seed,
     * or to nothing when no probe is given.
     */
    private RowStrategy queued(Probe... probes) {
        Deque<Probe> queue = new ArrayDeque<>(List.of(probes));
        RowStrategy fallback = probes.length == 0 ? null : new RandomDefaultFillStrategy(model, new Random(11));
        return new RowStrategy() {
            @Override
            public String getId() {
                return "queued";
            }

            @Override
            public Optional<Probe> next(CoverageState state) {
                if (!queue.isEmpty()) {
                    return Optional.of(queue.poll());
                }
                return fallback == null ? Optional.empty() : fallback.next(state);
            }
        };
    }

    private static List<Row> rowsOf(CoverageResult result) {
        return result.getTests().stream().map(GeneratedTest::getRow).collect(Collectors.toList());
    }

    private static String witness(String a, String b, String c) {
        return "-- specification !( phi )  is false\n"
                + "  -> State: 1.1 <-\n"
                + "    step = run\n"
                + "    a = " + a + "\n"
                + "    b = " + b + "\n"
                + "    c = " + c + "\n";
    }

    private static final class RecordingListener implements DiscoveryListener {
        private final List<GeneratedTest> tests = new ArrayList<>();
        private final List<Pair> infeasiblePairs = new ArrayList<>();
        private final List<Row> infeasibleRows = new ArrayList<>();

        @Override
        public void onTestDiscovered(GeneratedTest test) {
            tests.add(test);
        }

        @Override
        public void onPairInfeasible(Pair pair) {
            infeasiblePairs.add(pair);
        }

        @Override
        public void onRowInfeasible(Row row) {
            infeasibleRows.add(row);
        }
    }
}
