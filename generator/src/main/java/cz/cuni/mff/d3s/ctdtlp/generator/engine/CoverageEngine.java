package cz.cuni.mff.d3s.ctdtlp.generator.engine;

import cz.cuni.mff.d3s.ctdtlp.generator.formula.FormulaBuilder;
import cz.cuni.mff.d3s.ctdtlp.generator.formula.Formulas;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.PairUniverse;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.CoverageContradictionException;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.DomainViolationException;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.GenerationException;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.InconsistentWitnessException;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.MissingWitnessException;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;
import cz.cuni.mff.d3s.ctdtlp.model.common.trace.RowExtractor;
import cz.cuni.mff.d3s.ctdtlp.model.common.trace.StepExtractor;
import cz.cuni.mff.d3s.ctdtlp.model.common.trace.TraceParser;
import cz.cuni.mff.d3s.ctdtlp.model.common.trace.WitnessTrace;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.Oracle;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleResponse;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleTimeoutException;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Discovery loop of a generation run.
 *
 * <p>Asks the strategy for probes until every pair of the universe is either covered by a
 * discovered test or proven infeasible. Each probe is fully classified before the next one is
 * requested:
 * <ul>
 *   <li>a feasible row (probed, or read from a pair probe's witness) retires its pending pairs and,
 *       when its row was not seen before, becomes a new test;</li>
 *   <li>an infeasible pair probe marks the pair infeasible;</li>
 *   <li>an infeasible row probe is diagnosed pair by pair; when no pending pair of the row is
 *       infeasible on its own, the row is recorded as an infeasible row.</li>
 * </ul>
 * Every error aborts the run. An instance runs once.
 */
@Slf4j
public class CoverageEngine {

    @Getter
    private final FactorModel model;
    private final Oracle oracle;
    @Getter
    private final RowStrategy strategy;
    private final GenerationSettings settings;
    private final DiscoveryListener listener;

    private final FormulaBuilder formulas;
    private final RowExtractor rowExtractor;
    private final StepExtractor stepExtractor;
    private final PairUniverse universe;
    private final CoverageState state;
    private final List<GeneratedTest> tests = new ArrayList<>();
    private int queryCount;
    private boolean started;

    @Builder
    private CoverageEngine(@NonNull FactorModel model, @NonNull Oracle oracle, @NonNull RowStrategy strategy,
                           @NonNull GenerationSettings settings, DiscoveryListener listener) {
        this.model = model;
        this.oracle = oracle;
        this.strategy = strategy;
        this.settings = settings;
        this.listener = listener == null ? DiscoveryListener.NONE : listener;
        this.formulas = new FormulaBuilder(model);
        this.rowExtractor = new RowExtractor(model);
        this.stepExtractor = new StepExtractor(model.getStepVariable(), model.getNoopStep());
        this.universe = PairUniverse.of(model);
        this.state = new CoverageState(universe);
    }

    public CoverageResult run() {
        if (started) {
            throw new IllegalStateException("A coverage engine runs only once");
        }
        started = true;

        log.info("Starting discovery with strategy '{}' over {} factors and {} pairs",
                strategy.getId(), model.size(), universe.size());

        while (!state.isExhausted()) {
            Probe probe = strategy.next(state).orElseThrow(() -> new IllegalStateException(
                    "Strategy '" + strategy.getId() + "' has no probe left while " + state.getTodo().size()
                            + " pairs are pending"));

            long before = state.progressMarker();
            try {
                handle(probe);
            } catch (GenerationException e) {
                log.error("Generation aborted while handling {}: {}", probe, e.getMessage());
                throw e;
            }
            if (state.progressMarker() == before) {
                throw new IllegalStateException("Probe " + probe + " made no progress; strategy '"
                        + strategy.getId() + "' would loop forever");
            }
            log.debug("{} pairs pending, {} tests, {} infeasible pairs",
                    state.getTodo().size(), tests.size(), state.getInfeasiblePairs().size());
        }

        CoverageConsistencyChecker.check(universe, tests, state.getInfeasiblePairs());
        log.info("Discovery finished: {} tests, {} feasible pairs, {} infeasible pairs, {} oracle queries",
                tests.size(), state.getFeasiblePairs().size(), state.getInfeasiblePairs().size(), queryCount);

        return CoverageResult.builder()
                .strategyId(strategy.getId())
                .universe(universe)
                .tests(Collections.unmodifiableList(new ArrayList<>(tests)))
                .feasiblePairs(state.getFeasiblePairs())
                .infeasiblePairs(state.getInfeasiblePairs())
                .infeasibleRowKeys(state.getInfeasibleRowKeys())
                .queryCount(queryCount)
                .build();
    }

    private void handle(Probe probe) {
        OracleResponse response = query(probe.getFormula());
        if (probe.isRowProbe()) {
            Row row = probe.getRow().requireTotalOver(model);
            if (response.isFeasible()) {
                WitnessTrace trace = TraceParser.parse(response.getRawOutput());
                if (trace.isEmpty()) {
                    throw new MissingWitnessException("Feasible row " + row + " came without a witness state. Formula: "
                            + probe.getFormula(), response.getRawOutput());
                }
                record(row, trace, probe.getFormula());
            } else {
                diagnose(row);
            }
        } else {
            Pair pair = probe.getPair();
            if (response.isFeasible()) {
                WitnessTrace trace = TraceParser.parse(response.getRawOutput());
                if (trace.isEmpty()) {
                    throw new MissingWitnessException("Feasible pair " + pair + " came without a witness state. Formula: "
                            + probe.getFormula(), response.getRawOutput());
                }
                Row row;
                try {
                    row = rowExtractor.extract(trace);
                } catch (DomainViolationException e) {
                    throw e.inWitnessOf(probe.getFormula(), response.getRawOutput());
                }
                if (!row.satisfies(pair)) {
                    throw new InconsistentWitnessException(pair, row, probe.getFormula(), response.getRawOutput());
                }
                record(row, trace, probe.getFormula());
            } else {
                markInfeasible(pair);
            }
        }
    }

    private void record(Row row, WitnessTrace trace, String formula) {
        Set<Pair> contradicting = state.infeasiblePairsOf(row);
        if (!contradicting.isEmpty()) {
            throw new CoverageContradictionException("Feasible row " + row + " contains pairs proven infeasible",
                    contradicting);
        }

        if (state.markSeen(row.key())) {
            GeneratedTest test = GeneratedTest.builder()
                    .index(tests.size())
                    .row(row)
                    .trace(trace)
                    .steps(stepExtractor.extract(trace))
                    .formula(formula)
                    .build();
            tests.add(test);
            int retired = state.retire(row);
            log.debug("Test #{} {} retires {} pairs", test.getIndex(), row, retired);
            listener.onTestDiscovered(test);
        } else {
            int retired = state.retire(row);
            log.debug("Duplicate row {} retires {} pairs", row, retired);
        }
    }

    private void diagnose(Row row) {
        List<Pair> candidates = state.pendingPairsOf(row);
        log.debug("Row {} is infeasible, diagnosing {} pending pairs", row, candidates.size());

        int proven = 0;
        for (Pair pair : candidates) {
            OracleResponse response = query(formulas.formulaForPair(pair));
            if (!response.isFeasible()) {
                markInfeasible(pair);
                proven++;
            }
        }

        if (proven == 0 && state.recordInfeasibleRow(row.key())) {
            log.debug("Row {} is infeasible although none of its pending pairs is", row);
            listener.onRowInfeasible(row);
        }
    }

    private void markInfeasible(Pair pair) {
        if (state.markInfeasible(pair)) {
            log.debug("Pair {} is infeasible", pair);
            listener.onPairInfeasible(pair);
        }
    }

    private OracleResponse query(String formula) {
        Formulas.requireBalanced(formula);
        int attempt = 0;
        while (true) {
            queryCount++;
            try {
                return oracle.submit(settings.getModelPath(), formula, settings.getQueryTimeout());
            } catch (OracleTimeoutException e) {
                if (attempt >= settings.getTimeoutRetries()) {
                    throw e;
                }
                attempt++;
                log.warn("Oracle timed out, retrying ({}/{}): {}", attempt, settings.getTimeoutRetries(), formula);
            }
        }
    }

    public int getQueryCount() {
        return queryCount;
    }
}
