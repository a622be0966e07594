package cz.cuni.mff.d3s.ctdtlp.generator.strategies;

import cz.cuni.mff.d3s.ctdtlp.generator.engine.CoverageState;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.Probe;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.RowStrategy;
import cz.cuni.mff.d3s.ctdtlp.generator.formula.FormulaBuilder;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Binding;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * In-parameter-order generation in two phases.
 *
 * <p>The streaming phase walks every combination of the first two factors' values and extends
 * each one factor by factor, choosing the value that forms the most pairs not yet proposed.
 * Rows that cover no pending pair, or would contain a pair proven infeasible, are skipped.
 * The completion phase then takes the first pending pair, extends it greedily towards pending
 * pairs while avoiding pairs proven infeasible, and probes that row; when no such row exists,
 * or it is a recorded infeasible row, the pair is probed on its own.
 */
@Slf4j
public class IpoTwixStrategy implements RowStrategy {

    public static final String ID = "ipo-twix";

    private final FormulaBuilder formulas;
    private final List<Factor> factors;

    private final List<List<Binding>> seeds = new ArrayList<>();
    private int nextSeed;
    private final Set<Pair> proposedPairs = new HashSet<>();

    public IpoTwixStrategy(FactorModel model) {
        if (model.size() < 2) {
            throw new IllegalArgumentException("Strategy '" + ID + "' needs at least two factors, got " + model.size());
        }
        this.formulas = new FormulaBuilder(model);
        this.factors = model.getFactors();

        Factor first = factors.get(0);
        Factor second = factors.get(1);
        for (FactorValue a : first.getDomain()) {
            for (FactorValue b : second.getDomain()) {
                seeds.add(List.of(Binding.of(first.getName(), a), Binding.of(second.getName(), b)));
            }
        }
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

        while (nextSeed < seeds.size()) {
            List<Binding> seed = seeds.get(nextSeed++);
            if (state.isInfeasible(Pair.of(seed.get(0), seed.get(1)))) {
                continue;
            }
            Optional<Row> candidate = extend(seed,
                    pair -> !proposedPairs.contains(pair),
                    pair -> !state.isInfeasible(pair));
            if (candidate.isEmpty()) {
                continue;
            }
            Row row = candidate.get();
            proposedPairs.addAll(row.pairs());
            if (state.pendingPairsOf(row).isEmpty() || state.isInfeasibleRow(row)) {
                log.trace("Skipping streamed row {}", row);
                continue;
            }
            return Optional.of(Probe.row(row, formulas.formulaForRow(row)));
        }

        Pair target = state.getTodo().first();
        Optional<Row> candidate = extend(target.bindings(),
                state::isPending,
                pair -> !state.isInfeasible(pair));
        if (candidate.isPresent() && !state.isInfeasibleRow(candidate.get())) {
            Row row = candidate.get();
            return Optional.of(Probe.row(row, formulas.formulaForRow(row)));
        }
        log.debug("No row avoiding known infeasible pairs for {}, probing it alone", target);
        return Optional.of(Probe.pair(target, formulas.formulaForPair(target)));
    }

    /**
     * Extends the pinned bindings to a full row, factor by factor in declaration order. Each
     * factor takes the value forming the most {@code wanted} pairs with the values chosen so far;
     * ties go to the earlier domain value. A value forming a pair rejected by {@code allowed} is
     * never chosen; the extension fails when some factor has no other value.
     */
    private Optional<Row> extend(List<Binding> pinned, Predicate<Pair> wanted, Predicate<Pair> allowed) {
        List<Binding> chosen = new ArrayList<>(pinned);
        Set<String> assigned = new HashSet<>();
        for (Binding binding : pinned) {
            assigned.add(binding.getFactor());
        }

        for (Factor factor : factors) {
            if (assigned.contains(factor.getName())) {
                continue;
            }
            Binding best = null;
            int bestScore = Integer.MIN_VALUE;
            for (FactorValue value : factor.getDomain()) {
                Binding candidate = Binding.of(factor.getName(), value);
                int score = 0;
                boolean rejected = false;
                for (Binding existing : chosen) {
                    Pair pair = Pair.of(existing, candidate);
                    if (!allowed.test(pair)) {
                        rejected = true;
                        break;
                    }
                    if (wanted.test(pair)) {
                        score++;
                    }
                }
                if (!rejected && score > bestScore) {
                    best = candidate;
                    bestScore = score;
                }
            }
            if (best == null) {
                return Optional.empty();
            }
            chosen.add(best);
            assigned.add(factor.getName());
        }
        return Optional.of(Row.of(chosen));
    }
}
