package cz.cuni.mff.d3s.ctdtlp.testutils;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Rows;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.Oracle;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleResponse;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Deterministic in-memory oracle. The "model" is a list of worlds, each a single state that
 * loops forever; a formula is feasible when some world satisfies it, and the witness is the
 * first such world printed the way nuXmv prints a counterexample.
 */
public class WorldOracle implements Oracle {

    private final List<Map<String, String>> worlds;
    private final List<String> queries = new ArrayList<>();

    public WorldOracle(List<Map<String, String>> worlds) {
        List<Map<String, String>> copy = new ArrayList<>();
        for (Map<String, String> world : worlds) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(world)));
        }
        this.worlds = Collections.unmodifiableList(copy);
    }

    /**
     * One world per full row of the model accepted by {@code allowed}. Each world sets every
     * factor's backing variable to the row's value, the step variable to {@code run} and the
     * end flag, if any, to {@code TRUE}.
     */
    public static WorldOracle fromRows(FactorModel model, Predicate<Row> allowed) {
        List<Map<String, String>> worlds = new ArrayList<>();
        for (Row row : Rows.cartesianProduct(model)) {
            if (!allowed.test(row)) {
                continue;
            }
            Map<String, String> world = new LinkedHashMap<>();
            world.put(model.getStepVariable(), "run");
            model.getEndFlagVariable().ifPresent(end -> world.put(end, "TRUE"));
            for (Factor factor : model.getFactors()) {
                world.put(factor.getBackingVariable(), row.get(factor.getName()).orElseThrow().render());
            }
            worlds.add(world);
        }
        return new WorldOracle(worlds);
    }

    @Override
    public OracleResponse submit(Path model, String formula, Duration timeout) {
        queries.add(formula);
        for (Map<String, String> world : worlds) {
            if (StateFormulaEvaluator.holds(formula, world)) {
                return OracleResponse.feasible(formula, counterexample(formula, world));
            }
        }
        return OracleResponse.infeasible(formula, "-- specification !( " + formula + " )  is true\n");
    }

    public List<String> getQueries() {
        return Collections.unmodifiableList(queries);
    }

    public List<Map<String, String>> getWorlds() {
        return worlds;
    }

    private static String counterexample(String formula, Map<String, String> world) {
        StringBuilder sb = new StringBuilder();
        sb.append("-- specification !( ").append(formula).append(" )  is false\n");
        sb.append("-- as demonstrated by the following execution sequence\n");
        sb.append("Trace Description: LTL Counterexample\n");
        sb.append("Trace Type: Counterexample\n");
        sb.append("  -- Loop starts here\n");
        sb.append("  -> State: 1.1 <-\n");
        world.forEach((name, value) -> sb.append("    ").append(name).append(" = ").append(value).append('\n'));
        sb.append("  -> State: 1.2 <-\n");
        return sb.toString();
    }
}
