package cz.cuni.mff.d3s.ctdtlp.testutils;

import cz.cuni.mff.d3s.ctdtlp.oracle.common.Oracle;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleResponse;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Oracle whose answers come from a function of the formula. The function may throw to
 * simulate timeouts or protocol errors.
 */
public class ScriptedOracle implements Oracle {

    private final Function<String, OracleResponse> script;
    private final List<String> queries = new ArrayList<>();

    public ScriptedOracle(Function<String, OracleResponse> script) {
        this.script = script;
    }

    @Override
    public OracleResponse submit(Path model, String formula, Duration timeout) {
        queries.add(formula);
        return script.apply(formula);
    }

    public List<String> getQueries() {
        return Collections.unmodifiableList(queries);
    }
}
