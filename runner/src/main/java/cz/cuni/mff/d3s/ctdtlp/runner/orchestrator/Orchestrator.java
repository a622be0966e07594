package cz.cuni.mff.d3s.ctdtlp.runner.orchestrator;

import cz.cuni.mff.d3s.ctdtlp.generator.engine.CoverageEngine;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.CoverageResult;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.GenerationSettings;
import cz.cuni.mff.d3s.ctdtlp.generator.formula.FormulaBuilder;
import cz.cuni.mff.d3s.ctdtlp.generator.minimize.GreedyMinimizer;
import cz.cuni.mff.d3s.ctdtlp.generator.offline.UnconstrainedPairwiseGenerator;
import cz.cuni.mff.d3s.ctdtlp.generator.output.ArtifactNames;
import cz.cuni.mff.d3s.ctdtlp.generator.output.OutputMaterializer;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.Oracle;
import cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv.ModelContractValidator;
import cz.cuni.mff.d3s.ctdtlp.runner.args.Arguments;
import cz.cuni.mff.d3s.ctdtlp.runner.config.GenerationRunConfiguration;
import cz.cuni.mff.d3s.ctdtlp.runner.config.SettingsLoader;
import cz.cuni.mff.d3s.ctdtlp.runner.factories.OracleFactory;
import cz.cuni.mff.d3s.ctdtlp.runner.factories.RowStrategyFactory;
import cz.cuni.mff.d3s.ctdtlp.runner.factories.RunConfigurationFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Coordinates one invocation: loads the factor settings, checks the model contract, and either
 * prints offline information or runs discovery, minimization and output.
 */
@Slf4j
public class Orchestrator {

    @Getter
    private final GenerationRunConfiguration runConfiguration;
    private final Oracle oracle;

    public Orchestrator(Arguments arguments) {
        this.runConfiguration = RunConfigurationFactory.createRunConfiguration(arguments);
        this.oracle = OracleFactory.createOracle(runConfiguration);
    }

    public Orchestrator(GenerationRunConfiguration runConfiguration, Oracle oracle) {
        runConfiguration.validate();
        this.runConfiguration = runConfiguration;
        this.oracle = oracle;
    }

    /**
     * Runs the whole invocation and prints its console output.
     *
     * @return the report of a generation run, empty for offline runs
     */
    public Optional<RunReport> run(PrintStream out) {
        FactorModel model = loadFactorModel();
        checkModelContract(model);

        if (runConfiguration.isOfflineOnly()) {
            printOffline(model, out);
            return Optional.empty();
        }

        RunReport report = generate(model);
        printReport(report, out);
        return Optional.of(report);
    }

    public FactorModel loadFactorModel() {
        return SettingsLoader.load(runConfiguration.getSettingsPath());
    }

    /**
     * @throws IllegalArgumentException listing every identifier the model does not declare
     */
    public void checkModelContract(FactorModel model) {
        Path modelPath = runConfiguration.getModelPath();
        if (modelPath == null) {
            return;
        }
        if (runConfiguration.isSkipContractCheck()) {
            log.warn("Skipping model contract check for {}", modelPath);
            return;
        }
        ModelContractValidator.validateOrThrow(modelPath, model);
    }

    /**
     * Discovers tests with the oracle, minimizes them and materializes the selected ones.
     */
    public RunReport generate(FactorModel model) {
        OutputMaterializer materializer = new OutputMaterializer(runConfiguration.getOutputDirectory(),
                runConfiguration.getArtifactFormat());

        CoverageEngine engine = CoverageEngine.builder()
                .model(model)
                .oracle(oracle)
                .strategy(RowStrategyFactory.createStrategy(runConfiguration, model))
                .settings(GenerationSettings.builder()
                        .modelPath(runConfiguration.getModelPath())
                        .queryTimeout(runConfiguration.getQueryTimeout())
                        .timeoutRetries(runConfiguration.getTimeoutRetries())
                        .build())
                .listener(materializer)
                .build();
        CoverageResult result = engine.run();

        Set<Pair> required = new TreeSet<>(result.getUniverse().getPairs());
        required.removeAll(result.getInfeasiblePairs());
        List<GeneratedTest> selected = GreedyMinimizer.minimize(result.getTests(), required);
        List<Path> pruned = materializer.prune(selected);
        materializer.writeSummaries(result, selected);

        return RunReport.builder()
                .result(result)
                .selectedTests(selected)
                .prunedArtifacts(pruned)
                .tracesDirectory(materializer.getTracesDirectory())
                .resultsDirectory(materializer.getResultsDirectory())
                .build();
    }

    public void printOffline(FactorModel model, PrintStream out) {
        FormulaBuilder formulas = new FormulaBuilder(model);

        if (runConfiguration.isPrintFactors()) {
            out.println("Factors (normalized domains):");
            for (Factor factor : model.getFactors()) {
                String values = factor.getDomain().stream().map(FactorValue::render).collect(Collectors.joining(", "));
                out.println("  - " + factor.getName() + " (" + factor.getKind() + ", var " + factor.getBackingVariable()
                        + "): [" + values + "]");
            }
        }

        if (runConfiguration.isPrintFormulas()) {
            out.println("Formulas per factor value:");
            for (Map.Entry<String, Map<FactorValue, String>> factor : formulas.valueFormulas().entrySet()) {
                factor.getValue().forEach((value, formula) ->
                        out.println("  - " + factor.getKey() + "=" + value.render() + ": " + formula));
            }
        }

        if (runConfiguration.isPrintPairwise()) {
            List<Row> rows = UnconstrainedPairwiseGenerator.generate(model);
            out.println("Unconstrained pairwise rows: " + rows.size());
            for (int i = 0; i < rows.size(); i++) {
                Row row = rows.get(i);
                out.println(String.format("  %02d. %s", i + 1, renderRow(row)));
                out.println("      LTL: " + formulas.formulaForRow(row));
            }
        }
    }

    public void printReport(RunReport report, PrintStream out) {
        CoverageResult result = report.getResult();

        out.println("Generated " + report.getSelectedTests().size() + " tests (" + result.getTestCount()
                + " discovered) with strategy " + result.getStrategyId());
        List<GeneratedTest> selected = report.getSelectedTests();
        for (int i = 0; i < selected.size(); i++) {
            GeneratedTest test = selected.get(i);
            out.println(String.format("  %02d. %s  %s", i + 1, ArtifactNames.fileNameFor(test.getRow()),
                    test.getSteps().isEmpty() ? "(no steps)" : String.join(", ", test.getSteps())));
        }

        if (!result.getInfeasiblePairs().isEmpty()) {
            out.println("Infeasible pairs:");
            for (Pair pair : result.getInfeasiblePairs()) {
                out.println("  - " + pair);
            }
        }

        out.println("Pairs: " + result.getUniverse().size() + " total, " + result.getFeasiblePairs().size()
                + " feasible, " + result.getInfeasibleCount() + " infeasible");
        out.println("Oracle queries: " + result.getQueryCount());
        out.println("Traces : " + report.getTracesDirectory());
        out.println("Results: " + report.getResultsDirectory());
    }

    private static String renderRow(Row row) {
        return row.asMap().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue().render())
                .collect(Collectors.joining(", "));
    }
}
