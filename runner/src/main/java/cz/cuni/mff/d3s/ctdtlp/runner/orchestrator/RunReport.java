package cz.cuni.mff.d3s.ctdtlp.runner.orchestrator;

import cz.cuni.mff.d3s.ctdtlp.generator.engine.CoverageResult;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.util.List;

/**
 * What a finished generation run produced.
 */
@Getter
@Builder
public class RunReport {

    private final CoverageResult result;

    /** Tests kept by the minimizer, in selection order. */
    private final List<GeneratedTest> selectedTests;

    /** Artifacts of discovered tests the minimizer dropped. */
    private final List<Path> prunedArtifacts;

    private final Path tracesDirectory;
    private final Path resultsDirectory;
}
