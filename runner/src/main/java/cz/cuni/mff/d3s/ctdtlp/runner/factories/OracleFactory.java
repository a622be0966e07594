package cz.cuni.mff.d3s.ctdtlp.runner.factories;

import cz.cuni.mff.d3s.ctdtlp.oracle.common.Oracle;
import cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv.NuXmvConfiguration;
import cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv.NuXmvOracle;
import cz.cuni.mff.d3s.ctdtlp.runner.config.GenerationRunConfiguration;

public class OracleFactory {

    public static Oracle createOracle(GenerationRunConfiguration configuration) {
        NuXmvConfiguration nuXmv = NuXmvConfiguration.builder()
                .binary(configuration.getNuxmvBinary())
                .workingDirectory(configuration.getModelPath() != null ? configuration.getModelPath().getParent() : null)
                .build();
        return new NuXmvOracle(nuXmv);
    }
}
