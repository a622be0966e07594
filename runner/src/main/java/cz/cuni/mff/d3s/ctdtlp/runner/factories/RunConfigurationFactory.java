package cz.cuni.mff.d3s.ctdtlp.runner.factories;

import cz.cuni.mff.d3s.ctdtlp.generator.output.ArtifactFormat;
import cz.cuni.mff.d3s.ctdtlp.model.common.TempPathResolver;
import cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv.NuXmvConfiguration;
import cz.cuni.mff.d3s.ctdtlp.runner.args.Arguments;
import cz.cuni.mff.d3s.ctdtlp.runner.config.GenerationRunConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Random;

/**
 * Turns parsed command-line arguments into a {@link GenerationRunConfiguration}.
 */
@Slf4j
public class RunConfigurationFactory {

    public static final String NUXMV_BIN_ENV = "NUXMV_BIN";

    public static GenerationRunConfiguration createRunConfiguration(Arguments arguments) {
        return createRunConfiguration(arguments, System.getenv());
    }

    /**
     * Same as {@link #createRunConfiguration(Arguments)} with an explicit environment.
     */
    public static GenerationRunConfiguration createRunConfiguration(Arguments arguments, Map<String, String> environment) {
        log.info("Creating run configuration from arguments");

        var modelPath = arguments.modelPath != null
                ? Path.of(arguments.modelPath).toAbsolutePath().normalize()
                : null;
        Path outputDir = null;
        if (!arguments.isOfflineOnly()) {
            outputDir = arguments.outputDirectory != null
                    ? Path.of(arguments.outputDirectory).toAbsolutePath().normalize()
                    : TempPathResolver.getDefaultOutputDirectory();
        }
        long seed = arguments.seed != null ? arguments.seed : new Random().nextLong();

        var configuration = GenerationRunConfiguration.builder()
                .settingsPath(Path.of(arguments.settingsPath).toAbsolutePath().normalize())
                .modelPath(modelPath)
                .nuxmvBinary(resolveNuXmvBinary(arguments.nuxmvBinary, environment))
                .strategyId(arguments.strategy)
                .seed(seed)
                .queryTimeout(Duration.ofSeconds(arguments.timeoutSeconds))
                .timeoutRetries(arguments.timeoutRetries)
                .outputDirectory(outputDir)
                .artifactFormat(ArtifactFormat.fromId(arguments.artifactFormat))
                .skipContractCheck(arguments.skipContractCheck)
                .printFactors(arguments.printFactors)
                .printFormulas(arguments.printFormulas)
                .printPairwise(arguments.printPairwise)
                .build();

        configuration.validate();

        log.info("Run configuration: strategy {}, seed {}, output {}", configuration.getStrategyId(),
                configuration.getSeed(), configuration.getOutputDirectory());
        return configuration;
    }

    /**
     * Resolves the nuXmv executable from the CLI argument, then the NUXMV_BIN environment variable,
     * then the default name looked up on PATH.
     */
    static String resolveNuXmvBinary(String cliBinary, Map<String, String> environment) {
        if (cliBinary != null && !cliBinary.isBlank()) {
            log.debug("Using nuXmv from CLI argument: {}", cliBinary);
            return cliBinary.strip();
        }

        String envBinary = environment.get(NUXMV_BIN_ENV);
        if (envBinary != null && !envBinary.isBlank()) {
            log.info("Using {} from environment: {}", NUXMV_BIN_ENV, envBinary);
            return envBinary.strip();
        }

        return NuXmvConfiguration.DEFAULT_BINARY;
    }
}
