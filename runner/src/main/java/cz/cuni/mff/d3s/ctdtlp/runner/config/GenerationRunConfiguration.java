package cz.cuni.mff.d3s.ctdtlp.runner.config;

import cz.cuni.mff.d3s.ctdtlp.generator.output.ArtifactFormat;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Everything one invocation needs, resolved from arguments and environment.
 */
@Getter
@Builder
@ToString
public class GenerationRunConfiguration {

    @NonNull
    private final Path settingsPath;

    /** SMV model; null only for offline runs. */
    private final Path modelPath;

    @NonNull
    private final String nuxmvBinary;

    @NonNull
    private final String strategyId;

    private final long seed;

    @NonNull
    private final Duration queryTimeout;

    private final int timeoutRetries;

    /** Run output directory; null only for offline runs. */
    private final Path outputDirectory;

    @NonNull
    private final ArtifactFormat artifactFormat;

    private final boolean skipContractCheck;
    private final boolean printFactors;
    private final boolean printFormulas;
    private final boolean printPairwise;

    public boolean isOfflineOnly() {
        return printFactors || printFormulas || printPairwise;
    }

    /**
     * @throws IllegalStateException if a generation run lacks its model or output directory
     */
    public void validate() {
        if (!isOfflineOnly()) {
            if (modelPath == null) {
                throw new IllegalStateException("Generation needs a model path");
            }
            if (outputDirectory == null) {
                throw new IllegalStateException("Generation needs an output directory");
            }
        }
        if (queryTimeout.isZero() || queryTimeout.isNegative()) {
            throw new IllegalStateException("Query timeout must be positive: " + queryTimeout);
        }
    }
}
