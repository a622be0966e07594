package cz.cuni.mff.d3s.ctdtlp.runner.args;

import cz.cuni.mff.d3s.ctdtlp.generator.output.ArtifactFormat;
import cz.cuni.mff.d3s.ctdtlp.generator.strategies.RowStrategyProvider;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line arguments of the generator.
 * Parsed by picocli; {@link #validate()} checks what picocli cannot.
 */
@CommandLine.Command(name = "ctd-tlp", version = "ctd-tlp 0.1.0",
        description = "Generates a pairwise covering test suite, using nuXmv to decide which factor combinations the model allows.")
public class Arguments {
    @CommandLine.Option(names = { "-s", "--settings" }, paramLabel = "SETTINGS", description = "Path to the factor settings JSON", required = true)
    public String settingsPath;

    @CommandLine.Option(names = { "-m", "--model" }, paramLabel = "MODEL", description = "Path to the SMV model (required unless only printing)")
    public String modelPath;

    @CommandLine.Option(names = { "-n", "--nuxmv" }, paramLabel = "BINARY",
                        description = "nuXmv executable (can also be set via NUXMV_BIN environment variable, default: nuXmv)")
    public String nuxmvBinary;

    @CommandLine.Option(names = { "-t", "--strategy" }, paramLabel = "STRATEGY",
                        description = "Row strategy (random-default-fill, random-direct, ipo-twix)",
                        defaultValue = "random-default-fill")
    public String strategy;

    @CommandLine.Option(names = { "--seed" }, paramLabel = "SEED", description = "Seed of the random pair choice; random when omitted")
    public Long seed;

    @CommandLine.Option(names = { "--timeout" }, paramLabel = "SECONDS", description = "Bound for one nuXmv query in seconds",
                        defaultValue = "30")
    public long timeoutSeconds;

    @CommandLine.Option(names = { "--retries" }, paramLabel = "N", description = "How many times a timed out query is repeated",
                        defaultValue = "0")
    public int timeoutRetries;

    @CommandLine.Option(names = { "-o", "--output-dir" }, paramLabel = "OUTPUT",
                        description = "Output directory for traces and summaries (default: fresh run directory under CTDTLP_OUTPUT_DIR or the temp directory)")
    public String outputDirectory;

    @CommandLine.Option(names = { "-f", "--artifact-format" }, paramLabel = "FORMAT",
                        description = "Content of each test artifact: steps or trace", defaultValue = "steps")
    public String artifactFormat;

    @CommandLine.Option(names = { "--skip-contract-check" }, description = "Do not check that the model declares the configured variables")
    public boolean skipContractCheck;

    @CommandLine.Option(names = { "--print-factors" }, description = "Print the normalized factor domains and exit")
    public boolean printFactors;

    @CommandLine.Option(names = { "--print-formulas" }, description = "Print the formula of every factor value and exit")
    public boolean printFormulas;

    @CommandLine.Option(names = { "--print-pairwise" }, description = "Print a pairwise covering set computed without nuXmv and exit")
    public boolean printPairwise;

    @CommandLine.Option(names = { "-V", "--version" }, versionHelp = true, description = "print version information and exit")
    private boolean versionRequested = false;

    @CommandLine.Option(names = { "-h", "--help" }, usageHelp = true, description = "display a help message")
    private boolean helpRequested = false;

    /**
     * True when the run only prints offline information and never queries nuXmv.
     */
    public boolean isOfflineOnly() {
        return printFactors || printFormulas || printPairwise;
    }

    /**
     * Validates the arguments and returns a list of validation errors.
     * Returns an empty list if all arguments are valid.
     *
     * @return List of validation error messages, empty if valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (settingsPath != null && !Files.isRegularFile(Path.of(settingsPath))) {
            errors.add("Settings file not found: " + settingsPath);
        }

        if (modelPath != null) {
            if (!Files.isRegularFile(Path.of(modelPath))) {
                errors.add("Model file not found: " + modelPath);
            }
        } else if (!isOfflineOnly()) {
            errors.add("A model is required for generation. Use --model, or one of --print-factors, "
                    + "--print-formulas, --print-pairwise.");
        }

        if (strategy != null && !RowStrategyProvider.hasStrategy(strategy)) {
            errors.add("Unknown strategy: '" + strategy + "'. Available strategies: "
                    + RowStrategyProvider.availableIds());
        }

        if (timeoutSeconds <= 0) {
            errors.add("Timeout must be positive, got " + timeoutSeconds);
        }

        if (timeoutRetries < 0) {
            errors.add("Retries must not be negative, got " + timeoutRetries);
        }

        if (artifactFormat != null) {
            try {
                ArtifactFormat.fromId(artifactFormat);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (outputDirectory != null) {
            Path output = Path.of(outputDirectory);
            if (Files.exists(output) && !Files.isDirectory(output)) {
                errors.add("Output path exists and is not a directory: " + outputDirectory);
            }
        }

        return errors;
    }

    /**
     * Validates arguments and throws an exception if invalid.
     *
     * @throws IllegalArgumentException if validation fails, with all error messages
     */
    public void validateOrThrow() throws IllegalArgumentException {
        List<String> errors = validate();
        if (!errors.isEmpty()) {
            String message = "Invalid arguments:\n  - " + String.join("\n  - ", errors);
            throw new IllegalArgumentException(message);
        }
    }
}
