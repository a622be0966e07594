package cz.cuni.mff.d3s.ctdtlp.model.common;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Resolves the directories a generation run writes to.
 *
 * <p>The base directory can be overridden using the CTDTLP_OUTPUT_DIR environment variable.
 * If not set, the system temporary directory is used with a "ctd-tlp" namespace subdirectory.
 */
@Slf4j
public final class TempPathResolver {

    /**
     * Environment variable to override the base output directory.
     */
    public static final String OUTPUT_DIR_ENV = "CTDTLP_OUTPUT_DIR";

    /**
     * Subdirectory name under system temp directory when OUTPUT_DIR_ENV is not set.
     */
    public static final String NAMESPACE = "ctd-tlp";

    /**
     * Subdirectory holding one artifact per retained test.
     */
    public static final String TRACES_DIR = "traces";

    /**
     * Subdirectory holding run-level summaries.
     */
    public static final String RESULTS_DIR = "results";

    private static final DateTimeFormatter RUN_ID_FORMATTER =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    private TempPathResolver() {}

    /**
     * Gets the base directory for generator output.
     *
     * <p>Resolution order:
     * <ol>
     *   <li>CTDTLP_OUTPUT_DIR environment variable (if set)</li>
     *   <li>System temp directory + "ctd-tlp" namespace</li>
     * </ol>
     */
    public static Path getBaseDirectory() {
        String envOutputDir = System.getenv(OUTPUT_DIR_ENV);
        if (envOutputDir != null && !envOutputDir.isBlank()) {
            return Path.of(envOutputDir).toAbsolutePath().normalize();
        }

        return Path.of(System.getProperty("java.io.tmpdir"))
            .resolve(NAMESPACE)
            .toAbsolutePath()
            .normalize();
    }

    /**
     * Creates a unique run directory named yyyyMMdd-HHmmss-SSS-{first 8 chars of a UUID}
     * under the base directory.
     */
    public static Path getDefaultOutputDirectory() {
        return resolveRunDirectory(getBaseDirectory());
    }

    /**
     * Returns a fresh run directory under {@code baseDirectory}. When it cannot be created now,
     * the path is still returned and writers create it on first write.
     */
    static Path resolveRunDirectory(Path baseDirectory) {
        Path runDir = baseDirectory.resolve(newRunId());
        try {
            Files.createDirectories(runDir);
        } catch (IOException e) {
            log.warn("Could not create run directory {}, deferring to first write: {}", runDir, e.toString());
        }
        return runDir;
    }

    public static Path getTracesDir(Path outputDirectory) {
        return outputDirectory.resolve(TRACES_DIR);
    }

    public static Path getResultsDir(Path outputDirectory) {
        return outputDirectory.resolve(RESULTS_DIR);
    }

    private static String newRunId() {
        String timestamp = RUN_ID_FORMATTER.format(LocalDateTime.now());
        return timestamp + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
