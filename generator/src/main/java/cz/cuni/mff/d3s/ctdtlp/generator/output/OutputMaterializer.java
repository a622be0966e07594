package cz.cuni.mff.d3s.ctdtlp.generator.output;

import cz.cuni.mff.d3s.ctdtlp.generator.engine.CoverageResult;
import cz.cuni.mff.d3s.ctdtlp.generator.engine.DiscoveryListener;
import cz.cuni.mff.d3s.ctdtlp.model.common.TempPathResolver;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.RowKey;
import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes one artifact per discovered test into {@code <output>/traces} and, once the suite is
 * minimized, deletes every artifact whose test was not selected. Run summaries go to
 * {@code <output>/results}.
 */
@Slf4j
public class OutputMaterializer implements DiscoveryListener {

    public static final String FEASIBLE_PAIRS_FILE = "feasible_pairs.txt";
    public static final String INFEASIBLE_PAIRS_FILE = "infeasible_pairs.txt";
    public static final String SUITE_FILE = "suite.txt";

    @Getter
    private final Path tracesDirectory;
    @Getter
    private final Path resultsDirectory;
    private final ArtifactFormat format;
    private final Map<String, RowKey> writtenNames = new HashMap<>();

    public OutputMaterializer(Path outputDirectory, ArtifactFormat format) {
        this.tracesDirectory = TempPathResolver.getTracesDir(outputDirectory);
        this.resultsDirectory = TempPathResolver.getResultsDir(outputDirectory);
        this.format = format;
    }

    @Override
    public void onTestDiscovered(GeneratedTest test) {
        write(test);
    }

    /**
     * Writes the artifact of one test.
     *
     * @return the artifact path
     * @throws IllegalStateException if another row of this run already maps to the same name
     */
    public Path write(GeneratedTest test) {
        String fileName = ArtifactNames.fileNameFor(test.getRow());
        RowKey previous = writtenNames.putIfAbsent(fileName, test.getRow().key());
        if (previous != null && !previous.equals(test.getRow().key())) {
            throw new IllegalStateException("Artifact name " + fileName + " is used by rows " + previous + " and "
                    + test.getRow().key());
        }
        Path file = tracesDirectory.resolve(fileName);
        writeString(file, format.render(test));
        log.debug("Wrote artifact {}", file);
        return file;
    }

    /**
     * Deletes every {@code run_*.txt} artifact that does not belong to a selected test.
     *
     * @return the deleted files
     */
    public List<Path> prune(Collection<GeneratedTest> selected) {
        Set<String> keep = new HashSet<>();
        for (GeneratedTest test : selected) {
            keep.add(ArtifactNames.fileNameFor(test.getRow()));
        }

        List<Path> deleted = new ArrayList<>();
        if (!Files.isDirectory(tracesDirectory)) {
            return deleted;
        }
        try (DirectoryStream<Path> artifacts = Files.newDirectoryStream(tracesDirectory, ArtifactNames.GLOB)) {
            for (Path artifact : artifacts) {
                if (!keep.contains(artifact.getFileName().toString())) {
                    Files.delete(artifact);
                    deleted.add(artifact);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prune artifacts in " + tracesDirectory, e);
        }
        log.info("Pruned {} artifacts, {} remain", deleted.size(), keep.size());
        return deleted;
    }

    /**
     * Writes {@code feasible_pairs.txt}, {@code infeasible_pairs.txt} and {@code suite.txt}.
     */
    public void writeSummaries(CoverageResult result, List<GeneratedTest> selected) {
        writeString(resultsDirectory.resolve(FEASIBLE_PAIRS_FILE), pairLines(result.getFeasiblePairs()));
        writeString(resultsDirectory.resolve(INFEASIBLE_PAIRS_FILE), pairLines(result.getInfeasiblePairs()));

        StringBuilder suite = new StringBuilder();
        for (GeneratedTest test : selected) {
            suite.append(String.join(",", test.getSteps())).append('\n');
        }
        writeString(resultsDirectory.resolve(SUITE_FILE), suite.toString());
        log.info("Wrote run summaries to {}", resultsDirectory);
    }

    private static String pairLines(Collection<Pair> pairs) {
        StringBuilder sb = new StringBuilder();
        for (Pair pair : pairs) {
            sb.append(pair).append('\n');
        }
        return sb.toString();
    }

    private static void writeString(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
