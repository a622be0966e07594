package cz.cuni.mff.d3s.ctdtlp.generator.output;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;

import java.util.Locale;
import java.util.StringJoiner;

/**
 * Deterministic artifact names such as {@code run_A0_B3_C1.txt}: factors in name order, each as
 * its upper-cased leading character followed by the value encoding.
 */
public final class ArtifactNames {

    public static final String PREFIX = "run_";
    public static final String SUFFIX = ".txt";
    public static final String GLOB = PREFIX + "*" + SUFFIX;

    private ArtifactNames() {}

    public static String fileNameFor(Row row) {
        StringJoiner parts = new StringJoiner("_", PREFIX, SUFFIX);
        row.asMap().forEach((name, value) ->
                parts.add(name.substring(0, 1).toUpperCase(Locale.ROOT) + value.encode()));
        return parts.toString();
    }

    public static boolean isArtifactName(String fileName) {
        return fileName.startsWith(PREFIX) && fileName.endsWith(SUFFIX);
    }
}
