package cz.cuni.mff.d3s.ctdtlp.generator.output;

import cz.cuni.mff.d3s.ctdtlp.model.common.tests.GeneratedTest;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Content written into each test artifact.
 */
public enum ArtifactFormat {
    /** Numbered list of the test's steps, one per line. */
    STEPS("steps"),
    /** The witness trace, reduced to state headers and printed assignments. */
    TRACE("trace");

    private final String id;

    ArtifactFormat(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public String render(GeneratedTest test) {
        if (this == TRACE) {
            return test.getTrace().render();
        }
        StringBuilder sb = new StringBuilder();
        List<String> steps = test.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            sb.append(i + 1).append(". ").append(steps.get(i)).append('\n');
        }
        return sb.toString();
    }

    /**
     * @throws IllegalArgumentException for an unknown id
     */
    public static ArtifactFormat fromId(String id) {
        String normalized = id == null ? "" : id.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(format -> format.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown artifact format '" + id + "'. Available: "
                        + Arrays.stream(values()).map(ArtifactFormat::getId).collect(Collectors.joining(", "))));
    }
}
