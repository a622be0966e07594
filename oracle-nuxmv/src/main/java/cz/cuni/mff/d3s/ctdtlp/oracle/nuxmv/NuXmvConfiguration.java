package cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * How to launch the nuXmv binary.
 */
@Getter
@Builder
@ToString
public class NuXmvConfiguration {

    public static final String DEFAULT_BINARY = "nuXmv";

    /** Executable name or path; resolved through PATH when not absolute. */
    @Builder.Default
    private final String binary = DEFAULT_BINARY;

    /** Working directory of the nuXmv process, or null to inherit ours. */
    private final Path workingDirectory;
}
