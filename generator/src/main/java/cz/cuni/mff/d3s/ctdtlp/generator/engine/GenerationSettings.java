package cz.cuni.mff.d3s.ctdtlp.generator.engine;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.nio.file.Path;
import java.time.Duration;

@Getter
@Builder
@ToString
public class GenerationSettings {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Model file handed to the oracle with every query. */
    @NonNull
    private final Path modelPath;

    /** Bound for one oracle query. */
    @Builder.Default
    private final Duration queryTimeout = DEFAULT_TIMEOUT;

    /** How many times a timed out query is repeated before the run aborts. */
    @Builder.Default
    private final int timeoutRetries = 0;
}
