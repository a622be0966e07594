package cz.cuni.mff.d3s.ctdtlp.model.common.errors;

import lombok.Getter;

/**
 * The oracle answered feasible but its output contains no parsable state.
 */
@Getter
public class MissingWitnessException extends GenerationException {

    private final String rawOutput;

    public MissingWitnessException(String message, String rawOutput) {
        super(message);
        this.rawOutput = rawOutput;
    }
}
