package cz.cuni.mff.d3s.ctdtlp.model.common.errors;

/**
 * Base of every fatal condition that aborts a generation run.
 * None of the subclasses is recovered locally.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Verbatim oracle output behind this failure, or null when no oracle answer is involved.
     */
    public String getRawOutput() {
        return null;
    }
}
