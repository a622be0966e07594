package cz.cuni.mff.d3s.ctdtlp.oracle.common;

import cz.cuni.mff.d3s.ctdtlp.model.common.errors.GenerationException;
import lombok.Getter;

import java.time.Duration;

/**
 * The verifier did not answer within its time bound. This says nothing about feasibility.
 */
@Getter
public class OracleTimeoutException extends GenerationException {

    private final String formula;
    private final Duration timeout;

    public OracleTimeoutException(String formula, Duration timeout) {
        super("Oracle timed out after " + timeout.toSeconds() + " s for formula: " + formula);
        this.formula = formula;
        this.timeout = timeout;
    }
}
