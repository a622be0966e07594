package cz.cuni.mff.d3s.ctdtlp.oracle.common;

import cz.cuni.mff.d3s.ctdtlp.model.common.errors.GenerationException;
import lombok.Getter;

/**
 * The verifier's answer could not be interpreted, or the verifier could not be run at all.
 * The raw output is kept verbatim for the failure report.
 */
@Getter
public class OracleProtocolException extends GenerationException {

    private final String formula;
    private final String rawOutput;

    public OracleProtocolException(String message, String formula, String rawOutput) {
        super(message + " for formula: " + formula);
        this.formula = formula;
        this.rawOutput = rawOutput;
    }

    public OracleProtocolException(String message, String formula, Throwable cause) {
        super(message + " for formula: " + formula, cause);
        this.formula = formula;
        this.rawOutput = "";
    }
}
