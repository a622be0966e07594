package cz.cuni.mff.d3s.ctdtlp.model.common.errors;

import lombok.Getter;

/**
 * A witness state reports a value that the factor's domain does not declare,
 * or does not report the factor's backing variable at all.
 */
@Getter
public class DomainViolationException extends GenerationException {

    private final String factor;
    private final String variable;
    private final String rawValue;

    /** Formula whose witness was read, null until attached with {@link #inWitnessOf(String, String)}. */
    private final String formula;
    private final String rawOutput;

    public DomainViolationException(String factor, String variable, String rawValue, String reason) {
        super("Factor '" + factor + "' (variable '" + variable + "'): " + reason
                + (rawValue == null ? "" : " [raw value: " + rawValue + "]"));
        this.factor = factor;
        this.variable = variable;
        this.rawValue = rawValue;
        this.formula = null;
        this.rawOutput = null;
    }

    private DomainViolationException(DomainViolationException violation, String formula, String rawOutput) {
        super(violation.getMessage() + ". Formula: " + formula, violation);
        this.factor = violation.factor;
        this.variable = violation.variable;
        this.rawValue = violation.rawValue;
        this.formula = formula;
        this.rawOutput = rawOutput;
    }

    /**
     * Returns the same violation annotated with the query whose witness it was read from.
     */
    public DomainViolationException inWitnessOf(String formula, String rawOutput) {
        return new DomainViolationException(this, formula, rawOutput);
    }
}
