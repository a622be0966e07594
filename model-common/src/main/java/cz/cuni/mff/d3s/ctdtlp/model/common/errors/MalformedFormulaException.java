package cz.cuni.mff.d3s.ctdtlp.model.common.errors;

import lombok.Getter;

/**
 * A formula that must not be sent to the model checker, e.g. one with unbalanced parentheses.
 */
@Getter
public class MalformedFormulaException extends GenerationException {

    private final String formula;

    public MalformedFormulaException(String message, String formula) {
        super(message + ": " + formula);
        this.formula = formula;
    }
}
