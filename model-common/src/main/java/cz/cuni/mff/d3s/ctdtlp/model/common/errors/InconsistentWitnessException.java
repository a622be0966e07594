package cz.cuni.mff.d3s.ctdtlp.model.common.errors;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import lombok.Getter;

/**
 * The row read from a pair query's witness does not contain the queried pair.
 * Usually a predicate and its backing variable disagree.
 */
@Getter
public class InconsistentWitnessException extends GenerationException {

    private final Pair pair;
    private final Row row;
    private final String formula;
    private final String rawOutput;

    public InconsistentWitnessException(Pair pair, Row row, String formula, String rawOutput) {
        super("Witness for pair " + pair + " yields row " + row + " which does not contain it. Formula: " + formula);
        this.pair = pair;
        this.row = row;
        this.formula = formula;
        this.rawOutput = rawOutput;
    }
}
