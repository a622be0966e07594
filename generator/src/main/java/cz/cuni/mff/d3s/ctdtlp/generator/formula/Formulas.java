package cz.cuni.mff.d3s.ctdtlp.generator.formula;

import cz.cuni.mff.d3s.ctdtlp.model.common.errors.MalformedFormulaException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * String helpers for building LTL formulas.
 */
public final class Formulas {

    public static final String TRUE = "TRUE";

    private Formulas() {}

    /**
     * Joins the parts with {@code &}, each wrapped in parentheses, and wraps the result.
     */
    public static String conjunction(List<String> parts) {
        if (parts.isEmpty()) {
            return TRUE;
        }
        return parts.stream().map(p -> "(" + p + ")").collect(Collectors.joining(" & ", "(", ")"));
    }

    /**
     * @return the formula itself
     * @throws MalformedFormulaException on a stray closing parenthesis or an unclosed opening one
     */
    public static String requireBalanced(String formula) {
        int balance = 0;
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (c == '(') {
                balance++;
            } else if (c == ')') {
                balance--;
                if (balance < 0) {
                    throw new MalformedFormulaException("Too many ')' at position " + i, formula);
                }
            }
        }
        if (balance != 0) {
            throw new MalformedFormulaException("Unbalanced parentheses (balance " + balance + ")", formula);
        }
        return formula;
    }
}
