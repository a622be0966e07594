package cz.cuni.mff.d3s.ctdtlp.testutils;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StateFormulaEvaluatorTest {

    private static final Map<String, String> STATE = Map.of(
            "logged_in", "TRUE",
            "end_of_test", "TRUE",
            "max_items", "4",
            "step", "checkout");

    @Test
    void givenAtomsAndComparisons_whenEvaluated_thenUseStateValues() {
        assertTrue(StateFormulaEvaluator.holds("logged_in", STATE));
        assertTrue(StateFormulaEvaluator.holds("max_items = 4", STATE));
        assertFalse(StateFormulaEvaluator.holds("max_items = 3", STATE));
        assertTrue(StateFormulaEvaluator.holds("step = checkout", STATE));
        assertTrue(StateFormulaEvaluator.holds("max_items != 3", STATE));
    }

    @Test
    void givenTemporalOperators_whenEvaluated_thenActAsIdentityOnSingleState() {
        assertTrue(StateFormulaEvaluator.holds("F(max_items = 4) & G(logged_in)", STATE));
        assertFalse(StateFormulaEvaluator.holds("!(G(logged_in))", STATE));
        assertTrue(StateFormulaEvaluator.holds("X X F end_of_test", STATE));
    }

    @Test
    void givenConnectives_whenEvaluated_thenStandardPrecedence() {
        assertTrue(StateFormulaEvaluator.holds("FALSE | TRUE & logged_in", STATE));
        assertTrue(StateFormulaEvaluator.holds("G(end_of_test -> (max_items = 3 | max_items = 4))", STATE));
        assertFalse(StateFormulaEvaluator.holds("end_of_test -> max_items = 5", STATE));
        assertTrue(StateFormulaEvaluator.holds("(TRUE) & (F (end_of_test & (logged_in) & (max_items = 4)))", STATE));
        assertTrue(StateFormulaEvaluator.holds("logged_in <-> end_of_test", STATE));
    }

    @Test
    void givenUnbalancedFormula_whenEvaluated_thenRejected() {
        assertThrows(IllegalArgumentException.class, () -> StateFormulaEvaluator.holds("(a & b", STATE));
        assertThrows(IllegalArgumentException.class, () -> StateFormulaEvaluator.holds("a b", STATE));
    }
}
