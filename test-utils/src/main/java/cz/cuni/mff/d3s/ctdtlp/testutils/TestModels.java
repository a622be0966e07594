package cz.cuni.mff.d3s.ctdtlp.testutils;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factor models shared by tests.
 */
public final class TestModels {

    public static final FactorValue F = FactorValue.FALSE;
    public static final FactorValue T = FactorValue.TRUE;

    private TestModels() {}

    /**
     * A in {false, true}, B in {3, 4, 5}, C in {false, true}; 16 pairs. Predicates read the
     * lower-case backing variables {@code a}, {@code b} and {@code c}.
     */
    public static FactorModel abc() {
        return abc(null);
    }

    public static FactorModel abc(String endFlag) {
        return FactorModel.builder()
                .stepVariable("step")
                .endFlag(endFlag)
                .factor(Factor.bool("A", "a", "a"))
                .factor(Factor.enumerated("B", enumValues("b", 3, 4, 5), "b"))
                .factor(Factor.bool("C", "c", "c"))
                .build();
    }

    /**
     * Enum value predicates of the form {@code F(variable = value)}, in the given order.
     */
    public static Map<Long, String> enumValues(String variable, long... values) {
        Map<Long, String> predicates = new LinkedHashMap<>();
        for (long value : values) {
            predicates.put(value, "F(" + variable + " = " + value + ")");
        }
        return predicates;
    }

    public static FactorValue i(long value) {
        return FactorValue.ofInt(value);
    }

    public static Row abcRow(FactorValue a, long b, FactorValue c) {
        Map<String, FactorValue> values = new LinkedHashMap<>();
        values.put("A", a);
        values.put("B", FactorValue.ofInt(b));
        values.put("C", c);
        return Row.of(values);
    }

    public static Pair pair(String factorA, FactorValue valueA, String factorB, FactorValue valueB) {
        return Pair.of(factorA, valueA, factorB, valueB);
    }
}
