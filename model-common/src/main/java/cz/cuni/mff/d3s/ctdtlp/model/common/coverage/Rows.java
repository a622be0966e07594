package cz.cuni.mff.d3s.ctdtlp.model.common.coverage;

import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Rows {

    private Rows() {}

    /**
     * Every full row of the model, varying the last declared factor fastest.
     */
    public static List<Row> cartesianProduct(FactorModel model) {
        List<Map<String, FactorValue>> partial = new ArrayList<>();
        partial.add(new LinkedHashMap<>());
        for (Factor factor : model.getFactors()) {
            List<Map<String, FactorValue>> extended = new ArrayList<>(partial.size() * factor.getDomain().size());
            for (Map<String, FactorValue> prefix : partial) {
                for (FactorValue value : factor.getDomain()) {
                    Map<String, FactorValue> next = new LinkedHashMap<>(prefix);
                    next.put(factor.getName(), value);
                    extended.add(next);
                }
            }
            partial = extended;
        }
        List<Row> rows = new ArrayList<>(partial.size());
        for (Map<String, FactorValue> values : partial) {
            rows.add(Row.of(values));
        }
        return rows;
    }

    /**
     * Row pinning the given bindings and setting every other factor to its first domain value.
     */
    public static Row defaultFilled(FactorModel model, List<Binding> pinned) {
        Map<String, FactorValue> values = new LinkedHashMap<>();
        for (Factor factor : model.getFactors()) {
            values.put(factor.getName(), factor.firstValue());
        }
        for (Binding binding : pinned) {
            if (!model.getFactor(binding.getFactor()).accepts(binding.getValue())) {
                throw new IllegalArgumentException("Binding " + binding + " is outside the factor's domain");
            }
            values.put(binding.getFactor(), binding.getValue());
        }
        return Row.of(values);
    }
}
