package cz.cuni.mff.d3s.ctdtlp.model.common.coverage;

import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * An assignment of factor values, stored sorted by factor name.
 *
 * <p>A row is total with respect to a factor model when it assigns every factor
 * exactly one value from that factor's domain; see {@link #requireTotalOver(FactorModel)}.
 */
@EqualsAndHashCode
public final class Row implements Serializable {
    private static final long serialVersionUID = 1L;

    private final SortedMap<String, FactorValue> values;

    private Row(SortedMap<String, FactorValue> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static Row of(Map<String, FactorValue> values) {
        return new Row(new TreeMap<>(values));
    }

    public static Row of(List<Binding> bindings) {
        TreeMap<String, FactorValue> values = new TreeMap<>();
        for (Binding binding : bindings) {
            FactorValue previous = values.put(binding.getFactor(), binding.getValue());
            if (previous != null && !previous.equals(binding.getValue())) {
                throw new IllegalArgumentException("Conflicting bindings for factor '" + binding.getFactor()
                        + "': " + previous + " and " + binding.getValue());
            }
        }
        return new Row(values);
    }

    /**
     * Checks that this row assigns every factor of the model a value from its domain
     * and nothing else.
     *
     * @return this row
     * @throws IllegalArgumentException when the row is not a total assignment over the model
     */
    public Row requireTotalOver(FactorModel model) {
        if (values.size() != model.size()) {
            throw new IllegalArgumentException("Row " + this + " does not assign exactly the factors "
                    + model.getFactorNames());
        }
        for (Factor factor : model.getFactors()) {
            FactorValue value = values.get(factor.getName());
            if (value == null || !factor.accepts(value)) {
                throw new IllegalArgumentException("Row " + this + " has no valid value for factor '"
                        + factor.getName() + "'");
            }
        }
        return this;
    }

    public Optional<FactorValue> get(String factor) {
        return Optional.ofNullable(values.get(factor));
    }

    public boolean contains(Binding binding) {
        return binding.getValue().equals(values.get(binding.getFactor()));
    }

    public boolean satisfies(Pair pair) {
        return pair.isSatisfiedBy(this);
    }

    public SortedMap<String, FactorValue> asMap() {
        return values;
    }

    public List<Binding> bindings() {
        List<Binding> bindings = new ArrayList<>(values.size());
        values.forEach((name, value) -> bindings.add(Binding.of(name, value)));
        return bindings;
    }

    /**
     * Every pair of bindings this row contains, in canonical order.
     */
    public List<Pair> pairs() {
        List<Binding> bindings = bindings();
        List<Pair> pairs = new ArrayList<>();
        for (int i = 0; i < bindings.size(); i++) {
            for (int j = i + 1; j < bindings.size(); j++) {
                pairs.add(Pair.of(bindings.get(i), bindings.get(j)));
            }
        }
        return pairs;
    }

    public RowKey key() {
        return new RowKey(bindings());
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
