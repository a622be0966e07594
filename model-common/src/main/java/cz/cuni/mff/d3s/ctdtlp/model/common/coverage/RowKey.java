package cz.cuni.mff.d3s.ctdtlp.model.common.coverage;

import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical identifier of a full assignment: its bindings sorted by factor name.
 * Two rows with the same assignments have equal keys regardless of insertion order.
 */
@EqualsAndHashCode
public final class RowKey implements Serializable {
    private static final long serialVersionUID = 1L;

    private final List<Binding> bindings;

    RowKey(List<Binding> sortedBindings) {
        this.bindings = List.copyOf(sortedBindings);
    }

    public List<Binding> getBindings() {
        return bindings;
    }

    @Override
    public String toString() {
        return bindings.stream().map(Binding::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
