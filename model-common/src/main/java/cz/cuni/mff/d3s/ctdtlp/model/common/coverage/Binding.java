package cz.cuni.mff.d3s.ctdtlp.model.common.coverage;

import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * One factor set to one value, e.g. {@code b_max_items=3}.
 */
@Getter
@EqualsAndHashCode
public final class Binding implements Comparable<Binding>, Serializable {
    private static final long serialVersionUID = 1L;

    private static final Comparator<Binding> ORDER = Comparator
            .comparing(Binding::getFactor)
            .thenComparing(Binding::getValue);

    private final String factor;
    private final FactorValue value;

    private Binding(String factor, FactorValue value) {
        this.factor = Objects.requireNonNull(factor, "factor");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Binding of(String factor, FactorValue value) {
        return new Binding(factor, value);
    }

    @Override
    public int compareTo(Binding other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return factor + "=" + value;
    }
}
