package cz.cuni.mff.d3s.ctdtlp.model.common.coverage;

import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;

/**
 * An unordered combination of two bindings on two different factors.
 *
 * <p>The bindings are stored in canonical order (by factor name), so
 * {@code Pair.of(a, b)} and {@code Pair.of(b, a)} are equal.
 */
@Getter
@EqualsAndHashCode
public final class Pair implements Comparable<Pair>, Serializable {
    private static final long serialVersionUID = 1L;

    private static final Comparator<Pair> ORDER = Comparator
            .comparing(Pair::getFirst)
            .thenComparing(Pair::getSecond);

    private final Binding first;
    private final Binding second;

    private Pair(Binding first, Binding second) {
        this.first = first;
        this.second = second;
    }

    /**
     * @throws IllegalArgumentException if both bindings refer to the same factor
     */
    public static Pair of(Binding a, Binding b) {
        int order = a.getFactor().compareTo(b.getFactor());
        if (order == 0) {
            throw new IllegalArgumentException("A pair needs two different factors, got " + a + " and " + b);
        }
        return order < 0 ? new Pair(a, b) : new Pair(b, a);
    }

    public static Pair of(String factorA, FactorValue valueA, String factorB, FactorValue valueB) {
        return of(Binding.of(factorA, valueA), Binding.of(factorB, valueB));
    }

    public List<Binding> bindings() {
        return List.of(first, second);
    }

    /**
     * True if the row assigns both bindings of this pair.
     */
    public boolean isSatisfiedBy(Row row) {
        return row.contains(first) && row.contains(second);
    }

    @Override
    public int compareTo(Pair other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
