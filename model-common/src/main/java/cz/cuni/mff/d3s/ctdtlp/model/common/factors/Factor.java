package cz.cuni.mff.d3s.ctdtlp.model.common.factors;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A testing dimension: a named factor with an ordered domain of values and one
 * temporal-logic predicate per value.
 *
 * <p>Instances are immutable. Use {@link #bool(String, String, String)} or
 * {@link #enumerated(String, Map, String)} to create them; both validate the declaration.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Factor implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final FactorKind kind;

    /** Domain values in declaration order; the first one is the default-fill value. */
    private final List<FactorValue> domain;

    @ToString.Exclude
    private final Map<FactorValue, String> predicates;

    /** Model variable whose value reflects this factor in a witness state. */
    private final String backingVariable;

    private Factor(String name, FactorKind kind, Map<FactorValue, String> predicates, String backingVariable) {
        this.name = name;
        this.kind = kind;
        this.predicates = Collections.unmodifiableMap(new LinkedHashMap<>(predicates));
        this.domain = Collections.unmodifiableList(new ArrayList<>(predicates.keySet()));
        this.backingVariable = backingVariable;
    }

    /**
     * Creates a boolean factor. The {@code true} value maps to {@code predicate},
     * the {@code false} value to its negation.
     *
     * @param backingVariable model variable name, or null to use the factor name
     */
    public static Factor bool(String name, String predicate, String backingVariable) {
        requireIdentifier(name, "factor name");
        requirePredicate(name, predicate);
        Map<FactorValue, String> predicates = new LinkedHashMap<>();
        predicates.put(FactorValue.FALSE, "!(" + predicate.strip() + ")");
        predicates.put(FactorValue.TRUE, predicate.strip());
        return new Factor(name, FactorKind.BOOL, predicates, resolveBackingVariable(name, backingVariable));
    }

    /**
     * Creates an enumerated factor from its declared values, in declaration order.
     *
     * @param backingVariable model variable name, or null to use the factor name
     */
    public static Factor enumerated(String name, Map<Long, String> valuePredicates, String backingVariable) {
        requireIdentifier(name, "factor name");
        if (valuePredicates == null || valuePredicates.isEmpty()) {
            throw new IllegalArgumentException("Enum factor '" + name + "' must declare at least one value");
        }
        Map<FactorValue, String> predicates = new LinkedHashMap<>();
        for (var entry : valuePredicates.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Enum factor '" + name + "' declares a null value");
            }
            requirePredicate(name, entry.getValue());
            predicates.put(FactorValue.ofInt(entry.getKey()), entry.getValue().strip());
        }
        return new Factor(name, FactorKind.ENUM, predicates, resolveBackingVariable(name, backingVariable));
    }

    /**
     * Returns the declared predicate for one domain value.
     *
     * @throws IllegalArgumentException if the value is not part of the domain
     */
    public String predicateFor(FactorValue value) {
        String predicate = predicates.get(value);
        if (predicate == null) {
            throw new IllegalArgumentException("Value " + value + " is not in the domain of factor '" + name
                    + "': " + domain);
        }
        return predicate;
    }

    public boolean accepts(FactorValue value) {
        return predicates.containsKey(value);
    }

    public FactorValue firstValue() {
        return domain.get(0);
    }

    static boolean isIdentifier(String candidate) {
        return candidate != null && NAME_PATTERN.matcher(candidate).matches();
    }

    private static void requireIdentifier(String candidate, String label) {
        if (!isIdentifier(candidate)) {
            throw new IllegalArgumentException("Invalid " + label + " '" + candidate
                    + "'. Use [A-Za-z_][A-Za-z0-9_]*");
        }
    }

    private static void requirePredicate(String factorName, String predicate) {
        if (predicate == null || predicate.isBlank()) {
            throw new IllegalArgumentException("Factor '" + factorName + "' has an empty predicate");
        }
    }

    private static String resolveBackingVariable(String name, String backingVariable) {
        if (backingVariable == null || backingVariable.isBlank()) {
            return name;
        }
        return backingVariable.strip();
    }
}
