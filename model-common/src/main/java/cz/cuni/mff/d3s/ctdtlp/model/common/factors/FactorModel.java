package cz.cuni.mff.d3s.ctdtlp.model.common.factors;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized description of all testing dimensions of one generation run,
 * together with the model bindings needed to query and read witness traces.
 *
 * <p>Built once from the settings document and immutable afterwards.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FactorModel {

    public static final String DEFAULT_TEST_RULE = "TRUE";
    public static final String DEFAULT_NOOP_STEP = "none";

    /** Factors in declaration order. */
    private final List<Factor> factors;

    /** Model variable holding the action taken in each step. */
    private final String stepVariable;

    /** Model variable flagging the end of a test, or null when the model has none. */
    private final String endFlag;

    /** Global applicability rule conjoined to every formula. */
    private final String testRule;

    /** Step value that marks an idle step and is dropped from extracted step lists. */
    private final String noopStep;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final Map<String, Factor> factorsByName;

    @Builder
    private FactorModel(@Singular List<Factor> factors, String stepVariable, String endFlag,
                        String testRule, String noopStep) {
        if (factors == null || factors.isEmpty()) {
            throw new IllegalArgumentException("At least one factor must be declared");
        }
        if (!Factor.isIdentifier(stepVariable)) {
            throw new IllegalArgumentException("Invalid step variable '" + stepVariable
                    + "'. Use [A-Za-z_][A-Za-z0-9_]*");
        }
        if (endFlag != null && !endFlag.isBlank() && !Factor.isIdentifier(endFlag.strip())) {
            throw new IllegalArgumentException("Invalid end flag '" + endFlag + "'. Use [A-Za-z_][A-Za-z0-9_]*");
        }

        Map<String, Factor> byName = new LinkedHashMap<>();
        Set<String> duplicates = new HashSet<>();
        for (Factor factor : factors) {
            if (byName.put(factor.getName(), factor) != null) {
                duplicates.add(factor.getName());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Duplicate factor names: " + duplicates);
        }

        this.factors = List.copyOf(factors);
        this.factorsByName = Collections.unmodifiableMap(byName);
        this.stepVariable = stepVariable;
        this.endFlag = endFlag == null || endFlag.isBlank() ? null : endFlag.strip();
        this.testRule = testRule == null || testRule.isBlank() ? DEFAULT_TEST_RULE : testRule.strip();
        this.noopStep = noopStep == null || noopStep.isBlank() ? DEFAULT_NOOP_STEP : noopStep.strip().toLowerCase(Locale.ROOT);
    }

    public Optional<String> getEndFlagVariable() {
        return Optional.ofNullable(endFlag);
    }

    /**
     * @throws IllegalArgumentException if no factor has the given name
     */
    public Factor getFactor(String name) {
        Factor factor = factorsByName.get(name);
        if (factor == null) {
            throw new IllegalArgumentException("Unknown factor: " + name);
        }
        return factor;
    }

    public boolean hasFactor(String name) {
        return factorsByName.containsKey(name);
    }

    public List<String> getFactorNames() {
        return List.copyOf(factorsByName.keySet());
    }

    public int size() {
        return factors.size();
    }
}
