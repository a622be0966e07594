package cz.cuni.mff.d3s.ctdtlp.generator.formula;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Binding;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorKind;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns values, pairs, full rows and partial assignments into LTL formulas for the oracle.
 *
 * <p>All operations are pure. Every returned formula has balanced parentheses; anything else
 * fails with {@link cz.cuni.mff.d3s.ctdtlp.model.common.errors.MalformedFormulaException}
 * before it can reach the model checker.
 */
public class FormulaBuilder {

    /** Placeholder in the test rule that stands for the configured end flag variable. */
    public static final String END_FLAG_PLACEHOLDER = "end_flag";

    private static final Pattern END_FLAG_TOKEN = Pattern.compile("\\b" + END_FLAG_PLACEHOLDER + "\\b");

    @Getter
    private final FactorModel model;

    /** The test rule with the end flag placeholder resolved. */
    @Getter
    private final String testRule;

    public FormulaBuilder(FactorModel model) {
        this.model = model;
        this.testRule = resolveTestRule(model);
    }

    private static String resolveTestRule(FactorModel model) {
        String rule = model.getTestRule();
        Optional<String> endFlag = model.getEndFlagVariable();
        if (endFlag.isPresent()) {
            rule = END_FLAG_TOKEN.matcher(rule).replaceAll(Matcher.quoteReplacement(endFlag.get()));
        }
        return rule;
    }

    public String formulaForValue(Factor factor, FactorValue value) {
        return factor.predicateFor(value);
    }

    public String formulaForValue(Binding binding) {
        return formulaForValue(model.getFactor(binding.getFactor()), binding.getValue());
    }

    /**
     * {@code ((rule) & (p_a) & (p_b) & (F (end)))}; the last conjunct only when an end flag is declared.
     *
     * <p>Value predicates are properties of the whole trace (e.g. {@code F(b = 3)}), so they are
     * conjoined at the top level, where they hold on the same witness as the end flag. Moving them
     * inside {@code F (end & ...)} would evaluate them from the end state onwards only.
     */
    public String formulaForPair(Pair pair) {
        List<String> parts = new ArrayList<>();
        parts.add(testRule);
        parts.add(formulaForValue(pair.getFirst()));
        parts.add(formulaForValue(pair.getSecond()));
        model.getEndFlagVariable().ifPresent(end -> parts.add("F (" + end + ")"));
        return Formulas.requireBalanced(Formulas.conjunction(parts));
    }

    /**
     * {@code ((rule) & (domain guard) & (p_1) & ... & (p_n))} over every factor of the row.
     */
    public String formulaForRow(Row row) {
        return build(row.bindings(), model.getFactors(), false);
    }

    /**
     * Like {@link #formulaForRow(Row)} restricted to the given bindings; the domain guard covers
     * only their factors, and when an end flag is declared the end must be reachable.
     */
    public String formulaForPartialAssignment(Collection<Binding> bindings) {
        Set<Factor> factors = new LinkedHashSet<>();
        for (Binding binding : bindings) {
            factors.add(model.getFactor(binding.getFactor()));
        }
        return build(bindings, factors, true);
    }

    /**
     * Restricts every enum factor's backing variable to its declared values, in every state where
     * the end flag holds, or in every state when the model has no end flag.
     */
    public String domainGuard(Collection<Factor> factors) {
        List<String> guards = new ArrayList<>();
        for (Factor factor : factors) {
            if (factor.getKind() != FactorKind.ENUM) {
                continue;
            }
            List<String> alternatives = new ArrayList<>();
            for (FactorValue value : factor.getDomain()) {
                alternatives.add(factor.getBackingVariable() + " = " + value.render());
            }
            String inDomain = String.join(" | ", alternatives);
            guards.add(model.getEndFlagVariable()
                    .map(end -> "G (" + end + " -> (" + inDomain + "))")
                    .orElse("G (" + inDomain + ")"));
        }
        if (guards.isEmpty()) {
            return Formulas.TRUE;
        }
        return guards.size() == 1 ? guards.get(0) : Formulas.conjunction(guards);
    }

    /**
     * Per-value formulas of every factor, in declaration order, for offline inspection.
     */
    public Map<String, Map<FactorValue, String>> valueFormulas() {
        Map<String, Map<FactorValue, String>> formulas = new LinkedHashMap<>();
        for (Factor factor : model.getFactors()) {
            formulas.put(factor.getName(), factor.getPredicates());
        }
        return formulas;
    }

    private String build(Collection<Binding> bindings, Collection<Factor> guardedFactors, boolean requireEnd) {
        List<String> parts = new ArrayList<>();
        parts.add(testRule);
        parts.add(domainGuard(guardedFactors));
        for (Binding binding : bindings) {
            parts.add(formulaForValue(binding));
        }
        if (requireEnd) {
            model.getEndFlagVariable().ifPresent(end -> parts.add("F (" + end + ")"));
        }
        return Formulas.requireBalanced(Formulas.conjunction(parts));
    }
}
