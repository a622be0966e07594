package cz.cuni.mff.d3s.ctdtlp.model.common.trace;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.DomainViolationException;
import cz.cuni.mff.d3s.ctdtlp.model.common.errors.MissingWitnessException;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorKind;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Summarizes a witness trace into a full row of factor values.
 *
 * <p>The summarized state is the last one where the end flag holds, or the last state
 * when the model has no end flag or the flag never holds. Values are never coerced to a
 * nearest or default value; anything outside a factor's domain is a {@link DomainViolationException}.
 */
@RequiredArgsConstructor
public final class RowExtractor {

    private final FactorModel model;

    public Row extract(WitnessTrace trace) {
        State state = selectState(trace);
        Map<String, FactorValue> values = new LinkedHashMap<>();
        for (Factor factor : model.getFactors()) {
            values.put(factor.getName(), readValue(factor, state));
        }
        return Row.of(values);
    }

    State selectState(WitnessTrace trace) {
        if (trace.isEmpty()) {
            throw new MissingWitnessException("Witness trace contains no state", null);
        }
        Optional<String> endFlag = model.getEndFlagVariable();
        if (endFlag.isPresent()) {
            List<State> states = trace.getStates();
            for (int i = states.size() - 1; i >= 0; i--) {
                String flag = states.get(i).getValues().get(endFlag.get());
                if (flag != null && flag.strip().equalsIgnoreCase("TRUE")) {
                    return states.get(i);
                }
            }
        }
        return trace.lastState().orElseThrow();
    }

    private FactorValue readValue(Factor factor, State state) {
        String variable = factor.getBackingVariable();
        String raw = state.getValues().get(variable);
        if (raw == null) {
            throw new DomainViolationException(factor.getName(), variable, null,
                    "variable missing from witness state " + state.getLabel());
        }

        FactorValue value = coerce(factor, variable, raw.strip());
        if (!factor.accepts(value)) {
            throw new DomainViolationException(factor.getName(), variable, raw,
                    "value " + value + " is outside the declared domain " + factor.getDomain());
        }
        return value;
    }

    private static FactorValue coerce(Factor factor, String variable, String raw) {
        if (factor.getKind() == FactorKind.BOOL) {
            if (raw.equalsIgnoreCase("TRUE")) {
                return FactorValue.TRUE;
            }
            if (raw.equalsIgnoreCase("FALSE")) {
                return FactorValue.FALSE;
            }
            throw new DomainViolationException(factor.getName(), variable, raw, "not a boolean value");
        }
        try {
            return FactorValue.ofInt(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            throw new DomainViolationException(factor.getName(), variable, raw, "not an integer value");
        }
    }
}
