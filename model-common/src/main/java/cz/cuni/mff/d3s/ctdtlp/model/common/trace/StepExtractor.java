package cz.cuni.mff.d3s.ctdtlp.model.common.trace;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the action taken in every state of a witness trace.
 */
public final class StepExtractor {

    private final String stepVariable;
    private final String noopStep;

    public StepExtractor(String stepVariable, String noopStep) {
        this.stepVariable = stepVariable;
        this.noopStep = normalize(noopStep);
    }

    /**
     * Returns the normalized step values of all states, skipping states without the step
     * variable and idle steps.
     */
    public List<String> extract(WitnessTrace trace) {
        List<String> steps = new ArrayList<>();
        for (State state : trace.getStates()) {
            Optional<String> raw = state.get(stepVariable);
            if (raw.isEmpty()) {
                continue;
            }
            String step = normalize(raw.get());
            if (!step.isEmpty() && !step.equals(noopStep)) {
                steps.add(step);
            }
        }
        return steps;
    }

    /**
     * Parses the raw output again and extracts its steps.
     */
    public List<String> extract(String rawOutput) {
        return extract(TraceParser.parse(rawOutput));
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.strip();
        while (value.length() >= 1 && (value.startsWith("\"") || value.startsWith("'"))) {
            value = value.substring(1);
        }
        while (!value.isEmpty() && (value.endsWith("\"") || value.endsWith("'"))) {
            value = value.substring(0, value.length() - 1);
        }
        return value.strip().toLowerCase(Locale.ROOT);
    }
}
