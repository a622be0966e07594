package cz.cuni.mff.d3s.ctdtlp.model.common.trace;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Ordered sequence of committed states of the first counterexample printed by the model checker.
 *
 * <p>Instances are produced by {@link TraceParser} and never modified afterwards.
 */
public final class WitnessTrace implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final WitnessTrace EMPTY = new WitnessTrace(List.of());

    private final List<State> states;

    public WitnessTrace(List<State> states) {
        this.states = List.copyOf(states);
    }

    public static WitnessTrace empty() {
        return EMPTY;
    }

    public List<State> getStates() {
        return states;
    }

    public Optional<State> lastState() {
        return states.isEmpty() ? Optional.empty() : Optional.of(states.get(states.size() - 1));
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public int size() {
        return states.size();
    }

    /**
     * Renders the trace in the model checker's own layout, keeping only state headers
     * and the assignments printed for each state.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (State state : states) {
            sb.append("-> State: ").append(state.getLabel()).append(" <-\n");
            state.getAssignments().forEach((name, value) ->
                    sb.append("  ").append(name).append(" = ").append(value).append('\n'));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "WitnessTrace[states=" + states.size() + "]";
    }
}
