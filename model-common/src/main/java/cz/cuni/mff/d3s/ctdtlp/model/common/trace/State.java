package cz.cuni.mff.d3s.ctdtlp.model.common.trace;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One committed step of a witness trace: raw variable names mapped to raw textual values.
 *
 * <p>The model checker prints only the variables that changed, so {@link #getValues()}
 * holds the full snapshot (previous state overlaid with this state's assignments),
 * while {@link #getAssignments()} holds only what was printed for this state.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class State implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String label;
    private final Map<String, String> values;
    private final Map<String, String> assignments;

    public State(String label, Map<String, String> values, Map<String, String> assignments) {
        this.label = label;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    /**
     * Snapshot-only convenience constructor; every value counts as printed.
     */
    public State(String label, Map<String, String> values) {
        this(label, values, values);
    }

    public Optional<String> get(String variable) {
        return Optional.ofNullable(values.get(variable));
    }
}
