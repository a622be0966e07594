package cz.cuni.mff.d3s.ctdtlp.model.common.trace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented state machine that turns raw model checker output into a {@link WitnessTrace}.
 *
 * <p>Recognized lines:
 * <ul>
 *   <li>{@code -> State: 1.2 <-} starts a new state and commits the pending one,</li>
 *   <li>{@code -> Input: 1.2 <-} suspends assignment collection until the next state,</li>
 *   <li>{@code name = value} adds an assignment to the pending state,</li>
 *   <li>a {@code <!-- ################### Trace number: N ...} marker ends parsing once a state was seen.</li>
 * </ul>
 * Anything else is ignored. Parsing is pure and never throws on unexpected text.
 */
public final class TraceParser {

    public static final String TRACE_BOUNDARY_MARKER = "<!-- ################### Trace number:";

    private static final Pattern STATE_LINE = Pattern.compile("^\\s*->\\s*State:\\s*(\\S+)\\s*<-\\s*$");
    private static final Pattern INPUT_LINE = Pattern.compile("^\\s*->\\s*Input:\\s*(\\S+)\\s*<-\\s*$");
    private static final Pattern ASSIGNMENT_LINE =
            Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_.\\[\\]$#-]*)\\s*=\\s*(.+?)\\s*$");

    private TraceParser() {}

    public static WitnessTrace parse(String rawOutput) {
        if (rawOutput == null || rawOutput.isEmpty()) {
            return WitnessTrace.empty();
        }

        List<State> committed = new ArrayList<>();
        Map<String, String> snapshot = new LinkedHashMap<>();
        Map<String, String> pending = null;
        String pendingLabel = null;
        boolean collecting = false;

        for (String line : rawOutput.split("\\R")) {
            if (line.contains(TRACE_BOUNDARY_MARKER)) {
                if (pending != null || !committed.isEmpty()) {
                    break;
                }
                continue;
            }

            Matcher state = STATE_LINE.matcher(line);
            if (state.matches()) {
                if (pending != null) {
                    committed.add(commit(pendingLabel, snapshot, pending));
                }
                pendingLabel = state.group(1);
                pending = new LinkedHashMap<>();
                collecting = true;
                continue;
            }

            if (INPUT_LINE.matcher(line).matches()) {
                collecting = false;
                continue;
            }

            if (collecting) {
                Matcher assignment = ASSIGNMENT_LINE.matcher(line);
                if (assignment.matches()) {
                    pending.put(assignment.group(1), assignment.group(2));
                }
            }
        }

        if (pending != null) {
            committed.add(commit(pendingLabel, snapshot, pending));
        }
        return new WitnessTrace(committed);
    }

    private static State commit(String label, Map<String, String> snapshot, Map<String, String> assignments) {
        snapshot.putAll(assignments);
        return new State(label, snapshot, assignments);
    }
}
