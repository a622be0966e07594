package cz.cuni.mff.d3s.ctdtlp.generator.engine;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.PairUniverse;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.RowKey;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Coverage bookkeeping of one run.
 *
 * <p>Only the {@link CoverageEngine} mutates it; strategies see the read-only views.
 * {@code todo} never intersects {@code infeasiblePairs} or {@code feasiblePairs}.
 */
public final class CoverageState {

    private final NavigableSet<Pair> todo;
    private final NavigableSet<Pair> infeasiblePairs = new TreeSet<>();
    private final NavigableSet<Pair> feasiblePairs = new TreeSet<>();
    private final Set<RowKey> infeasibleRowKeys = new LinkedHashSet<>();
    private final Set<RowKey> seenRowKeys = new LinkedHashSet<>();

    public CoverageState(PairUniverse universe) {
        this.todo = new TreeSet<>(universe.getPairs());
    }

    public NavigableSet<Pair> getTodo() {
        return Collections.unmodifiableNavigableSet(todo);
    }

    public NavigableSet<Pair> getInfeasiblePairs() {
        return Collections.unmodifiableNavigableSet(infeasiblePairs);
    }

    public NavigableSet<Pair> getFeasiblePairs() {
        return Collections.unmodifiableNavigableSet(feasiblePairs);
    }

    public Set<RowKey> getInfeasibleRowKeys() {
        return Collections.unmodifiableSet(infeasibleRowKeys);
    }

    public boolean isExhausted() {
        return todo.isEmpty();
    }

    public boolean isPending(Pair pair) {
        return todo.contains(pair);
    }

    public boolean isInfeasible(Pair pair) {
        return infeasiblePairs.contains(pair);
    }

    public boolean isInfeasibleRow(Row row) {
        return infeasibleRowKeys.contains(row.key());
    }

    /**
     * Pairs of the row already proven infeasible; a feasible row must have none.
     */
    public Set<Pair> infeasiblePairsOf(Row row) {
        return row.pairs().stream().filter(infeasiblePairs::contains).collect(Collectors.toCollection(TreeSet::new));
    }

    public List<Pair> pendingPairsOf(Row row) {
        return row.pairs().stream().filter(todo::contains).collect(Collectors.toList());
    }

    /**
     * Moves every pending pair of a feasible row to the feasible set.
     *
     * @return number of pairs retired
     */
    int retire(Row row) {
        int retired = 0;
        for (Pair pair : row.pairs()) {
            if (todo.remove(pair)) {
                feasiblePairs.add(pair);
                retired++;
            }
        }
        return retired;
    }

    boolean markInfeasible(Pair pair) {
        if (feasiblePairs.contains(pair)) {
            throw new IllegalStateException("Pair " + pair + " was already proven feasible");
        }
        todo.remove(pair);
        return infeasiblePairs.add(pair);
    }

    boolean recordInfeasibleRow(RowKey key) {
        return infeasibleRowKeys.add(key);
    }

    boolean markSeen(RowKey key) {
        return seenRowKeys.add(key);
    }

    /**
     * Cheap fingerprint of progress: changes whenever a pair leaves {@code todo} or a new
     * infeasible row is recorded.
     */
    long progressMarker() {
        return ((long) infeasibleRowKeys.size() << 32) - todo.size();
    }
}
