package cz.cuni.mff.d3s.ctdtlp.generator.engine;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Objects;

/**
 * One oracle query proposed by a {@link RowStrategy}: either a full row or a single pair.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Probe {

    public enum Kind {
        ROW,
        PAIR
    }

    private final Kind kind;

    /** The probed row, null for pair probes. */
    private final Row row;

    /** The probed pair, null for row probes. */
    private final Pair pair;

    private final String formula;

    public static Probe row(Row row, String formula) {
        return new Probe(Kind.ROW, Objects.requireNonNull(row, "row"), null, Objects.requireNonNull(formula, "formula"));
    }

    public static Probe pair(Pair pair, String formula) {
        return new Probe(Kind.PAIR, null, Objects.requireNonNull(pair, "pair"), Objects.requireNonNull(formula, "formula"));
    }

    public boolean isRowProbe() {
        return kind == Kind.ROW;
    }
}
