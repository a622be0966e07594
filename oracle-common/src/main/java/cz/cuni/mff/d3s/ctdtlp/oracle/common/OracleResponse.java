package cz.cuni.mff.d3s.ctdtlp.oracle.common;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Result of one oracle query. For feasible formulas {@link #getRawOutput()} carries the witness text.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString(exclude = "rawOutput")
public class OracleResponse {

    @NonNull
    private final Verdict verdict;

    /** The formula that was decided. */
    @NonNull
    private final String formula;

    /** Everything the verifier printed on stdout and stderr. */
    @Builder.Default
    private final String rawOutput = "";

    public boolean isFeasible() {
        return verdict == Verdict.FEASIBLE;
    }

    public static OracleResponse feasible(String formula, String rawOutput) {
        return OracleResponse.builder().verdict(Verdict.FEASIBLE).formula(formula).rawOutput(rawOutput).build();
    }

    public static OracleResponse infeasible(String formula, String rawOutput) {
        return OracleResponse.builder().verdict(Verdict.INFEASIBLE).formula(formula).rawOutput(rawOutput).build();
    }
}
