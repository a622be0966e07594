package cz.cuni.mff.d3s.ctdtlp.oracle.common;

/**
 * Answer to a feasibility query about a formula (not about its negation).
 */
public enum Verdict {
    /** A witness trace satisfying the formula exists. */
    FEASIBLE,
    /** No execution of the model satisfies the formula. */
    INFEASIBLE
}
