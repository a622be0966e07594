package cz.cuni.mff.d3s.ctdtlp.model.common.factors;

/**
 * Kind of a testing factor.
 */
public enum FactorKind {
    /** Domain is exactly {false, true}; the value predicates are a formula and its negation. */
    BOOL,
    /** Domain is an explicit list of integer values, each with its own predicate. */
    ENUM
}
