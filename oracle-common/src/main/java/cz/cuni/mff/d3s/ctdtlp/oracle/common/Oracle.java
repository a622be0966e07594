package cz.cuni.mff.d3s.ctdtlp.oracle.common;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Decides whether some execution of a model satisfies a temporal formula.
 */
public interface Oracle {

    /**
     * Submits one formula and blocks until the verifier answers or the timeout elapses.
     *
     * @param model   the model file to check against
     * @param formula the formula whose satisfiability is asked (not its negation)
     * @param timeout upper bound for a single query
     * @return the verdict together with the raw verifier output
     * @throws OracleTimeoutException  if no answer arrived within the timeout
     * @throws OracleProtocolException if the output holds no verdict or more than one
     */
    OracleResponse submit(Path model, String formula, Duration timeout);

    /**
     * Human readable name used in logs and reports.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
