package cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv;

import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleProtocolException;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.Verdict;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps nuXmv's answer about the negated formula to a verdict about the formula itself.
 *
 * <p>{@code -- specification !(phi) is false} means a counterexample to the negation exists,
 * so phi is feasible; {@code ... is true} means phi is infeasible. Exactly one such line must be present.
 */
public final class VerdictParser {

    private static final Pattern VERDICT_LINE =
            Pattern.compile("^\\s*--\\s*specification\\b.*\\bis\\s+(true|false)\\b", Pattern.CASE_INSENSITIVE);

    private VerdictParser() {}

    public static Verdict parse(String rawOutput, String formula) {
        List<String> verdicts = new ArrayList<>();
        for (String line : rawOutput.split("\\R")) {
            Matcher matcher = VERDICT_LINE.matcher(line);
            if (matcher.find()) {
                verdicts.add(matcher.group(1).toLowerCase(Locale.ROOT));
            }
        }

        if (verdicts.isEmpty()) {
            throw new OracleProtocolException("No verdict line in nuXmv output", formula, rawOutput);
        }
        if (verdicts.size() > 1) {
            throw new OracleProtocolException("Expected exactly one verdict line, found " + verdicts.size(),
                    formula, rawOutput);
        }
        return verdicts.get(0).equals("false") ? Verdict.FEASIBLE : Verdict.INFEASIBLE;
    }
}
