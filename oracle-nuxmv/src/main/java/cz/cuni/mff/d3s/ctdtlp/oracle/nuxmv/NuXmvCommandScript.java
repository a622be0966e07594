package cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv;

import cz.cuni.mff.d3s.ctdtlp.model.common.errors.MalformedFormulaException;

import java.nio.file.Path;

/**
 * Renders the command script nuXmv runs for one query.
 *
 * <p>The script loads and builds the model, checks the negation of the formula and prints the
 * counterexample verbosely:
 * <pre>
 * read_model -i "model.smv"
 * go
 * check_ltlspec -p "!( phi )"
 * show_traces -v
 * quit
 * </pre>
 */
public final class NuXmvCommandScript {

    private NuXmvCommandScript() {}

    public static String render(Path model, String formula) {
        if (formula.indexOf('"') >= 0) {
            throw new MalformedFormulaException("Formula contains a double quote and cannot be embedded in a nuXmv script",
                    formula);
        }
        String modelPath = model.toAbsolutePath().normalize().toString();
        if (modelPath.indexOf('"') >= 0) {
            throw new IllegalArgumentException("Model path contains a double quote: " + modelPath);
        }
        return "read_model -i \"" + modelPath + "\"\n"
                + "go\n"
                + "check_ltlspec -p \"" + negate(formula) + "\"\n"
                + "show_traces -v\n"
                + "quit\n";
    }

    static String negate(String formula) {
        return "!( " + formula.strip() + " )";
    }
}
