package cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv;

import cz.cuni.mff.d3s.ctdtlp.model.common.errors.MalformedFormulaException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NuXmvCommandScriptTest {

    @Test
    void givenFormula_whenRendered_thenScriptChecksItsNegation() {
        Path model = Path.of("/models/shop.smv");

        List<String> lines = NuXmvCommandScript.render(model, " F(end_of_test) ").lines().toList();

        assertEquals(List.of(
                "read_model -i \"" + model.toAbsolutePath().normalize() + "\"",
                "go",
                "check_ltlspec -p \"!( F(end_of_test) )\"",
                "show_traces -v",
                "quit"), lines);
    }

    @Test
    void givenFormulaWithQuote_whenRendered_thenRejectedAsMalformed() {
        assertThrows(MalformedFormulaException.class,
                () -> NuXmvCommandScript.render(Path.of("m.smv"), "step = \"add\""));
    }
}
