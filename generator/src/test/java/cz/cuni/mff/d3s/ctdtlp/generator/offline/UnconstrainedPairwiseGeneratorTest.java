package cz.cuni.mff.d3s.ctdtlp.generator.offline;

import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Pair;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.PairUniverse;
import cz.cuni.mff.d3s.ctdtlp.model.common.coverage.Row;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.testutils.TestModels;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.F;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.T;
import static cz.cuni.mff.d3s.ctdtlp.testutils.TestModels.abcRow;
import static org.junit.jupiter.api.Assertions.*;

class UnconstrainedPairwiseGeneratorTest {

    @Test
    void givenAbcModel_whenGenerated_thenEveryPairCoveredWithMinimalRowCount() {
        // given
        FactorModel model = TestModels.abc();

        // when
        List<Row> rows = UnconstrainedPairwiseGenerator.generate(model);

        // then
        Set<Pair> covered = new HashSet<>();
        rows.forEach(row -> covered.addAll(row.pairs()));
        assertEquals(PairUniverse.of(model).getPairs(), covered);
        assertEquals(6, rows.size());
        assertEquals(abcRow(F, 3, F), rows.get(0));
        assertEquals(abcRow(F, 4, T), rows.get(1));
    }

    @Test
    void givenSingleFactor_whenGenerated_thenOneRow() {
        // given
        FactorModel model = FactorModel.builder()
                .stepVariable("step")
                .factor(Factor.bool("A", "a", null))
                .build();

        // when
        List<Row> rows = UnconstrainedPairwiseGenerator.generate(model);

        // then
        assertEquals(1, rows.size());
        assertEquals(F, rows.get(0).get("A").orElseThrow());
    }
}
