package cz.cuni.mff.d3s.ctdtlp.model.common.coverage;

import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorValue;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PairUniverseTest {

    private static final FactorValue F = FactorValue.FALSE;
    private static final FactorValue T = FactorValue.TRUE;

    private static FactorModel abcModel() {
        Map<Long, String> bValues = new LinkedHashMap<>();
        bValues.put(3L, "F(b = 3)");
        bValues.put(4L, "F(b = 4)");
        bValues.put(5L, "F(b = 5)");
        return FactorModel.builder()
                .stepVariable("step")
                .factor(Factor.bool("A", "a", null))
                .factor(Factor.enumerated("B", bValues, null))
                .factor(Factor.bool("C", "c", null))
                .build();
    }

    @Test
    void givenAbcModel_whenUniverseBuilt_thenContainsSixteenPairs() {
        FactorModel model = abcModel();

        PairUniverse universe = PairUniverse.of(model);

        assertEquals(16, universe.size());
        assertEquals(16, PairUniverse.expectedSize(model));
    }

    @Test
    void givenSingleFactor_whenUniverseBuilt_thenEmpty() {
        FactorModel model = FactorModel.builder()
                .stepVariable("step")
                .factor(Factor.bool("A", "a", null))
                .build();

        assertEquals(0, PairUniverse.of(model).size());
    }

    @Test
    void givenPairInEitherOrder_whenCreated_thenEqualAndCanonical() {
        Pair forward = Pair.of("A", F, "C", T);
        Pair backward = Pair.of("C", T, "A", F);

        assertEquals(forward, backward);
        assertEquals("A", backward.getFirst().getFactor());
        assertEquals("(A=false, C=true)", backward.toString());
    }

    @Test
    void givenSameFactorTwice_whenPairCreated_thenRejected() {
        assertThrows(IllegalArgumentException.class, () -> Pair.of("A", F, "A", T));
    }

    @Test
    void givenFullRow_whenPairsListed_thenEveryFactorCombinationAppearsOnce() {
        Row row = Row.of(Map.of("A", F, "B", FactorValue.ofInt(3), "C", T));

        List<Pair> pairs = row.pairs();

        assertEquals(3, pairs.size());
        assertTrue(pairs.contains(Pair.of("A", F, "B", FactorValue.ofInt(3))));
        assertTrue(pairs.contains(Pair.of("A", F, "C", T)));
        assertTrue(pairs.contains(Pair.of("B", FactorValue.ofInt(3), "C", T)));
        assertTrue(PairUniverse.of(abcModel()).getPairs().containsAll(pairs));
    }

    @Test
    void givenRowsBuiltInDifferentOrder_whenKeysCompared_thenEqual() {
        Map<String, FactorValue> first = new LinkedHashMap<>();
        first.put("C", T);
        first.put("A", F);
        first.put("B", FactorValue.ofInt(4));
        Map<String, FactorValue> second = new LinkedHashMap<>();
        second.put("A", F);
        second.put("B", FactorValue.ofInt(4));
        second.put("C", T);

        assertEquals(Row.of(first).key(), Row.of(second).key());
        assertEquals(Row.of(first), Row.of(second));
    }

    @Test
    void givenRowWithValueOutsideDomain_whenCheckedAgainstModel_thenRejected() {
        FactorModel model = abcModel();
        Row bad = Row.of(Map.of("A", F, "B", FactorValue.ofInt(9), "C", T));
        Row partial = Row.of(Map.of("A", F, "C", T));
        Row good = Row.of(Map.of("A", F, "B", FactorValue.ofInt(5), "C", T));

        assertThrows(IllegalArgumentException.class, () -> bad.requireTotalOver(model));
        assertThrows(IllegalArgumentException.class, () -> partial.requireTotalOver(model));
        assertSame(good, good.requireTotalOver(model));
    }

    @Test
    void givenConflictingBindings_whenRowBuilt_thenRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Row.of(List.of(Binding.of("A", F), Binding.of("A", T))));
    }
}
