package cz.cuni.mff.d3s.ctdtlp.model.common.factors;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FactorModelTest {

    private static Map<Long, String> values(long... values) {
        Map<Long, String> predicates = new LinkedHashMap<>();
        for (long v : values) {
            predicates.put(v, "F(x = " + v + ")");
        }
        return predicates;
    }

    @Test
    void givenBoolFactor_whenCreated_thenDomainIsFalseThenTrueWithNegatedPredicate() {
        Factor factor = Factor.bool("a_logout", "G(!logout)", "no_logout");

        assertEquals(FactorKind.BOOL, factor.getKind());
        assertEquals(List.of(FactorValue.FALSE, FactorValue.TRUE), factor.getDomain());
        assertEquals("G(!logout)", factor.predicateFor(FactorValue.TRUE));
        assertEquals("!(G(!logout))", factor.predicateFor(FactorValue.FALSE));
        assertEquals("no_logout", factor.getBackingVariable());
    }

    @Test
    void givenEnumFactor_whenCreated_thenDomainKeepsDeclarationOrder() {
        Factor factor = Factor.enumerated("b_items", values(5, 3, 4), null);

        assertEquals(List.of(FactorValue.ofInt(5), FactorValue.ofInt(3), FactorValue.ofInt(4)), factor.getDomain());
        assertEquals(FactorValue.ofInt(5), factor.firstValue());
        assertEquals("b_items", factor.getBackingVariable());
        assertEquals("F(x = 3)", factor.predicateFor(FactorValue.ofInt(3)));
    }

    @Test
    void givenValueOutsideDomain_whenPredicateRequested_thenThrows() {
        Factor factor = Factor.enumerated("b_items", values(3, 4), null);

        assertThrows(IllegalArgumentException.class, () -> factor.predicateFor(FactorValue.ofInt(7)));
        assertThrows(IllegalArgumentException.class, () -> factor.predicateFor(FactorValue.TRUE));
        assertFalse(factor.accepts(FactorValue.ofInt(7)));
    }

    @Test
    void givenInvalidDeclarations_whenCreated_thenRejected() {
        assertThrows(IllegalArgumentException.class, () -> Factor.bool("1abc", "p", null));
        assertThrows(IllegalArgumentException.class, () -> Factor.bool("a", " ", null));
        assertThrows(IllegalArgumentException.class, () -> Factor.enumerated("b", Map.of(), null));
    }

    @Test
    void givenDuplicateFactorNames_whenModelBuilt_thenRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> FactorModel.builder()
                .stepVariable("step")
                .factor(Factor.bool("a", "p", null))
                .factor(Factor.bool("a", "q", null))
                .build());

        assertTrue(e.getMessage().contains("Duplicate"));
    }

    @Test
    void givenNoFactors_whenModelBuilt_thenRejected() {
        assertThrows(IllegalArgumentException.class, () -> FactorModel.builder().stepVariable("step").build());
    }

    @Test
    void givenOptionalFieldsOmitted_whenModelBuilt_thenDefaultsApply() {
        FactorModel model = FactorModel.builder()
                .stepVariable("step")
                .factor(Factor.bool("a", "p", null))
                .build();

        assertEquals(FactorModel.DEFAULT_TEST_RULE, model.getTestRule());
        assertEquals(FactorModel.DEFAULT_NOOP_STEP, model.getNoopStep());
        assertTrue(model.getEndFlagVariable().isEmpty());
        assertEquals(List.of("a"), model.getFactorNames());
    }

    @Test
    void givenUpperCaseNoopStepUnderTurkishLocale_whenModelBuilt_thenLowerCasedLocaleIndependently() {
        // given
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            // when
            FactorModel model = FactorModel.builder()
                    .stepVariable("step")
                    .noopStep(" IDLE ")
                    .factor(Factor.bool("a", "p", null))
                    .build();

            // then
            assertEquals("idle", model.getNoopStep());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void givenUnknownFactor_whenLookedUp_thenThrows() {
        FactorModel model = FactorModel.builder()
                .stepVariable("step")
                .endFlag("end_of_test")
                .factor(Factor.bool("a", "p", null))
                .build();

        assertEquals("end_of_test", model.getEndFlagVariable().orElseThrow());
        assertTrue(model.hasFactor("a"));
        assertThrows(IllegalArgumentException.class, () -> model.getFactor("z"));
    }

    @Test
    void givenMixedValues_whenCompared_thenBooleansOrderBeforeIntegers() {
        assertTrue(FactorValue.FALSE.compareTo(FactorValue.TRUE) < 0);
        assertTrue(FactorValue.TRUE.compareTo(FactorValue.ofInt(0)) < 0);
        assertTrue(FactorValue.ofInt(3).compareTo(FactorValue.ofInt(4)) < 0);
        assertNotEquals(FactorValue.TRUE, FactorValue.ofInt(1));
        assertEquals("1", FactorValue.TRUE.encode());
        assertEquals("TRUE", FactorValue.TRUE.render());
    }
}
