package com.dmn.model;

import com.dmn.exception.ModelException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HitPolicy.
 */
class HitPolicyTest {

    @ParameterizedTest
    @CsvSource({
            "FIRST, FIRST",
            "f, FIRST",
            "Unique, UNIQUE",
            "P, PRIORITY",
            "A, ANY",
            "RULE ORDER, RULE_ORDER",
            "rule_order, RULE_ORDER",
            "O, OUTPUT_ORDER",
            "C, COLLECT",
            "C+, COLLECT",
            "C#, COLLECT"
    })
    @DisplayName("Should accept long and short forms")
    void shouldParse(String text, HitPolicy expected) {
        assertEquals(expected, HitPolicy.parse(text));
    }

    @Test
    @DisplayName("Blank text defaults to FIRST")
    void blankDefaultsToFirst() {
        assertEquals(HitPolicy.FIRST, HitPolicy.parse(null));
        assertEquals(HitPolicy.FIRST, HitPolicy.parse("  "));
    }

    @Test
    @DisplayName("Unknown text is a model error")
    void unknownIsModelError() {
        ModelException e = assertThrows(ModelException.class, () -> HitPolicy.parse("SOMETIMES"));
        assertEquals("Unknown hit policy: SOMETIMES", e.getMessage());
    }

    @ParameterizedTest
    @CsvSource({
            "C+, SUM",
            "sum, SUM",
            "C#, COUNT",
            "C<, MIN",
            "C>, MAX",
            "C, NONE",
            "COLLECT, NONE"
    })
    @DisplayName("Should read the aggregation from short forms and names")
    void shouldParseAggregation(String text, CollectAggregation expected) {
        assertEquals(expected, HitPolicy.parseAggregation(text));
    }

    @Test
    @DisplayName("Only FIRST, UNIQUE and ANY are single-hit")
    void singleHit() {
        assertTrue(HitPolicy.FIRST.isSingleHit());
        assertTrue(HitPolicy.ANY.isSingleHit());
        assertFalse(HitPolicy.PRIORITY.isSingleHit());
        assertFalse(HitPolicy.COLLECT.isSingleHit());
    }
}
