package com.dmn.table;

import com.dmn.feel.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UnaryTestMatcher.
 */
class UnaryTestMatcherTest {

    @ParameterizedTest(name = "''{0}'' against {1} is {2}")
    @CsvSource(value = {
            "-|anything|true",
            "< 18|17|true",
            "< 18|18|false",
            "<= 18|18|true",
            "> 10|10.5|true",
            ">= 5|4|false",
            "== 5|5.0|true",
            "[1..10]|10|true",
            "[1..10)|10|false",
            "(1..10]|1|false",
            "(1..10]|1.5|true",
            "\"a\", \"b\"|b|true",
            "\"a\", \"b\"|c|false",
            "not(\"a\", \"b\")|c|true",
            "not(\"a\")|a|false",
            "true|true|true",
            "42|42.0|true",
            "\"Gold\"|Gold|true",
            "Gold|Silver|false",
            "< \"m\"|apple|true"
    }, delimiter = '|')
    @DisplayName("Should evaluate numeric, string and boolean tests")
    void shouldMatch(String test, String candidate, boolean expected) {
        assertEquals(expected, UnaryTestMatcher.matches(test, candidate));
    }

    @ParameterizedTest(name = "''{0}'' against {1} is {2}")
    @CsvSource(value = {
            "2024-01-15|2024-01-15|true",
            "< 2024-06-01|2024-01-15|true",
            "[2024-01-01..2024-12-31]|2024-06-15|true",
            "[2024-01-01..2024-12-31]|2025-01-01|false",
            "[09:00..17:00]|12:30|true",
            "> 2024-01-01T08:00:00|2024-01-01T09:00:00|true",
            "> P1D|PT25H|true",
            "<= P1Y|P13M|false"
    }, delimiter = '|')
    @DisplayName("Should compare temporal values by their meaning")
    void shouldMatchTemporal(String test, String candidate, boolean expected) {
        assertEquals(expected, UnaryTestMatcher.matches(test, candidate));
    }

    @Test
    @DisplayName("A list candidate matches if any element does")
    void listCandidate() {
        Value list = Value.list(List.of(Value.of(1), Value.of(7)));
        assertTrue(UnaryTestMatcher.matches("> 5", list));
        assertFalse(UnaryTestMatcher.matches("> 10", list));
    }

    @Test
    @DisplayName("A null candidate is never ordered")
    void nullCandidate() {
        assertTrue(UnaryTestMatcher.matches("-", Value.NULL));
        assertTrue(UnaryTestMatcher.matches("null", Value.NULL));
        assertTrue(UnaryTestMatcher.matches("not(\"a\")", Value.NULL));
        assertFalse(UnaryTestMatcher.matches("> 70", Value.NULL));
        assertFalse(UnaryTestMatcher.matches("[1..10]", Value.NULL));
        assertFalse(UnaryTestMatcher.matches("\"a\", \"b\"", Value.NULL));
    }

    @Test
    @DisplayName("Numbers are compared numerically, not as text")
    void numericComparison() {
        assertTrue(UnaryTestMatcher.matches("> 9", Value.of(10)));
        assertTrue(UnaryTestMatcher.matches("[650..750)", Value.of(700)));
    }

    @Test
    @DisplayName("Should split on commas outside quotes and brackets")
    void shouldSplitTopLevel() {
        assertEquals(List.of("\"a,b\"", "[1..2]", "not(3, 4)"),
                UnaryTestMatcher.splitTopLevel("\"a,b\", [1..2], not(3, 4)"));
    }

    @Test
    @DisplayName("Should strip one pair of single or double quotes")
    void shouldUnquote() {
        assertEquals("x", UnaryTestMatcher.unquote(" \"x\" "));
        assertEquals("x", UnaryTestMatcher.unquote("'x'"));
        assertEquals("\"", UnaryTestMatcher.unquote("\""));
    }

    @ParameterizedTest(name = "{0} vs {1} is {2}")
    @CsvSource(value = {
            "2|10|-1",
            "2024-01-01|2023-12-31|1",
            "\"2024-01-01\"|2024-01-01|0",
            "10:00:00|09:30:00|1",
            "2024-01-01T10:00:00|2024-01-01T10:00:00|0",
            "P1Y|P13M|-1",
            "PT1H|PT30M|1",
            "-P1D|P0D|-1",
            "\"apple\"|\"banana\"|-1"
    }, delimiter = '|')
    @DisplayName("Should order numbers, temporals and text")
    void shouldCompareValues(String left, String right, int expected) {
        assertEquals(expected, UnaryTestMatcher.compareValues(left, right));
    }
}
