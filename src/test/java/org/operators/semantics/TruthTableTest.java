package org.operators.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.operators.formula.Formula;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.operators.parser.FormulaParser.parse;

@DisplayName("TruthTable Tests")
class TruthTableTest {

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @ParameterizedTest(name = "{0} on p=F,q=F / p=F,q=T / p=T,q=F / p=T,q=T")
        @CsvSource(delimiter = ';', value = {
                "p & q;     false, false, false, true",
                "p | q;     false, true, true, true",
                "p -> q;    true, true, false, true",
                "p + q;     false, true, true, false",
                "p <-> q;   true, false, false, true",
                "p -& q;    true, true, true, false",
                "p -| q;    true, false, false, false"
        })
        @DisplayName("Should evaluate every binary operator")
        void testBinaryOperators(String formula, String expected) {
            List<Boolean> values = TruthTable.truthValues(parse(formula), List.of("p", "q"));
            List<Boolean> expectedValues = Arrays.stream(expected.split(","))
                    .map(String::trim)
                    .map(Boolean::parseBoolean)
                    .toList();
            assertEquals(expectedValues, values);
        }

        @Test
        @DisplayName("Should evaluate constants without a model")
        void testConstants() {
            assertTrue(TruthTable.evaluate(parse("T"), Map.of()));
            assertFalse(TruthTable.evaluate(parse("F"), Map.of()));
            assertTrue(TruthTable.evaluate(parse("~F"), Map.of()));
        }

        @Test
        @DisplayName("Should reject models missing a variable")
        void testMissingVariable() {
            Formula formula = parse("p & q");
            assertThrows(IllegalArgumentException.class, () -> TruthTable.evaluate(formula, Map.of("p", true)));
        }
    }

    @Nested
    @DisplayName("Models")
    class Models {

        @Test
        @DisplayName("Should enumerate models in binary counting order")
        void testAllModels() {
            List<Map<String, Boolean>> models = TruthTable.allModels(List.of("p", "q"));

            assertEquals(4, models.size());
            assertEquals(Map.of("p", false, "q", false), models.get(0));
            assertEquals(Map.of("p", false, "q", true), models.get(1));
            assertEquals(Map.of("p", true, "q", false), models.get(2));
            assertEquals(Map.of("p", true, "q", true), models.get(3));
        }

        @Test
        @DisplayName("Should produce a single empty model without variables")
        void testNoVariables() {
            assertEquals(List.of(Map.of()), TruthTable.allModels(List.of()));
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        @DisplayName("Should recognise tautologies, contradictions and satisfiable formulas")
        void testClassification() {
            assertTrue(TruthTable.isTautology(parse("p | ~p")));
            assertFalse(TruthTable.isTautology(parse("p | q")));
            assertTrue(TruthTable.isContradiction(parse("p & ~p")));
            assertTrue(TruthTable.isSatisfiable(parse("p & ~q")));
            assertFalse(TruthTable.isSatisfiable(parse("F")));
        }

        @Test
        @DisplayName("Should compare formulas over the union of their variables")
        void testEquivalence() {
            assertTrue(TruthTable.isEquivalent(parse("p -> q"), parse("~p | q")));
            assertTrue(TruthTable.isEquivalent(parse("T"), parse("r | ~r")));
            assertFalse(TruthTable.isEquivalent(parse("p -> q"), parse("q -> p")));
            assertFalse(TruthTable.isEquivalent(parse("q"), parse("q & p")));
        }

        @Test
        @DisplayName("Should format one row per model")
        void testFormat() {
            String table = TruthTable.format(parse("p -> q"));
            String[] lines = table.split("\n");

            assertEquals(6, lines.length);
            assertEquals("| p | q | (p -> q) |", lines[0]);
            assertEquals("| F | F | T        |", lines[2]);
            assertEquals("| T | F | F        |", lines[4]);
        }
    }
}
