package org.operators.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.operators.formula.Formula;
import org.operators.formula.Formula.Type;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaParser Tests")
class FormulaParserTest {

    @Nested
    @DisplayName("Precedence and associativity")
    class Precedence {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = ';', value = {
                "p & q | r;             ((p & q) | r)",
                "p | q & r;             (p | (q & r))",
                "~p & q;                (~p & q)",
                "!p;                    ~p",
                "~~p;                   ~~p",
                "p -> q -> r;           (p -> (q -> r))",
                "p | q -> r;            ((p | q) -> r)",
                "p <-> q -> r;          (p <-> (q -> r))",
                "p <-> q + r;           ((p <-> q) + r)",
                "p -& q -| r;           ((p -& q) -| r)",
                "p -| q -& r;           (p -| (q -& r))",
                "p & q & r;             ((p & q) & r)",
                "(p -> q) -> r;         ((p -> q) -> r)",
                "~(p | T) -> F;         (~(p | T) -> F)"
        })
        @DisplayName("Should build the expected tree")
        void testShape(String input, String expected) {
            assertEquals(expected, FormulaParser.parse(input).toString());
        }

        @Test
        @DisplayName("Should keep every operator as its own node")
        void testOperatorsPreserved() {
            Formula formula = FormulaParser.parse("p <-> q");

            assertEquals(Type.IFF, formula.type);
            assertEquals(new Formula("p"), formula.first);
            assertEquals(new Formula("q"), formula.second);
        }
    }

    @Nested
    @DisplayName("Atoms")
    class Atoms {

        @Test
        @DisplayName("Should read variables and constants")
        void testAtoms() {
            assertEquals(new Formula("x12"), FormulaParser.parse("  x12 "));
            assertEquals(new Formula(true), FormulaParser.parse("T"));
            assertEquals(new Formula(false), FormulaParser.parse("(F)"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "((p + q) <-> ~r) -& (s -| T)",
                "~(a1 & (b_2 -> F))",
                "(p -> (q -> r))"
        })
        @DisplayName("Should read back its own printed form")
        void testRoundTrip(String text) {
            Formula formula = FormulaParser.parse(text);
            assertEquals(formula, FormulaParser.parse(formula.toString()));
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrors {

        @ParameterizedTest
        @ValueSource(strings = {"", "p &", "(p | q", "p q", "P", "p $ q", "-> p"})
        @DisplayName("Should reject malformed formulas")
        void testMalformed(String text) {
            assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse(text));
        }

        @Test
        @DisplayName("Should report the position of the offending symbol")
        void testPosition() {
            FormulaSyntaxException exception =
                    assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("p $ q"));

            assertEquals(1, exception.getLine());
            assertEquals(2, exception.getColumn());
        }

        @Test
        @DisplayName("Should reject null text")
        void testNull() {
            assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(null));
        }
    }
}
