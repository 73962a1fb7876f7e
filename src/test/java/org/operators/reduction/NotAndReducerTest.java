package org.operators.reduction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.operators.formula.Formula;
import org.operators.semantics.TruthTable;

import static org.junit.jupiter.api.Assertions.*;
import static org.operators.parser.FormulaParser.parse;

@DisplayName("NotAndReducer Tests")
class NotAndReducerTest {

    private final NotAndReducer reducer = new NotAndReducer();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = ';', value = {
            "p;             p",
            "~p;            ~p",
            "p & q;         (p & q)",
            "p | q;         ~(~p & ~q)",
            "p -> q;        ~(~~p & ~q)",
            "T;             ~(~p & ~~p)",
            "p -| q;        ~~(~p & ~q)"
    })
    @DisplayName("Should replace OR with De Morgan")
    void testDeMorgan(String input, String expected) {
        assertEquals(expected, reducer.reduce(parse(input)).toString());
    }

    @Test
    @DisplayName("Should keep formulas already over {~, &} unchanged")
    void testAlreadyReduced() {
        Formula formula = parse("~(p & ~q) & r");
        assertEquals(formula, reducer.reduce(formula));
    }

    @Test
    @DisplayName("Should only use NOT and AND")
    void testAlphabet() {
        Formula formula = parse("(p + q) <-> (r -| F)");
        Formula reduced = reducer.reduce(formula);

        assertTrue(OperatorBasis.NOT_AND.admits(reduced));
        assertTrue(TruthTable.isEquivalent(formula, reduced));
    }
}
