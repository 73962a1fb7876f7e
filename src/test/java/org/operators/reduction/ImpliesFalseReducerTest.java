package org.operators.reduction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operators.formula.Formula;
import org.operators.semantics.TruthTable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.operators.parser.FormulaParser.parse;

@DisplayName("ImpliesFalseReducer Tests")
class ImpliesFalseReducerTest {

    private final ImpliesFalseReducer reducer = new ImpliesFalseReducer();

    @Test
    @DisplayName("Should encode negation as (a -> F)")
    void testNegation() {
        Formula reduced = reducer.reduce(parse("~p"));

        assertEquals("(p -> F)", reduced.toString());
        assertEquals(List.of(true, false), TruthTable.truthValues(reduced, List.of("p")));
    }

    @Test
    @DisplayName("Should keep implications with reduced operands")
    void testImplication() {
        assertEquals("((p -> F) -> q)", reducer.reduce(parse("p | q")).toString());
        assertEquals("((p -> (q -> F)) -> F)", reducer.reduce(parse("p & q")).toString());
    }

    @Test
    @DisplayName("Should map a bare T to (F -> F)")
    void testTrueConstant() {
        assertEquals("(F -> F)", reducer.reduce(parse("T")).toString());
    }

    @Test
    @DisplayName("Should reduce a bare F through ~(p -> p)")
    void testFalseConstant() {
        Formula reduced = reducer.reduce(parse("F"));

        assertEquals("((p -> p) -> F)", reduced.toString());
        assertTrue(TruthTable.isContradiction(reduced));
    }

    @Test
    @DisplayName("Should match the documented pipeline ImpliesNot -> ImpliesFalse")
    void testChaining() {
        Formula formula = parse("(p <-> q) -| r");
        Formula chained = reducer.reduce(new ImpliesNotReducer().reduce(formula));

        assertTrue(TruthTable.isEquivalent(reducer.reduce(formula), chained));
        assertTrue(OperatorBasis.IMPLIES_FALSE.admits(chained));
    }
}
