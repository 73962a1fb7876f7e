package org.operators.reduction;

import org.operators.formula.Formula;

import java.util.logging.Logger;

import static org.operators.formula.Formula.and;
import static org.operators.formula.Formula.not;
import static org.operators.formula.Formula.or;

/**
 * RIDUZIONE A {~, &, |} - Eliminatore generale, primo anello della catena
 *
 * Riscrive ogni operatore e costante nella base {~, &, |} con una visita
 * bottom-up dell'albero: prima si riducono gli operandi, poi si combina il
 * risultato secondo l'operatore originale.
 *
 * IDENTITÀ APPLICATE (a', b' operandi già ridotti):
 * • T       -> p | ~p
 * • F       -> p & ~p
 * • a & b, a | b invariati
 * • a -> b  -> ~a' | b'
 * • a + b   -> (a' & ~b') | (~a' & b')
 * • a <-> b -> (~a' | b') & (a' | ~b')
 * • a -& b  -> ~(a' & b')
 * • a -| b  -> ~(a' | b')
 *
 * Il risultato non contiene costanti: è il punto di partenza per le riduzioni
 * verso {~, &} e verso {->, ~}.
 */
public class NotAndOrReducer implements FormulaReducer {

    private static final Logger LOGGER = Logger.getLogger(NotAndOrReducer.class.getName());

    @Override
    public Formula reduce(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da ridurre non può essere null");
        }

        Formula result = convert(formula);
        LOGGER.fine(() -> "Riduzione a {~, &, |}: " + formula + " -> " + result);
        return result;
    }

    @Override
    public OperatorBasis getTargetBasis() {
        return OperatorBasis.NOT_AND_OR;
    }

    private Formula convert(Formula formula) {
        return switch (formula.type) {
            case TRUE -> tautology();
            case FALSE -> contradiction();
            case VARIABLE -> formula;
            case NOT -> not(convert(formula.first));
            case AND, OR, IMPLIES, XOR, IFF, NAND, NOR -> convertBinary(formula);
        };
    }

    /**
     * Riduce prima l'operando sinistro, poi il destro, e li combina secondo
     * l'operatore del nodo.
     */
    private Formula convertBinary(Formula formula) {
        Formula left = convert(formula.first);
        Formula right = convert(formula.second);

        return switch (formula.type) {
            case AND -> and(left, right);
            case OR -> or(left, right);
            case IMPLIES -> or(not(left), right);
            case XOR -> or(and(left, not(right)), and(not(left), right));
            case IFF -> and(or(not(left), right), or(left, not(right)));
            case NAND -> not(and(left, right));
            case NOR -> not(or(left, right));
            default -> throw new IllegalStateException("Operatore non binario: " + formula.type);
        };
    }

    // p | ~p
    private static Formula tautology() {
        Formula p = new Formula(OperatorBasis.IDIOM_VARIABLE);
        return or(p, not(p));
    }

    // p & ~p
    private static Formula contradiction() {
        Formula p = new Formula(OperatorBasis.IDIOM_VARIABLE);
        return and(p, not(p));
    }
}
