package org.operators.reduction;

import org.operators.formula.Formula;

import java.util.logging.Logger;

import static org.operators.formula.Formula.nand;

/**
 * RIDUZIONE A {-&} - Un solo connettivo binario
 *
 * Lavora sul risultato di {@link NotAndReducer}, usando l'identità
 * a -& b = ~(a & b):
 * • ~a    -> (n -& n)        con n = a'
 * • a & b -> (d -& d)        con d = (a' -& b')
 *
 * Ogni congiunzione diventa due applicazioni di -&, ogni negazione una. Gli
 * operandi ridotti vengono ripetuti, quindi la dimensione dell'albero stampato
 * può crescere esponenzialmente con la profondità.
 */
public class NandReducer implements FormulaReducer {

    private static final Logger LOGGER = Logger.getLogger(NandReducer.class.getName());

    private final NotAndReducer notAndReducer = new NotAndReducer();

    @Override
    public Formula reduce(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da ridurre non può essere null");
        }

        Formula result = convert(notAndReducer.reduce(formula));
        LOGGER.fine(() -> "Riduzione a {-&}: " + formula + " -> " + result);
        return result;
    }

    @Override
    public OperatorBasis getTargetBasis() {
        return OperatorBasis.NAND;
    }

    // Input garantito su {~, &}
    private Formula convert(Formula formula) {
        return switch (formula.type) {
            case VARIABLE -> formula;
            case NOT -> {
                Formula inner = convert(formula.first);
                yield nand(inner, inner);
            }
            case AND -> {
                Formula left = convert(formula.first);
                Formula right = convert(formula.second);
                Formula negated = nand(left, right);
                yield nand(negated, negated);
            }
            default -> throw new IllegalStateException(
                    "Operatore inatteso nella riduzione a {-&}: " + formula.type);
        };
    }
}
