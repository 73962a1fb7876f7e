package org.operators.reduction;

import org.operators.formula.Formula;

import java.util.logging.Logger;

import static org.operators.formula.Formula.and;
import static org.operators.formula.Formula.not;

/**
 * RIDUZIONE A {~, &} - Eliminazione delle disgiunzioni
 *
 * Lavora sul risultato di {@link NotAndOrReducer} e sostituisce ogni OR con la
 * legge di De Morgan: a | b -> ~(~a' & ~b'). Negazioni e congiunzioni passano
 * invariate con gli operandi ridotti.
 */
public class NotAndReducer implements FormulaReducer {

    private static final Logger LOGGER = Logger.getLogger(NotAndReducer.class.getName());

    private final NotAndOrReducer notAndOrReducer = new NotAndOrReducer();

    @Override
    public Formula reduce(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da ridurre non può essere null");
        }

        Formula result = convert(notAndOrReducer.reduce(formula));
        LOGGER.fine(() -> "Riduzione a {~, &}: " + formula + " -> " + result);
        return result;
    }

    @Override
    public OperatorBasis getTargetBasis() {
        return OperatorBasis.NOT_AND;
    }

    // Input garantito su {~, &, |}, senza costanti
    private Formula convert(Formula formula) {
        return switch (formula.type) {
            case VARIABLE -> formula;
            case NOT -> not(convert(formula.first));
            case AND -> and(convert(formula.first), convert(formula.second));
            case OR -> {
                Formula left = convert(formula.first);
                Formula right = convert(formula.second);
                yield not(and(not(left), not(right)));
            }
            default -> throw new IllegalStateException(
                    "Operatore inatteso nella riduzione a {~, &}: " + formula.type);
        };
    }
}
