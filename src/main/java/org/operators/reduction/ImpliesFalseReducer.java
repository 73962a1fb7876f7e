package org.operators.reduction;

import org.operators.formula.Formula;

import java.util.logging.Logger;

import static org.operators.formula.Formula.implies;

/**
 * RIDUZIONE A {->, F} - Eliminazione della negazione
 *
 * Lavora sul risultato di {@link ImpliesNotReducer} usando ~a = a -> F.
 * Le implicazioni restano tali con gli operandi ridotti. La costante T
 * isolata diventa direttamente (F -> F).
 */
public class ImpliesFalseReducer implements FormulaReducer {

    private static final Logger LOGGER = Logger.getLogger(ImpliesFalseReducer.class.getName());

    private final ImpliesNotReducer impliesNotReducer = new ImpliesNotReducer();

    @Override
    public Formula reduce(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da ridurre non può essere null");
        }

        Formula result = formula.type == Formula.Type.TRUE
                ? implies(new Formula(false), new Formula(false))
                : convert(impliesNotReducer.reduce(formula));

        LOGGER.fine(() -> "Riduzione a {->, F}: " + formula + " -> " + result);
        return result;
    }

    @Override
    public OperatorBasis getTargetBasis() {
        return OperatorBasis.IMPLIES_FALSE;
    }

    // Input garantito su {->, ~}
    private Formula convert(Formula formula) {
        return switch (formula.type) {
            case VARIABLE -> formula;
            case NOT -> implies(convert(formula.first), new Formula(false));
            case IMPLIES -> implies(convert(formula.first), convert(formula.second));
            default -> throw new IllegalStateException(
                    "Operatore inatteso nella riduzione a {->, F}: " + formula.type);
        };
    }
}
