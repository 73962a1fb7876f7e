package org.operators.reduction;

import org.operators.formula.Formula;

import java.util.logging.Logger;

import static org.operators.formula.Formula.implies;
import static org.operators.formula.Formula.not;

/**
 * RIDUZIONE A {->, ~} - Eliminazione di congiunzioni e disgiunzioni
 *
 * Lavora sul risultato di {@link NotAndOrReducer}:
 * • a & b -> ~(a' -> ~b')
 * • a | b -> ~a' -> b'
 *
 * Una costante isolata viene tradotta direttamente nell'idioma della base:
 * T -> (p -> p), F -> ~(p -> p).
 */
public class ImpliesNotReducer implements FormulaReducer {

    private static final Logger LOGGER = Logger.getLogger(ImpliesNotReducer.class.getName());

    private final NotAndOrReducer notAndOrReducer = new NotAndOrReducer();

    @Override
    public Formula reduce(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da ridurre non può essere null");
        }

        // La riduzione a {~, &, |} non restituisce mai costanti: il caso va riconosciuto prima
        Formula result = switch (formula.type) {
            case TRUE -> tautology();
            case FALSE -> not(tautology());
            default -> convert(notAndOrReducer.reduce(formula));
        };

        LOGGER.fine(() -> "Riduzione a {->, ~}: " + formula + " -> " + result);
        return result;
    }

    @Override
    public OperatorBasis getTargetBasis() {
        return OperatorBasis.IMPLIES_NOT;
    }

    // Input garantito su {~, &, |}, senza costanti
    private Formula convert(Formula formula) {
        return switch (formula.type) {
            case VARIABLE -> formula;
            case NOT -> not(convert(formula.first));
            case AND -> {
                Formula left = convert(formula.first);
                Formula right = convert(formula.second);
                yield not(implies(left, not(right)));
            }
            case OR -> {
                Formula left = convert(formula.first);
                Formula right = convert(formula.second);
                yield implies(not(left), right);
            }
            default -> throw new IllegalStateException(
                    "Operatore inatteso nella riduzione a {->, ~}: " + formula.type);
        };
    }

    // p -> p
    private static Formula tautology() {
        Formula p = new Formula(OperatorBasis.IDIOM_VARIABLE);
        return implies(p, p);
    }
}
