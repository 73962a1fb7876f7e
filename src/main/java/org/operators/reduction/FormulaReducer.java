package org.operators.reduction;

import org.operators.formula.Formula;

/**
 * Riduzione sintattica di una formula verso una base di operatori completa.
 *
 * Il risultato ha la stessa tavola di verità della formula di partenza e usa
 * soltanto gli operatori di {@link #getTargetBasis()}. La formula passata non
 * viene modificata.
 */
public interface FormulaReducer {

    /**
     * @param formula formula su qualunque operatore supportato (non null)
     * @return nuova formula equivalente sull'alfabeto della base di arrivo
     */
    Formula reduce(Formula formula);

    OperatorBasis getTargetBasis();
}
