package org.operators.reduction;

import org.operators.formula.Formula;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Punto di accesso unico alle cinque riduzioni.
 *
 * Associa a ogni {@link OperatorBasis} il riduttore dedicato. I riduttori non
 * hanno stato, quindi un'istanza può essere condivisa tra più thread.
 */
public class OperatorReducer {

    private static final Logger LOGGER = Logger.getLogger(OperatorReducer.class.getName());

    private final Map<OperatorBasis, FormulaReducer> reducers = new EnumMap<>(OperatorBasis.class);

    public OperatorReducer() {
        register(new NotAndOrReducer());
        register(new NotAndReducer());
        register(new NandReducer());
        register(new ImpliesNotReducer());
        register(new ImpliesFalseReducer());
    }

    private void register(FormulaReducer reducer) {
        reducers.put(reducer.getTargetBasis(), reducer);
    }

    public FormulaReducer reducerFor(OperatorBasis basis) {
        FormulaReducer reducer = reducers.get(basis);
        if (reducer == null) {
            throw new IllegalArgumentException("Nessun riduttore per la base: " + basis);
        }
        return reducer;
    }

    /**
     * Riduce la formula verso la base indicata.
     *
     * @param formula formula da ridurre
     * @param basis base di arrivo
     * @return formula equivalente sull'alfabeto della base
     */
    public Formula reduce(Formula formula, OperatorBasis basis) {
        return reducerFor(basis).reduce(formula);
    }

    /**
     * Riduce la formula verso tutte le basi, nell'ordine di dichiarazione di
     * {@link OperatorBasis}.
     *
     * @return mappa non modificabile base -> formula ridotta
     */
    public Map<OperatorBasis, Formula> reduceAll(Formula formula) {
        LOGGER.fine(() -> "Riduzione verso tutte le basi: " + formula);

        Map<OperatorBasis, Formula> results = new EnumMap<>(OperatorBasis.class);
        for (OperatorBasis basis : OperatorBasis.values()) {
            results.put(basis, reduce(formula, basis));
        }
        return Collections.unmodifiableMap(results);
    }
}
