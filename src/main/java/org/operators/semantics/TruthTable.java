package org.operators.semantics;

import org.operators.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * SEMANTICA PROPOSIZIONALE - Valutazione e tavole di verità
 *
 * Valuta formule su assegnamenti di verità e confronta formule enumerando
 * tutti i modelli delle loro variabili. Usata per verificare che una riduzione
 * conservi la tavola di verità; non partecipa alla riduzione stessa.
 *
 * Il numero di modelli è 2^n sulle n variabili: pensata per formule piccole.
 */
public final class TruthTable {

    private static final Logger LOGGER = Logger.getLogger(TruthTable.class.getName());

    private TruthTable() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region VALUTAZIONE

    /**
     * Calcola il valore di verità della formula nel modello dato.
     *
     * @param formula formula da valutare
     * @param model assegnamento nome variabile -> valore
     * @return valore di verità della formula
     * @throws IllegalArgumentException se il modello non assegna una variabile della formula
     */
    public static boolean evaluate(Formula formula, Map<String, Boolean> model) {
        return switch (formula.type) {
            case TRUE -> true;
            case FALSE -> false;
            case VARIABLE -> {
                Boolean value = model.get(formula.name);
                if (value == null) {
                    throw new IllegalArgumentException("Variabile senza valore nel modello: " + formula.name);
                }
                yield value;
            }
            case NOT -> !evaluate(formula.first, model);
            case AND -> evaluate(formula.first, model) && evaluate(formula.second, model);
            case OR -> evaluate(formula.first, model) || evaluate(formula.second, model);
            case IMPLIES -> !evaluate(formula.first, model) || evaluate(formula.second, model);
            case XOR -> evaluate(formula.first, model) != evaluate(formula.second, model);
            case IFF -> evaluate(formula.first, model) == evaluate(formula.second, model);
            case NAND -> !(evaluate(formula.first, model) && evaluate(formula.second, model));
            case NOR -> !(evaluate(formula.first, model) || evaluate(formula.second, model));
        };
    }

    //endregion

    //region MODELLI E TAVOLE

    /**
     * Genera tutti i modelli sulle variabili date, in ordine di conteggio binario:
     * la prima variabile è la più significativa e il primo modello è tutto falso.
     *
     * @param variables nomi delle variabili
     * @return lista dei 2^n modelli
     */
    public static List<Map<String, Boolean>> allModels(List<String> variables) {
        int count = variables.size();
        if (count > 30) {
            throw new IllegalArgumentException("Troppe variabili per una tavola di verità: " + count);
        }

        List<Map<String, Boolean>> models = new ArrayList<>(1 << count);
        for (int row = 0; row < (1 << count); row++) {
            Map<String, Boolean> model = new LinkedHashMap<>();
            for (int i = 0; i < count; i++) {
                int bit = count - 1 - i;
                model.put(variables.get(i), ((row >> bit) & 1) == 1);
            }
            models.add(Collections.unmodifiableMap(model));
        }
        return models;
    }

    /**
     * Valuta la formula su ogni modello delle variabili date.
     *
     * @return valori di verità nello stesso ordine di {@link #allModels(List)}
     */
    public static List<Boolean> truthValues(Formula formula, List<String> variables) {
        List<Boolean> values = new ArrayList<>();
        for (Map<String, Boolean> model : allModels(variables)) {
            values.add(evaluate(formula, model));
        }
        return values;
    }

    //endregion

    //region PROPRIETÀ SEMANTICHE

    public static boolean isTautology(Formula formula) {
        return truthValues(formula, new ArrayList<>(formula.getVariables())).stream().allMatch(v -> v);
    }

    public static boolean isContradiction(Formula formula) {
        return truthValues(formula, new ArrayList<>(formula.getVariables())).stream().noneMatch(v -> v);
    }

    public static boolean isSatisfiable(Formula formula) {
        return !isContradiction(formula);
    }

    /**
     * Verifica che due formule abbiano la stessa tavola di verità.
     *
     * Le formule vengono valutate sull'unione delle loro variabili: se una delle
     * due introduce una variabile assente nell'altra (come la p degli idiomi per
     * le costanti), il suo valore non deve influire sul risultato.
     *
     * @return true se le formule coincidono su ogni modello
     */
    public static boolean isEquivalent(Formula first, Formula second) {
        SortedSet<String> variables = new TreeSet<>(first.getVariables());
        variables.addAll(second.getVariables());

        for (Map<String, Boolean> model : allModels(new ArrayList<>(variables))) {
            if (evaluate(first, model) != evaluate(second, model)) {
                LOGGER.fine(() -> "Formule non equivalenti nel modello " + model + ": " + first + " / " + second);
                return false;
            }
        }
        return true;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Stampa la tavola di verità della formula, una riga per modello.
     *
     * Esempio per (p -> q):
     * <pre>
     * | p | q | (p -> q) |
     * |---|---|----------|
     * | F | F | T        |
     * ...
     * </pre>
     */
    public static String format(Formula formula) {
        List<String> variables = new ArrayList<>(formula.getVariables());
        String header = formula.toString();
        StringBuilder table = new StringBuilder("|");

        for (String variable : variables) {
            table.append(' ').append(variable).append(" |");
        }
        table.append(' ').append(header).append(" |\n|");
        for (String variable : variables) {
            table.append("-".repeat(variable.length() + 2)).append('|');
        }
        table.append("-".repeat(header.length() + 2)).append("|\n");

        for (Map<String, Boolean> model : allModels(variables)) {
            table.append('|');
            for (String variable : variables) {
                table.append(' ').append(pad(symbol(model.get(variable)), variable.length())).append(" |");
            }
            table.append(' ').append(pad(symbol(evaluate(formula, model)), header.length())).append(" |\n");
        }
        return table.toString();
    }

    private static String symbol(boolean value) {
        return value ? "T" : "F";
    }

    private static String pad(String text, int width) {
        return text + " ".repeat(Math.max(0, width - text.length()));
    }

    //endregion
}
