package org.operators.reduction;

import org.operators.formula.Formula;
import org.operators.formula.Formula.Type;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Basi di operatori complete raggiungibili dal riduttore.
 *
 * Ogni base dichiara il proprio alfabeto: l'insieme di operatori e costanti che
 * possono comparire nel risultato della riduzione (le variabili sono sempre ammesse).
 */
public enum OperatorBasis {

    NOT_AND_OR("nao", EnumSet.of(Type.NOT, Type.AND, Type.OR)),
    NOT_AND("na", EnumSet.of(Type.NOT, Type.AND)),
    NAND("nand", EnumSet.of(Type.NAND)),
    IMPLIES_NOT("in", EnumSet.of(Type.IMPLIES, Type.NOT)),
    IMPLIES_FALSE("if", EnumSet.of(Type.IMPLIES, Type.FALSE));

    /**
     * Variabile usata dagli idiomi che sostituiscono le costanti, ad esempio
     * T -> (p | ~p). Il nome è fisso anche quando la formula contiene già p.
     */
    public static final String IDIOM_VARIABLE = "p";

    private final String key;
    private final Set<Type> alphabet;

    OperatorBasis(String key, Set<Type> alphabet) {
        this.key = key;
        this.alphabet = Collections.unmodifiableSet(alphabet);
    }

    /**
     * Chiave breve usata dalla linea di comando (-b=nao,nand,...).
     */
    public String getKey() {
        return key;
    }

    public Set<Type> getAlphabet() {
        return alphabet;
    }

    /**
     * Verifica che la formula usi solo operatori e costanti di questa base.
     *
     * @param formula formula da controllare
     * @return true se ogni operatore della formula appartiene all'alfabeto
     */
    public boolean admits(Formula formula) {
        return alphabet.containsAll(formula.getOperators());
    }

    /**
     * Risolve una base a partire dalla chiave breve, senza distinguere maiuscole.
     *
     * @throws IllegalArgumentException se la chiave non corrisponde ad alcuna base
     */
    public static OperatorBasis fromKey(String key) {
        if (key != null) {
            for (OperatorBasis basis : values()) {
                if (basis.key.equalsIgnoreCase(key.trim())) {
                    return basis;
                }
            }
        }
        throw new IllegalArgumentException("Base di operatori sconosciuta: " + key);
    }
}
