package org.operators.formula;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Rappresentazione immutabile di una formula proposizionale in forma ad albero.
 *
 * Ogni nodo ha un tipo che ne determina esattamente l'arietà:
 * • Costanti T e F: nessun figlio
 * • Variabili: nessun figlio, solo il nome
 * • Negazione: un figlio ({@link #first})
 * • Operatori binari (&, |, ->, +, <->, -&, -|): due figli ({@link #first}, {@link #second})
 *
 * I nodi non vengono mai modificati dopo la costruzione: ogni trasformazione
 * costruisce un nuovo albero e lascia intatto quello di partenza. Poiché i nodi
 * sono immutabili, sottoalberi identici possono essere condivisi tra più alberi.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati, con simbolo testuale e arietà.
     */
    public enum Type {
        TRUE("T", 0),       // Costante vera
        FALSE("F", 0),      // Costante falsa
        VARIABLE(null, 0),  // Variabile proposizionale: p, q, r1, ...
        NOT("~", 1),        // Negazione: ~A
        AND("&", 2),        // Congiunzione: A & B
        OR("|", 2),         // Disgiunzione: A | B
        IMPLIES("->", 2),   // Implicazione: A -> B
        XOR("+", 2),        // Disgiunzione esclusiva: A + B
        IFF("<->", 2),      // Biimplicazione: A <-> B
        NAND("-&", 2),      // Congiunzione negata: A -& B
        NOR("-|", 2);       // Disgiunzione negata: A -| B

        private final String symbol;
        private final int arity;

        Type(String symbol, int arity) {
            this.symbol = symbol;
            this.arity = arity;
        }

        public String getSymbol() {
            return symbol;
        }

        public int getArity() {
            return arity;
        }

        public boolean isConstant() {
            return this == TRUE || this == FALSE;
        }

        public boolean isBinary() {
            return arity == 2;
        }
    }

    /** Tipo del nodo corrente nell'albero */
    public final Type type;

    /** Nome della variabile (solo per nodi VARIABLE) */
    public final String name;

    /** Primo operando (nodi NOT e binari) */
    public final Formula first;

    /** Secondo operando (solo nodi binari) */
    public final Formula second;

    /** Hash strutturale calcolato una sola volta, l'albero non cambia */
    private final int hash;

    //endregion

    //region COSTRUTTORI E INIZIALIZZAZIONE

    /**
     * Costruisce nodo foglia per variabile proposizionale.
     *
     * @param name nome della variabile (non null, non vuoto)
     * @throws IllegalArgumentException se name null o vuoto
     */
    public Formula(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }

        this.type = Type.VARIABLE;
        this.name = name.trim();
        this.first = null;
        this.second = null;
        this.hash = computeHash();
    }

    /**
     * Costruisce nodo costante T o F.
     *
     * @param value valore di verità della costante
     */
    public Formula(boolean value) {
        this.type = value ? Type.TRUE : Type.FALSE;
        this.name = null;
        this.first = null;
        this.second = null;
        this.hash = computeHash();
    }

    /**
     * Costruisce nodo unario per negazione.
     *
     * @param operand sottoformula da negare (non null)
     * @throws IllegalArgumentException se operand null
     */
    public Formula(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }

        this.type = Type.NOT;
        this.name = null;
        this.first = operand;
        this.second = null;
        this.hash = computeHash();
    }

    /**
     * Costruisce nodo binario.
     *
     * @param type operatore binario
     * @param first operando sinistro (non null)
     * @param second operando destro (non null)
     * @throws IllegalArgumentException se il tipo non è binario o un operando è null
     */
    public Formula(Type type, Formula first, Formula second) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo deve essere un operatore binario, ricevuto: " + type);
        }
        if (first == null || second == null) {
            throw new IllegalArgumentException("Operandi per " + type + " non possono essere null");
        }

        this.type = type;
        this.name = null;
        this.first = first;
        this.second = second;
        this.hash = computeHash();
    }

    //endregion

    //region COSTRUTTORI ABBREVIATI

    public static Formula not(Formula operand) {
        return new Formula(operand);
    }

    public static Formula and(Formula first, Formula second) {
        return new Formula(Type.AND, first, second);
    }

    public static Formula or(Formula first, Formula second) {
        return new Formula(Type.OR, first, second);
    }

    public static Formula implies(Formula first, Formula second) {
        return new Formula(Type.IMPLIES, first, second);
    }

    public static Formula nand(Formula first, Formula second) {
        return new Formula(Type.NAND, first, second);
    }

    //endregion

    //region UTILITÀ E ANALISI

    /**
     * Raccoglie i nomi di tutte le variabili della formula in ordine alfabetico.
     *
     * @return insieme ordinato dei nomi delle variabili
     */
    public SortedSet<String> getVariables() {
        SortedSet<String> variables = new TreeSet<>();
        collectVariables(variables);
        return variables;
    }

    private void collectVariables(Set<String> variables) {
        switch (type.getArity()) {
            case 0 -> {
                if (type == Type.VARIABLE) {
                    variables.add(name);
                }
            }
            case 1 -> first.collectVariables(variables);
            default -> {
                first.collectVariables(variables);
                second.collectVariables(variables);
            }
        }
    }

    /**
     * Raccoglie gli operatori e le costanti usati nella formula.
     * Le variabili non compaiono nel risultato.
     *
     * @return insieme dei tipi di nodo presenti, escluso VARIABLE
     */
    public Set<Type> getOperators() {
        Set<Type> operators = EnumSet.noneOf(Type.class);
        collectOperators(operators);
        return operators;
    }

    private void collectOperators(Set<Type> operators) {
        if (type != Type.VARIABLE) {
            operators.add(type);
        }
        if (first != null) {
            first.collectOperators(operators);
        }
        if (second != null) {
            second.collectOperators(operators);
        }
    }

    /**
     * Conta i nodi dell'albero, foglie comprese.
     */
    public int countNodes() {
        return switch (type.getArity()) {
            case 0 -> 1;
            case 1 -> 1 + first.countNodes();
            default -> 1 + first.countNodes() + second.countNodes();
        };
    }

    /**
     * Calcola la profondità massima dell'albero della formula.
     */
    public int calculateDepth() {
        return switch (type.getArity()) {
            case 0 -> 0;
            case 1 -> 1 + first.calculateDepth();
            default -> 1 + Math.max(first.calculateDepth(), second.calculateDepth());
        };
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale. L'ordine degli operandi conta: nessun operatore
     * viene considerato commutativo.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        return hash == other.hash
                && type == other.type
                && Objects.equals(name, other.name)
                && Objects.equals(first, other.first)
                && Objects.equals(second, other.second);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    private int computeHash() {
        int result = type.hashCode();
        result = 31 * result + Objects.hashCode(name);
        result = 31 * result + Objects.hashCode(first);
        result = 31 * result + Objects.hashCode(second);
        return result;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Genera la rappresentazione infissa della formula, rileggibile dal parser.
     *
     * FORMATO OUTPUT:
     * • Costanti: T, F
     * • Variabili: nome (p, q, r1)
     * • Negazioni: ~operando (~p, ~(p & q))
     * • Binari: sempre tra parentesi, (p -> q), ((p & q) | r)
     *
     * @return stringa rappresentante la formula
     */
    @Override
    public String toString() {
        return switch (type) {
            case TRUE, FALSE -> type.getSymbol();
            case VARIABLE -> name;
            case NOT -> type.getSymbol() + first;
            case AND, OR, IMPLIES, XOR, IFF, NAND, NOR ->
                    "(" + first + " " + type.getSymbol() + " " + second + ")";
        };
    }

    //endregion
}
