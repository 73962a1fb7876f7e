package org.operators.parser;

/**
 * Errore di sintassi nel testo di una formula.
 * Riporta la posizione (riga e colonna) del primo simbolo non riconosciuto.
 */
public class FormulaSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public FormulaSyntaxException(String message, int line, int column, Throwable cause) {
        super("Errore di sintassi a riga " + line + ", colonna " + column + ": " + message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
