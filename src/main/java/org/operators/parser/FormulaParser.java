package org.operators.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.operators.formula.Formula;

import java.util.logging.Logger;

/**
 * Lettura di formule in notazione infissa.
 *
 * Pipeline: Lexing -> Parsing -> Visitor ({@link FormulaBuilder}). Il primo
 * errore lessicale o sintattico interrompe la lettura con
 * {@link FormulaSyntaxException}, senza tentativi di recupero.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param formulaText formula, ad esempio "(p -> q) & ~r"
     * @return albero della formula
     * @throws FormulaSyntaxException se il testo non rispetta la grammatica
     * @throws IllegalArgumentException se il testo è null
     */
    public static Formula parse(String formulaText) {
        if (formulaText == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }

        CharStream input = CharStreams.fromString(formulaText);
        LogicFormulaLexer lexer = new LogicFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaBuilder().visit(tree);

        LOGGER.fine(() -> "Formula letta: " + formulaText.trim() + " -> " + formula);
        return formula;
    }

    /**
     * Trasforma le segnalazioni di ANTLR in eccezioni invece di stamparle su stderr.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        private static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new FormulaSyntaxException(msg, line, charPositionInLine, e);
        }
    }
}
