package org.operators.parser;

import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.operators.formula.Formula;
import org.operators.formula.Formula.Type;
import org.operators.parser.LogicFormulaParser.AndContext;
import org.operators.parser.LogicFormulaParser.FalseContext;
import org.operators.parser.LogicFormulaParser.FormulaContext;
import org.operators.parser.LogicFormulaParser.IdContext;
import org.operators.parser.LogicFormulaParser.IffContext;
import org.operators.parser.LogicFormulaParser.ImpliesContext;
import org.operators.parser.LogicFormulaParser.NotContext;
import org.operators.parser.LogicFormulaParser.OrContext;
import org.operators.parser.LogicFormulaParser.ParContext;
import org.operators.parser.LogicFormulaParser.TrueContext;
import org.operators.parser.LogicFormulaParser.VarContext;

import java.util.logging.Logger;

/**
 * COSTRUTTORE FORMULE - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Visitor sull'albero generato dalla grammatica LogicFormula. A differenza di una
 * conversione in forma normale, ogni operatore del testo viene conservato così
 * com'è nel nodo corrispondente: la riscrittura è compito dei riduttori.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Biimplicazione (<->) e disgiunzione esclusiva (+), associative a sinistra
 * - Implicazione (->), associativa a destra: A -> B -> C = A -> (B -> C)
 * - Disgiunzione (|) e disgiunzione negata (-|), associative a sinistra
 * - Congiunzione (&) e congiunzione negata (-&), associative a sinistra
 * - Negazione (~ oppure !)
 * - Variabili, costanti T e F, espressioni tra parentesi
 */
public class FormulaBuilder extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.equivalence());
        LOGGER.finest(() -> "Formula costruita: " + formula);
        return formula;
    }

    //endregion

    //region OPERATORI BINARI

    /**
     * Catene di <-> e + piegate a sinistra: A <-> B + C = ((A <-> B) + C).
     */
    @Override
    public Formula visitIff(IffContext ctx) {
        return foldLeft(ctx);
    }

    /**
     * Implicazione con associatività a destra, ottenuta dalla ricorsione della grammatica.
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }

        Formula consequent = visit(ctx.implication());
        return new Formula(Type.IMPLIES, antecedent, consequent);
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        return foldLeft(ctx);
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        return foldLeft(ctx);
    }

    /**
     * I figli di una regola "operando (operatore operando)*" si alternano: in
     * posizione pari gli operandi, in posizione dispari i token degli operatori.
     */
    private Formula foldLeft(ParseTree ctx) {
        Formula result = visit(ctx.getChild(0));

        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            TerminalNode operator = (TerminalNode) ctx.getChild(i);
            Formula right = visit(ctx.getChild(i + 1));
            result = new Formula(binaryType(operator), result, right);
        }
        return result;
    }

    private Type binaryType(TerminalNode operator) {
        return switch (operator.getSymbol().getType()) {
            case LogicFormulaLexer.IFF -> Type.IFF;
            case LogicFormulaLexer.XOR -> Type.XOR;
            case LogicFormulaLexer.OR -> Type.OR;
            case LogicFormulaLexer.NOR -> Type.NOR;
            case LogicFormulaLexer.AND -> Type.AND;
            case LogicFormulaLexer.NAND -> Type.NAND;
            default -> throw new IllegalStateException("Token non binario: " + operator.getText());
        };
    }

    //endregion

    //region NEGAZIONE, PARENTESI E ATOMI

    @Override
    public Formula visitNot(NotContext ctx) {
        return new Formula(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.equivalence());
    }

    @Override
    public Formula visitId(IdContext ctx) {
        return new Formula(ctx.IDENTIFIER().getText());
    }

    @Override
    public Formula visitTrue(TrueContext ctx) {
        return new Formula(true);
    }

    @Override
    public Formula visitFalse(FalseContext ctx) {
        return new Formula(false);
    }

    //endregion
}
