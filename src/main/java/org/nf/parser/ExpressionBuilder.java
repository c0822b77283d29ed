package org.nf.parser;

import org.nf.antlr.LogicFormulaBaseVisitor;
import org.nf.antlr.LogicFormulaParser.AndContext;
import org.nf.antlr.LogicFormulaParser.FormulaContext;
import org.nf.antlr.LogicFormulaParser.IdContext;
import org.nf.antlr.LogicFormulaParser.ImpliesContext;
import org.nf.antlr.LogicFormulaParser.NotContext;
import org.nf.antlr.LogicFormulaParser.OrContext;
import org.nf.antlr.LogicFormulaParser.ParContext;
import org.nf.antlr.LogicFormulaParser.VarContext;
import org.nf.expression.Expression;

import java.util.logging.Logger;

/**
 * COSTRUTTORE DELL'ALBERO - Visitor dall'albero sintattico ANTLR a {@link Expression}
 *
 * A differenza di una conversione diretta, l'albero prodotto conserva le implicazioni
 * così come scritte: la loro eliminazione spetta al normalizzatore.
 *
 * ASSOCIATIVITÀ:
 * • Implicazione (=>): a destra, a => b => c diventa a => (b => c)
 * • Disgiunzione (||) e congiunzione (&&): a sinistra, a && b && c diventa (a && b) && c
 * • Negazione (~): prefissa, ~~a diventa ~(~a)
 */
final class ExpressionBuilder extends LogicFormulaBaseVisitor<Expression> {

    private static final Logger LOGGER = Logger.getLogger(ExpressionBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Expression visitFormula(FormulaContext ctx) {
        Expression expression = visit(ctx.implication());
        LOGGER.fine("Albero sintattico costruito: " + expression);
        return expression;
    }

    //endregion

    //region CONNETTIVI BINARI

    /**
     * Gestisce implicazioni; la ricorsione sulla regola {@code implication}
     * realizza l'associatività a destra.
     */
    @Override
    public Expression visitImplies(ImpliesContext ctx) {
        Expression antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }
        return Expression.implies(antecedent, visit(ctx.implication()));
    }

    @Override
    public Expression visitOr(OrContext ctx) {
        Expression result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = Expression.or(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    @Override
    public Expression visitAnd(AndContext ctx) {
        Expression result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            result = Expression.and(result, visit(ctx.negation(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONI, PARENTESI E TERMINI

    @Override
    public Expression visitNot(NotContext ctx) {
        return Expression.not(visit(ctx.negation()));
    }

    @Override
    public Expression visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    /**
     * Le parentesi rientrano al livello di precedenza più debole e non lasciano
     * traccia nell'albero.
     */
    @Override
    public Expression visitPar(ParContext ctx) {
        return visit(ctx.implication());
    }

    @Override
    public Expression visitId(IdContext ctx) {
        String name = ctx.TERM().getText();
        LOGGER.finest("Termine atomico: " + name);
        return Expression.term(name);
    }

    //endregion
}
