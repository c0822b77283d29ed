package org.nf.render;

import org.nf.expression.Expression;

/**
 * RAPPRESENTAZIONE TESTUALE - Serializzazione di un albero nella sintassi del parser
 *
 * FORMATO OUTPUT:
 * • Termini: nome esatto (a, x1, p.q)
 * • Negazioni: ~operando, con parentesi se l'operando è un connettivo binario
 * • Connettivi binari: operandi separati da " && ", " || ", " => "
 * • Costanti: true, false
 *
 * Le parentesi compaiono solo dove la precedenza lo richiede: un sotto-albero va tra
 * parentesi se il suo connettivo lega meno del contesto in cui compare. Per && e ||
 * (associativi a sinistra) l'operando destro è valutato un livello più in alto, per
 * => (associativo a destra) lo è il sinistro, così la rilettura ricostruisce lo
 * stesso albero.
 *
 * La variante {@link #renderGrouped(Expression)} racchiude inoltre tra parentesi ogni
 * connettivo binario annidato in un connettivo diverso, così che in una forma normale
 * ogni clausola con più letterali risulti delimitata: ~a || (b && c).
 */
public final class FormulaRenderer {

    /** Livelli di precedenza, dal più debole al più forte */
    private static final int LEVEL_IMPLIES = 1;
    private static final int LEVEL_OR = 2;
    private static final int LEVEL_AND = 3;
    private static final int LEVEL_NOT = 4;
    private static final int LEVEL_ATOM = 5;

    private FormulaRenderer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Rappresentazione con le sole parentesi richieste dalla precedenza.
     */
    public static String render(Expression expression) {
        StringBuilder builder = new StringBuilder();
        render(expression, LEVEL_IMPLIES, null, false, builder);
        return builder.toString();
    }

    /**
     * Rappresentazione con parentesi anche attorno ai connettivi annidati in un
     * connettivo diverso.
     */
    public static String renderGrouped(Expression expression) {
        StringBuilder builder = new StringBuilder();
        render(expression, LEVEL_IMPLIES, null, true, builder);
        return builder.toString();
    }

    private static void render(Expression expression, int context, Expression.Type parent,
                               boolean grouped, StringBuilder out) {
        int precedence = precedenceOf(expression.getType());
        boolean parenthesize = precedence < context
                || (grouped && parent != null && expression.isBinary() && expression.getType() != parent);
        if (parenthesize) {
            out.append('(');
        }

        switch (expression.getType()) {
            case TERM -> out.append(expression.getName());
            case TRUE -> out.append("true");
            case FALSE -> out.append("false");
            case NOT -> {
                out.append('~');
                render(expression.getOperand(), LEVEL_NOT, null, grouped, out);
            }
            case AND -> renderBinary(expression, " && ", precedence, precedence + 1, grouped, out);
            case OR -> renderBinary(expression, " || ", precedence, precedence + 1, grouped, out);
            case IMPLIES -> renderBinary(expression, " => ", precedence + 1, precedence, grouped, out);
        }

        if (parenthesize) {
            out.append(')');
        }
    }

    private static void renderBinary(Expression expression, String symbol,
                                     int leftContext, int rightContext, boolean grouped, StringBuilder out) {
        render(expression.getLeft(), leftContext, expression.getType(), grouped, out);
        out.append(symbol);
        render(expression.getRight(), rightContext, expression.getType(), grouped, out);
    }

    private static int precedenceOf(Expression.Type type) {
        return switch (type) {
            case IMPLIES -> LEVEL_IMPLIES;
            case OR -> LEVEL_OR;
            case AND -> LEVEL_AND;
            case NOT -> LEVEL_NOT;
            case TERM, TRUE, FALSE -> LEVEL_ATOM;
        };
    }
}
