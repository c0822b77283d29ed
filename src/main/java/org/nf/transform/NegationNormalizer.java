package org.nf.transform;

import org.nf.expression.Expression;

import java.util.logging.Logger;

/**
 * NORMALIZZAZIONE NEGAZIONI - Forma normale negata (NNF)
 *
 * Elimina le implicazioni e spinge le negazioni verso le foglie con le leggi di
 * De Morgan, finché ogni NOT avvolge soltanto un termine.
 *
 * TRASFORMAZIONI APPLICATE:
 * • A => B    -> ~A || B
 * • ~~A       -> A
 * • ~(A && B) -> ~A || ~B
 * • ~(A || B) -> ~A && ~B
 * • ~(A => B) -> A && ~B
 * • ~true -> false, ~false -> true
 * • Negazioni atomiche preservate: ~P rimane ~P
 */
public final class NegationNormalizer {

    private static final Logger LOGGER = Logger.getLogger(NegationNormalizer.class.getName());

    private NegationNormalizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte l'espressione in forma normale negata. Totale su ogni albero ben formato.
     *
     * @param expression albero da normalizzare (anche con implicazioni)
     * @return albero equivalente in NNF, privo di implicazioni
     */
    public static Expression toNNF(Expression expression) {
        Expression result = normalize(expression);
        LOGGER.finest("Dopo normalizzazione negazioni: " + result);
        return result;
    }

    private static Expression normalize(Expression expression) {
        return switch (expression.getType()) {
            case TERM, TRUE, FALSE -> expression;

            case NOT -> negate(expression.getOperand());

            case AND -> Expression.and(normalize(expression.getLeft()), normalize(expression.getRight()));

            case OR -> Expression.or(normalize(expression.getLeft()), normalize(expression.getRight()));

            case IMPLIES -> Expression.or(negate(expression.getLeft()), normalize(expression.getRight()));
        };
    }

    /**
     * Restituisce la NNF di ~operand.
     */
    private static Expression negate(Expression operand) {
        return switch (operand.getType()) {
            case TERM -> Expression.not(operand);

            case TRUE -> Expression.FALSE;

            case FALSE -> Expression.TRUE;

            // ~~A -> A (eliminazione doppia negazione)
            case NOT -> normalize(operand.getOperand());

            case AND -> Expression.or(negate(operand.getLeft()), negate(operand.getRight()));

            case OR -> Expression.and(negate(operand.getLeft()), negate(operand.getRight()));

            case IMPLIES -> Expression.and(normalize(operand.getLeft()), negate(operand.getRight()));
        };
    }
}
