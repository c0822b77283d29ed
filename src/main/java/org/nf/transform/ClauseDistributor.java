package org.nf.transform;

import org.nf.expression.Expression;
import org.nf.expression.NormalForm;

import java.util.logging.Logger;

/**
 * DISTRIBUZIONE - Da NNF a struttura a due livelli
 *
 * Per la CNF distribuisce OR sopra AND, per la DNF il duale AND sopra OR, finché
 * nessun nodo del connettivo interno ha come figlio un nodo del connettivo esterno.
 *
 * PROPRIETÀ DISTRIBUTIVA (CNF):
 * • A || (B && C) -> (A || B) && (A || C)
 * • (A && B) || C -> (A || C) && (B || C)
 * • (A && B) || (C && D) -> (A || C) && (A || D) && (B || C) && (B || D)
 *
 * Il numero di clausole può crescere esponenzialmente su input patologici: è un limite
 * intrinseco della conversione. La ricorsione termina perché ogni passo riduce
 * strettamente l'annidamento del connettivo esterno dentro quello interno.
 */
public final class ClauseDistributor {

    private static final Logger LOGGER = Logger.getLogger(ClauseDistributor.class.getName());

    private ClauseDistributor() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    public static Expression toCNF(Expression nnf) {
        return distribute(nnf, NormalForm.CNF);
    }

    public static Expression toDNF(Expression nnf) {
        return distribute(nnf, NormalForm.DNF);
    }

    /**
     * Distribuisce i connettivi per ottenere la forma richiesta.
     *
     * @param nnf espressione in forma normale negata; se non lo è viene normalizzata
     * @param form forma di destinazione
     * @return albero a due livelli: connettivo esterno su clausole di letterali
     */
    public static Expression distribute(Expression nnf, NormalForm form) {
        Expression input = nnf;
        if (!nnf.isNegationNormalForm()) {
            // Dovrebbe essere già risolto da NegationNormalizer
            LOGGER.warning("Espressione non in NNF ricevuta dalla distribuzione: " + nnf);
            input = NegationNormalizer.toNNF(nnf);
        }

        Expression result = distributeNode(input, form);
        LOGGER.finest("Dopo distribuzione " + form + ": " + result);
        return result;
    }

    //endregion

    //region DISTRIBUZIONE RICORSIVA

    private static Expression distributeNode(Expression expression, NormalForm form) {
        if (expression.getType() == form.outer()) {
            // Il connettivo esterno resta invariato, si distribuisce nei figli
            return Expression.binary(form.outer(),
                    distributeNode(expression.getLeft(), form),
                    distributeNode(expression.getRight(), form));
        }
        if (expression.getType() == form.inner()) {
            return merge(distributeNode(expression.getLeft(), form),
                    distributeNode(expression.getRight(), form), form);
        }
        // Letterali e costanti: caso base
        return expression;
    }

    /**
     * Combina con il connettivo interno due operandi già distribuiti, spingendo
     * il connettivo esterno verso la radice.
     */
    private static Expression merge(Expression left, Expression right, NormalForm form) {
        if (left.getType() == form.outer()) {
            // (A op B) inner C -> (A inner C) op (B inner C)
            return Expression.binary(form.outer(),
                    merge(left.getLeft(), right, form),
                    merge(left.getRight(), right, form));
        }
        if (right.getType() == form.outer()) {
            // A inner (B op C) -> (A inner B) op (A inner C)
            return Expression.binary(form.outer(),
                    merge(left, right.getLeft(), form),
                    merge(left, right.getRight(), form));
        }
        return Expression.binary(form.inner(), left, right);
    }

    //endregion
}
