package org.nf.transform;

import org.nf.expression.Clause;
import org.nf.expression.Expression;
import org.nf.expression.Literal;
import org.nf.expression.NormalForm;
import org.nf.optionalfeatures.SubsumptionPrinciple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * SEMPLIFICAZIONE - Riduzione locale di una formula in forma normale
 *
 * Lavora sulla struttura a due livelli prodotta da {@link ClauseDistributor}.
 *
 * REGOLE APPLICATE (in ordine):
 * 1. Letterali duplicati in una clausola eliminati: (a || a || b) -> (a || b)
 * 2. Costanti nelle clausole: quella assorbente rende banale la clausola, quella
 *    neutra viene rimossa; una clausola rimasta vuota assorbe l'intera formula
 * 3. Clausole con un termine in entrambe le polarità eliminate
 *    (sempre vere in CNF, sempre false in DNF)
 * 4. Clausole identiche eliminate
 * 5. Due clausole unitarie complementari assorbono la formula: a && ~a -> false (CNF)
 * 6. Sussunzione, se abilitata
 * 7. Nessuna clausola rimasta: costante neutra (true per CNF, false per DNF)
 * 8. Ordinamento deterministico e ricostruzione senza involucri superflui
 *
 * Il risultato è un punto fisso: semplificarlo di nuovo non lo cambia.
 */
public class ClauseSimplifier {

    private static final Logger LOGGER = Logger.getLogger(ClauseSimplifier.class.getName());

    /** Ottimizzatore opzionale; null se la sussunzione è disabilitata */
    private final SubsumptionPrinciple subsumption;

    public ClauseSimplifier() {
        this(false);
    }

    /**
     * @param useSubsumption true per eliminare anche le clausole sussunte
     */
    public ClauseSimplifier(boolean useSubsumption) {
        this.subsumption = useSubsumption ? new SubsumptionPrinciple() : null;
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Semplifica una formula in forma normale.
     *
     * @param expression formula a due livelli per la forma indicata; un albero di
     *                   forma diversa viene prima normalizzato e distribuito
     * @param form forma normale della formula
     * @return formula semplificata, eventualmente una costante
     */
    public Expression simplify(Expression expression, NormalForm form) {
        Expression input = expression;
        if (!isTwoLevel(expression, form)) {
            LOGGER.warning("Espressione non in " + form + " ricevuta dalla semplificazione: " + expression);
            input = ClauseDistributor.distribute(NegationNormalizer.toNNF(expression), form);
        }

        Expression result = simplifyClauses(input, form);
        LOGGER.finest("Dopo semplificazione " + form + ": " + result);
        return result;
    }

    /**
     * Verifica che l'espressione sia un connettivo esterno su clausole di letterali
     * (o costanti) uniti dal connettivo interno.
     */
    public static boolean isTwoLevel(Expression expression, NormalForm form) {
        List<Expression> clauses = new ArrayList<>();
        flatten(expression, form.outer(), clauses);
        for (Expression clause : clauses) {
            List<Expression> leaves = new ArrayList<>();
            flatten(clause, form.inner(), leaves);
            for (Expression leaf : leaves) {
                if (!leaf.isLiteral() && !leaf.isConstant()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return ottimizzatore di sussunzione usato, oppure null se disabilitato
     */
    public SubsumptionPrinciple getSubsumption() {
        return subsumption;
    }

    //endregion

    //region ALGORITMO

    private Expression simplifyClauses(Expression expression, NormalForm form) {
        List<Expression> clauseNodes = new ArrayList<>();
        flatten(expression, form.outer(), clauseNodes);

        Set<Clause> uniqueClauses = new LinkedHashSet<>();
        for (Expression clauseNode : clauseNodes) {
            List<Expression> leaves = new ArrayList<>();
            flatten(clauseNode, form.inner(), leaves);

            Set<Literal> literals = new LinkedHashSet<>();
            boolean trivial = false;
            for (Expression leaf : leaves) {
                if (leaf.equals(form.innerAbsorbing())) {
                    trivial = true;
                    break;
                }
                if (!leaf.equals(form.innerNeutral())) {
                    literals.add(Literal.fromExpression(leaf));
                }
            }

            if (trivial) {
                continue;
            }
            if (literals.isEmpty()) {
                LOGGER.fine("Clausola vuota: la formula si riduce a " + form.outerAbsorbing());
                return form.outerAbsorbing();
            }

            Clause clause = new Clause(literals);
            if (clause.isComplementary()) {
                LOGGER.finest("Clausola con letterali complementari eliminata: " + clause);
                continue;
            }
            uniqueClauses.add(clause);
        }

        if (hasComplementaryUnits(uniqueClauses)) {
            LOGGER.fine("Clausole unitarie complementari: la formula si riduce a " + form.outerAbsorbing());
            return form.outerAbsorbing();
        }

        List<Clause> clauses = new ArrayList<>(uniqueClauses);
        if (subsumption != null) {
            clauses = subsumption.applySubsumption(clauses, form);
        }

        if (clauses.isEmpty()) {
            return form.outerNeutral();
        }

        Collections.sort(clauses);

        List<Expression> rebuilt = new ArrayList<>();
        for (Clause clause : clauses) {
            rebuilt.add(clause.toExpression(form.inner()));
        }
        return Clause.foldLeft(form.outer(), rebuilt);
    }

    private static boolean hasComplementaryUnits(Set<Clause> clauses) {
        Set<Literal> units = new HashSet<>();
        for (Clause clause : clauses) {
            if (clause.isUnit()) {
                Literal unit = clause.getLiterals().first();
                if (units.contains(unit.complement())) {
                    return true;
                }
                units.add(unit);
            }
        }
        return false;
    }

    /**
     * Appiattisce le catene del connettivo indicato: (a op b) op c -> [a, b, c].
     */
    private static void flatten(Expression expression, Expression.Type connective, List<Expression> operands) {
        if (expression.getType() == connective) {
            flatten(expression.getLeft(), connective, operands);
            flatten(expression.getRight(), connective, operands);
        } else {
            operands.add(expression);
        }
    }

    //endregion
}
