package org.nf.optionalfeatures;

import org.nf.expression.Clause;
import org.nf.expression.NormalForm;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * IMPLEMENTAZIONE DEL PRINCIPIO DI SUSSUNZIONE per formule in forma normale
 *
 * Elimina le clausole che sono sovrainsieme di altre clausole, mantenendo
 * l'equivalenza logica (legge di assorbimento).
 *
 * DEFINIZIONE:
 * Una clausola C1 sussume una clausola C2 se tutti i letterali di C1 sono
 * contenuti in C2. In questo caso C2 può essere eliminata.
 *
 * ESEMPI:
 * • CNF: a && (a || b) && (~c || d) && (~c || d || e)  →  a && (~c || d)
 * • DNF: a || (a && b)  →  a
 */
public class SubsumptionPrinciple {

    private static final Logger LOGGER = Logger.getLogger(SubsumptionPrinciple.class.getName());

    //region STATO OTTIMIZZAZIONE

    /** Registro testuale dell'ultima ottimizzazione */
    private StringBuilder optimizationLog;

    /** Contatore clausole eliminate */
    private int eliminatedClauses;

    /** Clausole ricevute dall'ultima ottimizzazione */
    private int originalClauseCount;

    //endregion

    public SubsumptionPrinciple() {
        resetState();
    }

    private void resetState() {
        this.optimizationLog = new StringBuilder();
        this.eliminatedClauses = 0;
        this.originalClauseCount = 0;
    }

    //region INTERFACCIA PUBBLICA PRINCIPALE

    /**
     * Applica il principio di sussunzione all'insieme di clausole.
     *
     * La regola è la stessa per CNF e DNF: in entrambe la clausola più piccola
     * implica (CNF) o è implicata da (DNF) quella più grande, che risulta ridondante.
     *
     * @param clauses clausole senza duplicati
     * @param form forma normale delle clausole, usata solo per il registro
     * @return clausole non sussunte, nell'ordine originale
     */
    public List<Clause> applySubsumption(List<Clause> clauses, NormalForm form) {
        resetState();
        originalClauseCount = clauses.size();
        optimizationLog.append("Forma: ").append(form).append("\n");
        optimizationLog.append("Clausole originali: ").append(originalClauseCount).append("\n");

        Set<Integer> clausesToEliminate = new HashSet<>();

        // Confronto ogni coppia di clausole
        for (int i = 0; i < clauses.size(); i++) {
            if (clausesToEliminate.contains(i)) continue;

            Clause clause1 = clauses.get(i);

            for (int j = i + 1; j < clauses.size(); j++) {
                if (clausesToEliminate.contains(j)) continue;

                Clause clause2 = clauses.get(j);

                if (clause1.subsumes(clause2)) {
                    clausesToEliminate.add(j);
                    recordElimination(clause1, clause2);
                } else if (clause2.subsumes(clause1)) {
                    clausesToEliminate.add(i);
                    recordElimination(clause2, clause1);
                    break; // clause1 eliminata, passa alla prossima
                }
            }
        }

        List<Clause> remaining = new ArrayList<>();
        for (int i = 0; i < clauses.size(); i++) {
            if (!clausesToEliminate.contains(i)) {
                remaining.add(clauses.get(i));
            }
        }

        optimizationLog.append("Clausole rimanenti: ").append(remaining.size()).append("\n");
        LOGGER.fine("Ottimizzazione sussunzione completata: " + eliminatedClauses + " clausole eliminate");
        return remaining;
    }

    private void recordElimination(Clause subsuming, Clause subsumed) {
        eliminatedClauses++;
        optimizationLog.append("SUSSUNZIONE: ").append(subsuming)
                .append(" sussume ").append(subsumed).append("\n");
        LOGGER.finest("Clausola " + subsuming + " sussume " + subsumed);
    }

    //endregion

    //region INTERFACCIA PUBBLICA INFORMAZIONI

    /**
     * Restituisce il resoconto dell'ultima ottimizzazione.
     */
    public String getOptimizationInfo() {
        StringBuilder info = new StringBuilder();
        info.append("=== SUBSUMPTION OPTIMIZATION REPORT ===\n");
        info.append("Clausole eliminate: ").append(eliminatedClauses).append("\n");

        if (originalClauseCount > 0) {
            double reductionPercentage = (double) eliminatedClauses / originalClauseCount * 100;
            info.append("Riduzione percentuale: ").append(String.format("%.1f%%", reductionPercentage)).append("\n");
        }

        info.append("\nDettagli ottimizzazione:\n");
        info.append(optimizationLog);
        return info.toString();
    }

    public int getEliminatedClausesCount() {
        return eliminatedClauses;
    }

    public int getOriginalClausesCount() {
        return originalClauseCount;
    }

    @Override
    public String toString() {
        return String.format("SubsumptionPrinciple[original=%d, eliminated=%d, final=%d]",
                originalClauseCount, eliminatedClauses, originalClauseCount - eliminatedClauses);
    }

    //endregion
}
