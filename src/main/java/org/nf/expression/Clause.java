package org.nf.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * CLAUSOLA - Insieme immutabile di letterali uniti dal connettivo interno
 *
 * In CNF una clausola è una disgiunzione di letterali, in DNF una congiunzione.
 * I letterali sono mantenuti ordinati e senza duplicati, quindi due clausole con
 * gli stessi letterali sono uguali indipendentemente dall'ordine di inserimento.
 *
 * ORDINAMENTO: prima per numero di letterali, poi lessicograficamente sui letterali.
 */
public final class Clause implements Comparable<Clause> {

    private final SortedSet<Literal> literals;

    /**
     * @param literals letterali della clausola (i duplicati vengono eliminati)
     * @throws IllegalArgumentException se la collezione è null o contiene null
     */
    public Clause(Collection<Literal> literals) {
        if (literals == null) {
            throw new IllegalArgumentException("Lista letterali non può essere null");
        }
        SortedSet<Literal> sorted = new TreeSet<>();
        for (Literal literal : literals) {
            if (literal == null) {
                throw new IllegalArgumentException("Lista letterali non può contenere elementi null");
            }
            sorted.add(literal);
        }
        this.literals = Collections.unmodifiableSortedSet(sorted);
    }

    public SortedSet<Literal> getLiterals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public boolean isUnit() {
        return literals.size() == 1;
    }

    /**
     * Verifica se la clausola contiene un termine con entrambe le polarità.
     */
    public boolean isComplementary() {
        Literal previous = null;
        for (Literal literal : literals) {
            // l'ordinamento mette adiacenti i letterali con lo stesso nome
            if (previous != null && previous.isComplementOf(literal)) {
                return true;
            }
            previous = literal;
        }
        return false;
    }

    /**
     * Una clausola ne sussume un'altra se tutti i suoi letterali vi sono contenuti.
     */
    public boolean subsumes(Clause other) {
        return other.literals.containsAll(literals);
    }

    /**
     * Ricostruisce la clausola come albero binario annidato a sinistra.
     *
     * @param connective connettivo interno (AND oppure OR)
     * @throws IllegalStateException se la clausola è vuota
     */
    public Expression toExpression(Expression.Type connective) {
        if (literals.isEmpty()) {
            throw new IllegalStateException("Clausola vuota non rappresentabile come espressione");
        }
        List<Expression> operands = new ArrayList<>();
        for (Literal literal : literals) {
            operands.add(literal.toExpression());
        }
        return Clause.foldLeft(connective, operands);
    }

    /**
     * Combina una lista non vuota di operandi in un albero binario annidato a sinistra:
     * [a, b, c] diventa ((a op b) op c).
     */
    public static Expression foldLeft(Expression.Type connective, List<Expression> operands) {
        Iterator<Expression> iterator = operands.iterator();
        Expression result = iterator.next();
        while (iterator.hasNext()) {
            result = Expression.binary(connective, result, iterator.next());
        }
        return result;
    }

    @Override
    public int compareTo(Clause other) {
        int bySize = Integer.compare(literals.size(), other.literals.size());
        if (bySize != 0) {
            return bySize;
        }
        Iterator<Literal> mine = literals.iterator();
        Iterator<Literal> theirs = other.literals.iterator();
        while (mine.hasNext()) {
            int byLiteral = mine.next().compareTo(theirs.next());
            if (byLiteral != 0) {
                return byLiteral;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return literals.equals(((Clause) obj).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        return literals.toString();
    }
}
